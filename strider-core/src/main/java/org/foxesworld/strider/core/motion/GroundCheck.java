package org.foxesworld.strider.core.motion;

import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.anim.AnimationParams;
import org.foxesworld.strider.core.anim.AnimationSink;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.diag.Diagnostics;

import java.util.Objects;
import java.util.Optional;

/**
 * Recomputes {@link GroundState#grounded} from one sphere probe per frame.
 */
public final class GroundCheck {

    private final GroundProbe probe;
    private final Diagnostics diagnostics;
    private final Vector3f position = new Vector3f();

    public GroundCheck(GroundProbe probe, Diagnostics diagnostics) {
        this.probe = Objects.requireNonNull(probe, "probe");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public boolean run(CharacterBody body, PlayerConfig cfg, GroundState ground, Optional<AnimationSink> anim) {
        body.getPosition(position);
        ground.probeCentre.set(position.x, position.y - cfg.groundedOffset, position.z);

        float radius = cfg.groundedRadius;
        ground.grounded = probe.overlaps(ground.probeCentre, radius, cfg.groundLayers);

        anim.ifPresent(a -> a.setBool(AnimationParams.GROUNDED, ground.grounded));
        diagnostics.groundProbe(ground.probeCentre, radius, ground.grounded);
        return ground.grounded;
    }
}
