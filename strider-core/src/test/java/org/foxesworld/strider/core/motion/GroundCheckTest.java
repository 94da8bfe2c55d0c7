package org.foxesworld.strider.core.motion;

import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.anim.AnimationParams;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.diag.DiagnosticSink;
import org.foxesworld.strider.core.diag.Diagnostics;
import org.foxesworld.strider.core.support.Fakes;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GroundCheckTest {

    @Test
    void checksBelowFeetWithConfiguredRadiusAndMask() {
        Vector3f seenCentre = new Vector3f();
        float[] seenRadius = new float[1];
        int[] seenMask = new int[1];
        GroundProbe probe = (c, r, m) -> {
            seenCentre.set(c);
            seenRadius[0] = r;
            seenMask[0] = m;
            return true;
        };

        PlayerConfig cfg = new PlayerConfig();
        cfg.groundLayers = 0b101;
        Fakes.Body body = new Fakes.Body();
        body.position.set(1f, 2f, 3f);
        Fakes.Anim anim = new Fakes.Anim();

        boolean[] drawn = new boolean[1];
        Diagnostics diag = new Diagnostics(new DiagnosticSink() {
            @Override
            public void groundProbe(Vector3f centre, float radius, boolean grounded) {
                drawn[0] = grounded;
            }
        });

        GroundState ground = new GroundState();
        boolean grounded = new GroundCheck(probe, diag).run(body, cfg, ground, Optional.of(anim));

        assertTrue(grounded);
        assertEquals(1f, seenCentre.x, 0f);
        assertEquals(2.14f, seenCentre.y, 1e-6f);
        assertEquals(3f, seenCentre.z, 0f);
        assertEquals(0.5f, seenRadius[0], 0f);
        assertEquals(0b101, seenMask[0]);
        assertTrue(anim.bools.get(AnimationParams.GROUNDED));
        assertTrue(drawn[0]);
    }

    @Test
    void reportsAirborne() {
        GroundState ground = new GroundState();
        new GroundCheck((c, r, m) -> false, new Diagnostics())
                .run(new Fakes.Body(), new PlayerConfig(), ground, Optional.empty());
        assertFalse(ground.grounded);
    }
}
