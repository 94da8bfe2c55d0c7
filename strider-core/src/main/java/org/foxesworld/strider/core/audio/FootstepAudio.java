package org.foxesworld.strider.core.audio;

import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.diag.Diagnostics;
import org.foxesworld.strider.core.motion.CharacterBody;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Gait sounds raised from animation events.
 * Events from clips with a blend weight of 0.5 or less are ignored so crossfades do not double up steps.
 */
public final class FootstepAudio {

    static final float WEIGHT_GATE = 0.5f;

    public static final String DIAG_NO_LANDING = "audio.landing";

    private final AudioSink sink;
    private final CharacterBody body;
    private final PlayerConfig config;
    private final Diagnostics diagnostics;
    private final List<String> footsteps;
    private final String landing;
    private final Random random;

    private final Vector3f pos = new Vector3f();

    public FootstepAudio(AudioSink sink, CharacterBody body, PlayerConfig config, Diagnostics diagnostics,
                         List<String> footsteps, String landing, Random random) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.body = Objects.requireNonNull(body, "body");
        this.config = Objects.requireNonNull(config, "config");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.footsteps = List.copyOf(footsteps);
        this.landing = landing;
        this.random = Objects.requireNonNull(random, "random");
    }

    public boolean onFootstep(float clipWeight) {
        if (clipWeight <= WEIGHT_GATE || footsteps.isEmpty()) return false;
        String clip = footsteps.get(random.nextInt(footsteps.size()));
        sink.playClipAtPoint(clip, origin(), config.footstepVolume);
        return true;
    }

    public boolean onLand(float clipWeight) {
        if (clipWeight <= WEIGHT_GATE) return false;
        if (landing == null) {
            diagnostics.warnOnce(DIAG_NO_LANDING, "landing clip not assigned");
            return false;
        }
        sink.playClipAtPoint(landing, origin(), config.footstepVolume);
        return true;
    }

    private Vector3f origin() {
        return body.getPosition(pos).addLocal(config.controllerCenter);
    }
}
