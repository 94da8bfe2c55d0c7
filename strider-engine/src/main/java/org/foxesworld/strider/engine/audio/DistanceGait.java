package org.foxesworld.strider.engine.audio;

import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.audio.FootstepAudio;

import java.util.Objects;

/**
 * Stand-in for animation events when the character has no animated rig: raises a
 * footstep every {@link #strideLength} metres of grounded travel and a landing on every
 * airborne-to-grounded transition. Events carry full clip weight.
 */
public final class DistanceGait {

    private final FootstepAudio audio;

    public volatile float strideLength = 1.6f;

    private float travelled;
    private boolean wasGrounded = true;

    public DistanceGait(FootstepAudio audio) {
        this.audio = Objects.requireNonNull(audio, "audio");
    }

    public void update(Vector3f velocity, boolean grounded, float dt) {
        if (grounded && !wasGrounded) {
            audio.onLand(1f);
            travelled = 0f;
        }
        wasGrounded = grounded;
        if (!grounded) return;

        travelled += (float) Math.sqrt(velocity.x * velocity.x + velocity.z * velocity.z) * dt;
        if (travelled >= strideLength) {
            travelled -= strideLength;
            audio.onFootstep(1f);
        }
    }
}
