package org.foxesworld.strider.core.motion;

import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.math.Smoothing;

public final class LocomotionState {

    public float currentSpeed;

    /** Smoothed target speed, drives animation only. */
    public float animationBlend;

    public final Smoothing.Velocity rotationVelocity = new Smoothing.Velocity();

    public float targetSpeed;
    public float inputMagnitude;

    /** Last facing heading the body was steered toward, degrees. */
    public float targetRotation;

    /** Normalised horizontal direction of the last frame, zero when idle. */
    public final Vector3f direction = new Vector3f();

    /** Realized displacement of the last frame divided by its dt. */
    public final Vector3f realizedVelocity = new Vector3f();

    public void reset() {
        currentSpeed = 0f;
        animationBlend = 0f;
        rotationVelocity.reset();
        targetSpeed = 0f;
        inputMagnitude = 0f;
        targetRotation = 0f;
        direction.set(0f, 0f, 0f);
        realizedVelocity.set(0f, 0f, 0f);
    }
}
