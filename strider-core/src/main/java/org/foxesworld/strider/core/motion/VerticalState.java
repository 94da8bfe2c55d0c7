package org.foxesworld.strider.core.motion;

public final class VerticalState {

    public static final float TERMINAL_VELOCITY = 53.0f;

    /** Velocity held while standing so the character stays pressed to the ground. */
    public static final float GROUNDED_VELOCITY = -2.0f;

    public float verticalVelocity;
    public float jumpTimeoutRemaining;
    public float fallTimeoutRemaining;
}
