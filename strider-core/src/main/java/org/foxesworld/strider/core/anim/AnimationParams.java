package org.foxesworld.strider.core.anim;

/**
 * Names of the parameters published to an {@link AnimationSink}.
 */
public final class AnimationParams {

    public static final String SPEED = "Speed";
    public static final String DIRECTION = "Direction";
    public static final String MOTION_SPEED = "MotionSpeed";
    public static final String GROUNDED = "Grounded";
    public static final String JUMP = "Jump";
    public static final String FREE_FALL = "FreeFall";

    private AnimationParams() {}
}
