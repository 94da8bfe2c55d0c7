package org.foxesworld.strider.core.config;

/**
 * Per view-mode tuning. Angles in degrees, speeds in m/s.
 */
public final class ModeConfig {

    public volatile float moveSpeed = 2.0f;
    public volatile float sprintSpeed = 6.0f;

    /** Look scale. Only first person applies it. */
    public volatile float rotationSpeed = 1.0f;
    public volatile float rotationSmoothTime = 0.12f;
    public volatile float speedChangeRate = 10.0f;

    public volatile float topClamp;
    public volatile float bottomClamp;

    public volatile MovementPolicy movementPolicy;

    private ModeConfig(float topClamp, float bottomClamp, MovementPolicy policy) {
        this.topClamp = topClamp;
        this.bottomClamp = bottomClamp;
        this.movementPolicy = policy;
    }

    public static ModeConfig firstPersonDefaults() {
        return new ModeConfig(65f, -75f, MovementPolicy.CHARACTER_RELATIVE);
    }

    public static ModeConfig thirdPersonDefaults() {
        return new ModeConfig(90f, -50f, MovementPolicy.CAMERA_RELATIVE);
    }
}
