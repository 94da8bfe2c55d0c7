package org.foxesworld.strider.core.orientation;

/**
 * Accumulated look angles in degrees. The smoothed pair is what gets written to targets.
 */
public final class OrientationState {

    public float yaw;
    public float pitch;

    public float yawSmoothed;
    public float pitchSmoothed;

    /** Body yaw applied by the last first-person update. */
    public float lastBodyYawDelta;

    public void snapYaw(float yawDegrees) {
        yaw = yawDegrees;
        yawSmoothed = yawDegrees;
    }

    public void reset() {
        yaw = pitch = yawSmoothed = pitchSmoothed = 0f;
        lastBodyYawDelta = 0f;
    }
}
