package org.foxesworld.strider.core.math;

import com.jme3.math.FastMath;

/**
 * Angle helpers, all in degrees.
 */
public final class AngleMath {

    /** Bound for free (unclamped) axes: wrap only. */
    public static final float FREE = Float.POSITIVE_INFINITY;

    private AngleMath() {}

    /**
     * Folds {@code angle} back by one turn when it left [-360, 360], then clamps into [min, max].
     * Not a general normalizer: one correction step only.
     */
    public static float clampAngle(float angle, float min, float max) {
        if (angle < -360f) angle += 360f;
        if (angle > 360f) angle -= 360f;
        return FastMath.clamp(angle, min, max);
    }

    /** Shortest signed difference from {@code current} to {@code target}, in (-180, 180]. */
    public static float deltaAngle(float current, float target) {
        float delta = repeat(target - current, 360f);
        if (delta > 180f) delta -= 360f;
        return delta;
    }

    /** Loops {@code t} into [0, length). */
    public static float repeat(float t, float length) {
        return FastMath.clamp(t - (float) Math.floor(t / length) * length, 0f, length);
    }

    public static float lerpAngle(float a, float b, float t) {
        return a + deltaAngle(a, b) * FastMath.clamp(t, 0f, 1f);
    }

    /** Heading of a horizontal direction; 0 faces +Z, positive turns toward +X. */
    public static float headingOf(float x, float z) {
        return FastMath.atan2(x, z) * FastMath.RAD_TO_DEG;
    }
}
