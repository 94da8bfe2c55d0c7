package org.foxesworld.strider.core.math;

import com.jme3.math.FastMath;
import com.jme3.math.Vector3f;

/**
 * Scalar and vector approach functions used by the controllers and camera filters.
 */
public final class Smoothing {

    /** Velocity scratch for {@link #smoothDamp} / {@link #smoothDampAngle}. */
    public static final class Velocity {
        public float value;

        public void reset() { value = 0f; }
    }

    private Smoothing() {}

    public static float moveTowards(float current, float target, float maxDelta) {
        if (Math.abs(target - current) <= maxDelta) return target;
        return current + Math.signum(target - current) * maxDelta;
    }

    public static float lerp(float a, float b, float t) {
        return a + (b - a) * FastMath.clamp(t, 0f, 1f);
    }

    public static float inverseLerp(float a, float b, float value) {
        if (a == b) return 0f;
        return FastMath.clamp((value - a) / (b - a), 0f, 1f);
    }

    /**
     * Blend factor for a 0..1 smoothing knob: 0 snaps, values near 1 lag.
     */
    public static float exponential(float smoothing, float dt) {
        float k = 1f - FastMath.clamp(smoothing, 0f, 1f);
        return 1f - (float) Math.exp(-k * 30f * dt);
    }

    /**
     * Critically damped approach of {@code current} toward {@code target}.
     */
    public static float smoothDamp(float current, float target, Velocity velocity,
                                   float smoothTime, float maxSpeed, float dt) {
        smoothTime = Math.max(0.0001f, smoothTime);
        float omega = 2f / smoothTime;
        float x = omega * dt;
        float exp = 1f / (1f + x + 0.48f * x * x + 0.235f * x * x * x);

        float change = current - target;
        float originalTo = target;
        float maxChange = maxSpeed * smoothTime;
        change = FastMath.clamp(change, -maxChange, maxChange);
        target = current - change;

        float temp = (velocity.value + omega * change) * dt;
        velocity.value = (velocity.value - omega * temp) * exp;
        float output = target + (change + temp) * exp;

        // no overshoot
        if (originalTo - current > 0f == output > originalTo) {
            output = originalTo;
            velocity.value = dt > 0f ? (output - originalTo) / dt : 0f;
        }
        return output;
    }

    public static float smoothDampAngle(float current, float target, Velocity velocity,
                                        float smoothTime, float dt) {
        target = current + AngleMath.deltaAngle(current, target);
        return smoothDamp(current, target, velocity, smoothTime, Float.POSITIVE_INFINITY, dt);
    }

    /**
     * Vector form of {@link #smoothDamp}; writes the result into {@code store} and updates {@code velocity}.
     */
    public static Vector3f smoothDamp(Vector3f current, Vector3f target, Vector3f velocity,
                                      float smoothTime, float dt, Vector3f store) {
        smoothTime = Math.max(0.0001f, smoothTime);
        float omega = 2f / smoothTime;
        float x = omega * dt;
        float exp = 1f / (1f + x + 0.48f * x * x + 0.235f * x * x * x);

        float cx = current.x - target.x;
        float cy = current.y - target.y;
        float cz = current.z - target.z;

        float tx = (velocity.x + omega * cx) * dt;
        float ty = (velocity.y + omega * cy) * dt;
        float tz = (velocity.z + omega * cz) * dt;

        velocity.set((velocity.x - omega * tx) * exp,
                (velocity.y - omega * ty) * exp,
                (velocity.z - omega * tz) * exp);

        float ox = target.x + (cx + tx) * exp;
        float oy = target.y + (cy + ty) * exp;
        float oz = target.z + (cz + tz) * exp;

        float toTargetX = target.x - current.x;
        float toTargetY = target.y - current.y;
        float toTargetZ = target.z - current.z;
        float passedX = ox - target.x;
        float passedY = oy - target.y;
        float passedZ = oz - target.z;
        if (toTargetX * passedX + toTargetY * passedY + toTargetZ * passedZ > 0f) {
            ox = target.x;
            oy = target.y;
            oz = target.z;
            velocity.set(0f, 0f, 0f);
        }
        return store.set(ox, oy, oz);
    }
}
