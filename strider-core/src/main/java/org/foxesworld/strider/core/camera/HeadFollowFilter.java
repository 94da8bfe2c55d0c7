package org.foxesworld.strider.core.camera;

import com.jme3.math.Quaternion;
import com.jme3.math.Vector2f;
import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.math.Smoothing;

import java.util.Objects;

/**
 * Keeps a first-person camera anchor close to a (possibly animated) head.
 *
 * The anchor trails the head with a damped spring. When it drifts past the snap
 * threshold and the player has not looked around for a while, it jumps straight back.
 */
public final class HeadFollowFilter {

    static final float LOOK_AXIS_THRESHOLD = 0.01f;

    private final PlayerConfig config;

    private final Vector3f velocity = new Vector3f();
    private final Vector3f goal = new Vector3f();
    private final Vector3f axis = new Vector3f();

    private float lookIdle;

    public HeadFollowFilter(PlayerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @param current anchor position of the previous frame
     * @param headRotation head orientation; its +Z column is forward, -X column right
     * @param looking whether look input was above the dead zone this frame
     * @return {@code store}, holding the new anchor position
     */
    public Vector3f update(Vector3f current, Vector3f headPosition, Quaternion headRotation,
                           boolean looking, boolean sprinting, float dt, Vector3f store) {
        Vector3f off = config.headOffset;

        goal.set(headPosition);
        headRotation.getRotationColumn(0, axis).multLocal(-off.x);
        goal.addLocal(axis);
        headRotation.getRotationColumn(1, axis).multLocal(off.y);
        goal.addLocal(axis);
        headRotation.getRotationColumn(2, axis).multLocal(off.z);
        goal.addLocal(axis);

        if (!config.headFollowX) goal.x = current.x;
        if (!config.headFollowY) goal.y = current.y;
        if (!config.headFollowZ) goal.z = current.z;

        lookIdle = looking ? 0f : lookIdle + dt;

        float dist = current.distance(goal);
        if (dist > config.headSnapThreshold && lookIdle >= config.headRecenterDelay) {
            velocity.set(0f, 0f, 0f);
            return store.set(goal);
        }

        float speed = sprinting ? config.headSprintSmoothSpeed : config.headSmoothSpeed;
        float smoothTime = 1f / Math.max(0.0001f, speed);
        return Smoothing.smoothDamp(current, goal, velocity, smoothTime, dt, store);
    }

    /** Whether either look axis moved enough to hold off recentering. */
    public static boolean isLooking(Vector2f look) {
        return Math.abs(look.x) > LOOK_AXIS_THRESHOLD || Math.abs(look.y) > LOOK_AXIS_THRESHOLD;
    }

    public float lookIdleTime() { return lookIdle; }

    public void reset() {
        velocity.set(0f, 0f, 0f);
        lookIdle = 0f;
    }
}
