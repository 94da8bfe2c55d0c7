package org.foxesworld.strider.core.motion;

import com.jme3.math.FastMath;
import com.jme3.math.Vector3f;

/**
 * The controlled character's transform. Yaw in degrees, 0 faces +Z.
 */
public interface CharacterBody {

    Vector3f getPosition(Vector3f store);

    float getYaw();

    void setYaw(float degrees);

    default void rotateYaw(float deltaDegrees) {
        setYaw(getYaw() + deltaDegrees);
    }

    default Vector3f forward(Vector3f store) {
        float r = getYaw() * FastMath.DEG_TO_RAD;
        return store.set(FastMath.sin(r), 0f, FastMath.cos(r));
    }

    default Vector3f right(Vector3f store) {
        float r = getYaw() * FastMath.DEG_TO_RAD;
        return store.set(-FastMath.cos(r), 0f, FastMath.sin(r));
    }
}
