package org.foxesworld.strider.core.motion;

import com.jme3.math.Vector3f;

/**
 * Collision-resolving displacement of the character. Called at most once per frame.
 */
@FunctionalInterface
public interface CharacterMotor {

    /**
     * Moves by {@code displacement} and writes the displacement actually travelled into {@code store}.
     */
    Vector3f move(Vector3f displacement, Vector3f store);
}
