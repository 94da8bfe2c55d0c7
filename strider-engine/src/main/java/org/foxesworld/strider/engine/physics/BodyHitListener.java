package org.foxesworld.strider.engine.physics;

import com.jme3.bullet.collision.PhysicsCollisionObject;
import com.jme3.math.Vector3f;

/**
 * Told about every collision object the character motor runs into.
 */
@FunctionalInterface
public interface BodyHitListener {

    /** {@code moveDirection} is normalised and must not be retained. */
    void onBodyHit(PhysicsCollisionObject hit, Vector3f moveDirection);
}
