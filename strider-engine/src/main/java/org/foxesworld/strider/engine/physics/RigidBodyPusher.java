package org.foxesworld.strider.engine.physics;

import com.jme3.bullet.collision.PhysicsCollisionObject;
import com.jme3.bullet.objects.PhysicsRigidBody;
import com.jme3.math.Vector3f;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.motion.PushRule;

import java.util.Objects;

/**
 * Shoves dynamic rigid bodies the character walks into.
 */
public final class RigidBodyPusher implements BodyHitListener {

    private static final Logger log = LogManager.getLogger(RigidBodyPusher.class);

    private final PlayerConfig config;
    private final Vector3f impulse = new Vector3f();

    public RigidBodyPusher(PlayerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public void onBodyHit(PhysicsCollisionObject hit, Vector3f moveDirection) {
        if (!(hit instanceof PhysicsRigidBody rb)) return;

        if (!PushRule.impulse(config.pushEnabled, rb.isDynamic(), rb.getCollisionGroup(), config.pushLayers,
                moveDirection, config.pushStrength, impulse)) {
            return;
        }
        rb.activate();
        rb.applyCentralImpulse(impulse);
        log.trace("[push] {} impulse={}", rb, impulse);
    }
}
