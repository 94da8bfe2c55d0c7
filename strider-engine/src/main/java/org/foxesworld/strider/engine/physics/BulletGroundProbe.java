package org.foxesworld.strider.engine.physics;

import com.jme3.bullet.PhysicsSpace;
import com.jme3.bullet.collision.PhysicsCollisionEvent;
import com.jme3.bullet.collision.PhysicsCollisionObject;
import com.jme3.bullet.collision.shapes.SphereCollisionShape;
import com.jme3.bullet.objects.PhysicsGhostObject;
import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.motion.GroundProbe;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sphere overlap through a free-standing ghost object and {@link PhysicsSpace#contactTest}.
 * Ghost objects (triggers) and explicitly ignored objects never count as ground.
 */
public final class BulletGroundProbe implements GroundProbe {

    private final PhysicsSpace space;
    private final Set<PhysicsCollisionObject> ignored = ConcurrentHashMap.newKeySet();

    private PhysicsGhostObject ghost;
    private float ghostRadius = -1f;

    private int mask;
    private boolean found;

    public BulletGroundProbe(PhysicsSpace space) {
        this.space = Objects.requireNonNull(space, "space");
    }

    public BulletGroundProbe ignore(PhysicsCollisionObject pco) {
        ignored.add(Objects.requireNonNull(pco, "pco"));
        return this;
    }

    @Override
    public boolean overlaps(Vector3f centre, float radius, int layerMask) {
        if (radius <= 0f) return false;
        if (ghost == null || radius != ghostRadius) {
            ghost = new PhysicsGhostObject(new SphereCollisionShape(radius));
            ghostRadius = radius;
        }
        ghost.setPhysicsLocation(centre);

        mask = layerMask;
        found = false;
        space.contactTest(ghost, this::onContact);
        return found;
    }

    private void onContact(PhysicsCollisionEvent event) {
        if (found) return;
        PhysicsCollisionObject other = event.getObjectA() == ghost ? event.getObjectB() : event.getObjectA();
        if (other == null || other instanceof PhysicsGhostObject) return;
        if (ignored.contains(other)) return;
        if ((other.getCollisionGroup() & mask) == 0) return;
        found = true;
    }
}
