package org.foxesworld.strider.engine.physics;

import com.jme3.bullet.PhysicsSpace;
import com.jme3.bullet.collision.PhysicsCollisionObject;
import com.jme3.bullet.collision.PhysicsSweepTestResult;
import com.jme3.bullet.collision.shapes.CapsuleCollisionShape;
import com.jme3.bullet.objects.PhysicsGhostObject;
import com.jme3.math.Transform;
import com.jme3.math.Vector3f;
import com.jme3.scene.Spatial;
import org.foxesworld.strider.core.motion.CharacterMotor;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Kinematic capsule character. Each move is resolved as a horizontal sweep (with one slide
 * along the blocking surface) followed by a vertical sweep, stopping a skin width short of
 * whatever was hit. The spatial is expected to hang directly under the root node, feet at
 * its origin.
 */
public final class BulletCharacterMotor implements CharacterMotor {

    static final float MIN_MOVE = 1e-5f;

    private final PhysicsSpace space;
    private final Spatial body;
    private final CapsuleCollisionShape shape;
    private final Vector3f centreOffset;
    private final List<BodyHitListener> listeners = new CopyOnWriteArrayList<>();

    public volatile float skinWidth = 0.02f;
    public volatile int collideWithGroups = PhysicsCollisionObject.COLLISION_GROUP_01;

    private final Vector3f start = new Vector3f();
    private final Vector3f pos = new Vector3f();
    private final Vector3f part = new Vector3f();
    private final Vector3f dir = new Vector3f();
    private final Vector3f from = new Vector3f();
    private final Vector3f to = new Vector3f();
    private final Vector3f normal = new Vector3f();
    private final Transform fromT = new Transform();
    private final Transform toT = new Transform();

    public BulletCharacterMotor(PhysicsSpace space, Spatial body, float radius, float height) {
        this.space = Objects.requireNonNull(space, "space");
        this.body = Objects.requireNonNull(body, "body");
        if (radius <= 0f || height < 2f * radius) {
            throw new IllegalArgumentException("bad capsule: radius=" + radius + " height=" + height);
        }
        this.shape = new CapsuleCollisionShape(radius, height - 2f * radius);
        this.centreOffset = new Vector3f(0f, height * 0.5f, 0f);
    }

    public void addHitListener(BodyHitListener l) {
        listeners.add(Objects.requireNonNull(l, "listener"));
    }

    @Override
    public Vector3f move(Vector3f displacement, Vector3f store) {
        start.set(body.getLocalTranslation());
        pos.set(start);

        part.set(displacement.x, 0f, displacement.z);
        if (sweep(part)) {
            // slide the rest along the wall, once
            part.set(displacement.x, 0f, displacement.z).subtractLocal(pos.x - start.x, 0f, pos.z - start.z);
            float into = part.dot(normal);
            if (into < 0f) part.subtractLocal(normal.x * into, 0f, normal.z * into);
            part.y = 0f;
            sweep(part);
        }

        part.set(0f, displacement.y, 0f);
        sweep(part);

        body.setLocalTranslation(pos);
        return store.set(pos).subtractLocal(start);
    }

    /**
     * Advances {@link #pos} by {@code delta} or up to the first blocking hit.
     * @return true when something blocked the move; {@link #normal} then holds its normal
     */
    private boolean sweep(Vector3f delta) {
        float len = delta.length();
        if (len < MIN_MOVE) return false;

        float skin = skinWidth;
        dir.set(delta).divideLocal(len);
        from.set(pos).addLocal(centreOffset);
        to.set(dir).multLocal(len + skin).addLocal(from);
        fromT.setTranslation(from);
        toT.setTranslation(to);

        List<PhysicsSweepTestResult> results = space.sweepTest(shape, fromT, toT);
        PhysicsSweepTestResult best = null;
        for (PhysicsSweepTestResult r : results) {
            PhysicsCollisionObject pco = r.getCollisionObject();
            if (pco instanceof PhysicsGhostObject) continue;
            if ((pco.getCollisionGroup() & collideWithGroups) == 0) continue;
            if (best == null || r.getHitFraction() < best.getHitFraction()) best = r;
        }

        if (best == null) {
            pos.addLocal(delta);
            return false;
        }

        float travel = Math.max(0f, best.getHitFraction() * (len + skin) - skin);
        pos.addLocal(dir.x * travel, dir.y * travel, dir.z * travel);
        best.getHitNormalLocal(normal);

        for (BodyHitListener l : listeners) {
            l.onBodyHit(best.getCollisionObject(), dir);
        }
        return true;
    }
}
