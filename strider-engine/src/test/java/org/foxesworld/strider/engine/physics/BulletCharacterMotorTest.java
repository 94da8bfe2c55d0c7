package org.foxesworld.strider.engine.physics;

import com.jme3.bullet.PhysicsSpace;
import com.jme3.bullet.collision.PhysicsCollisionObject;
import com.jme3.bullet.collision.shapes.BoxCollisionShape;
import com.jme3.bullet.objects.PhysicsRigidBody;
import com.jme3.math.Vector3f;
import com.jme3.scene.Node;
import com.jme3.system.NativeLibraryLoader;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BulletCharacterMotorTest {

    private static final float RADIUS = 0.3f;
    private static final float HEIGHT = 1.8f;

    // wall face at x = 2.5
    private static final float WALL_FACE = 2.5f;

    private PhysicsSpace space;
    private Node body;
    private BulletCharacterMotor motor;
    private final Vector3f realized = new Vector3f();

    @BeforeAll
    static void loadBullet() {
        NativeLibraryLoader.loadNativeLibrary("bulletjme", true);
    }

    @BeforeEach
    void setUp() {
        space = new PhysicsSpace(PhysicsSpace.BroadphaseType.DBVT);
        body = new Node("body");
        motor = new BulletCharacterMotor(space, body, RADIUS, HEIGHT);
    }

    private PhysicsRigidBody wall(float mass, int group) {
        PhysicsRigidBody wall = new PhysicsRigidBody(new BoxCollisionShape(0.5f, 2f, 10f), mass);
        wall.setPhysicsLocation(new Vector3f(WALL_FACE + 0.5f, 1f, 0f));
        wall.setCollisionGroup(group);
        space.addCollisionObject(wall);
        return wall;
    }

    @Test
    void freeMoveAppliesWholeDisplacement() {
        motor.move(new Vector3f(1f, -0.5f, 2f), realized);

        assertEquals(1f, realized.x, 1e-5f);
        assertEquals(-0.5f, realized.y, 1e-5f);
        assertEquals(2f, realized.z, 1e-5f);
        assertEquals(realized, body.getLocalTranslation());
    }

    @Test
    void stopsSkinWidthShortOfWall() {
        wall(0f, PhysicsCollisionObject.COLLISION_GROUP_01);

        motor.move(new Vector3f(5f, 0f, 0f), realized);

        float contact = WALL_FACE - RADIUS;
        assertEquals(contact - motor.skinWidth, body.getLocalTranslation().x, 0.05f);
        assertTrue(body.getLocalTranslation().x < contact, "x " + body.getLocalTranslation().x);
        assertEquals(body.getLocalTranslation().x, realized.x, 1e-5f);
    }

    @Test
    void slidesAlongWallOnce() {
        wall(0f, PhysicsCollisionObject.COLLISION_GROUP_01);

        motor.move(new Vector3f(5f, 0f, 5f), realized);

        assertTrue(body.getLocalTranslation().x < WALL_FACE - RADIUS);
        // blocked on x, the rest of the move carries on along the wall
        assertEquals(5f, body.getLocalTranslation().z, 0.1f);
    }

    @Test
    void groupsOutsideCollideMaskAreWalkedThrough() {
        wall(0f, PhysicsCollisionObject.COLLISION_GROUP_02);

        motor.move(new Vector3f(5f, 0f, 0f), realized);

        assertEquals(5f, body.getLocalTranslation().x, 1e-5f);
    }

    @Test
    void hitsAreReportedWithMoveDirection() {
        PhysicsRigidBody wall = wall(0f, PhysicsCollisionObject.COLLISION_GROUP_01);
        List<PhysicsCollisionObject> hits = new ArrayList<>();
        List<Vector3f> dirs = new ArrayList<>();
        motor.addHitListener((hit, dir) -> {
            hits.add(hit);
            dirs.add(dir.clone());
        });

        motor.move(new Vector3f(5f, 0f, 0f), realized);

        assertSame(wall, hits.get(0));
        assertEquals(1f, dirs.get(0).x, 1e-5f);
    }

    @Test
    void pusherShovesDynamicBodiesItTouches() {
        PlayerConfig cfg = new PlayerConfig();
        cfg.pushEnabled = true;
        cfg.pushLayers = PhysicsCollisionObject.COLLISION_GROUP_01;
        PhysicsRigidBody crate = wall(2f, PhysicsCollisionObject.COLLISION_GROUP_01);
        crate.setGravity(new Vector3f());
        motor.addHitListener(new RigidBodyPusher(cfg));

        motor.move(new Vector3f(5f, 0f, 0f), realized);

        Vector3f v = crate.getLinearVelocity(null);
        assertEquals(cfg.pushStrength / 2f, v.x, 1e-4f);
        assertEquals(0f, v.y, 1e-6f);
    }

    @Test
    void rejectsCapsuleShorterThanItsDiameter() {
        assertThrows(IllegalArgumentException.class, () -> new BulletCharacterMotor(space, body, 0.5f, 0.8f));
    }
}
