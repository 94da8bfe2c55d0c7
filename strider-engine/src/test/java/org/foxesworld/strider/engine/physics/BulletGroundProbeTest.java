package org.foxesworld.strider.engine.physics;

import com.jme3.bullet.PhysicsSpace;
import com.jme3.bullet.collision.PhysicsCollisionObject;
import com.jme3.bullet.collision.shapes.BoxCollisionShape;
import com.jme3.bullet.collision.shapes.SphereCollisionShape;
import com.jme3.bullet.objects.PhysicsGhostObject;
import com.jme3.bullet.objects.PhysicsRigidBody;
import com.jme3.math.Vector3f;
import com.jme3.system.NativeLibraryLoader;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BulletGroundProbeTest {

    private static final Vector3f ABOVE_FLOOR = new Vector3f(0f, 0.1f, 0f);

    private PhysicsSpace space;
    private BulletGroundProbe ground;

    @BeforeAll
    static void loadBullet() {
        NativeLibraryLoader.loadNativeLibrary("bulletjme", true);
    }

    @BeforeEach
    void setUp() {
        space = new PhysicsSpace(PhysicsSpace.BroadphaseType.DBVT);
        ground = new BulletGroundProbe(space);
    }

    private PhysicsRigidBody floor() {
        PhysicsRigidBody floor = new PhysicsRigidBody(new BoxCollisionShape(5f, 0.5f, 5f), 0f);
        floor.setPhysicsLocation(new Vector3f(0f, -0.5f, 0f));
        floor.setCollisionGroup(PhysicsCollisionObject.COLLISION_GROUP_01);
        space.addCollisionObject(floor);
        return floor;
    }

    @Test
    void floorCountsAsGround() {
        floor();
        assertTrue(ground.overlaps(ABOVE_FLOOR, 0.3f, PlayerConfig.ALL_LAYERS));
    }

    @Test
    void emptySpaceIsNotGround() {
        assertFalse(ground.overlaps(ABOVE_FLOOR, 0.3f, PlayerConfig.ALL_LAYERS));
    }

    @Test
    void triggerVolumesAreNotGround() {
        PhysicsGhostObject trigger = new PhysicsGhostObject(new SphereCollisionShape(1f));
        trigger.setPhysicsLocation(new Vector3f());
        space.addCollisionObject(trigger);

        assertFalse(ground.overlaps(new Vector3f(), 0.3f, PlayerConfig.ALL_LAYERS));
    }

    @Test
    void layerMaskFiltersByCollisionGroup() {
        floor();
        assertFalse(ground.overlaps(ABOVE_FLOOR, 0.3f, PhysicsCollisionObject.COLLISION_GROUP_02));
        assertTrue(ground.overlaps(ABOVE_FLOOR, 0.3f,
                PhysicsCollisionObject.COLLISION_GROUP_01 | PhysicsCollisionObject.COLLISION_GROUP_02));
    }

    @Test
    void ignoredObjectsAreNotGround() {
        ground.ignore(floor());
        assertFalse(ground.overlaps(ABOVE_FLOOR, 0.3f, PlayerConfig.ALL_LAYERS));
    }

    @Test
    void sphereFarAboveFloorIsAirborne() {
        floor();
        assertFalse(ground.overlaps(new Vector3f(0f, 2f, 0f), 0.3f, PlayerConfig.ALL_LAYERS));
    }

    @Test
    void nonPositiveRadiusNeverOverlaps() {
        floor();
        assertFalse(ground.overlaps(ABOVE_FLOOR, 0f, PlayerConfig.ALL_LAYERS));
    }
}
