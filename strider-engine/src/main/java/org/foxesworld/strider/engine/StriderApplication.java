package org.foxesworld.strider.engine;

import com.jme3.app.SimpleApplication;
import com.jme3.asset.plugins.FileLocator;
import com.jme3.bullet.BulletAppState;
import com.jme3.bullet.PhysicsSpace;
import com.jme3.bullet.collision.PhysicsCollisionObject;
import com.jme3.bullet.collision.PhysicsRayTestResult;
import com.jme3.bullet.control.RigidBodyControl;
import com.jme3.bullet.objects.PhysicsGhostObject;
import com.jme3.light.AmbientLight;
import com.jme3.light.DirectionalLight;
import com.jme3.material.Material;
import com.jme3.math.ColorRGBA;
import com.jme3.math.FastMath;
import com.jme3.math.Vector3f;
import com.jme3.scene.Geometry;
import com.jme3.scene.Node;
import com.jme3.scene.Spatial;
import com.jme3.scene.shape.Box;
import com.jme3.scene.shape.Cylinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.strider.core.audio.FootstepAudio;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.diag.Diagnostics;
import org.foxesworld.strider.core.player.PlayerControllerLoop;
import org.foxesworld.strider.core.view.ViewMode;
import org.foxesworld.strider.engine.app.PlayerCameraAppState;
import org.foxesworld.strider.engine.app.PlayerControllerAppState;
import org.foxesworld.strider.engine.audio.DistanceGait;
import org.foxesworld.strider.engine.audio.JmeAudioSink;
import org.foxesworld.strider.engine.camera.JmeCameraRig;
import org.foxesworld.strider.engine.camera.MainCameraView;
import org.foxesworld.strider.engine.config.TuningReloader;
import org.foxesworld.strider.engine.input.JmeInputSource;
import org.foxesworld.strider.engine.physics.BulletCharacterMotor;
import org.foxesworld.strider.engine.physics.BulletGroundProbe;
import org.foxesworld.strider.engine.physics.RigidBodyPusher;
import org.foxesworld.strider.engine.scene.SpatialCameraTarget;
import org.foxesworld.strider.engine.scene.SpatialCharacterBody;
import org.foxesworld.strider.engine.scene.UserDataAnimationSink;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Demo scene: a floor, a few pushable crates and one player with both views.
 */
public class StriderApplication extends SimpleApplication {

    private static final Logger log = LogManager.getLogger(StriderApplication.class);

    static final int FLOOR_GROUP = PhysicsCollisionObject.COLLISION_GROUP_01;
    static final int CRATE_GROUP = PhysicsCollisionObject.COLLISION_GROUP_02;

    static final float CAPSULE_RADIUS = 0.28f;
    static final float CAPSULE_HEIGHT = 1.8f;
    static final float EYE_HEIGHT = 1.6f;

    private BulletAppState bullet;
    private JmeAudioSink audio;

    @Override
    public void simpleInitApp() {
        log.info("{} {}", StriderVersion.NAME, StriderVersion.VERSION);
        log.info("Java: {}", System.getProperty("java.version"));
        log.info("OS: {} {}", System.getProperty("os.name"), System.getProperty("os.version"));

        assetManager.registerLocator(StriderVersion.ASSETSDIR, FileLocator.class);
        flyCam.setEnabled(false);

        bullet = new BulletAppState();
        stateManager.attach(bullet);
        PhysicsSpace space = bullet.getPhysicsSpace();
        space.setGravity(new Vector3f(0, -9.81f, 0));

        addLights();
        buildFloor(space);
        buildCrates(space);

        PlayerConfig config = new PlayerConfig();
        config.groundedRadius = CAPSULE_RADIUS;
        config.groundLayers = FLOOR_GROUP | CRATE_GROUP;
        config.pushEnabled = true;
        config.pushLayers = CRATE_GROUP;

        Diagnostics diagnostics = new Diagnostics();

        // player: body under root, first-person target at eye height, head anchor next to it
        Node player = new Node("player");
        player.setLocalTranslation(0f, 0.1f, 0f);
        rootNode.attachChild(player);
        Geometry bodyGeom = new Geometry("playerBody", new Cylinder(8, 16, CAPSULE_RADIUS, CAPSULE_HEIGHT, true));
        bodyGeom.setMaterial(lit(ColorRGBA.Orange));
        bodyGeom.rotate(FastMath.HALF_PI, 0f, 0f);
        bodyGeom.setLocalTranslation(0f, CAPSULE_HEIGHT * 0.5f, 0f);
        player.attachChild(bodyGeom);

        Node head = new Node("head");
        head.setLocalTranslation(0f, EYE_HEIGHT, 0f);
        player.attachChild(head);
        Node fpTargetNode = new Node("firstPersonTarget");
        head.attachChild(fpTargetNode);
        Node tpTargetNode = new Node("thirdPersonTarget");
        rootNode.attachChild(tpTargetNode);

        SpatialCharacterBody body = new SpatialCharacterBody(player, 0f);
        SpatialCameraTarget fpTarget = new SpatialCameraTarget(fpTargetNode);
        SpatialCameraTarget tpTarget = new SpatialCameraTarget(tpTargetNode);

        BulletCharacterMotor motor = new BulletCharacterMotor(space, player, CAPSULE_RADIUS, CAPSULE_HEIGHT);
        motor.collideWithGroups = FLOOR_GROUP | CRATE_GROUP;
        motor.addHitListener(new RigidBodyPusher(config));

        JmeCameraRig fpRig = new JmeCameraRig(JmeCameraRig.Kind.FIRST_PERSON, cam, null);
        JmeCameraRig tpRig = new JmeCameraRig(JmeCameraRig.Kind.THIRD_PERSON, cam, (from, to) -> rayFraction(space, from, to));

        JmeInputSource input = new JmeInputSource(config);
        MainCameraView view = new MainCameraView(cam);
        UserDataAnimationSink anim = new UserDataAnimationSink(player);

        TuningReloader tuning = TuningReloader.fromSystemProperty(config);

        PlayerControllerLoop loop = PlayerControllerLoop.builder()
                .config(config)
                .input(input)
                .body(body)
                .motor(motor)
                .groundProbe(new BulletGroundProbe(space))
                .animation(() -> Optional.of(anim))
                .cameraView(() -> Optional.of(view))
                .firstPersonRig(fpRig)
                .thirdPersonRig(tpRig)
                .firstPersonTarget(fpTarget)
                .thirdPersonTarget(tpTarget)
                .zoomRig(tpRig)
                .diagnostics(diagnostics)
                .build();

        loop.viewModes().addListener((from, to) ->
                bodyGeom.setCullHint(to == ViewMode.FIRST_PERSON ? Spatial.CullHint.Always : Spatial.CullHint.Inherit));

        audio = new JmeAudioSink(assetManager, rootNode);
        FootstepAudio footsteps = new FootstepAudio(audio, body, config, diagnostics,
                List.of("Sounds/Player/footstep_01.ogg", "Sounds/Player/footstep_02.ogg",
                        "Sounds/Player/footstep_03.ogg", "Sounds/Player/footstep_04.ogg"),
                "Sounds/Player/land.ogg", new Random());

        stateManager.attach(new PlayerControllerAppState(loop, input, tuning));
        stateManager.attach(new PlayerCameraAppState(loop, fpRig, tpRig, tpTarget)
                .headFollow(head, fpTarget)
                .gait(new DistanceGait(footsteps)));
    }

    static float rayFraction(PhysicsSpace space, Vector3f from, Vector3f to) {
        float best = 1f;
        for (PhysicsRayTestResult r : space.rayTest(from, to)) {
            PhysicsCollisionObject pco = r.getCollisionObject();
            if (pco instanceof PhysicsGhostObject) continue;
            if ((pco.getCollisionGroup() & FLOOR_GROUP) == 0) continue;
            best = Math.min(best, r.getHitFraction());
        }
        return best;
    }

    private void addLights() {
        AmbientLight ambient = new AmbientLight(ColorRGBA.White.mult(0.35f));
        rootNode.addLight(ambient);
        DirectionalLight sun = new DirectionalLight(new Vector3f(-0.4f, -1f, -0.3f).normalizeLocal());
        rootNode.addLight(sun);
        viewPort.setBackgroundColor(new ColorRGBA(0.55f, 0.7f, 0.9f, 1f));
    }

    private void buildFloor(PhysicsSpace space) {
        Geometry floor = new Geometry("floor", new Box(50f, 0.5f, 50f));
        floor.setMaterial(lit(ColorRGBA.DarkGray));
        floor.setLocalTranslation(0f, -0.5f, 0f);
        RigidBodyControl rb = new RigidBodyControl(0f);
        floor.addControl(rb);
        rb.setCollisionGroup(FLOOR_GROUP);
        space.add(rb);
        rootNode.attachChild(floor);

        // a step to walk onto
        Geometry step = new Geometry("step", new Box(2f, 0.15f, 2f));
        step.setMaterial(lit(ColorRGBA.Gray));
        step.setLocalTranslation(0f, 0.15f, 8f);
        RigidBodyControl stepRb = new RigidBodyControl(0f);
        step.addControl(stepRb);
        stepRb.setCollisionGroup(FLOOR_GROUP);
        space.add(stepRb);
        rootNode.attachChild(step);
    }

    private void buildCrates(PhysicsSpace space) {
        for (int i = 0; i < 4; i++) {
            Geometry crate = new Geometry("crate" + i, new Box(0.4f, 0.4f, 0.4f));
            crate.setMaterial(lit(ColorRGBA.Brown));
            crate.setLocalTranslation(-3f + i * 2f, 0.4f, 4f);
            RigidBodyControl rb = new RigidBodyControl(20f);
            crate.addControl(rb);
            rb.setCollisionGroup(CRATE_GROUP);
            rb.setCollideWithGroups(FLOOR_GROUP | CRATE_GROUP);
            space.add(rb);
            rootNode.attachChild(crate);
        }
    }

    private Material lit(ColorRGBA color) {
        Material m = new Material(assetManager, "Common/MatDefs/Light/Lighting.j3md");
        m.setBoolean("UseMaterialColors", true);
        m.setColor("Diffuse", color);
        m.setColor("Ambient", color);
        return m;
    }

    @Override
    public void destroy() {
        if (audio != null) audio.release();
        super.destroy();
    }

    @Override
    public void handleError(String errMsg, Throwable t) {
        log.error("Fatal: {}", errMsg, t);
        stop();
    }
}
