package org.foxesworld.strider.core.player;

import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.anim.AnimationParams;
import org.foxesworld.strider.core.anim.AnimationSink;
import org.foxesworld.strider.core.camera.CameraView;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.diag.Diagnostics;
import org.foxesworld.strider.core.motion.VerticalMotionIntegrator;
import org.foxesworld.strider.core.support.Fakes;
import org.foxesworld.strider.core.view.ViewMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlayerControllerLoopTest {

    private static final float DT = 1f / 60f;

    private final PlayerConfig cfg = new PlayerConfig();
    private final Fakes.Body body = new Fakes.Body();
    private final Fakes.Motor motor = new Fakes.Motor(body);
    private final Fakes.Input input = new Fakes.Input();
    private final Fakes.Anim anim = new Fakes.Anim();
    private final Fakes.Rig fpRig = new Fakes.Rig();
    private final Fakes.Rig tpRig = new Fakes.Rig();
    private final Fakes.Target fpTarget = new Fakes.Target();
    private final Fakes.Target tpTarget = new Fakes.Target();
    private final Fakes.View view = new Fakes.View();
    private final Diagnostics diag = new Diagnostics();

    private boolean grounded = true;
    private PlayerControllerLoop loop;

    @BeforeEach
    void setUp() {
        loop = PlayerControllerLoop.builder()
                .config(cfg)
                .input(input)
                .body(body)
                .motor(motor)
                .groundProbe((c, r, m) -> grounded)
                .animation(() -> Optional.<AnimationSink>of(anim))
                .cameraView(() -> Optional.<CameraView>of(view))
                .firstPersonRig(fpRig)
                .thirdPersonRig(tpRig)
                .firstPersonTarget(fpTarget)
                .thirdPersonTarget(tpTarget)
                .zoomRig(tpRig)
                .diagnostics(diag)
                .build();
        loop.start();
    }

    private void frame() {
        loop.update(DT);
        loop.lateUpdate(DT);
    }

    @Test
    void mustBeStartedFirst() {
        PlayerControllerLoop fresh = PlayerControllerLoop.builder()
                .input(input).body(body).motor(motor).groundProbe((c, r, m) -> true).build();
        assertThrows(IllegalStateException.class, () -> fresh.update(DT));
    }

    @Test
    void jumpScenario() {
        loop.state().vertical.jumpTimeoutRemaining = 0f;
        input.script = f -> f.jump = true;

        loop.update(DT);

        float launch = VerticalMotionIntegrator.launchVelocity(cfg.jumpHeight, cfg.gravity);
        assertTrue(anim.bools.get(AnimationParams.JUMP));
        assertEquals(launch + cfg.gravity * DT, loop.state().vertical.verticalVelocity, 0f);

        // the ground check of the next frame sees the character off the ground,
        // the integrator acts on it one frame after that
        grounded = false;
        loop.update(DT);
        assertTrue(loop.state().vertical.verticalVelocity > 4f);

        loop.update(DT);
        assertEquals(cfg.jumpTimeout, loop.state().vertical.jumpTimeoutRemaining, 0f);
        assertFalse(loop.frame().jump);
    }

    @Test
    void bufferedJumpDoesNotFireOnLanding() {
        grounded = false;
        loop.state().ground.grounded = false;
        input.script = f -> f.jump = true;
        loop.update(DT);
        assertFalse(loop.frame().jump);

        input.script = f -> {};
        grounded = true;
        for (int i = 0; i < 30; i++) loop.update(DT);
        assertTrue(loop.state().vertical.verticalVelocity < 0f);
    }

    @Test
    void standingStillKeepsGroundedVelocity() {
        for (int i = 0; i < 120; i++) frame();
        assertEquals(-2f + cfg.gravity * DT, loop.state().vertical.verticalVelocity, 0f);
        assertTrue(anim.bools.get(AnimationParams.GROUNDED));
    }

    @Test
    void walkingForwardMovesBodyAlongFacing() {
        input.script = f -> f.move.set(0f, 1f);
        for (int i = 0; i < 120; i++) frame();

        assertEquals(cfg.firstPerson.moveSpeed, loop.state().locomotion.currentSpeed, 0f);
        assertTrue(body.position.z > 3f);
        assertEquals(0f, body.position.x, 1e-4f);
        assertEquals(0.5f, anim.floats.get(AnimationParams.SPEED), 0f);
    }

    @Test
    void toggleSwitchesModeAndOrientationTarget() {
        assertEquals(ViewMode.FIRST_PERSON, loop.mode());
        assertTrue(fpRig.active);

        input.script = f -> {
            f.toggleViewHeld = true;
            f.look.set(10f, 0f);
        };
        frame();

        assertEquals(ViewMode.THIRD_PERSON, loop.mode());
        assertTrue(tpRig.active);
        assertFalse(fpRig.active);
        assertEquals(1, tpTarget.writes);
        assertEquals(-10f, loop.state().orientation.yaw, 1e-4f);

        input.script = f -> f.toggleViewHeld = false;
        frame();
        input.script = f -> f.toggleViewHeld = true;
        frame();
        assertEquals(ViewMode.FIRST_PERSON, loop.mode());
        assertTrue(fpRig.active);
    }

    @Test
    void initialModeComesFromConfig() {
        cfg.initialMode = ViewMode.THIRD_PERSON;
        loop.start();
        assertEquals(ViewMode.THIRD_PERSON, loop.mode());
        assertTrue(tpRig.active);
        assertFalse(fpRig.active);
    }

    @Test
    void zoomRunsOnlyInThirdPerson() {
        tpRig.distance = 5f;
        loop.start();
        input.script = f -> f.zoom = 0.2f;
        frame();
        assertEquals(5f, tpRig.distance, 0f);

        loop.viewModes().switchTo(ViewMode.THIRD_PERSON, loop.state().orientation, body, Optional.empty());
        frame();
        assertEquals(3f, tpRig.distance, 1e-5f);
    }

    @Test
    void failingCollaboratorIsContainedAndReportedOnce() {
        PlayerControllerLoop broken = PlayerControllerLoop.builder()
                .config(cfg)
                .input(input)
                .body(body)
                .motor((d, s) -> { throw new IllegalStateException("motor offline"); })
                .groundProbe((c, r, m) -> true)
                .animation(() -> Optional.<AnimationSink>of(anim))
                .firstPersonRig(fpRig)
                .thirdPersonRig(tpRig)
                .firstPersonTarget(fpTarget)
                .diagnostics(diag)
                .build();
        broken.start();

        input.script = f -> f.look.set(0f, 10f);
        broken.update(DT);
        broken.lateUpdate(DT);
        broken.update(DT);
        broken.lateUpdate(DT);

        assertTrue(diag.isReported("loop.locomotion"));
        // later steps kept running
        assertEquals(20f, broken.state().orientation.pitch, 1e-4f);
        assertTrue(anim.bools.get(AnimationParams.GROUNDED));
    }

    @Test
    void groundProbeCentreIsOffsetFromFeet() {
        Vector3f[] centre = new Vector3f[1];
        PlayerControllerLoop l = PlayerControllerLoop.builder()
                .config(cfg).input(input).body(body).motor(motor)
                .groundProbe((c, r, m) -> { centre[0] = c.clone(); return true; })
                .build();
        l.start();
        body.position.set(0f, 1f, 0f);
        l.update(DT);
        assertEquals(1.14f, centre[0].y, 1e-5f);
    }
}
