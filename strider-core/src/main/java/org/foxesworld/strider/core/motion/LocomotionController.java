package org.foxesworld.strider.core.motion;

import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.anim.AnimationParams;
import org.foxesworld.strider.core.anim.AnimationSink;
import org.foxesworld.strider.core.camera.CameraView;
import org.foxesworld.strider.core.config.DirectionParameter;
import org.foxesworld.strider.core.config.ModeConfig;
import org.foxesworld.strider.core.config.MovementPolicy;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.diag.Diagnostics;
import org.foxesworld.strider.core.input.InputFrame;
import org.foxesworld.strider.core.math.AngleMath;
import org.foxesworld.strider.core.math.Smoothing;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Horizontal movement for both view modes: speed ramp, direction, facing and the
 * single combined displacement call.
 */
public final class LocomotionController {

    static final float SPEED_OFFSET = 0.1f;
    static final float BLEND_FLOOR = 0.01f;
    static final float FACING_THRESHOLD = 0.01f;

    public static final String DIAG_NO_CAMERA = "locomotion.camera";

    private final CharacterBody body;
    private final CharacterMotor motor;
    private final Supplier<Optional<CameraView>> camera;
    private final Diagnostics diagnostics;

    private final Vector3f forward = new Vector3f();
    private final Vector3f right = new Vector3f();
    private final Vector3f facing = new Vector3f();
    private final Vector3f displacement = new Vector3f();
    private final Vector3f realized = new Vector3f();

    public LocomotionController(CharacterBody body, CharacterMotor motor,
                                Supplier<Optional<CameraView>> camera, Diagnostics diagnostics) {
        this.body = Objects.requireNonNull(body, "body");
        this.motor = Objects.requireNonNull(motor, "motor");
        this.camera = Objects.requireNonNull(camera, "camera");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public void update(LocomotionState s, InputFrame in, ModeConfig mode, PlayerConfig cfg,
                       float verticalVelocity, Optional<AnimationSink> anim, float dt) {
        final boolean hasMove = in.hasMove();

        float targetSpeed = in.sprint ? mode.sprintSpeed : mode.moveSpeed;
        if (!hasMove) targetSpeed = 0f;
        s.targetSpeed = targetSpeed;

        s.inputMagnitude = in.analogMovement ? in.move.length() : 1f;

        final float rate = mode.speedChangeRate;
        final float wanted = targetSpeed * s.inputMagnitude;
        if (Math.abs(s.currentSpeed - wanted) > SPEED_OFFSET) {
            s.currentSpeed = Smoothing.moveTowards(s.currentSpeed, wanted, rate * dt);
        } else {
            s.currentSpeed = wanted;
        }

        s.animationBlend = Smoothing.lerp(s.animationBlend, targetSpeed, dt * rate);
        if (s.animationBlend < BLEND_FLOOR) s.animationBlend = 0f;

        resolveDirection(s, in, mode, dt);

        displacement.set(s.direction).multLocal(s.currentSpeed * s.inputMagnitude * dt);
        displacement.y += verticalVelocity * dt;

        motor.move(displacement, realized);
        if (dt > 0f) {
            s.realizedVelocity.set(realized).divideLocal(dt);
        } else {
            s.realizedVelocity.set(0f, 0f, 0f);
        }

        anim.ifPresent(a -> publish(a, s, in, mode, cfg));
    }

    private void resolveDirection(LocomotionState s, InputFrame in, ModeConfig mode, float dt) {
        final float mx = in.move.x;
        final float my = in.move.y;

        switch (mode.movementPolicy) {
            case CHARACTER_RELATIVE -> {
                body.right(right);
                body.forward(forward);
                s.direction.set(right).multLocal(mx).addLocal(forward.x * my, 0f, forward.z * my);
                if (s.direction.lengthSquared() > 0.01f) {
                    s.direction.normalizeLocal();
                } else {
                    s.direction.set(0f, 0f, 0f);
                }
            }
            case CAMERA_RELATIVE -> {
                Optional<CameraView> view = camera.get();
                if (view.isEmpty()) {
                    diagnostics.warnOnce(DIAG_NO_CAMERA, "no main camera; camera-relative movement skipped");
                    s.direction.set(0f, 0f, 0f);
                    return;
                }
                diagnostics.clear(DIAG_NO_CAMERA);

                flatten(view.get().forward(forward));
                flatten(view.get().right(right));

                // backward keeps the front facing away from the camera
                float fz = my < -FACING_THRESHOLD ? -my : my;
                facing.set(right).multLocal(mx).addLocal(forward.x * fz, 0f, forward.z * fz).normalizeLocal();

                if (in.hasMove() && Math.abs(my) > FACING_THRESHOLD) {
                    turnToward(s, facing, mode, dt);
                }

                s.direction.set(right).multLocal(mx).addLocal(forward.x * my, 0f, forward.z * my).normalizeLocal();
            }
            case WORLD_RELATIVE -> {
                if (!in.hasMove()) {
                    s.direction.set(0f, 0f, 0f);
                    return;
                }
                // world right is -X in a +Z-forward basis
                s.direction.set(-mx, 0f, my).normalizeLocal();
                turnToward(s, s.direction, mode, dt);
            }
        }
    }

    private void turnToward(LocomotionState s, Vector3f dir, ModeConfig mode, float dt) {
        if (dir.x == 0f && dir.z == 0f) return;
        s.targetRotation = AngleMath.headingOf(dir.x, dir.z);
        float yaw = Smoothing.smoothDampAngle(body.getYaw(), s.targetRotation, s.rotationVelocity,
                mode.rotationSmoothTime, dt);
        body.setYaw(yaw);
    }

    private static void flatten(Vector3f v) {
        v.y = 0f;
        v.normalizeLocal();
    }

    private static void publish(AnimationSink a, LocomotionState s, InputFrame in, ModeConfig mode, PlayerConfig cfg) {
        a.setFloat(AnimationParams.SPEED, normalizedBlend(s.animationBlend, mode.moveSpeed, mode.sprintSpeed));
        a.setFloat(AnimationParams.MOTION_SPEED, s.inputMagnitude);
        a.setFloat(AnimationParams.DIRECTION, direction(in.move.y, cfg.directionParameter));
    }

    /**
     * Maps a blend speed onto [0, 1]: 0..0.5 covers walking, 0.5..1 covers walk to sprint.
     * Rounded to two decimals.
     */
    public static float normalizedBlend(float blend, float moveSpeed, float sprintSpeed) {
        float n = 0f;
        if (blend > 0f) {
            if (blend <= moveSpeed) {
                n = Smoothing.inverseLerp(0f, moveSpeed, blend) * 0.5f;
            } else {
                n = 0.5f + Smoothing.inverseLerp(moveSpeed, sprintSpeed, blend) * 0.5f;
            }
        }
        return Math.round(n * 100f) / 100f;
    }

    static float direction(float moveY, DirectionParameter mode) {
        if (mode == DirectionParameter.RAW) return moveY;
        if (moveY > FACING_THRESHOLD) return 1f;
        if (moveY < -FACING_THRESHOLD) return -1f;
        return 0f;
    }
}
