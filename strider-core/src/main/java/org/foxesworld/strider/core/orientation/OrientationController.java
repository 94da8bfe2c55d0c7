package org.foxesworld.strider.core.orientation;

import com.jme3.math.FastMath;
import com.jme3.math.Quaternion;
import org.foxesworld.strider.core.config.ModeConfig;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.diag.Diagnostics;
import org.foxesworld.strider.core.input.InputFrame;
import org.foxesworld.strider.core.input.LookDevice;
import org.foxesworld.strider.core.math.AngleMath;
import org.foxesworld.strider.core.math.Smoothing;
import org.foxesworld.strider.core.motion.CharacterBody;

import java.util.Objects;
import java.util.Optional;

/**
 * Look handling for both modes. Runs in the late phase, after the body has moved.
 *
 * Positive look.x turns right (yaw decreases), positive look.y looks up.
 */
public final class OrientationController {

    /** Squared look magnitude under which input is treated as noise. */
    public static final float LOOK_THRESHOLD = 0.01f;

    public static final String DIAG_FP_TARGET = "orientation.firstPersonTarget";
    public static final String DIAG_TP_TARGET = "orientation.thirdPersonTarget";

    private final Diagnostics diagnostics;
    private final Quaternion tmpRot = new Quaternion();

    public OrientationController(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    static float deltaMultiplier(LookDevice device, float dt) {
        return device == LookDevice.POINTER ? 1f : dt;
    }

    public void firstPerson(OrientationState s, InputFrame in, ModeConfig mode, PlayerConfig cfg,
                            CharacterBody body, Optional<CameraTarget> target, float dt) {
        s.lastBodyYawDelta = 0f;

        if (in.look.lengthSquared() >= LOOK_THRESHOLD) {
            float mult = deltaMultiplier(in.lookDevice, dt);
            float speed = mode.rotationSpeed;

            s.pitch += in.look.y * speed * mult;
            float yawDelta = -in.look.x * speed * mult;

            s.pitch = AngleMath.clampAngle(s.pitch, mode.bottomClamp, mode.topClamp);

            body.rotateYaw(yawDelta);
            s.lastBodyYawDelta = yawDelta;
        }

        // clamps may have been retuned since the last frame
        s.pitch = FastMath.clamp(s.pitch, mode.bottomClamp, mode.topClamp);
        s.pitchSmoothed = approach(s.pitchSmoothed, s.pitch, cfg.lookSmoothing, dt);
        s.yawSmoothed = s.yaw;

        if (target.isEmpty()) {
            diagnostics.warnOnce(DIAG_FP_TARGET, "first-person camera target not assigned");
            return;
        }
        diagnostics.clear(DIAG_FP_TARGET);

        tmpRot.fromAngles(-s.pitchSmoothed * FastMath.DEG_TO_RAD, 0f, 0f);
        target.get().setRotation(tmpRot);
    }

    public void thirdPerson(OrientationState s, InputFrame in, ModeConfig mode, PlayerConfig cfg,
                            Optional<CameraTarget> target, float dt) {
        if (target.isEmpty()) {
            // no rotation to write, but the pitch clamps still hold
            s.pitch = AngleMath.clampAngle(s.pitch, mode.bottomClamp, mode.topClamp);
            diagnostics.warnOnce(DIAG_TP_TARGET, "third-person camera target not assigned");
            return;
        }
        diagnostics.clear(DIAG_TP_TARGET);

        if (in.look.lengthSquared() >= LOOK_THRESHOLD && !cfg.lockCameraPosition) {
            float mult = deltaMultiplier(in.lookDevice, dt);
            s.yaw -= in.look.x * mult;
            s.pitch += in.look.y * mult;
        }

        s.yaw = AngleMath.clampAngle(s.yaw, -AngleMath.FREE, AngleMath.FREE);
        s.pitch = AngleMath.clampAngle(s.pitch, mode.bottomClamp, mode.topClamp);

        float smoothing = cfg.lookSmoothing;
        if (smoothing <= 0f) {
            s.yawSmoothed = s.yaw;
        } else {
            s.yawSmoothed = AngleMath.lerpAngle(s.yawSmoothed, s.yaw, Smoothing.exponential(smoothing, dt));
        }
        s.pitchSmoothed = approach(s.pitchSmoothed, s.pitch, smoothing, dt);

        float pitch = s.pitchSmoothed + cfg.cameraAngleOverride;
        tmpRot.fromAngles(-pitch * FastMath.DEG_TO_RAD, s.yawSmoothed * FastMath.DEG_TO_RAD, 0f);
        target.get().setRotation(tmpRot);
    }

    private static float approach(float current, float target, float smoothing, float dt) {
        if (smoothing <= 0f) return target;
        return Smoothing.lerp(current, target, Smoothing.exponential(smoothing, dt));
    }
}
