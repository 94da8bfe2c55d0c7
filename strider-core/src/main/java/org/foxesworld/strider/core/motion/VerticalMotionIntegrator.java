package org.foxesworld.strider.core.motion;

import com.jme3.math.FastMath;
import org.foxesworld.strider.core.anim.AnimationParams;
import org.foxesworld.strider.core.anim.AnimationSink;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.input.InputFrame;

import java.util.Optional;

/**
 * Jump, fall and gravity for one character.
 *
 * Runs before the frame's ground probe, so {@code grounded} is the value the previous probe left.
 */
public final class VerticalMotionIntegrator {

    /** Starts with both cooldowns primed and no vertical velocity. */
    public void reset(VerticalState s, PlayerConfig cfg) {
        s.verticalVelocity = 0f;
        s.jumpTimeoutRemaining = cfg.jumpTimeout;
        s.fallTimeoutRemaining = cfg.fallTimeout;
    }

    public static float launchVelocity(float jumpHeight, float gravity) {
        return FastMath.sqrt(Math.max(0f, jumpHeight * -2f * gravity));
    }

    public void integrate(VerticalState s, boolean grounded, InputFrame input, PlayerConfig cfg,
                          Optional<AnimationSink> anim, float dt) {
        final float gravity = cfg.gravity;

        if (grounded) {
            s.fallTimeoutRemaining = cfg.fallTimeout;

            anim.ifPresent(a -> {
                a.setBool(AnimationParams.JUMP, false);
                a.setBool(AnimationParams.FREE_FALL, false);
            });

            if (s.verticalVelocity < 0f) {
                s.verticalVelocity = VerticalState.GROUNDED_VELOCITY;
            }

            if (input.jump && s.jumpTimeoutRemaining <= 0f) {
                s.verticalVelocity = launchVelocity(cfg.jumpHeight, gravity);
                anim.ifPresent(a -> a.setBool(AnimationParams.JUMP, true));
            }

            if (s.jumpTimeoutRemaining >= 0f) {
                s.jumpTimeoutRemaining -= dt;
            }
        } else {
            s.jumpTimeoutRemaining = cfg.jumpTimeout;

            if (s.fallTimeoutRemaining >= 0f) {
                s.fallTimeoutRemaining -= dt;
            } else {
                anim.ifPresent(a -> a.setBool(AnimationParams.FREE_FALL, true));
            }

            input.clearJump();
        }

        // one Euler step, may overshoot terminal velocity by a frame
        if (s.verticalVelocity < VerticalState.TERMINAL_VELOCITY) {
            s.verticalVelocity += gravity * dt;
        }
    }
}
