package org.foxesworld.strider.engine.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.strider.core.config.DirectionParameter;
import org.foxesworld.strider.core.config.ModeConfig;
import org.foxesworld.strider.core.config.MovementPolicy;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.view.ViewMode;
import org.graalvm.polyglot.Value;

import java.util.Locale;

import static org.foxesworld.strider.engine.config.JsCfg.*;

/**
 * Applies a tuning object onto a {@link PlayerConfig}. Missing keys keep their current
 * value; numbers are clamped to sane ranges.
 *
 * <pre>
 * ({
 *   initialMode: "thirdPerson", switchViewKey: "V",
 *   jumpHeight: 1.2, gravity: -9.81,
 *   firstPerson: { moveSpeed: 2, sprintSpeed: 6, topClamp: 65, bottomClamp: -75 },
 *   thirdPerson: { movementPolicy: "cameraRelative" },
 *   zoom: { speed: 10, min: 1, max: 10 },
 *   push: { enabled: true, strength: 1.1, layers: 2 }
 * })
 * </pre>
 */
public final class PlayerConfigBinder {

    private static final Logger log = LogManager.getLogger(PlayerConfigBinder.class);

    public void apply(Value cfg, PlayerConfig c) {
        if (cfg == null || cfg.isNull()) return;

        c.initialMode = ViewMode.parse(str(cfg, "initialMode", null), c.initialMode);
        String key = str(cfg, "switchViewKey", c.switchViewKey);
        if (key != null && !key.isBlank()) c.switchViewKey = key.trim();

        c.cameraAngleOverride = numClamp(cfg, "cameraAngleOverride", c.cameraAngleOverride, -90f, 90f);
        c.lockCameraPosition = bool(cfg, "lockCameraPosition", c.lockCameraPosition);
        c.lookSmoothing = numClamp(cfg, "lookSmoothing", c.lookSmoothing, 0f, 0.99f);

        c.jumpHeight = numClamp(cfg, "jumpHeight", c.jumpHeight, 0f, 100f);
        c.gravity = numClamp(cfg, "gravity", c.gravity, -200f, -0.1f);
        c.jumpTimeout = numClamp(cfg, "jumpTimeout", c.jumpTimeout, 0f, 10f);
        c.fallTimeout = numClamp(cfg, "fallTimeout", c.fallTimeout, 0f, 10f);

        c.groundedOffset = numClamp(cfg, "groundedOffset", c.groundedOffset, -10f, 10f);
        c.groundedRadius = numClamp(cfg, "groundedRadius", c.groundedRadius, 0.01f, 10f);
        c.groundLayers = intR(cfg, "groundLayers", c.groundLayers);

        c.directionParameter = parseDirection(str(cfg, "directionParameter", null), c.directionParameter);
        c.footstepVolume = numClamp(cfg, "footstepVolume", c.footstepVolume, 0f, 1f);
        vec3(member(cfg, "controllerCenter"), c.controllerCenter);

        applyMode(member(cfg, "firstPerson"), c.firstPerson);
        applyMode(member(cfg, "thirdPerson"), c.thirdPerson);

        Value zoom = member(cfg, "zoom");
        if (has(zoom)) {
            c.zoomSpeed = numClamp(zoom, "speed", c.zoomSpeed, 0f, 1000f);
            float min = numClamp(zoom, "min", c.zoomMinDistance, 0.1f, 1000f);
            float max = numClamp(zoom, "max", c.zoomMaxDistance, 0.1f, 1000f);
            c.zoomMinDistance = Math.min(min, max);
            c.zoomMaxDistance = Math.max(min, max);
        }

        Value head = member(cfg, "headFollow");
        if (has(head)) {
            vec3(member(head, "offset"), c.headOffset);
            c.headFollowX = bool(head, "followX", c.headFollowX);
            c.headFollowY = bool(head, "followY", c.headFollowY);
            c.headFollowZ = bool(head, "followZ", c.headFollowZ);
            c.headSmoothSpeed = numClamp(head, "smoothSpeed", c.headSmoothSpeed, 0.01f, 1000f);
            c.headSprintSmoothSpeed = numClamp(head, "sprintSmoothSpeed", c.headSprintSmoothSpeed, 0.01f, 1000f);
            c.headSnapThreshold = numClamp(head, "snapThreshold", c.headSnapThreshold, 0f, 100f);
            c.headRecenterDelay = numClamp(head, "recenterDelay", c.headRecenterDelay, 0f, 60f);
        }

        Value push = member(cfg, "push");
        if (has(push)) {
            c.pushEnabled = bool(push, "enabled", c.pushEnabled);
            c.pushStrength = numClamp(push, "strength", c.pushStrength, 0.5f, 5f);
            c.pushLayers = intR(push, "layers", c.pushLayers);
        }

        log.debug("[tuning] applied: mode={}, jumpHeight={}, gravity={}", c.initialMode, c.jumpHeight, c.gravity);
    }

    void applyMode(Value cfg, ModeConfig m) {
        if (!has(cfg)) return;

        m.moveSpeed = numClamp(cfg, "moveSpeed", m.moveSpeed, 0f, 1000f);
        m.sprintSpeed = numClamp(cfg, "sprintSpeed", m.sprintSpeed, 0f, 1000f);
        m.rotationSpeed = numClamp(cfg, "rotationSpeed", m.rotationSpeed, 0f, 100f);
        m.rotationSmoothTime = numClamp(cfg, "rotationSmoothTime", m.rotationSmoothTime, 0f, 0.3f);
        m.speedChangeRate = numClamp(cfg, "speedChangeRate", m.speedChangeRate, 0f, 1000f);

        float top = numClamp(cfg, "topClamp", m.topClamp, -90f, 90f);
        float bottom = numClamp(cfg, "bottomClamp", m.bottomClamp, -90f, 90f);
        m.topClamp = Math.max(top, bottom);
        m.bottomClamp = Math.min(top, bottom);

        m.movementPolicy = parsePolicy(str(cfg, "movementPolicy", null), m.movementPolicy);
    }

    static MovementPolicy parsePolicy(String raw, MovementPolicy def) {
        if (raw == null) return def;
        String s = raw.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        return switch (s) {
            case "character", "characterrelative" -> MovementPolicy.CHARACTER_RELATIVE;
            case "camera", "camerarelative" -> MovementPolicy.CAMERA_RELATIVE;
            case "world", "worldrelative" -> MovementPolicy.WORLD_RELATIVE;
            default -> {
                log.warn("[tuning] unknown movementPolicy '{}', keeping {}", raw, def);
                yield def;
            }
        };
    }

    static DirectionParameter parseDirection(String raw, DirectionParameter def) {
        if (raw == null) return def;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "raw" -> DirectionParameter.RAW;
            case "sign" -> DirectionParameter.SIGN;
            default -> {
                log.warn("[tuning] unknown directionParameter '{}', keeping {}", raw, def);
                yield def;
            }
        };
    }
}
