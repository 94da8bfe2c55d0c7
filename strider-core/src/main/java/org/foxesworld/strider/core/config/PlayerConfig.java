package org.foxesworld.strider.core.config;

import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.view.ViewMode;

/**
 * All controller tunables.
 *
 * Fields are volatile so a tuning reload may write them between frames;
 * the controller reads each value at most once per sub-update.
 */
public final class PlayerConfig {

    public static final int ALL_LAYERS = -1;

    public final ModeConfig firstPerson = ModeConfig.firstPersonDefaults();
    public final ModeConfig thirdPerson = ModeConfig.thirdPersonDefaults();

    // -------------------------------------------------------------------------
    // View
    // -------------------------------------------------------------------------
    public volatile ViewMode initialMode = ViewMode.FIRST_PERSON;
    public volatile String switchViewKey = "C";

    /** Added to third-person pitch when building the camera rotation. */
    public volatile float cameraAngleOverride = 0f;
    public volatile boolean lockCameraPosition = false;

    /** 0..1: 0 writes look angles directly, higher values lag. */
    public volatile float lookSmoothing = 0f;

    // -------------------------------------------------------------------------
    // Vertical motion
    // -------------------------------------------------------------------------
    public volatile float jumpHeight = 1.2f;
    public volatile float gravity = -9.81f;
    public volatile float jumpTimeout = 0.1f;
    public volatile float fallTimeout = 0.15f;

    // -------------------------------------------------------------------------
    // Ground probe
    // -------------------------------------------------------------------------
    public volatile float groundedOffset = -0.14f;
    public volatile float groundedRadius = 0.5f;
    public volatile int groundLayers = ALL_LAYERS;

    // -------------------------------------------------------------------------
    // Animation / audio
    // -------------------------------------------------------------------------
    public volatile DirectionParameter directionParameter = DirectionParameter.RAW;
    public volatile float footstepVolume = 0.5f;

    /** Footstep origin relative to the body position. */
    public final Vector3f controllerCenter = new Vector3f(0f, 0.93f, 0f);

    // -------------------------------------------------------------------------
    // Third-person zoom
    // -------------------------------------------------------------------------
    public volatile float zoomSpeed = 10f;
    public volatile float zoomMinDistance = 1f;
    public volatile float zoomMaxDistance = 10f;

    // -------------------------------------------------------------------------
    // Head follow
    // -------------------------------------------------------------------------
    public final Vector3f headOffset = new Vector3f(0f, 0.1f, 0.1f);
    public volatile boolean headFollowX = true;
    public volatile boolean headFollowY = true;
    public volatile boolean headFollowZ = true;
    public volatile float headSmoothSpeed = 10f;
    public volatile float headSprintSmoothSpeed = 20f;
    public volatile float headSnapThreshold = 0.5f;
    public volatile float headRecenterDelay = 0.5f;

    // -------------------------------------------------------------------------
    // Pushing rigid bodies
    // -------------------------------------------------------------------------
    public volatile boolean pushEnabled = false;
    public volatile float pushStrength = 1.1f;
    public volatile int pushLayers = ALL_LAYERS;

    public ModeConfig mode(ViewMode mode) {
        return mode == ViewMode.THIRD_PERSON ? thirdPerson : firstPerson;
    }
}
