package org.foxesworld.strider.core.camera;

import com.jme3.math.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.strider.core.config.PlayerConfig;

import java.util.Objects;

/**
 * Scroll zoom for the third-person rig.
 */
public final class CameraZoom {

    private static final Logger log = LogManager.getLogger(CameraZoom.class);

    static final float SCROLL_THRESHOLD = 0.01f;

    private final PlayerConfig config;

    private ZoomableRig rig;
    private float defaultDistance;

    public CameraZoom(PlayerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Binds the rig and remembers its current distance as the reset value.
     * A null rig leaves the filter inert for the session.
     */
    public void bind(ZoomableRig rig) {
        if (rig == null) {
            log.error("[zoom] no zoomable third-person rig; zoom disabled");
            this.rig = null;
            return;
        }
        this.rig = rig;
        this.defaultDistance = rig.distance();
        log.debug("[zoom] bound, default distance={}", defaultDistance);
    }

    public boolean isBound() { return rig != null; }

    public float defaultDistance() { return defaultDistance; }

    public void update(float scroll, boolean resetRequested) {
        if (rig == null) return;

        if (Math.abs(scroll) > SCROLL_THRESHOLD) {
            float d = rig.distance() - scroll * config.zoomSpeed;
            rig.setDistance(FastMath.clamp(d, config.zoomMinDistance, config.zoomMaxDistance));
        }

        if (resetRequested) reset();
    }

    public void reset() {
        if (rig == null) return;
        rig.setDistance(defaultDistance);
    }
}
