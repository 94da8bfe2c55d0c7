package org.foxesworld.strider.engine.camera;

import com.jme3.math.Quaternion;
import com.jme3.math.Vector3f;
import com.jme3.renderer.Camera;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.strider.core.camera.ZoomableRig;
import org.foxesworld.strider.core.math.Smoothing;
import org.foxesworld.strider.core.orientation.CameraTarget;
import org.foxesworld.strider.core.view.CameraRig;
import org.foxesworld.strider.engine.scene.SpatialCameraTarget;

import java.util.Objects;

/**
 * Drives the application camera from a target node while active.
 *
 * FIRST_PERSON puts the camera at the target (or at an anchor override, for head follow).
 * THIRD_PERSON orbits behind the target at {@link #distance()} with a shoulder offset, pulls in
 * when the ray from target to camera is blocked, and follows with exponential smoothing.
 */
public final class JmeCameraRig implements CameraRig, ZoomableRig {

    private static final Logger log = LogManager.getLogger(JmeCameraRig.class);

    public enum Kind { FIRST_PERSON, THIRD_PERSON }

    public interface RaycastProvider {
        float rayFraction(Vector3f from, Vector3f to); // 1=no hit
    }

    private final Kind kind;
    private final Camera cam;
    private final RaycastProvider raycast;

    public volatile float side = 0.25f;
    /** 0..1: 0 = snappy, 1 = very smooth. */
    public volatile float followSmoothing = 0.18f;
    public volatile float collisionPadding = 0.2f;
    public volatile float minDistance = 0.3f;

    private volatile float distance = 4f;

    private boolean active;
    private SpatialCameraTarget target;
    private Vector3f anchorOverride;

    private final Vector3f smoothed = new Vector3f();
    private final Vector3f pivot = new Vector3f();
    private final Vector3f desired = new Vector3f();
    private final Vector3f axis = new Vector3f();
    private final Quaternion rot = new Quaternion();
    private boolean has;

    public JmeCameraRig(Kind kind, Camera cam, RaycastProvider raycast) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.cam = Objects.requireNonNull(cam, "cam");
        this.raycast = raycast;
    }

    public Kind kind() { return kind; }

    @Override
    public void setActive(boolean active) {
        if (this.active == active) return;
        this.active = active;
        has = false;
        log.debug("[camera] {} active={}", kind, active);
    }

    @Override
    public boolean isActive() { return active; }

    @Override
    public void setFollowAndLookTarget(CameraTarget target) {
        if (!(target instanceof SpatialCameraTarget s)) {
            throw new IllegalArgumentException("JmeCameraRig needs a SpatialCameraTarget, got " + target);
        }
        this.target = s;
        has = false;
    }

    @Override
    public float distance() { return distance; }

    @Override
    public void setDistance(float distance) {
        this.distance = Math.max(minDistance, distance);
    }

    /** First person only: camera position to use instead of the target's. Null clears it. */
    public void setAnchorOverride(Vector3f anchor) {
        this.anchorOverride = anchor;
    }

    /** Call once per frame, after the target has been turned. */
    public void update(float tpf) {
        if (!active || target == null) return;

        rot.set(target.spatial().getWorldRotation());
        pivot.set(target.spatial().getWorldTranslation());

        if (kind == Kind.FIRST_PERSON) {
            cam.setLocation(anchorOverride != null ? anchorOverride : pivot);
            cam.setRotation(rot);
            return;
        }

        // behind = -forward, right = -left
        rot.getRotationColumn(2, axis);
        desired.set(pivot).subtractLocal(axis.multLocal(distance));
        rot.getRotationColumn(0, axis);
        desired.subtractLocal(axis.multLocal(side));

        if (raycast != null) {
            float f = raycast.rayFraction(pivot, desired);
            if (f < 1f) {
                float full = pivot.distance(desired);
                float allowed = Math.max(minDistance, f * full - collisionPadding);
                axis.set(desired).subtractLocal(pivot).normalizeLocal().multLocal(allowed);
                desired.set(pivot).addLocal(axis);
            }
        }

        if (!has) {
            smoothed.set(desired);
            has = true;
        } else {
            float k = Smoothing.exponential(followSmoothing, tpf);
            smoothed.interpolateLocal(desired, k);
        }

        cam.setLocation(smoothed);
        cam.setRotation(rot);
    }
}
