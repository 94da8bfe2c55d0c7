package org.foxesworld.strider.engine.scene;

import com.jme3.math.Quaternion;
import com.jme3.math.Vector3f;
import com.jme3.scene.Spatial;
import org.foxesworld.strider.core.orientation.CameraTarget;

import java.util.Objects;

/**
 * A camera target node. First-person targets hang under the body (eye height), the
 * third-person one sits under the root and is moved with {@link #follow} every late phase.
 */
public final class SpatialCameraTarget implements CameraTarget {

    private final Spatial spatial;
    private final Vector3f tmp = new Vector3f();

    public SpatialCameraTarget(Spatial spatial) {
        this.spatial = Objects.requireNonNull(spatial, "spatial");
    }

    public Spatial spatial() { return spatial; }

    @Override
    public void setRotation(Quaternion rotation) {
        spatial.setLocalRotation(rotation);
    }

    /** Places the target {@code height} above {@code bodyPosition}. */
    public void follow(Vector3f bodyPosition, float height) {
        spatial.setLocalTranslation(tmp.set(bodyPosition).addLocal(0f, height, 0f));
    }
}
