package org.foxesworld.strider.engine.scene;

import com.jme3.math.FastMath;
import com.jme3.math.Quaternion;
import com.jme3.math.Vector3f;
import com.jme3.scene.Spatial;
import org.foxesworld.strider.core.motion.CharacterBody;

import java.util.Objects;

/**
 * Character body backed by a spatial. Yaw is kept here and pushed into the spatial's local rotation.
 */
public final class SpatialCharacterBody implements CharacterBody {

    private final Spatial spatial;
    private final Quaternion tmpRot = new Quaternion();
    private float yaw;

    public SpatialCharacterBody(Spatial spatial, float initialYaw) {
        this.spatial = Objects.requireNonNull(spatial, "spatial");
        setYaw(initialYaw);
    }

    public Spatial spatial() { return spatial; }

    @Override
    public Vector3f getPosition(Vector3f store) {
        return store.set(spatial.getWorldTranslation());
    }

    @Override
    public float getYaw() {
        return yaw;
    }

    @Override
    public void setYaw(float degrees) {
        yaw = degrees;
        tmpRot.fromAngles(0f, degrees * FastMath.DEG_TO_RAD, 0f);
        spatial.setLocalRotation(tmpRot);
    }
}
