package org.foxesworld.strider.core.camera;

import com.jme3.math.Vector3f;

/**
 * Read access to the main camera basis, for camera-relative movement.
 */
public interface CameraView {

    Vector3f forward(Vector3f store);

    Vector3f right(Vector3f store);
}
