package org.foxesworld.strider.engine.camera;

import com.jme3.math.Vector3f;
import com.jme3.renderer.Camera;
import org.foxesworld.strider.core.camera.CameraView;

import java.util.Objects;

public final class MainCameraView implements CameraView {

    private final Camera cam;

    public MainCameraView(Camera cam) {
        this.cam = Objects.requireNonNull(cam, "cam");
    }

    @Override
    public Vector3f forward(Vector3f store) {
        return cam.getDirection(store);
    }

    @Override
    public Vector3f right(Vector3f store) {
        return cam.getLeft(store).negateLocal();
    }
}
