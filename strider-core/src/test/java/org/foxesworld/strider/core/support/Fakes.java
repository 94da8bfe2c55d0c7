package org.foxesworld.strider.core.support;

import com.jme3.math.Quaternion;
import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.anim.AnimationSink;
import org.foxesworld.strider.core.camera.CameraView;
import org.foxesworld.strider.core.camera.ZoomableRig;
import org.foxesworld.strider.core.input.InputFrame;
import org.foxesworld.strider.core.input.InputSource;
import org.foxesworld.strider.core.input.LookDevice;
import org.foxesworld.strider.core.motion.CharacterBody;
import org.foxesworld.strider.core.motion.CharacterMotor;
import org.foxesworld.strider.core.orientation.CameraTarget;
import org.foxesworld.strider.core.view.CameraRig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * In-memory collaborators for controller tests.
 */
public final class Fakes {

    private Fakes() {}

    public static final class Body implements CharacterBody {
        public final Vector3f position = new Vector3f();
        public float yaw;

        @Override
        public Vector3f getPosition(Vector3f store) { return store.set(position); }

        @Override
        public float getYaw() { return yaw; }

        @Override
        public void setYaw(float degrees) { yaw = degrees; }
    }

    /** Moves the body by exactly what it is asked to. */
    public static final class Motor implements CharacterMotor {
        public final Body body;
        public final List<Vector3f> calls = new ArrayList<>();

        public Motor(Body body) { this.body = body; }

        @Override
        public Vector3f move(Vector3f displacement, Vector3f store) {
            calls.add(displacement.clone());
            body.position.addLocal(displacement);
            return store.set(displacement);
        }

        public Vector3f last() { return calls.get(calls.size() - 1); }
    }

    public static final class Anim implements AnimationSink {
        public final Map<String, Float> floats = new HashMap<>();
        public final Map<String, Boolean> bools = new HashMap<>();

        @Override
        public void setFloat(String name, float value) { floats.put(name, value); }

        @Override
        public void setBool(String name, boolean value) { bools.put(name, value); }

        public Map<String, Object> snapshot() {
            Map<String, Object> m = new HashMap<>(floats);
            m.putAll(bools);
            return m;
        }
    }

    public static final class Rig implements CameraRig, ZoomableRig {
        public boolean active;
        public CameraTarget target;
        public float distance = 4f;
        public int activations;

        @Override
        public void setActive(boolean active) {
            if (active && !this.active) activations++;
            this.active = active;
        }

        @Override
        public boolean isActive() { return active; }

        @Override
        public void setFollowAndLookTarget(CameraTarget target) { this.target = target; }

        @Override
        public float distance() { return distance; }

        @Override
        public void setDistance(float distance) { this.distance = distance; }
    }

    public static final class Target implements CameraTarget {
        public final Quaternion rotation = new Quaternion();
        public int writes;

        @Override
        public void setRotation(Quaternion r) {
            rotation.set(r);
            writes++;
        }

        public Vector3f forward() { return rotation.getRotationColumn(2); }
    }

    public static final class View implements CameraView {
        public final Vector3f forward = new Vector3f(0f, 0f, 1f);
        public final Vector3f right = new Vector3f(-1f, 0f, 0f);

        @Override
        public Vector3f forward(Vector3f store) { return store.set(forward); }

        @Override
        public Vector3f right(Vector3f store) { return store.set(right); }
    }

    /** Applies a per-frame script to the frame; jump is latched like a real source. */
    public static final class Input implements InputSource {
        public Consumer<InputFrame> script = f -> {};
        public LookDevice device = LookDevice.POINTER;

        @Override
        public void poll(InputFrame out) {
            out.lookDevice = device;
            script.accept(out);
        }

        @Override
        public LookDevice lookDevice() { return device; }
    }
}
