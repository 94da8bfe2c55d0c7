package org.foxesworld.strider.engine.scene;

import com.jme3.scene.Spatial;
import org.foxesworld.strider.core.anim.AnimationSink;

import java.util.Objects;

/**
 * Publishes animation parameters as user data on a spatial, where an anim control or a
 * script can read them back.
 */
public final class UserDataAnimationSink implements AnimationSink {

    private final Spatial spatial;

    public UserDataAnimationSink(Spatial spatial) {
        this.spatial = Objects.requireNonNull(spatial, "spatial");
    }

    @Override
    public void setFloat(String name, float value) {
        spatial.setUserData(name, value);
    }

    @Override
    public void setBool(String name, boolean value) {
        spatial.setUserData(name, value);
    }
}
