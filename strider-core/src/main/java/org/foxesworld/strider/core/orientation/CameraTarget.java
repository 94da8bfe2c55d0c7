package org.foxesworld.strider.core.orientation;

import com.jme3.math.Quaternion;

/**
 * A transform a camera rig follows and looks through.
 */
public interface CameraTarget {

    void setRotation(Quaternion rotation);
}
