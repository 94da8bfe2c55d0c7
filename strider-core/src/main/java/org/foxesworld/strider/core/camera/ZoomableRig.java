package org.foxesworld.strider.core.camera;

/**
 * A rig whose follow distance can be changed.
 */
public interface ZoomableRig {

    float distance();

    void setDistance(float distance);
}
