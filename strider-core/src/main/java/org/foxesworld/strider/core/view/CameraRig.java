package org.foxesworld.strider.core.view;

import org.foxesworld.strider.core.orientation.CameraTarget;

/**
 * One of the two camera rigs. Exactly one is active at a time.
 */
public interface CameraRig {

    void setActive(boolean active);

    boolean isActive();

    void setFollowAndLookTarget(CameraTarget target);
}
