package org.foxesworld.strider.core.player;

import org.foxesworld.strider.core.motion.GroundState;
import org.foxesworld.strider.core.motion.LocomotionState;
import org.foxesworld.strider.core.motion.VerticalState;
import org.foxesworld.strider.core.orientation.OrientationState;

/**
 * Everything the controller mutates per frame. Owned by one {@link PlayerControllerLoop}.
 */
public final class PlayerState {

    public final GroundState ground = new GroundState();
    public final VerticalState vertical = new VerticalState();
    public final OrientationState orientation = new OrientationState();
    public final LocomotionState locomotion = new LocomotionState();
}
