package org.foxesworld.strider.core.motion;

import com.jme3.math.Vector3f;

public final class GroundState {

    public boolean grounded = true;

    /** Centre used by the last probe. */
    public final Vector3f probeCentre = new Vector3f();
}
