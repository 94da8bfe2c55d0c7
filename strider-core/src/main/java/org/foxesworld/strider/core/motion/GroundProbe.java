package org.foxesworld.strider.core.motion;

import com.jme3.math.Vector3f;

/**
 * Sphere overlap against ground geometry. Trigger volumes never count.
 */
@FunctionalInterface
public interface GroundProbe {

    boolean overlaps(Vector3f centre, float radius, int layerMask);
}
