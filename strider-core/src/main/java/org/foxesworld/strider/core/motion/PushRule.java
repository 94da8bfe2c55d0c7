package org.foxesworld.strider.core.motion;

import com.jme3.math.Vector3f;

/**
 * Decides whether a body the character ran into gets shoved, and how hard.
 */
public final class PushRule {

    /** Hits pointing further down than this are steps onto the body, not pushes. */
    static final float DOWNWARD_LIMIT = -0.3f;

    private PushRule() {}

    /**
     * @param bodyGroups collision group bits of the hit body
     * @param moveDirection direction the character was moving when it hit
     * @param store receives the impulse when the method returns {@code true}
     */
    public static boolean impulse(boolean enabled, boolean dynamic, int bodyGroups, int pushLayers,
                                  Vector3f moveDirection, float strength, Vector3f store) {
        if (!enabled || !dynamic) return false;
        if ((bodyGroups & pushLayers) == 0) return false;
        if (moveDirection.y < DOWNWARD_LIMIT) return false;

        store.set(moveDirection.x, 0f, moveDirection.z).multLocal(strength);
        return true;
    }
}
