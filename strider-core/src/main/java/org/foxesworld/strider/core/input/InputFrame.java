package org.foxesworld.strider.core.input;

import com.jme3.math.Vector2f;

/**
 * Player intent for one simulation frame.
 * The instance persists across frames: sources overwrite it in {@link InputSource#poll},
 * the controller only ever clears {@link #jump}.
 */
public final class InputFrame {

    public final Vector2f move = new Vector2f();
    public final Vector2f look = new Vector2f();

    public boolean jump;
    public boolean sprint;
    public boolean analogMovement;

    /** Held state of the view toggle key. */
    public boolean toggleViewHeld;

    /** Scroll delta this frame. */
    public float zoom;
    public boolean zoomReset;

    public LookDevice lookDevice = LookDevice.POINTER;

    public boolean hasMove() {
        return move.x != 0f || move.y != 0f;
    }

    public void clearJump() {
        jump = false;
    }

    public void reset() {
        move.set(0f, 0f);
        look.set(0f, 0f);
        jump = false;
        sprint = false;
        analogMovement = false;
        toggleViewHeld = false;
        zoom = 0f;
        zoomReset = false;
        lookDevice = LookDevice.POINTER;
    }
}
