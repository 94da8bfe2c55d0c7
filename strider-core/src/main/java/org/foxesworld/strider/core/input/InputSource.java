package org.foxesworld.strider.core.input;

public interface InputSource {

    /**
     * Refreshes {@code out} before a frame. Implementations set {@code jump} on a new press
     * and leave it alone otherwise, so a request survives until the controller consumes it.
     */
    void poll(InputFrame out);

    LookDevice lookDevice();
}
