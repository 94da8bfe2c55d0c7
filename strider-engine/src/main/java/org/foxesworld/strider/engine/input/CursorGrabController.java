package org.foxesworld.strider.engine.input;

import com.jme3.input.InputManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

final class CursorGrabController {

    private static final Logger log = LogManager.getLogger(CursorGrabController.class);

    private final MouseState mouse;

    private InputManager input;
    private boolean locked = false;

    CursorGrabController(MouseState mouse) {
        this.mouse = mouse;
    }

    void bind(InputManager input) {
        this.input = input;
        apply();
    }

    void unbind() {
        if (input != null) input.setCursorVisible(true);
        input = null;
    }

    boolean isLocked() { return locked; }

    void setLocked(boolean lock) {
        if (this.locked == lock) return;
        this.locked = lock;
        // deltas gathered while the cursor was free must not turn the camera
        mouse.consumeDeltasAndWheel();
        apply();
        log.debug("[input] cursor locked={}", lock);
    }

    private void apply() {
        if (input != null) input.setCursorVisible(!locked);
    }
}
