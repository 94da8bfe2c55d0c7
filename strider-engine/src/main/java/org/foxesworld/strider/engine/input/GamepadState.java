package org.foxesworld.strider.engine.input;

import com.jme3.input.JoystickAxis;

import java.util.HashSet;
import java.util.Set;

/**
 * Latest stick values and held buttons of the first joystick.
 */
public final class GamepadState {

    private float leftX, leftY, rightX, rightY;
    private final Set<String> buttons = new HashSet<>();

    public void onAxis(String axisId, float value) {
        switch (axisId) {
            case JoystickAxis.X_AXIS -> leftX = value;
            case JoystickAxis.Y_AXIS -> leftY = value;
            case JoystickAxis.Z_AXIS -> rightX = value;
            case JoystickAxis.Z_ROTATION -> rightY = value;
            default -> {
                // triggers and hats are not mapped
            }
        }
    }

    public void onButton(String buttonId, boolean pressed) {
        if (pressed) buttons.add(buttonId);
        else buttons.remove(buttonId);
    }

    public boolean buttonDown(String buttonId) {
        return buttons.contains(buttonId);
    }

    public float leftX() { return leftX; }
    public float leftY() { return leftY; }
    public float rightX() { return rightX; }
    public float rightY() { return rightY; }

    public void clear() {
        leftX = leftY = rightX = rightY = 0f;
        buttons.clear();
    }
}
