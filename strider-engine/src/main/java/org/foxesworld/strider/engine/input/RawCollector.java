package org.foxesworld.strider.engine.input;

import com.jme3.input.RawInputListener;
import com.jme3.input.event.JoyAxisEvent;
import com.jme3.input.event.JoyButtonEvent;
import com.jme3.input.event.KeyInputEvent;
import com.jme3.input.event.MouseButtonEvent;
import com.jme3.input.event.MouseMotionEvent;
import com.jme3.input.event.TouchEvent;

final class RawCollector implements RawInputListener {

    private final KeyboardState keyboard;
    private final MouseState mouse;
    private final GamepadState gamepad;
    private final JmeInputSource owner;

    RawCollector(KeyboardState keyboard, MouseState mouse, GamepadState gamepad, JmeInputSource owner) {
        this.keyboard = keyboard;
        this.mouse = mouse;
        this.gamepad = gamepad;
        this.owner = owner;
    }

    @Override public void beginInput() {}
    @Override public void endInput() {}
    @Override public void onTouchEvent(TouchEvent evt) {}

    @Override
    public void onJoyAxisEvent(JoyAxisEvent evt) {
        gamepad.onAxis(evt.getAxis().getLogicalId(), evt.getValue());
    }

    @Override
    public void onJoyButtonEvent(JoyButtonEvent evt) {
        gamepad.onButton(evt.getButton().getLogicalId(), evt.isPressed());
        if (evt.isPressed()) owner.onButtonPressed(evt.getButton().getLogicalId());
    }

    @Override
    public void onKeyEvent(KeyInputEvent evt) {
        if (evt.isRepeating()) return;
        keyboard.onKeyEvent(evt.getKeyCode(), evt.isPressed());
        if (evt.isPressed()) owner.onKeyPressed(evt.getKeyCode());
    }

    @Override
    public void onMouseMotionEvent(MouseMotionEvent evt) {
        mouse.addDelta(evt.getDX(), evt.getDY());
        mouse.addWheel(evt.getDeltaWheel());
    }

    @Override
    public void onMouseButtonEvent(MouseButtonEvent evt) {
        mouse.setMouseDown(evt.getButtonIndex(), evt.isPressed());
        if (evt.isPressed()) owner.onMouseButtonPressed(evt.getButtonIndex());
    }
}
