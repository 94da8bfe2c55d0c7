package org.foxesworld.strider.engine.input;

import com.jme3.input.InputManager;
import com.jme3.input.KeyInput;
import com.jme3.input.MouseInput;
import com.jme3.math.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.input.InputFrame;
import org.foxesworld.strider.core.input.InputSource;
import org.foxesworld.strider.core.input.LookDevice;

import java.util.Objects;

/**
 * Keyboard, mouse and first-gamepad input collected through a raw listener.
 *
 * Bindings: WASD move, left shift sprint, space jump, the configured view key toggles the
 * view, wheel zooms, middle click resets zoom, escape frees the cursor and a left click
 * grabs it again. Gamepad: left stick move, right stick look, button 0 jump, button 8
 * sprint, button 3 view.
 */
public final class JmeInputSource implements InputSource {

    private static final Logger log = LogManager.getLogger(JmeInputSource.class);

    static final float STICK_DEAD_ZONE = 0.15f;

    /** Raw wheel units per notch reported by the LWJGL backends. */
    static final float WHEEL_UNITS_PER_NOTCH = 120f;
    static final float SCROLL_PER_NOTCH = 0.1f;

    static final String PAD_JUMP = "0";
    static final String PAD_VIEW = "3";
    static final String PAD_SPRINT = "8";

    private final PlayerConfig config;

    private final KeyboardState keyboard = new KeyboardState();
    private final MouseState mouse = new MouseState();
    private final GamepadState gamepad = new GamepadState();
    private final CursorGrabController cursor = new CursorGrabController(mouse);
    private final RawCollector collector = new RawCollector(keyboard, mouse, gamepad, this);

    /** Degrees per pixel of mouse motion. */
    public volatile float mouseSensitivity = 0.1f;
    /** Degrees per second at full right-stick deflection. */
    public volatile float stickLookRate = 120f;
    /** Mouse motion only turns the camera while this is set and the cursor is locked. */
    public volatile boolean cursorInputForLook = true;

    private InputManager input;
    private LookDevice device = LookDevice.POINTER;
    private boolean jumpPressed;
    private boolean zoomResetPressed;
    private String unknownViewKey;

    public JmeInputSource(PlayerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void attach(InputManager inputManager) {
        if (input != null) throw new IllegalStateException("JmeInputSource already attached");
        this.input = Objects.requireNonNull(inputManager, "inputManager");
        input.addRawInputListener(collector);
        cursor.bind(input);
        setCursorLocked(true);
        log.info("[input] attached, view key={}", config.switchViewKey);
    }

    public void detach() {
        if (input == null) return;
        input.removeRawInputListener(collector);
        cursor.unbind();
        input = null;
        keyboard.releaseAll();
        mouse.clear();
        gamepad.clear();
    }

    public boolean isCursorLocked() { return cursor.isLocked(); }

    public void setCursorLocked(boolean locked) {
        cursor.setLocked(locked);
    }

    // -------------------------------------------------------------------------
    // Press events from the raw listener
    // -------------------------------------------------------------------------

    void onKeyPressed(int keyCode) {
        if (keyCode == KeyInput.KEY_SPACE) jumpPressed = true;
        if (keyCode == KeyInput.KEY_ESCAPE) setCursorLocked(false);
    }

    void onMouseButtonPressed(int button) {
        if (button == MouseInput.BUTTON_MIDDLE) zoomResetPressed = true;
        if (button == MouseInput.BUTTON_LEFT && !cursor.isLocked()) setCursorLocked(true);
    }

    void onButtonPressed(String buttonId) {
        if (PAD_JUMP.equals(buttonId)) jumpPressed = true;
    }

    @Override
    public LookDevice lookDevice() {
        return device;
    }

    @Override
    public void poll(InputFrame out) {
        MouseState.Consumed m = mouse.consumeDeltasAndWheel();

        float rx = deadZone(gamepad.rightX());
        float ry = deadZone(gamepad.rightY());
        if (m.dx() != 0f || m.dy() != 0f) {
            device = LookDevice.POINTER;
        } else if (rx != 0f || ry != 0f) {
            device = LookDevice.RATE;
        }

        if (device == LookDevice.POINTER) {
            boolean look = cursor.isLocked() && cursorInputForLook;
            float sens = mouseSensitivity;
            out.look.set(look ? m.dx() * sens : 0f, look ? m.dy() * sens : 0f);
        } else {
            out.look.set(rx * stickLookRate, -ry * stickLookRate);
        }
        out.lookDevice = device;

        float lx = deadZone(gamepad.leftX());
        float ly = deadZone(gamepad.leftY());
        if (lx != 0f || ly != 0f) {
            out.move.set(lx, -ly);
            if (out.move.lengthSquared() > 1f) out.move.normalizeLocal();
            out.analogMovement = true;
        } else {
            out.move.set(axis(KeyInput.KEY_D, KeyInput.KEY_A), axis(KeyInput.KEY_W, KeyInput.KEY_S));
            if (out.move.lengthSquared() > 1f) out.move.normalizeLocal();
            out.analogMovement = false;
        }

        if (jumpPressed) {
            out.jump = true;
            jumpPressed = false;
        }

        out.sprint = keyboard.keyDown(KeyInput.KEY_LSHIFT) || gamepad.buttonDown(PAD_SPRINT);
        out.toggleViewHeld = keyboard.keyDown(viewKeyCode()) || gamepad.buttonDown(PAD_VIEW);

        out.zoom = m.wheel() / WHEEL_UNITS_PER_NOTCH * SCROLL_PER_NOTCH;
        out.zoomReset = zoomResetPressed;
        zoomResetPressed = false;
    }

    /** Resolves the view toggle key; an unknown name is logged once and never fires. */
    int viewKeyCode() {
        String name = config.switchViewKey;
        int code = KeyboardState.keyCode(name);
        if (code >= 0) {
            unknownViewKey = null;
        } else if (!Objects.equals(name, unknownViewKey)) {
            unknownViewKey = name;
            log.warn("[input] unknown view toggle key '{}', keyboard view switching disabled", name);
        }
        return code;
    }

    String unknownViewKey() { return unknownViewKey; }

    private float axis(int positiveKey, int negativeKey) {
        float v = 0f;
        if (keyboard.keyDown(positiveKey)) v += 1f;
        if (keyboard.keyDown(negativeKey)) v -= 1f;
        return v;
    }

    static float deadZone(float v) {
        return FastMath.abs(v) < STICK_DEAD_ZONE ? 0f : v;
    }

    // visible for tests
    RawCollector collector() { return collector; }
}
