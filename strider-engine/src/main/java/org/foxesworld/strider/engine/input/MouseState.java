package org.foxesworld.strider.engine.input;

/**
 * Mouse deltas and wheel accumulated between polls, plus the held button mask.
 */
public final class MouseState {

    private int mouseMask = 0;

    private float mdx = 0f;
    private float mdy = 0f;
    private float wheel = 0f;

    public record Consumed(float dx, float dy, float wheel) {}

    public boolean mouseDown(int button) {
        if (button < 0 || button >= 31) return false;
        return (mouseMask & (1 << button)) != 0;
    }

    public void setMouseDown(int button, boolean down) {
        if (button < 0 || button >= 31) return;
        int bit = 1 << button;
        if (down) mouseMask |= bit;
        else mouseMask &= ~bit;
    }

    public void addDelta(float dx, float dy) {
        mdx += dx;
        mdy += dy;
    }

    public void addWheel(float w) { wheel += w; }

    public Consumed consumeDeltasAndWheel() {
        float dx = mdx, dy = mdy, w = wheel;
        mdx = 0f;
        mdy = 0f;
        wheel = 0f;
        return new Consumed(dx, dy, w);
    }

    public void clear() {
        mouseMask = 0;
        consumeDeltasAndWheel();
    }
}
