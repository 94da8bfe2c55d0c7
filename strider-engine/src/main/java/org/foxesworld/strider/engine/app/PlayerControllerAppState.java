package org.foxesworld.strider.engine.app;

import com.jme3.app.Application;
import com.jme3.app.state.BaseAppState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.strider.core.player.PlayerControllerLoop;
import org.foxesworld.strider.engine.config.TuningReloader;
import org.foxesworld.strider.engine.input.JmeInputSource;

import java.util.Objects;

/**
 * Per-frame phase of the player: input, view toggle, vertical motion, ground check and
 * locomotion. Attach it before {@link PlayerCameraAppState}; jME updates states in attach order.
 */
public final class PlayerControllerAppState extends BaseAppState {

    private static final Logger log = LogManager.getLogger(PlayerControllerAppState.class);

    private final PlayerControllerLoop loop;
    private final JmeInputSource input;
    private final TuningReloader tuning;

    /**
     * @param tuning optional hot-reloaded tuning file, may be {@code null}
     */
    public PlayerControllerAppState(PlayerControllerLoop loop, JmeInputSource input, TuningReloader tuning) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.input = Objects.requireNonNull(input, "input");
        this.tuning = tuning;
    }

    public PlayerControllerLoop loop() {
        return loop;
    }

    @Override
    protected void initialize(Application app) {
        if (tuning != null) tuning.start();
        input.attach(app.getInputManager());
        loop.start();
        log.info("PlayerControllerAppState started");
    }

    @Override
    protected void cleanup(Application app) {
        input.detach();
        if (tuning != null) tuning.close();
    }

    @Override
    protected void onEnable() {
        input.setCursorLocked(true);
    }

    @Override
    protected void onDisable() {
        input.setCursorLocked(false);
    }

    @Override
    public void update(float tpf) {
        if (tuning != null) tuning.update(tpf);
        loop.update(tpf);
    }
}
