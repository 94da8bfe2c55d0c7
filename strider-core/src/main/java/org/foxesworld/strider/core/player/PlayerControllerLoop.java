package org.foxesworld.strider.core.player;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.strider.core.anim.AnimationSink;
import org.foxesworld.strider.core.camera.CameraView;
import org.foxesworld.strider.core.camera.CameraZoom;
import org.foxesworld.strider.core.camera.ZoomableRig;
import org.foxesworld.strider.core.config.ModeConfig;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.diag.Diagnostics;
import org.foxesworld.strider.core.input.InputFrame;
import org.foxesworld.strider.core.input.InputSource;
import org.foxesworld.strider.core.motion.CharacterBody;
import org.foxesworld.strider.core.motion.CharacterMotor;
import org.foxesworld.strider.core.motion.GroundCheck;
import org.foxesworld.strider.core.motion.GroundProbe;
import org.foxesworld.strider.core.motion.LocomotionController;
import org.foxesworld.strider.core.motion.VerticalMotionIntegrator;
import org.foxesworld.strider.core.orientation.CameraTarget;
import org.foxesworld.strider.core.orientation.OrientationController;
import org.foxesworld.strider.core.view.CameraRig;
import org.foxesworld.strider.core.view.ViewMode;
import org.foxesworld.strider.core.view.ViewModeStateMachine;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Per-frame driver of one player character.
 *
 * <p>{@link #update} runs input, view switch, vertical motion, ground probe and locomotion in
 * that order. {@link #lateUpdate} runs after every position update of the frame and turns the
 * camera targets, so the camera never reads a body position one frame old.</p>
 *
 * <p>A collaborator throwing inside a step is reported once and the step is skipped;
 * the remaining steps of the frame still run.</p>
 */
public final class PlayerControllerLoop {

    private static final Logger log = LogManager.getLogger(PlayerControllerLoop.class);

    private final PlayerConfig config;
    private final PlayerState state = new PlayerState();
    private final InputFrame frame = new InputFrame();

    private final InputSource input;
    private final CharacterBody body;
    private final Supplier<Optional<AnimationSink>> animation;
    private final Optional<CameraTarget> firstPersonTarget;
    private final Optional<CameraTarget> thirdPersonTarget;
    private final Diagnostics diagnostics;

    private final VerticalMotionIntegrator vertical = new VerticalMotionIntegrator();
    private final GroundCheck groundCheck;
    private final LocomotionController locomotion;
    private final OrientationController orientation;
    private final ViewModeStateMachine viewModes;
    private final CameraZoom zoom;
    private final ZoomableRig zoomRig;

    private boolean started;

    private PlayerControllerLoop(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.input = Objects.requireNonNull(b.input, "input");
        this.body = Objects.requireNonNull(b.body, "body");
        this.diagnostics = b.diagnostics != null ? b.diagnostics : new Diagnostics();
        this.animation = b.animation != null ? b.animation : Optional::empty;
        this.firstPersonTarget = Optional.ofNullable(b.firstPersonTarget);
        this.thirdPersonTarget = Optional.ofNullable(b.thirdPersonTarget);

        Supplier<Optional<CameraView>> camera = b.cameraView != null ? b.cameraView : Optional::empty;

        this.groundCheck = new GroundCheck(Objects.requireNonNull(b.groundProbe, "groundProbe"), diagnostics);
        this.locomotion = new LocomotionController(body, Objects.requireNonNull(b.motor, "motor"), camera, diagnostics);
        this.orientation = new OrientationController(diagnostics);
        this.viewModes = new ViewModeStateMachine(b.firstPersonRig, b.thirdPersonRig,
                b.firstPersonTarget, b.thirdPersonTarget, diagnostics);
        this.zoom = new CameraZoom(config);
        this.zoomRig = b.zoomRig;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PlayerConfig config() { return config; }
    public PlayerState state() { return state; }
    public InputFrame frame() { return frame; }
    public CharacterBody body() { return body; }
    public ViewMode mode() { return viewModes.mode(); }
    public ViewModeStateMachine viewModes() { return viewModes; }
    public CameraZoom zoom() { return zoom; }
    public Diagnostics diagnostics() { return diagnostics; }

    /** Primes timers, activates the initial rig and binds the zoom filter. */
    public void start() {
        vertical.reset(state.vertical, config);
        state.ground.grounded = true;
        state.locomotion.reset();
        state.orientation.reset();
        state.orientation.snapYaw(body.getYaw());
        viewModes.initialize(config.initialMode);
        zoom.bind(zoomRig);
        started = true;
        log.info("[player] started mode={}", viewModes.mode());
    }

    public void update(float dt) {
        ensureStarted();
        final Optional<AnimationSink> anim = animation.get();

        step("input", () -> input.poll(frame));
        step("view", () -> viewModes.update(frame.toggleViewHeld, state.orientation, body, anim));

        final ModeConfig mode = config.mode(viewModes.mode());

        step("vertical", () -> vertical.integrate(state.vertical, state.ground.grounded, frame, config, anim, dt));
        step("ground", () -> groundCheck.run(body, config, state.ground, anim));
        step("locomotion", () -> locomotion.update(state.locomotion, frame, mode, config,
                state.vertical.verticalVelocity, anim, dt));
    }

    public void lateUpdate(float dt) {
        ensureStarted();
        final ViewMode current = viewModes.mode();
        final ModeConfig mode = config.mode(current);

        if (current == ViewMode.FIRST_PERSON) {
            step("orientation", () -> orientation.firstPerson(state.orientation, frame, mode, config, body,
                    firstPersonTarget, dt));
        } else {
            step("orientation", () -> orientation.thirdPerson(state.orientation, frame, mode, config,
                    thirdPersonTarget, dt));
            step("zoom", () -> zoom.update(frame.zoom, frame.zoomReset));
        }
    }

    private void ensureStarted() {
        if (!started) throw new IllegalStateException("PlayerControllerLoop not started");
    }

    private void step(String name, Runnable r) {
        String key = "loop." + name;
        try {
            r.run();
            diagnostics.clear(key);
        } catch (RuntimeException e) {
            diagnostics.errorOnce(key, name + " step failed", e);
        }
    }

    public static final class Builder {
        private PlayerConfig config = new PlayerConfig();
        private InputSource input;
        private CharacterBody body;
        private CharacterMotor motor;
        private GroundProbe groundProbe;
        private Supplier<Optional<AnimationSink>> animation;
        private Supplier<Optional<CameraView>> cameraView;
        private CameraRig firstPersonRig;
        private CameraRig thirdPersonRig;
        private CameraTarget firstPersonTarget;
        private CameraTarget thirdPersonTarget;
        private ZoomableRig zoomRig;
        private Diagnostics diagnostics;

        private Builder() {}

        public Builder config(PlayerConfig v) { this.config = v; return this; }
        public Builder input(InputSource v) { this.input = v; return this; }
        public Builder body(CharacterBody v) { this.body = v; return this; }
        public Builder motor(CharacterMotor v) { this.motor = v; return this; }
        public Builder groundProbe(GroundProbe v) { this.groundProbe = v; return this; }
        public Builder animation(Supplier<Optional<AnimationSink>> v) { this.animation = v; return this; }
        public Builder cameraView(Supplier<Optional<CameraView>> v) { this.cameraView = v; return this; }
        public Builder firstPersonRig(CameraRig v) { this.firstPersonRig = v; return this; }
        public Builder thirdPersonRig(CameraRig v) { this.thirdPersonRig = v; return this; }
        public Builder firstPersonTarget(CameraTarget v) { this.firstPersonTarget = v; return this; }
        public Builder thirdPersonTarget(CameraTarget v) { this.thirdPersonTarget = v; return this; }
        public Builder zoomRig(ZoomableRig v) { this.zoomRig = v; return this; }
        public Builder diagnostics(Diagnostics v) { this.diagnostics = v; return this; }

        public PlayerControllerLoop build() {
            return new PlayerControllerLoop(this);
        }
    }
}
