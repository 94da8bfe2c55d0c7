package org.foxesworld.strider.core.view;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.strider.core.anim.AnimationParams;
import org.foxesworld.strider.core.anim.AnimationSink;
import org.foxesworld.strider.core.diag.Diagnostics;
import org.foxesworld.strider.core.motion.CharacterBody;
import org.foxesworld.strider.core.orientation.CameraTarget;
import org.foxesworld.strider.core.orientation.OrientationState;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * First/third person switch. Toggled on the press edge of the view key; the swap
 * completes inside the frame that saw the edge.
 */
public final class ViewModeStateMachine {

    private static final Logger log = LogManager.getLogger(ViewModeStateMachine.class);

    public static final String DIAG_RIGS = "view.rigs";

    private final Optional<CameraRig> firstPersonRig;
    private final Optional<CameraRig> thirdPersonRig;
    private final Optional<CameraTarget> firstPersonTarget;
    private final Optional<CameraTarget> thirdPersonTarget;
    private final Diagnostics diagnostics;

    private final List<ViewModeListener> listeners = new CopyOnWriteArrayList<>();

    private ViewMode mode = ViewMode.FIRST_PERSON;
    private boolean toggleLatch;
    private boolean initialized;

    public ViewModeStateMachine(CameraRig firstPersonRig, CameraRig thirdPersonRig,
                                CameraTarget firstPersonTarget, CameraTarget thirdPersonTarget,
                                Diagnostics diagnostics) {
        this.firstPersonRig = Optional.ofNullable(firstPersonRig);
        this.thirdPersonRig = Optional.ofNullable(thirdPersonRig);
        this.firstPersonTarget = Optional.ofNullable(firstPersonTarget);
        this.thirdPersonTarget = Optional.ofNullable(thirdPersonTarget);
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public ViewMode mode() { return mode; }

    public void addListener(ViewModeListener l) {
        listeners.add(Objects.requireNonNull(l, "listener"));
    }

    public void removeListener(ViewModeListener l) {
        listeners.remove(l);
    }

    /** Puts the rigs into the state of {@code initial}. No listener call, no animation reset. */
    public void initialize(ViewMode initial) {
        mode = Objects.requireNonNull(initial, "initial");
        toggleLatch = false;
        applyRigs();
        initialized = true;
        log.info("[view] initial mode={}", mode);
    }

    /**
     * Feeds the held state of the toggle key.
     *
     * @return true when the mode changed this frame
     */
    public boolean update(boolean toggleHeld, OrientationState orientation, CharacterBody body,
                          Optional<AnimationSink> anim) {
        if (!initialized) {
            throw new IllegalStateException("ViewModeStateMachine.update before initialize");
        }

        boolean pressed = toggleHeld && !toggleLatch;
        toggleLatch = toggleHeld;
        if (!pressed) return false;

        switchTo(mode.other(), orientation, body, anim);
        return true;
    }

    public void switchTo(ViewMode next, OrientationState orientation, CharacterBody body,
                         Optional<AnimationSink> anim) {
        Objects.requireNonNull(next, "next");
        if (next == mode) return;

        ViewMode from = mode;
        mode = next;
        applyRigs();

        if (next == ViewMode.THIRD_PERSON) {
            orientation.snapYaw(body.getYaw());
        }

        anim.ifPresent(ViewModeStateMachine::resetAnimation);

        log.info("[view] mode {} -> {}", from, next);
        for (ViewModeListener l : listeners) {
            l.onViewModeChanged(from, next);
        }
    }

    static void resetAnimation(AnimationSink a) {
        a.setFloat(AnimationParams.SPEED, 0f);
        a.setFloat(AnimationParams.MOTION_SPEED, 0f);
        a.setFloat(AnimationParams.DIRECTION, 0f);
        a.setBool(AnimationParams.JUMP, false);
        a.setBool(AnimationParams.FREE_FALL, false);
        a.setBool(AnimationParams.GROUNDED, true);
    }

    private void applyRigs() {
        if (firstPersonRig.isEmpty() || thirdPersonRig.isEmpty()) {
            diagnostics.warnOnce(DIAG_RIGS, "camera rigs not assigned (fp={}, tp={}); rig switching disabled",
                    firstPersonRig.isPresent(), thirdPersonRig.isPresent());
            return;
        }

        CameraRig outgoing = mode == ViewMode.FIRST_PERSON ? thirdPersonRig.get() : firstPersonRig.get();
        CameraRig incoming = mode == ViewMode.FIRST_PERSON ? firstPersonRig.get() : thirdPersonRig.get();
        Optional<CameraTarget> target = mode == ViewMode.FIRST_PERSON ? firstPersonTarget : thirdPersonTarget;

        outgoing.setActive(false);
        incoming.setActive(true);
        target.ifPresent(incoming::setFollowAndLookTarget);
    }
}
