package org.foxesworld.strider.engine.app;

import com.jme3.app.Application;
import com.jme3.app.state.BaseAppState;
import com.jme3.math.Vector3f;
import com.jme3.scene.Spatial;
import org.foxesworld.strider.core.camera.HeadFollowFilter;
import org.foxesworld.strider.core.input.InputFrame;
import org.foxesworld.strider.core.player.PlayerControllerLoop;
import org.foxesworld.strider.core.player.PlayerState;
import org.foxesworld.strider.core.view.ViewMode;
import org.foxesworld.strider.engine.audio.DistanceGait;
import org.foxesworld.strider.engine.camera.JmeCameraRig;
import org.foxesworld.strider.engine.scene.SpatialCameraTarget;

import java.util.Objects;

/**
 * Late phase of the player: moves the third-person target onto the body, turns the camera
 * targets, applies zoom, feeds the first-person head anchor and finally places the camera.
 */
public final class PlayerCameraAppState extends BaseAppState {

    private final PlayerControllerLoop loop;
    private final JmeCameraRig firstPersonRig;
    private final JmeCameraRig thirdPersonRig;
    private final SpatialCameraTarget thirdPersonTarget;

    private Spatial head;
    private SpatialCameraTarget firstPersonTarget;
    private HeadFollowFilter headFollow;
    private DistanceGait gait;

    /** Height of the third-person target above the feet. */
    public volatile float thirdPersonHeight = 1.375f;

    private final Vector3f bodyPos = new Vector3f();
    private final Vector3f anchor = new Vector3f();
    private boolean hasAnchor;

    public PlayerCameraAppState(PlayerControllerLoop loop, JmeCameraRig firstPersonRig,
                                JmeCameraRig thirdPersonRig, SpatialCameraTarget thirdPersonTarget) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.firstPersonRig = Objects.requireNonNull(firstPersonRig, "firstPersonRig");
        this.thirdPersonRig = Objects.requireNonNull(thirdPersonRig, "thirdPersonRig");
        this.thirdPersonTarget = thirdPersonTarget;
    }

    /** Enables head follow: the first-person camera trails {@code head} instead of sitting on the target. */
    public PlayerCameraAppState headFollow(Spatial head, SpatialCameraTarget firstPersonTarget) {
        this.head = Objects.requireNonNull(head, "head");
        this.firstPersonTarget = Objects.requireNonNull(firstPersonTarget, "firstPersonTarget");
        this.headFollow = new HeadFollowFilter(loop.config());
        this.hasAnchor = false;
        return this;
    }

    public PlayerCameraAppState gait(DistanceGait gait) {
        this.gait = gait;
        return this;
    }

    @Override
    protected void initialize(Application app) {}

    @Override
    protected void cleanup(Application app) {}

    @Override
    protected void onEnable() {}

    @Override
    protected void onDisable() {}

    @Override
    public void update(float tpf) {
        PlayerState state = loop.state();

        if (thirdPersonTarget != null) {
            thirdPersonTarget.follow(loop.body().getPosition(bodyPos), thirdPersonHeight);
        }

        loop.lateUpdate(tpf);

        if (headFollow != null && loop.mode() == ViewMode.FIRST_PERSON) {
            updateHeadAnchor(loop.frame(), tpf);
            firstPersonRig.setAnchorOverride(anchor);
        } else {
            firstPersonRig.setAnchorOverride(null);
            hasAnchor = false;
        }

        firstPersonRig.update(tpf);
        thirdPersonRig.update(tpf);

        if (gait != null) {
            gait.update(state.locomotion.realizedVelocity, state.ground.grounded, tpf);
        }
    }

    private void updateHeadAnchor(InputFrame frame, float tpf) {
        Vector3f headPos = head.getWorldTranslation();
        if (!hasAnchor) {
            anchor.set(headPos);
            headFollow.reset();
            hasAnchor = true;
        }
        boolean looking = HeadFollowFilter.isLooking(frame.look);
        headFollow.update(anchor, headPos, firstPersonTarget.spatial().getWorldRotation(),
                looking, frame.sprint, tpf, anchor);
    }
}
