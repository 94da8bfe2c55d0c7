package org.foxesworld.strider.engine.audio;

import com.jme3.asset.AssetManager;
import com.jme3.audio.AudioData;
import com.jme3.audio.AudioNode;
import com.jme3.math.Vector3f;
import com.jme3.scene.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.strider.core.audio.AudioSink;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Positional one-shots through {@link AudioNode#playInstance()}. One buffered node per clip,
 * created on first use and parked under {@code parent}. Clips that fail to load are logged
 * once and skipped afterwards.
 */
public final class JmeAudioSink implements AudioSink {

    private static final Logger log = LogManager.getLogger(JmeAudioSink.class);

    private final AssetManager assetManager;
    private final Node parent;
    private final Map<String, AudioNode> nodes = new HashMap<>();
    private final Set<String> broken = new HashSet<>();

    public JmeAudioSink(AssetManager assetManager, Node parent) {
        this.assetManager = Objects.requireNonNull(assetManager, "assetManager");
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    @Override
    public void playClipAtPoint(String clip, Vector3f point, float volume) {
        if (clip == null || broken.contains(clip)) return;

        AudioNode node = nodes.get(clip);
        if (node == null) {
            try {
                node = new AudioNode(assetManager, clip, AudioData.DataType.Buffer);
            } catch (RuntimeException e) {
                broken.add(clip);
                log.error("[audio] cannot load '{}', clip disabled", clip, e);
                return;
            }
            node.setPositional(true);
            node.setLooping(false);
            node.setReverbEnabled(false);
            parent.attachChild(node);
            nodes.put(clip, node);
        }

        node.setLocalTranslation(point);
        node.setVolume(volume);
        node.playInstance();
    }

    public void release() {
        for (AudioNode n : nodes.values()) {
            n.removeFromParent();
        }
        nodes.clear();
    }
}
