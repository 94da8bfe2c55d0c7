package org.foxesworld.strider.core.audio;

import com.jme3.math.Vector3f;

/**
 * Fire-and-forget positional one-shot.
 */
@FunctionalInterface
public interface AudioSink {

    void playClipAtPoint(String clip, Vector3f point, float volume);
}
