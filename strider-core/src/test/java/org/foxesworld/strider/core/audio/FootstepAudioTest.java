package org.foxesworld.strider.core.audio;

import com.jme3.math.Vector3f;
import org.foxesworld.strider.core.config.PlayerConfig;
import org.foxesworld.strider.core.diag.Diagnostics;
import org.foxesworld.strider.core.support.Fakes;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FootstepAudioTest {

    private record Played(String clip, Vector3f point, float volume) {}

    private final List<Played> played = new ArrayList<>();
    private final AudioSink sink = (clip, point, volume) -> played.add(new Played(clip, point.clone(), volume));
    private final Fakes.Body body = new Fakes.Body();
    private final PlayerConfig cfg = new PlayerConfig();
    private final Diagnostics diag = new Diagnostics();

    private FootstepAudio audio(String landing) {
        return new FootstepAudio(sink, body, cfg, diag, List.of("step_a.ogg", "step_b.ogg"), landing, new Random(3));
    }

    @Test
    void footstepsAreGatedOnClipWeight() {
        FootstepAudio a = audio("land.ogg");
        assertFalse(a.onFootstep(0.5f));
        assertFalse(a.onFootstep(0.2f));
        assertTrue(a.onFootstep(0.51f));
        assertEquals(1, played.size());
    }

    @Test
    void playsAtControllerCentreWithConfiguredVolume() {
        body.position.set(1f, 0f, -2f);
        audio("land.ogg").onFootstep(1f);

        Played p = played.get(0);
        assertTrue(p.clip().startsWith("step_"));
        assertEquals(new Vector3f(1f, 0.93f, -2f), p.point());
        assertEquals(0.5f, p.volume(), 0f);
    }

    @Test
    void footstepClipsAreDrawnFromTheWholeSet() {
        FootstepAudio a = audio("land.ogg");
        for (int i = 0; i < 50; i++) a.onFootstep(1f);
        assertTrue(played.stream().anyMatch(p -> p.clip().equals("step_a.ogg")));
        assertTrue(played.stream().anyMatch(p -> p.clip().equals("step_b.ogg")));
    }

    @Test
    void landingUsesSameGate() {
        FootstepAudio a = audio("land.ogg");
        assertFalse(a.onLand(0.4f));
        assertTrue(a.onLand(0.9f));
        assertEquals("land.ogg", played.get(0).clip());
    }

    @Test
    void missingLandingClipIsReportedNotThrown() {
        assertFalse(audio(null).onLand(1f));
        assertTrue(diag.isReported(FootstepAudio.DIAG_NO_LANDING));
        assertTrue(played.isEmpty());
    }
}
