package org.foxesworld.strider.core.diag;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiagnosticsTest {

    @Test
    void warnsOncePerKeyUntilCleared() {
        List<String> got = new ArrayList<>();
        Diagnostics d = new Diagnostics(new DiagnosticSink() {
            @Override
            public void warning(String key, String message) {
                got.add(key + ":" + message);
            }
        });

        assertTrue(d.warnOnce("a", "missing {}", "target"));
        assertFalse(d.warnOnce("a", "missing {}", "target"));
        assertTrue(d.warnOnce("b", "other"));
        assertEquals(List.of("a:missing target", "b:other"), got);

        d.clear("a");
        assertFalse(d.isReported("a"));
        assertTrue(d.warnOnce("a", "missing {}", "again"));
        assertEquals("a:missing again", got.get(2));
    }

    @Test
    void errorsShareTheOnceRule() {
        Diagnostics d = new Diagnostics();
        RuntimeException boom = new IllegalStateException("boom");
        assertTrue(d.errorOnce("x", "step failed", boom));
        assertFalse(d.errorOnce("x", "step failed", boom));
        assertTrue(d.isReported("x"));
    }
}
