package org.foxesworld.strider.core.diag;

import com.jme3.math.Vector3f;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;

import java.util.HashSet;
import java.util.Set;

/**
 * Keyed once-only reporting. A key stays silent until {@link #clear} is called for it,
 * after which the next occurrence is reported again.
 */
public final class Diagnostics {

    private static final Logger log = LogManager.getLogger(Diagnostics.class);

    private final Set<String> reported = new HashSet<>();
    private volatile DiagnosticSink sink;

    public Diagnostics() {}

    public Diagnostics(DiagnosticSink sink) {
        this.sink = sink;
    }

    public void setSink(DiagnosticSink sink) {
        this.sink = sink;
    }

    public boolean warnOnce(String key, String pattern, Object... args) {
        if (!reported.add(key)) return false;
        String msg = new ParameterizedMessage(pattern, args).getFormattedMessage();
        log.warn("[{}] {}", key, msg);
        DiagnosticSink s = sink;
        if (s != null) s.warning(key, msg);
        return true;
    }

    public boolean errorOnce(String key, String message, Throwable error) {
        if (!reported.add(key)) return false;
        log.error("[{}] {}", key, message, error);
        DiagnosticSink s = sink;
        if (s != null) s.warning(key, message + ": " + error);
        return true;
    }

    /** Marks the condition behind {@code key} as healed. */
    public void clear(String key) {
        if (reported.remove(key)) {
            log.debug("[{}] recovered", key);
        }
    }

    public boolean isReported(String key) {
        return reported.contains(key);
    }

    public void groundProbe(Vector3f centre, float radius, boolean grounded) {
        DiagnosticSink s = sink;
        if (s != null) s.groundProbe(centre, radius, grounded);
    }
}
