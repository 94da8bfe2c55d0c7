package org.foxesworld.strider.core.diag;

import com.jme3.math.Vector3f;

/**
 * Optional host hook for controller diagnostics.
 */
public interface DiagnosticSink {

    default void warning(String key, String message) {}

    /** Called after every ground probe. {@code centre} must not be retained. */
    default void groundProbe(Vector3f centre, float radius, boolean grounded) {}
}
