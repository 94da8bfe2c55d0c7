package org.foxesworld.strider.core.config;

/**
 * What the {@code Direction} animation parameter carries.
 */
public enum DirectionParameter {
    /** Raw forward/back input. */
    RAW,
    /** +1 / -1 / 0 with a 0.01 dead band. */
    SIGN
}
