package org.foxesworld.strider.core.config;

/**
 * How move input is turned into a world-space direction.
 */
public enum MovementPolicy {
    /** Character's own basis; the body strafes without turning. */
    CHARACTER_RELATIVE,
    /** Camera's flattened basis; the body turns toward travel. */
    CAMERA_RELATIVE,
    /** Fixed world basis (+Z forward); the body turns toward travel. */
    WORLD_RELATIVE
}
