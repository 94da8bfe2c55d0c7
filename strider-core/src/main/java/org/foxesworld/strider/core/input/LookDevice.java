package org.foxesworld.strider.core.input;

/**
 * Class of the device producing look deltas.
 * POINTER deltas are already per-frame; RATE values are per-second and get scaled by frame time.
 */
public enum LookDevice {
    POINTER,
    RATE
}
