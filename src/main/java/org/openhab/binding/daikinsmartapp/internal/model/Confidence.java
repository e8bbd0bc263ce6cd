package org.openhab.binding.daikinsmartapp.internal.model;

/**
 * How far the reported state of a unit can be trusted.
 */
public enum Confidence {
    /** The last poll succeeded. */
    HIGH,
    /** Never confirmed, or too many consecutive polls have failed. */
    LOW
}
