package org.openhab.binding.daikinsmartapp.internal.model;

import java.util.EnumSet;
import java.util.Set;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Controls a physical unit may support.
 */
@NonNullByDefault
public enum Capability {
    POWER,
    MODE_COOL,
    MODE_DRY,
    MODE_FAN;

    public static @Nullable Capability forMode(OperationMode mode) {
        switch (mode) {
            case COOL:
                return MODE_COOL;
            case DRY:
                return MODE_DRY;
            case FAN:
                return MODE_FAN;
            default:
                return null;
        }
    }

    public static Set<Capability> all() {
        return EnumSet.allOf(Capability.class);
    }
}
