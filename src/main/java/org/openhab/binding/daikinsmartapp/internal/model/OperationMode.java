package org.openhab.binding.daikinsmartapp.internal.model;

import java.util.Locale;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Operation modes exposed by the cloud protocol, with their wire codes and the
 * mode-specific parameter that carries the fan speed.
 */
@NonNullByDefault
public enum OperationMode {
    COOL("0200", "p_09"),
    DRY("0500", "p_27"),
    FAN("0000", "p_28"),
    UNKNOWN(null, null);

    private final @Nullable String code;
    private final @Nullable String fanSpeedParam;

    OperationMode(@Nullable String code, @Nullable String fanSpeedParam) {
        this.code = code;
        this.fanSpeedParam = fanSpeedParam;
    }

    public @Nullable String getCode() {
        return code;
    }

    public @Nullable String getFanSpeedParam() {
        return fanSpeedParam;
    }

    /**
     * Maps a raw mode value to a mode. Only the first four hex digits are
     * significant; anything unrecognised is {@link #UNKNOWN}.
     */
    public static OperationMode fromCode(@Nullable String raw) {
        if (raw == null || raw.length() < 4) {
            return UNKNOWN;
        }
        String normalized = raw.substring(0, 4).toUpperCase(Locale.ROOT);
        for (OperationMode mode : values()) {
            if (normalized.equals(mode.code)) {
                return mode;
            }
        }
        return UNKNOWN;
    }
}
