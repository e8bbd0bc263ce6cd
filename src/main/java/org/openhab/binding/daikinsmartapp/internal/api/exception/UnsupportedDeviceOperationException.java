package org.openhab.binding.daikinsmartapp.internal.api.exception;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.model.Capability;

/**
 * Thrown when a command targets a control the unit does not have, or asks
 * for something no unit can do.
 */
@NonNullByDefault
public class UnsupportedDeviceOperationException extends DaikinException {

    private static final long serialVersionUID = 1L;

    private final @Nullable Capability capability;

    public UnsupportedDeviceOperationException(String deviceId, Capability capability) {
        super("Device " + deviceId + " does not support " + capability);
        this.capability = capability;
    }

    public UnsupportedDeviceOperationException(String message) {
        super(message);
        this.capability = null;
    }

    /**
     * @return the missing control, or {@code null} if the request itself was invalid
     */
    public @Nullable Capability getCapability() {
        return capability;
    }
}
