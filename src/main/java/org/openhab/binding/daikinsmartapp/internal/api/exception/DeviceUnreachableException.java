package org.openhab.binding.daikinsmartapp.internal.api.exception;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Thrown when a status fetch fails in transport.
 */
@NonNullByDefault
public class DeviceUnreachableException extends DaikinException {

    private static final long serialVersionUID = 1L;

    public DeviceUnreachableException(String message) {
        super(message);
    }

    public DeviceUnreachableException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
