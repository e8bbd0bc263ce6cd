package org.openhab.binding.daikinsmartapp.internal.api.exception;

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * Thrown when the vendor, or the local catalog, does not know a unit id.
 * Callers should rediscover.
 */
@NonNullByDefault
public class UnknownDeviceException extends DaikinException {

    private static final long serialVersionUID = 1L;

    private final String deviceId;

    public UnknownDeviceException(String deviceId) {
        super("Unknown device: " + deviceId);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
