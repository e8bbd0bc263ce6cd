package org.openhab.binding.daikinsmartapp.internal.model;

import java.time.Instant;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * Ground truth for one unit as returned by a single status fetch.
 */
@NonNullByDefault
public final class DeviceStatusSnapshot {
    private final String deviceId;
    private final boolean power;
    private final OperationMode mode;
    private final DeviceReadings readings;
    private final Map<String, String> rawStatus;
    private final Instant fetchedAt;

    public DeviceStatusSnapshot(String deviceId, boolean power, OperationMode mode, DeviceReadings readings,
            Map<String, String> rawStatus, Instant fetchedAt) {
        this.deviceId = deviceId;
        this.power = power;
        this.mode = mode;
        this.readings = readings;
        this.rawStatus = Map.copyOf(rawStatus);
        this.fetchedAt = fetchedAt;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public boolean isPower() {
        return power;
    }

    public OperationMode getMode() {
        return mode;
    }

    public DeviceReadings getReadings() {
        return readings;
    }

    /**
     * Flattened status parameters keyed as {@code <group>.<param>}.
     */
    public Map<String, String> getRawStatus() {
        return rawStatus;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    @Override
    public String toString() {
        return "DeviceStatusSnapshot[" + deviceId + " power=" + (power ? "on" : "off") + " mode=" + mode + "]";
    }
}
