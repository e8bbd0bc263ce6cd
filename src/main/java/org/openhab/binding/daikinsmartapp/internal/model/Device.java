package org.openhab.binding.daikinsmartapp.internal.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * A unit discovered on the account. Identity and capabilities are fixed after
 * discovery; a rediscovery may only rename it.
 */
@NonNullByDefault
public final class Device {
    private final String deviceId;
    private final String displayName;
    private final String mac;
    private final Set<Capability> capabilities;

    public Device(String deviceId, String displayName, String mac, Set<Capability> capabilities) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.mac = Objects.requireNonNull(mac, "mac");
        this.capabilities = capabilities.isEmpty() ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getMac() {
        return mac;
    }

    public Set<Capability> getCapabilities() {
        return capabilities;
    }

    public boolean supports(Capability capability) {
        return capabilities.contains(capability);
    }

    public boolean supportsMode(OperationMode mode) {
        Capability capability = Capability.forMode(mode);
        return capability != null && capabilities.contains(capability);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Device)) {
            return false;
        }
        Device other = (Device) o;
        return deviceId.equals(other.deviceId) && displayName.equals(other.displayName) && mac.equals(other.mac)
                && capabilities.equals(other.capabilities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, displayName, mac, capabilities);
    }

    @Override
    public String toString() {
        return "Device[" + deviceId + " '" + displayName + "' " + capabilities + "]";
    }
}
