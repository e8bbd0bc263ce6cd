package org.openhab.binding.daikinsmartapp.internal;

import java.util.List;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.openhab.binding.daikinsmartapp.internal.model.Command;
import org.openhab.binding.daikinsmartapp.internal.model.Device;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceState;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceStatusSnapshot;

/**
 * Receives state changes so an adapter does not have to poll the registry.
 * Callbacks run on the thread that committed the change, after the registry
 * lock has been released.
 */
@NonNullByDefault
public interface DeviceStateListener {

    /**
     * Called whenever a registry mutation committed a different state.
     */
    void onStateChanged(DeviceState state);

    /**
     * Called when a pending command was not confirmed before the confirmation
     * timeout. The state has already been reverted to {@code serverState}.
     */
    default void onCommandPresumedFailed(Command command, DeviceStatusSnapshot serverState) {
    }

    default void onCatalogChanged(List<Device> devices) {
    }
}
