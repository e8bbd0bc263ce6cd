package org.openhab.binding.daikinsmartapp.internal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.api.exception.UnknownDeviceException;
import org.openhab.binding.daikinsmartapp.internal.model.Command;
import org.openhab.binding.daikinsmartapp.internal.model.Device;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceState;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceStatusSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory catalog of the account's units and their state. Every read and
 * every mutation goes through one lock; {@link #upsertState} is the only way
 * to change a state.
 */
@NonNullByDefault
public class DeviceRegistry {

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(DeviceRegistry.class));

    private final Object lock = new Object();
    private final Map<String, Device> devices = new LinkedHashMap<>();
    private final Map<String, DeviceState> states = new LinkedHashMap<>();
    private final List<DeviceStateListener> listeners = new CopyOnWriteArrayList<>();

    public List<Device> listDevices() {
        synchronized (lock) {
            return List.copyOf(devices.values());
        }
    }

    public @Nullable Device getDevice(String deviceId) {
        synchronized (lock) {
            return devices.get(deviceId);
        }
    }

    public @Nullable DeviceState getState(String deviceId) {
        synchronized (lock) {
            return states.get(deviceId);
        }
    }

    /**
     * Atomically replaces the state of a unit with {@code mutator(current)}.
     * Listeners are told about the result only if it differs from the
     * previous state.
     *
     * @return the committed state
     * @throws UnknownDeviceException if the unit is not in the catalog
     */
    public DeviceState upsertState(String deviceId, UnaryOperator<DeviceState> mutator)
            throws UnknownDeviceException {
        DeviceState previous;
        DeviceState next;
        synchronized (lock) {
            previous = states.get(deviceId);
            if (previous == null) {
                throw new UnknownDeviceException(deviceId);
            }
            next = Objects.requireNonNull(mutator.apply(previous), "mutator result");
            if (!deviceId.equals(next.getDeviceId())) {
                throw new IllegalArgumentException(
                        "Mutator changed device id from " + deviceId + " to " + next.getDeviceId());
            }
            states.put(deviceId, next);
        }
        if (!next.equals(previous)) {
            logger.trace("State of {} changed to {}", deviceId, next);
            fireStateChanged(next);
        }
        return next;
    }

    /**
     * Replaces the catalog after a discovery. States of units that are still
     * present are kept, units that vanished lose their state and new units
     * start out unknown.
     */
    public void replaceCatalog(Collection<Device> discovered) {
        List<DeviceState> added = new ArrayList<>();
        List<Device> catalog;
        synchronized (lock) {
            Map<String, Device> next = new LinkedHashMap<>();
            for (Device device : discovered) {
                next.put(device.getDeviceId(), device);
            }
            states.keySet().retainAll(next.keySet());
            for (String id : next.keySet()) {
                if (!states.containsKey(id)) {
                    DeviceState fresh = DeviceState.unknown(id);
                    states.put(id, fresh);
                    added.add(fresh);
                }
            }
            devices.clear();
            devices.putAll(next);
            catalog = List.copyOf(devices.values());
        }
        logger.debug("Catalog now holds {} units ({} new)", catalog.size(), added.size());
        for (DeviceStateListener listener : listeners) {
            listener.onCatalogChanged(catalog);
        }
        for (DeviceState state : added) {
            fireStateChanged(state);
        }
    }

    public void clear() {
        synchronized (lock) {
            devices.clear();
            states.clear();
        }
    }

    public void addListener(DeviceStateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DeviceStateListener listener) {
        listeners.remove(listener);
    }

    void fireCommandPresumedFailed(Command command, DeviceStatusSnapshot serverState) {
        for (DeviceStateListener listener : listeners) {
            try {
                listener.onCommandPresumedFailed(command, serverState);
            } catch (RuntimeException e) {
                logger.warn("Listener failed handling presumed failure of {}: {}", command, e.getMessage(), e);
            }
        }
    }

    private void fireStateChanged(DeviceState state) {
        for (DeviceStateListener listener : listeners) {
            try {
                listener.onStateChanged(state);
            } catch (RuntimeException e) {
                logger.warn("Listener failed handling state change of {}: {}", state.getDeviceId(), e.getMessage(),
                        e);
            }
        }
    }
}
