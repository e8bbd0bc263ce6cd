package org.openhab.binding.daikinsmartapp.internal;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.api.DaikinCloudApi;
import org.openhab.binding.daikinsmartapp.internal.api.exception.CommandInFlightException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.CommandSubmissionFailedException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.DaikinException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.UnknownDeviceException;
import org.openhab.binding.daikinsmartapp.internal.api.exception.UnsupportedDeviceOperationException;
import org.openhab.binding.daikinsmartapp.internal.model.Capability;
import org.openhab.binding.daikinsmartapp.internal.model.Command;
import org.openhab.binding.daikinsmartapp.internal.model.Device;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceState;
import org.openhab.binding.daikinsmartapp.internal.model.OperationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Submits power and mode changes. At most one command per unit is in flight:
 * from the moment submission starts until a poll confirms it or the
 * confirmation timeout expires. Accepted commands are applied optimistically
 * to the registry. Failed submissions are not retried here.
 */
@NonNullByDefault
public class CommandDispatcher {

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(CommandDispatcher.class));

    private final DaikinCloudApi api;
    private final DeviceRegistry registry;
    private final Clock clock;
    private final Duration confirmationTimeout;
    private final Set<String> submitting = ConcurrentHashMap.newKeySet();

    public CommandDispatcher(DaikinCloudApi api, DeviceRegistry registry, Clock clock,
            Duration confirmationTimeout) {
        this.api = Objects.requireNonNull(api, "api");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.confirmationTimeout = Objects.requireNonNull(confirmationTimeout, "confirmationTimeout");
    }

    /**
     * Builds a command for the given targets and dispatches it.
     *
     * @throws UnsupportedDeviceOperationException if nothing is targeted or the
     *             mode is {@link OperationMode#UNKNOWN}
     */
    public DeviceState dispatch(String deviceId, @Nullable Boolean targetPower, @Nullable OperationMode targetMode)
            throws DaikinException, InterruptedException {
        if (targetPower == null && targetMode == null) {
            throw new UnsupportedDeviceOperationException("A command for " + deviceId + " must target power or mode");
        }
        if (targetMode == OperationMode.UNKNOWN) {
            throw new UnsupportedDeviceOperationException("Mode " + targetMode + " cannot be set on " + deviceId);
        }
        return dispatch(new Command(deviceId, targetPower, targetMode, clock.instant(), 1));
    }

    /**
     * Validates and submits a command.
     *
     * @return the optimistic state recorded after the cloud accepted the command
     * @throws UnknownDeviceException if the unit is not in the catalog
     * @throws UnsupportedDeviceOperationException if the unit lacks a targeted
     *             capability; the registry is left untouched
     * @throws CommandInFlightException if another command for the unit is
     *             being submitted or still awaits confirmation
     * @throws CommandSubmissionFailedException if the cloud could not be reached
     *             or rejected the command; no pending command is recorded
     */
    public DeviceState dispatch(Command command) throws DaikinException, InterruptedException {
        String deviceId = command.getDeviceId();
        Device device = registry.getDevice(deviceId);
        if (device == null) {
            throw new UnknownDeviceException(deviceId);
        }
        validate(device, command);

        if (!submitting.add(deviceId)) {
            throw new CommandInFlightException("A command for " + deviceId + " is already being submitted");
        }
        try {
            DeviceState current = registry.getState(deviceId);
            if (current == null) {
                throw new UnknownDeviceException(deviceId);
            }
            Command pending = current.getPendingCommand();
            if (pending != null) {
                if (!isExpired(current, clock.instant())) {
                    throw new CommandInFlightException(
                            "Device " + deviceId + " still awaits confirmation of " + pending);
                }
                logger.info("{} expired without confirmation; accepting {}", pending, command);
            }

            boolean accepted = api.submitCommand(deviceId, command);
            if (!accepted) {
                throw new CommandSubmissionFailedException("Cloud rejected " + command);
            }
            Instant since = clock.instant();
            DeviceState optimistic = registry.upsertState(deviceId, s -> s.withPendingCommand(command, since));
            logger.debug("{} accepted, awaiting confirmation", command);
            return optimistic;
        } finally {
            submitting.remove(deviceId);
        }
    }

    private void validate(Device device, Command command) throws UnsupportedDeviceOperationException {
        if (command.getTargetPower() != null && !device.supports(Capability.POWER)) {
            throw new UnsupportedDeviceOperationException(device.getDeviceId(), Capability.POWER);
        }
        OperationMode mode = command.getTargetMode();
        if (mode != null && !device.supportsMode(mode)) {
            throw new UnsupportedDeviceOperationException(device.getDeviceId(),
                    Objects.requireNonNull(Capability.forMode(mode)));
        }
    }

    private boolean isExpired(DeviceState state, Instant now) {
        Instant since = state.getPendingSince();
        return since != null && Duration.between(since, now).compareTo(confirmationTimeout) > 0;
    }
}
