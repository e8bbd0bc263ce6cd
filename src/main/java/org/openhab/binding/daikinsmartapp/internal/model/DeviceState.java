package org.openhab.binding.daikinsmartapp.internal.model;

import java.time.Instant;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Best-known state of one unit. Instances are immutable; the registry swaps
 * them atomically. While {@code pendingCommand} is set, power and mode carry
 * the optimistic values of that command.
 */
@NonNullByDefault
public final class DeviceState {
    private final String deviceId;
    private final boolean power;
    private final OperationMode mode;
    private final DeviceReadings readings;
    private final @Nullable Instant lastConfirmedAt;
    private final @Nullable Command pendingCommand;
    private final @Nullable Instant pendingSince;
    private final Confidence confidence;

    private DeviceState(String deviceId, boolean power, OperationMode mode, DeviceReadings readings,
            @Nullable Instant lastConfirmedAt, @Nullable Command pendingCommand, @Nullable Instant pendingSince,
            Confidence confidence) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.power = power;
        this.mode = Objects.requireNonNull(mode, "mode");
        this.readings = Objects.requireNonNull(readings, "readings");
        this.lastConfirmedAt = lastConfirmedAt;
        this.pendingCommand = pendingCommand;
        this.pendingSince = pendingSince;
        this.confidence = Objects.requireNonNull(confidence, "confidence");
    }

    /**
     * State for a unit that has been discovered but never polled.
     */
    public static DeviceState unknown(String deviceId) {
        return new DeviceState(deviceId, false, OperationMode.UNKNOWN, DeviceReadings.EMPTY, null, null, null,
                Confidence.LOW);
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

    public @Nullable Instant getLastConfirmedAt() {
        return lastConfirmedAt;
    }

    public @Nullable Command getPendingCommand() {
        return pendingCommand;
    }

    public @Nullable Instant getPendingSince() {
        return pendingSince;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public boolean hasPendingCommand() {
        return pendingCommand != null;
    }

    /**
     * Adopts polled values as ground truth and drops any pending command.
     */
    public DeviceState confirmed(DeviceStatusSnapshot snapshot, Instant confirmedAt) {
        return new DeviceState(deviceId, snapshot.isPower(), snapshot.getMode(), snapshot.getReadings(), confirmedAt,
                null, null, Confidence.HIGH);
    }

    /**
     * Keeps the optimistic power and mode but refreshes telemetry from a poll
     * that did not (yet) confirm the pending command.
     */
    public DeviceState withReadings(DeviceReadings newReadings) {
        return new DeviceState(deviceId, power, mode, newReadings, lastConfirmedAt, pendingCommand, pendingSince,
                Confidence.HIGH);
    }

    /**
     * Records an accepted command and applies its targets optimistically.
     */
    public DeviceState withPendingCommand(Command command, Instant since) {
        Boolean targetPower = command.getTargetPower();
        OperationMode targetMode = command.getTargetMode();
        return new DeviceState(deviceId, targetPower != null ? targetPower.booleanValue() : power,
                targetMode != null ? targetMode : mode, readings, lastConfirmedAt, command, since, confidence);
    }

    public DeviceState withConfidence(Confidence newConfidence) {
        if (newConfidence == confidence) {
            return this;
        }
        return new DeviceState(deviceId, power, mode, readings, lastConfirmedAt, pendingCommand, pendingSince,
                newConfidence);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeviceState)) {
            return false;
        }
        DeviceState other = (DeviceState) o;
        return deviceId.equals(other.deviceId) && power == other.power && mode == other.mode
                && readings.equals(other.readings) && Objects.equals(lastConfirmedAt, other.lastConfirmedAt)
                && Objects.equals(pendingCommand, other.pendingCommand)
                && Objects.equals(pendingSince, other.pendingSince) && confidence == other.confidence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, Boolean.valueOf(power), mode, readings, lastConfirmedAt, pendingCommand,
                pendingSince, confidence);
    }

    @Override
    public String toString() {
        return "DeviceState[" + deviceId + " power=" + (power ? "on" : "off") + " mode=" + mode + " confidence="
                + confidence + (pendingCommand != null ? " pending=" + pendingCommand : "") + "]";
    }
}
