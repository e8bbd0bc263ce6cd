package org.openhab.binding.daikinsmartapp.internal.model;

import java.time.Instant;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * A mutating request for one unit. At least one of power and mode is targeted.
 */
@NonNullByDefault
public final class Command {
    private final String deviceId;
    private final @Nullable Boolean targetPower;
    private final @Nullable OperationMode targetMode;
    private final Instant issuedAt;
    private final int attemptCount;

    public Command(String deviceId, @Nullable Boolean targetPower, @Nullable OperationMode targetMode,
            Instant issuedAt, int attemptCount) {
        if (targetPower == null && targetMode == null) {
            throw new IllegalArgumentException("Command must target power and/or mode");
        }
        if (targetMode == OperationMode.UNKNOWN) {
            throw new IllegalArgumentException("Command cannot target mode UNKNOWN");
        }
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.targetPower = targetPower;
        this.targetMode = targetMode;
        this.issuedAt = Objects.requireNonNull(issuedAt, "issuedAt");
        this.attemptCount = attemptCount;
    }

    public static Command power(String deviceId, boolean on, Instant issuedAt) {
        return new Command(deviceId, Boolean.valueOf(on), null, issuedAt, 1);
    }

    public static Command mode(String deviceId, OperationMode mode, Instant issuedAt) {
        return new Command(deviceId, null, mode, issuedAt, 1);
    }

    public String getDeviceId() {
        return deviceId;
    }

    public @Nullable Boolean getTargetPower() {
        return targetPower;
    }

    public @Nullable OperationMode getTargetMode() {
        return targetMode;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    /**
     * Whether the reported values satisfy every field this command targets.
     */
    public boolean isSatisfiedBy(boolean power, OperationMode mode) {
        Boolean localPower = targetPower;
        if (localPower != null && localPower.booleanValue() != power) {
            return false;
        }
        OperationMode localMode = targetMode;
        return localMode == null || localMode == mode;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Command)) {
            return false;
        }
        Command other = (Command) o;
        return deviceId.equals(other.deviceId) && Objects.equals(targetPower, other.targetPower)
                && targetMode == other.targetMode && issuedAt.equals(other.issuedAt)
                && attemptCount == other.attemptCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, targetPower, targetMode, issuedAt, attemptCount);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Command[").append(deviceId);
        if (targetPower != null) {
            sb.append(" power=").append(Boolean.TRUE.equals(targetPower) ? "on" : "off");
        }
        if (targetMode != null) {
            sb.append(" mode=").append(targetMode);
        }
        return sb.append(" attempt=").append(attemptCount).append(']').toString();
    }
}
