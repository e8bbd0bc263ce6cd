package org.openhab.binding.daikinsmartapp.internal.model;

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Read-only telemetry reported alongside power and mode.
 */
@NonNullByDefault
public final class DeviceReadings {
    public static final DeviceReadings EMPTY = new DeviceReadings(null, null, null, null, null, null);

    private final @Nullable Double targetTemperature;
    private final @Nullable Double roomTemperature;
    private final @Nullable Integer roomHumidity;
    private final @Nullable String fanSpeedCode;
    private final @Nullable Double sensorTemperature1;
    private final @Nullable Double sensorTemperature2;

    public DeviceReadings(@Nullable Double targetTemperature, @Nullable Double roomTemperature,
            @Nullable Integer roomHumidity, @Nullable String fanSpeedCode) {
        this(targetTemperature, roomTemperature, roomHumidity, fanSpeedCode, null, null);
    }

    public DeviceReadings(@Nullable Double targetTemperature, @Nullable Double roomTemperature,
            @Nullable Integer roomHumidity, @Nullable String fanSpeedCode, @Nullable Double sensorTemperature1,
            @Nullable Double sensorTemperature2) {
        this.targetTemperature = targetTemperature;
        this.roomTemperature = roomTemperature;
        this.roomHumidity = roomHumidity;
        this.fanSpeedCode = fanSpeedCode;
        this.sensorTemperature1 = sensorTemperature1;
        this.sensorTemperature2 = sensorTemperature2;
    }

    public @Nullable Double getTargetTemperature() {
        return targetTemperature;
    }

    public @Nullable Double getRoomTemperature() {
        return roomTemperature;
    }

    public @Nullable Integer getRoomHumidity() {
        return roomHumidity;
    }

    public @Nullable String getFanSpeedCode() {
        return fanSpeedCode;
    }

    /**
     * Auxiliary temperature sensor reported by some indoor units, in degrees Celsius.
     */
    public @Nullable Double getSensorTemperature1() {
        return sensorTemperature1;
    }

    public @Nullable Double getSensorTemperature2() {
        return sensorTemperature2;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeviceReadings)) {
            return false;
        }
        DeviceReadings other = (DeviceReadings) o;
        return Objects.equals(targetTemperature, other.targetTemperature)
                && Objects.equals(roomTemperature, other.roomTemperature)
                && Objects.equals(roomHumidity, other.roomHumidity) && Objects.equals(fanSpeedCode, other.fanSpeedCode)
                && Objects.equals(sensorTemperature1, other.sensorTemperature1)
                && Objects.equals(sensorTemperature2, other.sensorTemperature2);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetTemperature, roomTemperature, roomHumidity, fanSpeedCode, sensorTemperature1,
                sensorTemperature2);
    }

    @Override
    public String toString() {
        return "DeviceReadings[target=" + targetTemperature + ", room=" + roomTemperature + ", humidity="
                + roomHumidity + ", fan=" + fanSpeedCode + ", sensor1=" + sensorTemperature1 + ", sensor2="
                + sensorTemperature2 + "]";
    }
}
