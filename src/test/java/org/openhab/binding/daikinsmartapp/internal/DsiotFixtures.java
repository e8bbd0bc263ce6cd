package org.openhab.binding.daikinsmartapp.internal;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.openhab.binding.daikinsmartapp.internal.model.Capability;
import org.openhab.binding.daikinsmartapp.internal.model.Device;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceReadings;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceStatusSnapshot;
import org.openhab.binding.daikinsmartapp.internal.model.OperationMode;

/**
 * Canned dsiot payloads shaped like the cloud's answers.
 */
@NonNullByDefault
public final class DsiotFixtures {

    private DsiotFixtures() {
    }

    /**
     * A {@code dgc_status} tree with the given power flag and mode code.
     */
    public static String statusTree(String power, String modeCode) {
        return "{\"pn\":\"dgc_status\",\"pch\":[{\"pn\":\"e_1002\",\"pch\":["
                + "{\"pn\":\"e_3001\",\"pch\":[{\"pn\":\"p_01\",\"pv\":\"" + modeCode + "\"},"
                + "{\"pn\":\"p_02\",\"pv\":\"32\"},{\"pn\":\"p_09\",\"pv\":\"0A00\"}]},"
                + "{\"pn\":\"e_3003\",\"pch\":[{\"pn\":\"p_2D\",\"pv\":\"03\"}]},"
                + "{\"pn\":\"e_A002\",\"pch\":[{\"pn\":\"p_01\",\"pv\":\"" + power + "\"}]},"
                + "{\"pn\":\"e_A00B\",\"pch\":[{\"pn\":\"p_01\",\"pv\":\"FE\"},{\"pn\":\"p_02\",\"pv\":\"37\"}]}"
                + "]}]}";
    }

    /**
     * Multi-request answer to a status read of one unit.
     */
    public static String statusResponse(String deviceId, String power, String modeCode) {
        return "{\"responses\":[{\"fr\":\"/dsiot/edges/" + deviceId + "/adr_0100.dgc_status\",\"rsc\":2000,"
                + "\"pc\":" + statusTree(power, modeCode) + "}]}";
    }

    /**
     * Multi-request answer to discovery: unit A exposes power and every mode,
     * unit B only the power group.
     */
    public static String discoveryResponse() {
        String edgeA = "{\"ri\":\"1001\",\"pch\":["
                + "{\"pn\":\"adp_d\",\"pch\":[{\"pn\":\"name\",\"pv\":\"Living room\"}]},"
                + "{\"pn\":\"adp_i\",\"pch\":[{\"pn\":\"mac\",\"pv\":\"AA:BB:CC:00:00:01\"}]},"
                + "{\"pn\":\"adr_0100\",\"pch\":[{\"pn\":\"dgc_status\",\"pch\":[{\"pn\":\"e_1002\",\"pch\":["
                + "{\"pn\":\"e_3001\",\"pch\":[{\"pn\":\"p_01\",\"pv\":\"0200\"},{\"pn\":\"p_02\",\"pv\":\"32\"},"
                + "{\"pn\":\"p_22\",\"pv\":\"020000\"},{\"pn\":\"p_24\",\"pv\":\"020000\"}]},"
                + "{\"pn\":\"e_A002\",\"pch\":[{\"pn\":\"p_01\",\"pv\":\"00\"}]}]}]}]}]}";
        String edgeB = "{\"ri\":\"1002\",\"pch\":["
                + "{\"pn\":\"adp_i\",\"pch\":[{\"pn\":\"mac\",\"pv\":\"AA:BB:CC:00:00:02\"}]},"
                + "{\"pn\":\"adr_0100\",\"pch\":[{\"pn\":\"dgc_status\",\"pch\":[{\"pn\":\"e_1002\",\"pch\":["
                + "{\"pn\":\"e_A002\",\"pch\":[{\"pn\":\"p_01\",\"pv\":\"00\"}]}]}]}]}]}";
        return "{\"responses\":[{\"fr\":\"/dsiot/edges\",\"rsc\":2000,\"pc\":[" + edgeA + "," + edgeB + "]},"
                + "{\"fr\":\"/dsiot/edges\",\"rsc\":2000,\"pc\":[{\"ri\":\"1001\"},{\"ri\":\"1002\"}]}]}";
    }

    public static String loginResponse(String idToken, String accessToken) {
        return "{\"rsc\":2000,\"id_token\":\"" + idToken + "\",\"access_token\":\"" + accessToken
                + "\",\"refresh_token\":\"REFRESH\"}";
    }

    /**
     * Unit supporting power and every mode.
     */
    public static Device fullDevice(String deviceId) {
        return new Device(deviceId, "Unit " + deviceId, "", Capability.all());
    }

    /**
     * Unit that can only be switched on and off.
     */
    public static Device powerOnlyDevice(String deviceId) {
        return new Device(deviceId, "Unit " + deviceId, "", EnumSet.of(Capability.POWER));
    }

    public static DeviceStatusSnapshot snapshot(String deviceId, boolean power, OperationMode mode,
            Instant fetchedAt) {
        return new DeviceStatusSnapshot(deviceId, power, mode, new DeviceReadings(24.0, 26.5, 40, "03"), Map.of(),
                fetchedAt);
    }
}
