package org.openhab.binding.daikinsmartapp.internal.api.mapper;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;
import org.openhab.binding.daikinsmartapp.internal.DsiotFixtures;
import org.openhab.binding.daikinsmartapp.internal.model.Capability;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceStatusSnapshot;
import org.openhab.binding.daikinsmartapp.internal.model.OperationMode;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * Tests for {@link DsiotStatusMapper}.
 */
@NonNullByDefault
@SuppressWarnings("null")
class DsiotStatusMapperTest {

    private static final Instant NOW = Instant.parse("2026-10-17T10:00:00Z");

    @Test
    void flattenMergesGroupsAsGroupDotParam() {
        JsonObject pc = JsonParser.parseString(DsiotFixtures.statusTree("01", "0200")).getAsJsonObject();

        Map<String, String> raw = DsiotStatusMapper.flatten(pc);

        assertNotNull(raw);
        assertEquals("01", raw.get("e_A002.p_01"));
        assertEquals("0200", raw.get("e_3001.p_01"));
        assertEquals("03", raw.get("e_3003.p_2D"));
        assertEquals("37", raw.get("e_A00B.p_02"));
    }

    @Test
    void flattenWithoutStatusRootReturnsNull() {
        JsonObject pc = JsonParser.parseString("{\"pn\":\"dgc_status\",\"pch\":[]}").getAsJsonObject();
        assertNull(DsiotStatusMapper.flatten(pc));
        assertNull(DsiotStatusMapper.flatten(null));
    }

    @Test
    void mapDecodesPowerModeAndTelemetry() {
        JsonObject pc = JsonParser.parseString(DsiotFixtures.statusTree("01", "0200")).getAsJsonObject();
        Map<String, String> raw = DsiotStatusMapper.flatten(pc);

        DeviceStatusSnapshot snapshot = DsiotStatusMapper.map("1001", raw, NOW);

        assertTrue(snapshot.isPower());
        assertEquals(OperationMode.COOL, snapshot.getMode());
        assertEquals(25.0, snapshot.getReadings().getTargetTemperature());
        assertEquals(-2.0, snapshot.getReadings().getRoomTemperature());
        assertEquals(55, snapshot.getReadings().getRoomHumidity());
        assertEquals("0A00", snapshot.getReadings().getFanSpeedCode());
        assertNull(snapshot.getReadings().getSensorTemperature1());
        assertEquals(NOW, snapshot.getFetchedAt());
    }

    @Test
    void mapTreatsUnrecognisedValuesAsOffAndUnknown() {
        Map<String, String> raw = new HashMap<>();
        raw.put("e_A002.p_01", "7F");
        raw.put("e_3001.p_01", "0900");

        DeviceStatusSnapshot snapshot = DsiotStatusMapper.map("1001", raw, NOW);

        assertFalse(snapshot.isPower());
        assertEquals(OperationMode.UNKNOWN, snapshot.getMode());
        assertNull(snapshot.getReadings().getTargetTemperature());
    }

    @Test
    void mapDecodesAuxiliarySensorTemperatures() {
        Map<String, String> raw = new HashMap<>();
        raw.put("e_A002.p_01", "01");
        raw.put("e_3001.p_01", "0000");
        raw.put("e_A00B.p_05", "2D00");
        raw.put("e_A00B.p_06", "FBFF");

        DeviceStatusSnapshot snapshot = DsiotStatusMapper.map("1001", raw, NOW);

        assertEquals(22.5, snapshot.getReadings().getSensorTemperature1());
        assertEquals(-2.5, snapshot.getReadings().getSensorTemperature2());
    }

    @Test
    void littleEndianHalfDegreeNeedsExactlyTwoBytes() {
        assertEquals(128.0, DsiotStatusMapper.decodeLeInt16HalfDegree("0001"));
        assertEquals(-0.5, DsiotStatusMapper.decodeLeInt16HalfDegree("ffff"));
        assertNull(DsiotStatusMapper.decodeLeInt16HalfDegree("2D"));
        assertNull(DsiotStatusMapper.decodeLeInt16HalfDegree("2D0000"));
        assertNull(DsiotStatusMapper.decodeLeInt16HalfDegree("ZZ00"));
        assertNull(DsiotStatusMapper.decodeLeInt16HalfDegree("+100"));
        assertNull(DsiotStatusMapper.decodeLeInt16HalfDegree(null));
    }

    @Test
    void writePayloadKeepsSameWidthRawValuesAndFallsBackToTemplate() {
        Map<String, String> raw = new HashMap<>();
        raw.put("e_3001.p_22", "030000");
        raw.put("e_3001.p_27", "0B");
        raw.put("e_3003.p_2D", "05");

        JsonObject payload = DsiotStatusMapper.buildWritePayload(true, OperationMode.DRY, raw);

        assertEquals("dgc_status", payload.get("pn").getAsString());
        JsonObject statusRoot = DsiotStatusMapper.childByName(payload, "e_1002");
        assertNotNull(statusRoot);
        Map<String, String> mode = params(DsiotStatusMapper.childByName(statusRoot, "e_3001"));
        assertEquals("0500", mode.get("p_01"));
        assertEquals("030000", mode.get("p_22"));
        assertEquals("0A00", mode.get("p_27"));
        assertEquals("0F0000", mode.get("p_23"));
        assertEquals("05", params(DsiotStatusMapper.childByName(statusRoot, "e_3003")).get("p_2D"));
        assertEquals("01", params(DsiotStatusMapper.childByName(statusRoot, "e_A002")).get("p_01"));
    }

    @Test
    void writePayloadUsesDefaultFanCodeWithoutRawStatus() {
        JsonObject payload = DsiotStatusMapper.buildWritePayload(false, OperationMode.FAN, Map.of());

        JsonObject statusRoot = DsiotStatusMapper.childByName(payload, "e_1002");
        assertEquals("02", params(DsiotStatusMapper.childByName(statusRoot, "e_3003")).get("p_2D"));
        assertEquals("00", params(DsiotStatusMapper.childByName(statusRoot, "e_A002")).get("p_01"));
        assertEquals("0000", params(DsiotStatusMapper.childByName(statusRoot, "e_3001")).get("p_01"));
    }

    @Test
    void capabilitiesFollowExposedGroups() {
        JsonObject edge = JsonParser.parseString("{\"ri\":\"1\",\"pch\":[{\"pn\":\"e_1002\",\"pch\":["
                + "{\"pn\":\"e_A002\",\"pch\":[{\"pn\":\"p_01\",\"pv\":\"00\"}]},"
                + "{\"pn\":\"e_3001\",\"pch\":[{\"pn\":\"p_01\",\"pv\":\"0200\"},{\"pn\":\"p_02\",\"pv\":\"32\"}]}"
                + "]}]}").getAsJsonObject();

        assertEquals(EnumSet.of(Capability.POWER, Capability.MODE_COOL), DsiotStatusMapper.capabilitiesOf(edge));
    }

    @Test
    void capabilitiesDefaultToEverythingWithoutStatusGroups() {
        JsonObject edge = JsonParser.parseString("{\"ri\":\"1\",\"pch\":[]}").getAsJsonObject();

        assertEquals(Capability.all(), DsiotStatusMapper.capabilitiesOf(edge));
    }

    @Test
    void modeGroupWithoutMarkersAllowsEveryMode() {
        JsonObject edge = JsonParser.parseString("{\"pch\":[{\"pn\":\"e_1002\",\"pch\":["
                + "{\"pn\":\"e_3001\",\"pch\":[{\"pn\":\"p_01\",\"pv\":\"0200\"}]}]}]}").getAsJsonObject();

        assertEquals(EnumSet.of(Capability.MODE_COOL, Capability.MODE_DRY, Capability.MODE_FAN),
                DsiotStatusMapper.capabilitiesOf(edge));
    }

    @Test
    void fanSpeedPrefersParameterOfCurrentMode() {
        Map<String, String> raw = new HashMap<>();
        raw.put("e_3001.p_09", "0300");
        raw.put("e_3001.p_27", "0b00");

        assertEquals("0B00", DsiotStatusMapper.extractFanSpeedCode(raw, OperationMode.DRY));
        assertEquals("0300", DsiotStatusMapper.extractFanSpeedCode(raw, OperationMode.COOL));
        assertNull(DsiotStatusMapper.extractFanSpeedCode(Map.of("e_3001.p_09", "FFFF"), OperationMode.COOL));
    }

    private static Map<String, String> params(JsonObject group) {
        Map<String, String> result = new HashMap<>();
        JsonArray children = group.getAsJsonArray("pch");
        children.forEach(child -> result.put(child.getAsJsonObject().get("pn").getAsString(),
                child.getAsJsonObject().get("pv").getAsString()));
        return result;
    }
}
