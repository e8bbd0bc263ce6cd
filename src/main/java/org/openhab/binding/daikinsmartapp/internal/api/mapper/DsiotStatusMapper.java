package org.openhab.binding.daikinsmartapp.internal.api.mapper;

import static org.openhab.binding.daikinsmartapp.internal.DaikinSmartAppBindingConstants.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.eclipse.jdt.annotation.Nullable;
import org.openhab.binding.daikinsmartapp.internal.model.Capability;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceReadings;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceStatusSnapshot;
import org.openhab.binding.daikinsmartapp.internal.model.OperationMode;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Maps the dsiot property trees used by the cloud ({@code pn} name, {@code pv}
 * value, {@code pch} children) to and from the {@link DeviceStatusSnapshot}
 * model.
 */
public class DsiotStatusMapper {

    // Parameter templates sent with a mode change; values are fixed-width hex
    private static final Map<String, String> COOL_TEMPLATE = template("p_02", "32", "p_05", "0F0000", "p_06",
            "0F0000", "p_09", "0700", "p_0C", "00");
    private static final Map<String, String> DRY_TEMPLATE = template("p_22", "020000", "p_23", "0F0000", "p_27",
            "0A00", "p_31", "00");
    private static final Map<String, String> FAN_TEMPLATE = template("p_24", "020000", "p_25", "050000", "p_28",
            "0A00");

    private static final String COOL_MARKER = "p_02";
    private static final String DRY_MARKER = "p_22";
    private static final String FAN_MARKER = "p_24";

    private static final String[] FAN_SPEED_PARAMS = { "p_09", "p_27", "p_28" };
    private static final Set<String> FAN_SPEED_CODES = Set.of("0A00", "0B00", "0300", "0400", "0500", "0600",
            "0700");

    private DsiotStatusMapper() {
    }

    /**
     * Flattens the groups below {@code e_1002} into {@code group.param -> value}.
     *
     * @return the flattened map, or {@code null} if the tree has no status root
     */
    public static @Nullable Map<String, String> flatten(@Nullable JsonObject pc) {
        JsonObject statusRoot = childByName(pc, NODE_STATUS_ROOT);
        if (statusRoot == null) {
            return null;
        }
        Map<String, String> merged = new LinkedHashMap<>();
        for (JsonObject group : children(statusRoot)) {
            String groupName = optString(group, "pn");
            if (groupName == null || groupName.isEmpty()) {
                continue;
            }
            for (JsonObject param : children(group)) {
                String key = optString(param, "pn");
                if (key == null || key.isEmpty() || !param.has("pv")) {
                    continue;
                }
                String value = optString(param, "pv");
                if (value != null) {
                    merged.put(groupName + "." + key, value);
                }
            }
        }
        return merged;
    }

    public static DeviceStatusSnapshot map(String deviceId, Map<String, String> raw, Instant fetchedAt) {
        boolean power = POWER_ON.equals(raw.get(KEY_POWER));
        OperationMode mode = OperationMode.fromCode(raw.get(KEY_MODE));

        Integer room = decodeSignedByte(raw.get(KEY_ROOM_TEMPERATURE));
        DeviceReadings readings = new DeviceReadings(decodeHalfDegree(raw.get(KEY_TARGET_TEMPERATURE)),
                room != null ? Double.valueOf(room.doubleValue()) : null, decodeHexInt(raw.get(KEY_ROOM_HUMIDITY)),
                extractFanSpeedCode(raw, mode), decodeLeInt16HalfDegree(raw.get(KEY_SENSOR_TEMPERATURE_1)),
                decodeLeInt16HalfDegree(raw.get(KEY_SENSOR_TEMPERATURE_2)));
        return new DeviceStatusSnapshot(deviceId, power, mode, readings, raw, fetchedAt);
    }

    /**
     * Builds the {@code pc} tree of a status write. Mode parameters are taken
     * from the last known raw status where they have the template's width,
     * otherwise from the template.
     */
    public static JsonObject buildWritePayload(boolean powerOn, OperationMode mode, Map<String, String> raw) {
        JsonArray modePatch = new JsonArray();
        modePatch.add(param("p_01", mode.getCode()));
        for (Map.Entry<String, String> entry : templateFor(mode).entrySet()) {
            String key = entry.getKey();
            String def = entry.getValue();
            String value = raw.get(NODE_MODE_GROUP + "." + key);
            if (value == null || value.length() != def.length()) {
                value = def;
            }
            modePatch.add(param(key, value));
        }

        String fanCode = raw.get(KEY_FAN_CODE);
        if (fanCode == null || fanCode.isEmpty()) {
            fanCode = DEFAULT_FAN_CODE;
        }
        JsonArray fanPatch = new JsonArray();
        fanPatch.add(param("p_2D", fanCode));

        JsonArray powerPatch = new JsonArray();
        powerPatch.add(param("p_01", powerOn ? POWER_ON : POWER_OFF));

        JsonArray groups = new JsonArray();
        groups.add(node(NODE_MODE_GROUP, modePatch));
        groups.add(node(NODE_FAN_GROUP, fanPatch));
        groups.add(node(NODE_POWER_GROUP, powerPatch));

        JsonArray root = new JsonArray();
        root.add(node(NODE_STATUS_ROOT, groups));
        return node(NODE_DGC_STATUS, root);
    }

    /**
     * Derives the capability set from an expanded edge tree. Units whose tree
     * carries no recognisable status groups are assumed to support everything.
     */
    public static Set<Capability> capabilitiesOf(@Nullable JsonObject edge) {
        JsonObject statusRoot = findByName(edge, NODE_STATUS_ROOT);
        if (statusRoot == null) {
            return Capability.all();
        }
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (childByName(statusRoot, NODE_POWER_GROUP) != null) {
            capabilities.add(Capability.POWER);
        }
        JsonObject modeGroup = childByName(statusRoot, NODE_MODE_GROUP);
        if (modeGroup != null) {
            Set<String> params = new HashSet<>();
            for (JsonObject child : children(modeGroup)) {
                String name = optString(child, "pn");
                if (name != null) {
                    params.add(name);
                }
            }
            boolean cool = params.contains(COOL_MARKER);
            boolean dry = params.contains(DRY_MARKER);
            boolean fan = params.contains(FAN_MARKER);
            if (!cool && !dry && !fan) {
                cool = dry = fan = true;
            }
            if (cool) {
                capabilities.add(Capability.MODE_COOL);
            }
            if (dry) {
                capabilities.add(Capability.MODE_DRY);
            }
            if (fan) {
                capabilities.add(Capability.MODE_FAN);
            }
        }
        return capabilities.isEmpty() ? Capability.all() : capabilities;
    }

    /**
     * Returns the fan speed code, preferring the parameter that belongs to the
     * current mode.
     */
    public static @Nullable String extractFanSpeedCode(Map<String, String> raw, OperationMode mode) {
        String preferred = mode.getFanSpeedParam();
        if (preferred != null) {
            String code = normalizeFanCode(raw.get(NODE_MODE_GROUP + "." + preferred));
            if (code != null) {
                return code;
            }
        }
        for (String key : FAN_SPEED_PARAMS) {
            if (key.equals(preferred)) {
                continue;
            }
            String code = normalizeFanCode(raw.get(NODE_MODE_GROUP + "." + key));
            if (code != null) {
                return code;
            }
        }
        return null;
    }

    public static @Nullable Integer decodeHexInt(@Nullable String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(Integer.parseInt(value, 16));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static @Nullable Integer decodeSignedByte(@Nullable String value) {
        Integer n = decodeHexInt(value);
        if (n == null) {
            return null;
        }
        int v = n.intValue();
        return Integer.valueOf(v >= 0x80 ? v - 0x100 : v);
    }

    public static @Nullable Double decodeHalfDegree(@Nullable String value) {
        Integer n = decodeHexInt(value);
        if (n == null) {
            return null;
        }
        return Double.valueOf(n.intValue() / 2.0);
    }

    /**
     * Decodes two bytes of hex, little-endian and signed, as half-degrees.
     * Anything but exactly four hex digits is {@code null}.
     */
    public static @Nullable Double decodeLeInt16HalfDegree(@Nullable String value) {
        if (value == null || value.length() != 4 || !value.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            return null;
        }
        int low = Integer.parseInt(value.substring(0, 2), 16);
        int high = Integer.parseInt(value.substring(2, 4), 16);
        short n = (short) ((high << 8) | low);
        return Double.valueOf(n / 2.0);
    }

    public static @Nullable JsonObject childByName(@Nullable JsonObject node, String name) {
        for (JsonObject child : children(node)) {
            if (name.equals(optString(child, "pn"))) {
                return child;
            }
        }
        return null;
    }

    /**
     * Depth-first search for the first node with the given name.
     */
    public static @Nullable JsonObject findByName(@Nullable JsonObject node, String name) {
        if (node == null) {
            return null;
        }
        if (name.equals(optString(node, "pn"))) {
            return node;
        }
        for (JsonObject child : children(node)) {
            JsonObject found = findByName(child, name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    public static Iterable<JsonObject> children(@Nullable JsonObject node) {
        List<JsonObject> result = new ArrayList<>();
        if (node == null || !node.has("pch") || !node.get("pch").isJsonArray()) {
            return result;
        }
        for (JsonElement element : node.getAsJsonArray("pch")) {
            if (element != null && element.isJsonObject()) {
                result.add(element.getAsJsonObject());
            }
        }
        return result;
    }

    public static @Nullable String optString(@Nullable JsonObject obj, String key) {
        if (obj == null || !obj.has(key)) {
            return null;
        }
        JsonElement element = obj.get(key);
        if (element == null || element.isJsonNull() || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }

    private static @Nullable String normalizeFanCode(@Nullable String value) {
        if (value == null || value.length() < 4) {
            return null;
        }
        String code = value.substring(0, 4).toUpperCase(Locale.ROOT);
        return FAN_SPEED_CODES.contains(code) ? code : null;
    }

    private static Map<String, String> templateFor(OperationMode mode) {
        switch (mode) {
            case COOL:
                return COOL_TEMPLATE;
            case DRY:
                return DRY_TEMPLATE;
            case FAN:
                return FAN_TEMPLATE;
            default:
                return Map.of();
        }
    }

    private static JsonObject param(String name, @Nullable String value) {
        JsonObject p = new JsonObject();
        p.addProperty("pn", name);
        p.addProperty("pv", value);
        return p;
    }

    private static JsonObject node(String name, JsonArray children) {
        JsonObject n = new JsonObject();
        n.addProperty("pn", name);
        n.add("pch", children);
        return n;
    }

    private static Map<String, String> template(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }
}
