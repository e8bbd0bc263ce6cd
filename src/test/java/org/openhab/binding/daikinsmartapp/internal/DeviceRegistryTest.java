package org.openhab.binding.daikinsmartapp.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openhab.binding.daikinsmartapp.internal.api.exception.UnknownDeviceException;
import org.openhab.binding.daikinsmartapp.internal.model.Confidence;
import org.openhab.binding.daikinsmartapp.internal.model.Device;
import org.openhab.binding.daikinsmartapp.internal.model.DeviceState;
import org.openhab.binding.daikinsmartapp.internal.model.OperationMode;

/**
 * Tests for {@link DeviceRegistry}.
 */
public @NonNullByDefault @SuppressWarnings("null") class DeviceRegistryTest {

    private static final Instant NOW = Instant.parse("2026-07-01T08:00:00Z");

    private DeviceRegistry registry;
    private final List<DeviceState> changes = new ArrayList<>();
    private final List<List<Device>> catalogs = new ArrayList<>();

    @BeforeEach
    public void setUp() {
        registry = new DeviceRegistry();
        registry.addListener(new DeviceStateListener() {
            @Override
            public void onStateChanged(DeviceState state) {
                changes.add(state);
            }

            @Override
            public void onCatalogChanged(List<Device> devices) {
                catalogs.add(devices);
            }
        });
    }

    @Test
    void newUnitsStartUnknown() {
        registry.replaceCatalog(List.of(DsiotFixtures.fullDevice("A"), DsiotFixtures.fullDevice("B")));

        assertEquals(2, registry.listDevices().size());
        DeviceState state = registry.getState("A");
        assertNotNull(state);
        assertEquals(OperationMode.UNKNOWN, state.getMode());
        assertEquals(Confidence.LOW, state.getConfidence());
        assertEquals(1, catalogs.size());
        assertEquals(2, changes.size());
    }

    @Test
    void rediscoveryKeepsSurvivingStateAndDropsVanished() throws Exception {
        registry.replaceCatalog(List.of(DsiotFixtures.fullDevice("A"), DsiotFixtures.fullDevice("B")));
        DeviceState polled = registry.upsertState("A",
                s -> s.confirmed(DsiotFixtures.snapshot("A", true, OperationMode.COOL, NOW), NOW));
        changes.clear();

        registry.replaceCatalog(List.of(DsiotFixtures.fullDevice("A"), DsiotFixtures.powerOnlyDevice("C")));

        assertSame(polled, registry.getState("A"));
        assertNull(registry.getState("B"));
        assertNull(registry.getDevice("B"));
        assertNotNull(registry.getState("C"));
        assertEquals(1, changes.size());
        assertEquals("C", changes.get(0).getDeviceId());
    }

    @Test
    void listenersOnlyHearRealChanges() throws Exception {
        registry.replaceCatalog(List.of(DsiotFixtures.fullDevice("A")));
        changes.clear();

        registry.upsertState("A", s -> s.confirmed(DsiotFixtures.snapshot("A", true, OperationMode.DRY, NOW), NOW));
        registry.upsertState("A", s -> s.confirmed(DsiotFixtures.snapshot("A", true, OperationMode.DRY, NOW), NOW));
        registry.upsertState("A", s -> s.withConfidence(Confidence.HIGH));

        assertEquals(1, changes.size());
        assertTrue(changes.get(0).isPower());
    }

    @Test
    void upsertOfUnknownUnitFails() {
        assertThrows(UnknownDeviceException.class, () -> registry.upsertState("missing", s -> s));
    }

    @Test
    void mutatorMustKeepDeviceId() {
        registry.replaceCatalog(List.of(DsiotFixtures.fullDevice("A")));

        assertThrows(IllegalArgumentException.class, () -> registry.upsertState("A", s -> DeviceState.unknown("B")));
    }

    @Test
    void failingListenerDoesNotBlockOthers() throws Exception {
        List<DeviceState> seen = new ArrayList<>();
        DeviceRegistry local = new DeviceRegistry();
        local.addListener(state -> {
            throw new IllegalStateException("listener bug");
        });
        local.addListener(seen::add);

        local.replaceCatalog(List.of(DsiotFixtures.fullDevice("A")));

        assertEquals(1, seen.size());
    }

    @Test
    void clearForgetsEverything() {
        registry.replaceCatalog(List.of(DsiotFixtures.fullDevice("A")));

        registry.clear();

        assertTrue(registry.listDevices().isEmpty());
        assertNull(registry.getState("A"));
    }
}
