package com.hubbridge.core.commissioning;

import com.hubbridge.device.BasicInformation;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.device.DeviceTypes;
import com.hubbridge.protocol.PairingCodes;
import com.hubbridge.storage.JsonFileStorageManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommissioningContextManagerTest {

    private static final DeclaredAttributes ROOT = new DeclaredAttributes("HubBridge", DeviceTypes.AGGREGATOR,
            0xfff1, "HubBridge", 0x8000, "HubBridge aggregator");

    @TempDir
    Path dir;

    private JsonFileStorageManager store;
    private CommissioningContextManager identities;

    @BeforeEach
    void setUp() {
        store = new JsonFileStorageManager(dir.resolve("identities.json"));
        AtomicInteger counter = new AtomicInteger();
        identities = new CommissioningContextManager(() -> store, "2.3.4", "6.1.0-arch",
                () -> String.format("%016x", counter.incrementAndGet()));
    }

    @Test
    void create_keepsSerialNumberAcrossCalls() {
        CommissioningIdentity first = identities.create("root", ROOT);
        CommissioningIdentity second = identities.create("root", ROOT);

        assertEquals("CS0000000000000001", first.serialNumber());
        assertEquals("CS0000000000000002", first.uniqueId());
        assertEquals(first.serialNumber(), second.serialNumber());
        assertEquals(first.uniqueId(), second.uniqueId());
    }

    @Test
    void create_survivesReopeningTheStore() {
        String serial = identities.create("root", ROOT).serialNumber();
        store.close();

        store = new JsonFileStorageManager(dir.resolve("identities.json"));

        assertEquals(serial, identities.create("root", ROOT).serialNumber());
    }

    @Test
    void create_derivesVersionsFromBridgeAndOs() {
        CommissioningIdentity identity = identities.create("root", ROOT);

        assertEquals(2, identity.softwareVersion());
        assertEquals("2.3.4", identity.softwareVersionString());
        assertEquals(6, identity.hardwareVersion());
        assertEquals("6.1.0-arch", identity.hardwareVersionString());
    }

    @Test
    void reset_generatesNewSerialNumberNextTime() {
        String serial = identities.create("lights", ROOT).serialNumber();

        identities.reset("lights");

        assertTrue(identities.storedSerialNumber("lights").isEmpty());
        assertNotEquals(serial, identities.create("lights", ROOT).serialNumber());
    }

    @Test
    void importFrom_usesTheDeviceSerialAndTruncatesText() {
        String longName = "A very long accessory name that does not fit";
        BridgedDevice device = new BridgedDevice(longName, DeviceTypes.ON_OFF_LIGHT,
                BasicInformation.of(longName, "SN-42", 0xfff2, "Vendor", 0x0010, null));

        CommissioningIdentity identity = identities.importFrom("accessory", device);

        assertEquals("SN-42", identity.serialNumber());
        assertEquals(BasicInformation.MAX_TEXT_LENGTH, identity.deviceName().length());
        assertEquals(longName.substring(0, BasicInformation.MAX_TEXT_LENGTH), identity.productName());
        assertEquals(DeviceTypes.ON_OFF_LIGHT, identity.deviceType());
    }

    @Test
    void ensureAggregatorIdentity_isStable() {
        AggregatorIdentity first = identities.ensureAggregatorIdentity("root");
        AggregatorIdentity second = identities.ensureAggregatorIdentity("root");

        assertTrue(first.serialNumber().startsWith("AG"));
        assertEquals(first, second);
    }

    @Test
    void savePairingCodes_writesBothCodes() {
        identities.savePairingCodes("root", new PairingCodes("MT:Y.K90", "3497-011-2332", 20202021, 3840));

        assertEquals("MT:Y.K90", identities.context("root").get("qrPairingCode", String.class, null));
        assertEquals("3497-011-2332", identities.context("root").get("manualPairingCode", String.class, null));
    }

    @Test
    void closedStore_isFatal() {
        store.close();

        PersistenceFatalException e = assertThrows(PersistenceFatalException.class,
                () -> identities.create("root", ROOT));
        assertEquals("root", e.getIdentityKey());
        assertThrows(PersistenceFatalException.class, () -> identities.storedSerialNumber("root"));
    }

    @Test
    void majorOf_fallsBackToOne() {
        assertEquals(1, CommissioningContextManager.majorOf(null));
        assertEquals(1, CommissioningContextManager.majorOf("beta"));
        assertEquals(17, CommissioningContextManager.majorOf("17.0.2"));
    }
}
