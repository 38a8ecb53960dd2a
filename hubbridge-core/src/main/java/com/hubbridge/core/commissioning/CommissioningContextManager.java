package com.hubbridge.core.commissioning;

import com.hubbridge.device.BasicInformation;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.protocol.PairingCodes;
import com.hubbridge.storage.StorageContext;
import com.hubbridge.storage.StorageException;
import com.hubbridge.storage.StorageManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Creates and imports commissioning identities in the identity store, one context per identity key
 * (plugin name, or {@value #ROOT_KEY} for the shared identity).
 * <p>
 * Serial number and unique id are read with a fallback: the fallback is persisted the first time and every later
 * call reads the stored value back, so a paired controller still recognises the node after a restart.
 * Any failure to reach the store is a {@link PersistenceFatalException}.
 */
public final class CommissioningContextManager {

    private static final Logger log = LoggerFactory.getLogger(CommissioningContextManager.class);

    public static final String ROOT_KEY = "root";

    static final String DEVICE_NAME = "deviceName";
    static final String DEVICE_TYPE = "deviceType";
    static final String VENDOR_ID = "vendorId";
    static final String VENDOR_NAME = "vendorName";
    static final String PRODUCT_ID = "productId";
    static final String PRODUCT_NAME = "productName";
    static final String NODE_LABEL = "nodeLabel";
    static final String PRODUCT_LABEL = "productLabel";
    static final String SERIAL_NUMBER = "serialNumber";
    static final String UNIQUE_ID = "uniqueId";
    static final String SOFTWARE_VERSION = "softwareVersion";
    static final String SOFTWARE_VERSION_STRING = "softwareVersionString";
    static final String HARDWARE_VERSION = "hardwareVersion";
    static final String HARDWARE_VERSION_STRING = "hardwareVersionString";
    static final String AGGREGATOR_SERIAL_NUMBER = "aggregatorSerialNumber";
    static final String AGGREGATOR_UNIQUE_ID = "aggregatorUniqueId";
    static final String QR_PAIRING_CODE = "qrPairingCode";
    static final String MANUAL_PAIRING_CODE = "manualPairingCode";

    private final Supplier<StorageManager> store;
    private final String bridgeVersion;
    private final String osVersion;
    private final Supplier<String> randomHex;

    public CommissioningContextManager(Supplier<StorageManager> store, String bridgeVersion) {
        this(store, bridgeVersion, System.getProperty("os.version"), CommissioningContextManager::randomHex);
    }

    CommissioningContextManager(Supplier<StorageManager> store, String bridgeVersion, String osVersion,
                                Supplier<String> randomHex) {
        this.store = Objects.requireNonNull(store, "store");
        this.bridgeVersion = bridgeVersion;
        this.osVersion = osVersion;
        this.randomHex = Objects.requireNonNull(randomHex, "randomHex");
    }

    /** Identity for something the bridge owns: the shared root or a per-plugin aggregator. */
    public CommissioningIdentity create(String key, DeclaredAttributes attributes) {
        Objects.requireNonNull(attributes, "attributes");
        return persist(key, attributes.deviceName(), attributes.deviceType(), attributes.vendorId(),
                attributes.vendorName(), attributes.productId(), attributes.productName(),
                "CS" + randomHex.get(), "CS" + randomHex.get());
    }

    /** Identity derived from a device's own basic information (accessory platforms in childbridge mode). */
    public CommissioningIdentity importFrom(String key, BridgedDevice device) {
        Objects.requireNonNull(device, "device");
        BasicInformation info = device.getBasicInformation();
        return persist(key, device.getDeviceName(), device.getDeviceType(), info.vendorId(), info.vendorName(),
                info.productId(), info.productName() != null ? info.productName() : device.getDeviceName(),
                info.serialNumber() != null ? info.serialNumber() : "CS" + randomHex.get(),
                info.uniqueId() != null ? info.uniqueId() : "CS" + randomHex.get());
    }

    private CommissioningIdentity persist(String key, String deviceName, int deviceType, int vendorId,
                                          String vendorName, int productId, String productName,
                                          String fallbackSerial, String fallbackUniqueId) {
        StorageContext context = context(key);
        try {
            String name = BasicInformation.truncate(deviceName);
            String vendor = BasicInformation.truncate(vendorName);
            String product = BasicInformation.truncate(productName);
            context.set(DEVICE_NAME, name);
            context.set(DEVICE_TYPE, deviceType);
            context.set(VENDOR_ID, vendorId);
            context.set(VENDOR_NAME, vendor);
            context.set(PRODUCT_ID, productId);
            context.set(PRODUCT_NAME, product);
            context.set(NODE_LABEL, product);
            context.set(PRODUCT_LABEL, product);

            String serial = readOrMaterialize(context, SERIAL_NUMBER, BasicInformation.truncate(fallbackSerial));
            String uniqueId = readOrMaterialize(context, UNIQUE_ID, BasicInformation.truncate(fallbackUniqueId));

            int softwareVersion = majorOf(bridgeVersion);
            String softwareVersionString = bridgeVersion != null ? bridgeVersion : "1.0.0";
            int hardwareVersion = majorOf(osVersion);
            String hardwareVersionString = osVersion != null ? osVersion : "1.0.0";
            context.set(SOFTWARE_VERSION, softwareVersion);
            context.set(SOFTWARE_VERSION_STRING, softwareVersionString);
            context.set(HARDWARE_VERSION, hardwareVersion);
            context.set(HARDWARE_VERSION_STRING, hardwareVersionString);

            log.debug("Commissioning identity {}: {} serial {} uniqueId {}", key, name, serial, uniqueId);
            return new CommissioningIdentity(key, name, deviceType, vendorId, vendor, productId, product,
                    serial, uniqueId, softwareVersion, softwareVersionString, hardwareVersion, hardwareVersionString);
        } catch (StorageException e) {
            throw new PersistenceFatalException(key, "Cannot write commissioning identity " + key, e);
        }
    }

    /** Stable serial number and unique id for the aggregator endpoint of an identity. */
    public AggregatorIdentity ensureAggregatorIdentity(String key) {
        StorageContext context = context(key);
        try {
            return new AggregatorIdentity(
                    readOrMaterialize(context, AGGREGATOR_SERIAL_NUMBER, "AG" + randomHex.get()),
                    readOrMaterialize(context, AGGREGATOR_UNIQUE_ID, "AG" + randomHex.get()));
        } catch (StorageException e) {
            throw new PersistenceFatalException(key, "Cannot write aggregator identity " + key, e);
        }
    }

    public void savePairingCodes(String key, PairingCodes codes) {
        StorageContext context = context(key);
        try {
            context.set(QR_PAIRING_CODE, codes.qrPairingCode());
            context.set(MANUAL_PAIRING_CODE, codes.manualPairingCode());
        } catch (StorageException e) {
            throw new PersistenceFatalException(key, "Cannot write pairing codes of " + key, e);
        }
    }

    /** Stored serial number of an identity, if it was ever created. */
    public Optional<String> storedSerialNumber(String key) {
        try {
            return Optional.ofNullable(context(key).get(SERIAL_NUMBER, String.class, null));
        } catch (StorageException e) {
            throw new PersistenceFatalException(key, "Cannot read commissioning identity " + key, e);
        }
    }

    /** Forgets an identity: the next creation generates new serial number and unique id. */
    public void reset(String key) {
        try {
            context(key).clearAll();
            log.info("Commissioning identity {} cleared", key);
        } catch (StorageException e) {
            throw new PersistenceFatalException(key, "Cannot clear commissioning identity " + key, e);
        }
    }

    /** The identity's storage context. */
    public StorageContext context(String key) {
        Objects.requireNonNull(key, "key");
        StorageManager manager = store.get();
        if (manager == null || manager.isClosed()) {
            throw new PersistenceFatalException(key, "No identity store available", null);
        }
        try {
            return manager.createContext(key);
        } catch (StorageException e) {
            throw new PersistenceFatalException(key, "Cannot open identity context " + key, e);
        }
    }

    private static String readOrMaterialize(StorageContext context, String field, String fallback) {
        String stored = context.get(field, String.class, null);
        if (stored != null) {
            return stored;
        }
        context.set(field, fallback);
        return fallback;
    }

    static int majorOf(String version) {
        if (version == null) return 1;
        String digits = version.trim().split("[^0-9]", 2)[0];
        if (digits.isEmpty()) return 1;
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static String randomHex() {
        byte[] bytes = new byte[8];
        new SecureRandom().nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
