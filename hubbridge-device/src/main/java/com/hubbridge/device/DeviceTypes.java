package com.hubbridge.device;

import java.util.Map;

/** Device type identifiers used by the bridge and the bundled platforms. */
public final class DeviceTypes {

    public static final int ROOT_NODE = 0x0016;
    public static final int AGGREGATOR = 0x000e;
    public static final int BRIDGED_NODE = 0x0013;
    public static final int ON_OFF_LIGHT = 0x0100;
    public static final int DIMMABLE_LIGHT = 0x0101;
    public static final int ON_OFF_PLUG_IN_UNIT = 0x010a;
    public static final int CONTACT_SENSOR = 0x0015;
    public static final int TEMPERATURE_SENSOR = 0x0302;
    public static final int WINDOW_COVERING = 0x0202;
    public static final int CONTROLLER = 0x000a;

    private static final Map<Integer, String> NAMES = Map.of(
            ROOT_NODE, "MA-rootnode",
            AGGREGATOR, "MA-aggregator",
            BRIDGED_NODE, "MA-bridgedevice",
            ON_OFF_LIGHT, "MA-onofflight",
            DIMMABLE_LIGHT, "MA-dimmablelight",
            ON_OFF_PLUG_IN_UNIT, "MA-onoffpluginunit",
            CONTACT_SENSOR, "MA-contactsensor",
            TEMPERATURE_SENSOR, "MA-tempsensor",
            WINDOW_COVERING, "MA-windowcovering",
            CONTROLLER, "MA-controller");

    private DeviceTypes() {
    }

    /** Display name for a device type, or the hex code when it is not a known one. */
    public static String name(int deviceType) {
        String name = NAMES.get(deviceType);
        return name != null ? name : String.format("0x%04x", deviceType);
    }
}
