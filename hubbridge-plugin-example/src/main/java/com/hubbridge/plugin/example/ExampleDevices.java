package com.hubbridge.plugin.example;

import com.hubbridge.device.BasicInformation;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.device.DeviceTypes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Device builders shared by the example platforms.
 */
public final class ExampleDevices {

    public static final int VENDOR_ID = 0xfff1;
    public static final String VENDOR_NAME = "HubBridge examples";

    public static final String ON_OFF = "OnOff";
    public static final String LEVEL_CONTROL = "LevelControl";
    public static final String ON_OFF_ATTRIBUTE = "onOff";
    public static final String CURRENT_LEVEL = "currentLevel";
    public static final int MAX_LEVEL = 254;

    private ExampleDevices() {
    }

    /** A light with an OnOff cluster, and a LevelControl cluster when dimmable. Starts off. */
    public static BridgedDevice light(String pluginName, int index, boolean dimmable) {
        String name = "Light " + index;
        BridgedDevice device = new BridgedDevice(name,
                dimmable ? DeviceTypes.DIMMABLE_LIGHT : DeviceTypes.ON_OFF_LIGHT,
                BasicInformation.of(name, serial(pluginName, index), VENDOR_ID, VENDOR_NAME,
                        dimmable ? 0x8001 : 0x8000, dimmable ? "Example dimmable light" : "Example light"));
        device.addClusterServer(ON_OFF, Map.of(ON_OFF_ATTRIBUTE, false));
        if (dimmable) {
            Map<String, Object> level = new LinkedHashMap<>();
            level.put(CURRENT_LEVEL, 0);
            level.put("minLevel", 1);
            level.put("maxLevel", MAX_LEVEL);
            device.addClusterServer(LEVEL_CONTROL, level);
        }
        return device;
    }

    /** A plug-in unit with an OnOff cluster. */
    public static BridgedDevice plug(String pluginName, String deviceName) {
        BridgedDevice device = new BridgedDevice(deviceName, DeviceTypes.ON_OFF_PLUG_IN_UNIT,
                BasicInformation.of(deviceName, serial(pluginName, 1), VENDOR_ID, VENDOR_NAME, 0x8002, "Example plug"));
        device.addClusterServer(ON_OFF, Map.of(ON_OFF_ATTRIBUTE, false));
        return device;
    }

    static String serial(String pluginName, int index) {
        return String.format("EX-%s-%03d", pluginName, index);
    }
}
