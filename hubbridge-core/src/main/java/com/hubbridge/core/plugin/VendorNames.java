package com.hubbridge.core.plugin;

import java.util.Map;

/** Names of well-known controller vendors, shown next to fabric information. */
public final class VendorNames {

    private static final Map<Integer, String> NAMES = Map.of(
            4937, "AppleHome",
            4996, "AppleKeyChain",
            4362, "SmartThings",
            4939, "HomeAssistant",
            24582, "GoogleHome",
            4631, "Alexa",
            4701, "Tuya",
            4742, "eWeLink",
            65521, "PythonMatterServer");

    private VendorNames() {
    }

    public static String of(int vendorId) {
        String name = NAMES.get(vendorId);
        return name != null ? "(" + name + ")" : "(unknown)";
    }
}
