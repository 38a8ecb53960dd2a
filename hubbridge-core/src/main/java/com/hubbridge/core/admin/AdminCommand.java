package com.hubbridge.core.admin;

import java.util.Locale;

/**
 * Command verbs of the administration surface.
 */
public enum AdminCommand {
    ADD_PLUGIN("addplugin", true),
    REMOVE_PLUGIN("removeplugin", true),
    ENABLE_PLUGIN("enableplugin", true),
    DISABLE_PLUGIN("disableplugin", true),
    SAVE_CONFIG("saveconfig", true),
    INSTALL_PLUGIN("installplugin", true),
    SHUTDOWN("shutdown", false),
    RESTART("restart", false),
    UPDATE("update", false),
    RESET("reset", false),
    FACTORY_RESET("factoryreset", false),
    UNREGISTER("unregister", false);

    private final String verb;
    private final boolean requiresParameter;

    AdminCommand(String verb, boolean requiresParameter) {
        this.verb = verb;
        this.requiresParameter = requiresParameter;
    }

    public String getVerb() {
        return verb;
    }

    /** Whether the verb needs a plugin name or package parameter. */
    public boolean requiresParameter() {
        return requiresParameter;
    }

    /**
     * @throws IllegalArgumentException for an unknown verb
     */
    public static AdminCommand fromVerb(String verb) {
        if (verb != null) {
            String normalized = verb.trim().toLowerCase(Locale.ROOT);
            for (AdminCommand command : values()) {
                if (command.verb.equals(normalized)) return command;
            }
        }
        throw new IllegalArgumentException("Unknown command: " + verb);
    }
}
