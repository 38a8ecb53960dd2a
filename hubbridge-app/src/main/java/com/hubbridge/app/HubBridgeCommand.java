package com.hubbridge.app;

import com.hubbridge.config.BridgeConfig;
import com.hubbridge.config.BridgeMode;
import com.hubbridge.config.RestartMode;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command line of the HubBridge process. Options override the environment configuration
 * ({@link BridgeConfig#fromEnvironment()}); the maintenance options run once and exit.
 */
@Command(name = "hubbridge", mixinStandardHelpOptions = true, versionProvider = HubBridgeCommand.VersionProvider.class,
        description = "Hosts device plugins and exposes their devices to home automation controllers")
public class HubBridgeCommand implements Callable<Integer> {

    /** Runs the process for a configuration and an optional maintenance task, returning the exit code. */
    @FunctionalInterface
    public interface Launcher {
        int launch(BridgeConfig config, MaintenanceTask task);
    }

    @ArgGroup(exclusive = true)
    ModeOptions mode;

    @ArgGroup(exclusive = true)
    RestartOptions restart;

    @ArgGroup(exclusive = true)
    MaintenanceOptions maintenance;

    @Option(names = "--port", paramLabel = "<port>", description = "First commissioning server port")
    Integer port;

    @Option(names = "--passcode", paramLabel = "<passcode>", description = "Commissioning passcode")
    Integer passcode;

    @Option(names = "--discriminator", paramLabel = "<discriminator>", description = "Commissioning discriminator")
    Integer discriminator;

    @Option(names = "--mdnsinterface", paramLabel = "<name>", description = "Network interface used for mDNS")
    String mdnsInterface;

    @Option(names = "--frontend", paramLabel = "<port>", description = "Administration frontend port")
    Integer frontendPort;

    @Option(names = "--debug", description = "Debug logging for HubBridge")
    boolean debug;

    private final Launcher launcher;

    public HubBridgeCommand(Launcher launcher) {
        this.launcher = launcher;
    }

    static class ModeOptions {
        @Option(names = "--bridge", required = true, description = "All plugins share one aggregator (default)")
        boolean bridge;

        @Option(names = "--childbridge", required = true, description = "Each plugin gets its own commissioning server")
        boolean childbridge;

        @Option(names = "--controller", required = true, description = "Run as a controller")
        boolean controller;

        BridgeMode toMode() {
            if (childbridge) return BridgeMode.CHILDBRIDGE;
            if (controller) return BridgeMode.CONTROLLER;
            return BridgeMode.BRIDGE;
        }
    }

    static class RestartOptions {
        @Option(names = "--service", required = true, description = "Supervised by a system service")
        boolean service;

        @Option(names = "--docker", required = true, description = "Running in a container")
        boolean docker;

        RestartMode toRestartMode() {
            return service ? RestartMode.SERVICE : RestartMode.DOCKER;
        }
    }

    static class MaintenanceOptions {
        @Option(names = "--list", required = true, description = "List registered plugins and devices")
        boolean list;

        @Option(names = "--logstorage", required = true, description = "Print the node storage and identity store")
        boolean logStorage;

        @Option(names = "--loginterfaces", required = true, description = "Print the network interfaces")
        boolean logInterfaces;

        @Option(names = "--add", required = true, paramLabel = "<path|name>", description = "Register a plugin")
        String add;

        @Option(names = "--remove", required = true, paramLabel = "<name>", description = "Unregister a plugin")
        String remove;

        @Option(names = "--enable", required = true, paramLabel = "<name>", description = "Enable a plugin")
        String enable;

        @Option(names = "--disable", required = true, paramLabel = "<name>", description = "Disable a plugin")
        String disable;

        @Option(names = "--reset", required = true, arity = "0..1", fallbackValue = "", paramLabel = "<plugin>",
                description = "Reset commissioning of HubBridge, or of one plugin in childbridge mode")
        String reset;

        @Option(names = "--factoryreset", required = true, description = "Delete all stored state")
        boolean factoryReset;

        MaintenanceTask toTask() {
            if (list) return MaintenanceTask.of(MaintenanceTask.Kind.LIST);
            if (logStorage) return MaintenanceTask.of(MaintenanceTask.Kind.LOG_STORAGE);
            if (logInterfaces) return MaintenanceTask.of(MaintenanceTask.Kind.LOG_INTERFACES);
            if (add != null) return new MaintenanceTask(MaintenanceTask.Kind.ADD, add);
            if (remove != null) return new MaintenanceTask(MaintenanceTask.Kind.REMOVE, remove);
            if (enable != null) return new MaintenanceTask(MaintenanceTask.Kind.ENABLE, enable);
            if (disable != null) return new MaintenanceTask(MaintenanceTask.Kind.DISABLE, disable);
            if (reset != null) {
                return reset.isBlank()
                        ? MaintenanceTask.of(MaintenanceTask.Kind.RESET)
                        : new MaintenanceTask(MaintenanceTask.Kind.RESET_PLUGIN, reset);
            }
            return MaintenanceTask.of(MaintenanceTask.Kind.FACTORY_RESET);
        }
    }

    @Override
    public Integer call() {
        BridgeConfig config = toConfig(BridgeConfig.fromEnvironment());
        if (config.isDebug()) {
            LogLevels.enableDebug();
        }
        return launcher.launch(config, maintenanceTask().orElse(null));
    }

    /** Applies the given options on top of {@code base}. */
    BridgeConfig toConfig(BridgeConfig base) {
        BridgeConfig.Builder builder = base.toBuilder();
        if (mode != null) builder.mode(mode.toMode());
        if (restart != null) builder.restartMode(restart.toRestartMode());
        if (port != null) builder.port(port);
        if (passcode != null) builder.passcode(passcode);
        if (discriminator != null) builder.discriminator(discriminator);
        if (mdnsInterface != null) builder.mdnsInterface(mdnsInterface);
        if (frontendPort != null) builder.frontendPort(frontendPort);
        if (debug) builder.debug(true);
        return builder.build();
    }

    Optional<MaintenanceTask> maintenanceTask() {
        return maintenance != null ? Optional.of(maintenance.toTask()) : Optional.empty();
    }

    static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = HubBridgeCommand.class.getPackage().getImplementationVersion();
            return new String[]{"HubBridge " + (version != null ? version : BridgeConfig.DEFAULT_VERSION)};
        }
    }
}
