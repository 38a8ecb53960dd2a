package com.hubbridge.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.hubbridge.core.HubBridge;
import com.hubbridge.core.admin.SystemInformation;
import com.hubbridge.core.plugin.RegisteredPlugin;
import com.hubbridge.core.shutdown.ShutdownAction;
import com.hubbridge.core.shutdown.ShutdownRequest;
import com.hubbridge.device.SerializedDevice;
import com.hubbridge.storage.StorageContext;
import com.hubbridge.storage.StorageManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Runs a {@link MaintenanceTask} on the bridge thread of an initialized bridge, then shuts the bridge down.
 * Listings go to the command's output; failures are logged and still end with a shutdown.
 */
final class MaintenanceRunner {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceRunner.class);

    private final HubBridge bridge;
    private final PrintWriter out;

    MaintenanceRunner(HubBridge bridge, PrintWriter out) {
        this.bridge = bridge;
        this.out = out;
    }

    /** Completes after the bridge published its completion event. */
    CompletableFuture<Void> run(MaintenanceTask task) {
        CompletableFuture<ShutdownRequest> performed = CompletableFuture
                .supplyAsync(() -> perform(task), bridge.getScheduler())
                .thenCompose(Function.identity())
                .exceptionally(e -> {
                    log.error("{} failed: {}", task.kind(), rootMessage(e));
                    return ShutdownRequest.of(ShutdownAction.SHUTDOWN);
                });
        return performed.thenCompose(bridge::shutdown);
    }

    private CompletableFuture<ShutdownRequest> perform(MaintenanceTask task) {
        String argument = task.argument();
        switch (task.kind()) {
            case LIST -> listPluginsAndDevices();
            case LOG_STORAGE -> {
                printStore("Node storage", bridge.getNodeStorage());
                printStore("Identity store", bridge.getIdentityStore());
            }
            case LOG_INTERFACES -> printInterfaces();
            case ADD -> {
                return bridge.addPlugin(argument).thenApply(p -> {
                    out.println("Added plugin " + p.getName() + " from " + p.getPath());
                    return shutdownRequest();
                });
            }
            case REMOVE -> {
                return bridge.removePlugin(argument).thenApply(v -> shutdownRequest());
            }
            case ENABLE -> {
                return bridge.enablePlugin(argument).thenApply(v -> shutdownRequest());
            }
            case DISABLE -> {
                return bridge.disablePlugin(argument).thenApply(v -> shutdownRequest());
            }
            case RESET_PLUGIN -> {
                return bridge.resetPluginIdentity(argument).thenApply(v -> shutdownRequest());
            }
            case RESET -> {
                return CompletableFuture.completedFuture(ShutdownRequest.of(ShutdownAction.RESET));
            }
            case FACTORY_RESET -> {
                return CompletableFuture.completedFuture(ShutdownRequest.of(ShutdownAction.FACTORY_RESET));
            }
        }
        return CompletableFuture.completedFuture(shutdownRequest());
    }

    private void listPluginsAndDevices() {
        List<RegisteredPlugin> plugins = bridge.getPluginRegistry().all();
        out.println("Registered plugins (" + plugins.size() + "):");
        for (RegisteredPlugin plugin : plugins) {
            out.printf("  %s %s %s %s%n", plugin.getName(), orDash(plugin.getVersion()),
                    plugin.isEnabled() ? "enabled" : "disabled", orDash(plugin.getPath()));
        }
        List<SerializedDevice> devices = bridge.storedDevices();
        out.println("Registered devices (" + devices.size() + "):");
        for (SerializedDevice device : devices) {
            out.printf("  %s %s %s %s%n", device.pluginName(), device.deviceName(), orDash(device.serialNumber()),
                    device.endpoint() != null ? "endpoint " + device.endpoint() : "-");
        }
        out.flush();
    }

    private void printStore(String title, StorageManager store) {
        if (store == null) {
            out.println(title + ": not open");
            return;
        }
        out.println(title + " " + store.describe() + ":");
        for (String name : store.contextNames()) {
            StorageContext context = store.createContext(name);
            out.println("  [" + name + "]");
            for (String key : context.keys()) {
                out.println("    " + key + " = " + context.get(key, JsonNode.class, null));
            }
        }
        out.flush();
    }

    private void printInterfaces() {
        List<SystemInformation.NetworkAddress> addresses = SystemInformation.networkAddresses();
        out.println("Network interfaces (" + addresses.size() + " address(es)):");
        for (SystemInformation.NetworkAddress address : addresses) {
            out.printf("  %s %s %s %s%n", address.interfaceName(), address.ipv6() ? "IPv6" : "IPv4",
                    address.address(), orDash(address.macAddress()));
        }
        String selected = bridge.getConfig().getMdnsInterface();
        out.println("Selected mDNS interface: " + (selected != null ? selected : "all"));
        out.flush();
    }

    private static ShutdownRequest shutdownRequest() {
        return ShutdownRequest.of(ShutdownAction.SHUTDOWN);
    }

    private static String orDash(String value) {
        return value != null ? value : "-";
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage();
    }
}
