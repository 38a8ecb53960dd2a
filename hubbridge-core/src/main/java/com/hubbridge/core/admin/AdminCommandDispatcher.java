package com.hubbridge.core.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.hubbridge.core.HubBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Maps administration commands to bridge operations, which run on the bridge thread. The returned future completes
 * when the operation finished (for shutdown verbs: when cleanup completed); a rejected command completes it
 * exceptionally.
 */
public final class AdminCommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AdminCommandDispatcher.class);

    private final HubBridge bridge;

    public AdminCommandDispatcher(HubBridge bridge) {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
    }

    public CompletableFuture<Void> dispatch(String verb, String parameter, JsonNode body) {
        AdminCommand command;
        try {
            command = AdminCommand.fromVerb(verb);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected admin command {}", verb);
            return CompletableFuture.failedFuture(e);
        }
        return dispatch(command, parameter, body);
    }

    public CompletableFuture<Void> dispatch(AdminCommand command, String parameter, JsonNode body) {
        Objects.requireNonNull(command, "command");
        if (command.requiresParameter() && (parameter == null || parameter.isBlank())) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Command " + command.getVerb() + " needs a parameter"));
        }
        log.debug("Received admin command {}:{}", command.getVerb(), parameter);
        CompletableFuture<Void> result;
        try {
            result = switch (command) {
                case ADD_PLUGIN -> bridge.addPlugin(parameter).thenApply(p -> (Void) null);
                case REMOVE_PLUGIN -> bridge.removePlugin(parameter);
                case ENABLE_PLUGIN -> bridge.enablePlugin(parameter);
                case DISABLE_PLUGIN -> bridge.disablePlugin(parameter);
                case SAVE_CONFIG -> bridge.savePluginConfig(parameter, body);
                case INSTALL_PLUGIN -> bridge.installPlugin(parameter);
                case SHUTDOWN -> bridge.shutdown();
                case RESTART -> bridge.restart();
                case UPDATE -> bridge.update();
                case RESET -> bridge.reset();
                case FACTORY_RESET -> bridge.factoryReset();
                case UNREGISTER -> bridge.unregisterAndShutdown();
            };
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.whenComplete((v, e) -> {
            if (e != null) {
                log.error("Admin command {} failed: {}", command.getVerb(), rootMessage(e));
            }
        });
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
