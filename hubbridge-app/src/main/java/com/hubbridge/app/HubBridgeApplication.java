package com.hubbridge.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.time.Duration;

/**
 * HubBridge process entry point. Parses the command line, then runs {@link BridgeProcess} until its final
 * {@code Shutdown}. SIGINT and SIGTERM are routed to the running bridge by a shutdown hook
 * that waits up to {@value #SHUTDOWN_GRACE_SECONDS} s for the cleanup.
 */
public final class HubBridgeApplication {

    private static final Logger log = LoggerFactory.getLogger(HubBridgeApplication.class);
    private static final int SHUTDOWN_GRACE_SECONDS = 30;

    private HubBridgeApplication() {
    }

    public static void main(String[] args) {
        ShutdownHookSignals signals = new ShutdownHookSignals(Duration.ofSeconds(SHUTDOWN_GRACE_SECONDS));
        CommandLine commandLine = new CommandLine(new HubBridgeCommand((config, task) -> {
            PrintWriter out = new PrintWriter(System.out, true);
            return new BridgeProcess(config, signals, out).run(task);
        }));
        int exitCode = commandLine.execute(args);
        if (signals.isFired()) {
            // exiting from the shutdown hook already; System.exit would block
            log.info("HubBridge stopped by signal");
            return;
        }
        log.info("HubBridge exiting with code {}", exitCode);
        System.exit(exitCode);
    }
}
