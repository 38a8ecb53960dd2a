package com.hubbridge.protocol.local;

import com.hubbridge.device.BasicInformation;
import com.hubbridge.protocol.Aggregator;
import com.hubbridge.protocol.CommissioningServer;
import com.hubbridge.protocol.CommissioningServerOptions;
import com.hubbridge.protocol.ProtocolEngine;
import com.hubbridge.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Protocol engine that keeps every server in the JVM. Ports are recorded but never bound, so
 * the whole lifecycle can run without a network stack.
 */
public final class LocalProtocolEngine implements ProtocolEngine {

    private static final Logger log = LoggerFactory.getLogger(LocalProtocolEngine.class);

    private final PairingCodeGenerator codes = new PairingCodeGenerator();
    private final List<LocalCommissioningServer> servers = new CopyOnWriteArrayList<>();
    private volatile boolean started;
    private volatile boolean closed;
    private volatile String controllerContext;

    @Override
    public LocalCommissioningServer createCommissioningServer(CommissioningServerOptions options) {
        if (closed) {
            throw new ProtocolException("Protocol engine is closed");
        }
        for (LocalCommissioningServer existing : servers) {
            if (existing.getPort() == options.port()) {
                throw new ProtocolException("Port " + options.port() + " already used by " + existing.getName());
            }
        }
        var info = options.basicInformation();
        LocalCommissioningServer server = new LocalCommissioningServer(options,
                codes.generate(info.vendorId(), info.productId(), options.passcode(), options.discriminator()));
        servers.add(server);
        if (started) {
            server.start();
        }
        log.debug("Created commissioning server {} on port {}", options.name(), options.port());
        return server;
    }

    @Override
    public Aggregator createAggregator(String name, BasicInformation basicInformation) {
        return new LocalAggregator(name, basicInformation);
    }

    @Override
    public List<CommissioningServer> getCommissioningServers() {
        return new ArrayList<>(servers);
    }

    @Override
    public void startController(String contextName) {
        this.controllerContext = contextName;
        start();
        log.info("Controller started with context {}", contextName);
    }

    public String getControllerContext() {
        return controllerContext;
    }

    @Override
    public void start() {
        if (closed) {
            throw new ProtocolException("Protocol engine is closed");
        }
        for (LocalCommissioningServer server : servers) {
            if (!server.isStarted()) server.start();
        }
        started = true;
        log.info("Protocol engine started with {} commissioning server(s)", servers.size());
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public void close() {
        for (LocalCommissioningServer server : servers) {
            server.close();
        }
        started = false;
        closed = true;
        log.info("Protocol engine closed");
    }

    public boolean isClosed() {
        return closed;
    }
}
