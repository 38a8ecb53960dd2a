package com.hubbridge.protocol.local;

import com.hubbridge.device.Endpoint;
import com.hubbridge.protocol.CommissioningListener;
import com.hubbridge.protocol.CommissioningServer;
import com.hubbridge.protocol.CommissioningServerOptions;
import com.hubbridge.protocol.FabricInfo;
import com.hubbridge.protocol.PairingCodes;
import com.hubbridge.protocol.ProtocolException;
import com.hubbridge.protocol.SessionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process commissioning server. Controllers are simulated through {@link #commission(FabricInfo)},
 * {@link #openSession(SessionInfo)} and {@link #removeFabric(int)}, which fire the listener callbacks
 * a network engine would fire.
 */
public final class LocalCommissioningServer implements CommissioningServer {

    private static final Logger log = LoggerFactory.getLogger(LocalCommissioningServer.class);

    private final CommissioningServerOptions options;
    private final PairingCodes pairingCodes;
    private final List<Endpoint> endpoints = new CopyOnWriteArrayList<>();
    private final Map<Integer, FabricInfo> fabrics = new ConcurrentHashMap<>();
    private final Map<String, SessionInfo> sessions = new ConcurrentHashMap<>();
    private volatile CommissioningListener listener;
    private volatile boolean started;
    private volatile boolean closed;
    private volatile boolean reachable;
    private int nextEndpoint = 1;

    LocalCommissioningServer(CommissioningServerOptions options, PairingCodes pairingCodes) {
        this.options = Objects.requireNonNull(options, "options");
        this.pairingCodes = Objects.requireNonNull(pairingCodes, "pairingCodes");
    }

    public CommissioningServerOptions getOptions() {
        return options;
    }

    @Override
    public String getName() {
        return options.name();
    }

    @Override
    public int getPort() {
        return options.port();
    }

    @Override
    public synchronized void addEndpoint(Endpoint endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        if (closed) {
            throw new ProtocolException("Commissioning server " + getName() + " is closed");
        }
        if (endpoints.contains(endpoint)) return;
        endpoint.setEndpointNumber(nextEndpoint++);
        endpoints.add(endpoint);
    }

    @Override
    public synchronized void removeEndpoint(Endpoint endpoint) {
        if (endpoints.remove(endpoint)) {
            endpoint.setEndpointNumber(null);
        }
    }

    @Override
    public List<Endpoint> getEndpoints() {
        return new ArrayList<>(endpoints);
    }

    @Override
    public boolean isCommissioned() {
        return !fabrics.isEmpty();
    }

    @Override
    public PairingCodes getPairingCodes() {
        return pairingCodes;
    }

    @Override
    public List<FabricInfo> getCommissionedFabrics() {
        return new ArrayList<>(fabrics.values());
    }

    @Override
    public List<SessionInfo> getActiveSessions() {
        return sessions.values().stream().filter(SessionInfo::active).toList();
    }

    @Override
    public void setReachability(boolean reachable) {
        this.reachable = reachable;
        for (Endpoint endpoint : endpoints) {
            endpoint.setReachable(reachable);
        }
    }

    public boolean isReachable() {
        return reachable;
    }

    @Override
    public void factoryReset() {
        fabrics.clear();
        sessions.clear();
        log.info("Commissioning server {} factory reset", getName());
    }

    @Override
    public void setCommissioningListener(CommissioningListener listener) {
        this.listener = listener;
    }

    void start() {
        if (closed) {
            throw new ProtocolException("Commissioning server " + getName() + " is closed");
        }
        started = true;
        log.debug("Commissioning server {} listening on port {}", getName(), getPort());
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public void close() {
        started = false;
        closed = true;
        sessions.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    /** Adds a fabric as if a controller completed commissioning. */
    public void commission(FabricInfo fabric) {
        fabrics.put(fabric.fabricIndex(), fabric);
        CommissioningListener l = listener;
        if (l != null) l.onCommissioningChanged(this, fabric.fabricIndex());
    }

    /** Removes a fabric (and its sessions) as if the controller deleted the pairing. */
    public void removeFabric(int fabricIndex) {
        fabrics.remove(fabricIndex);
        sessions.values().removeIf(s -> s.fabricIndex() != null && s.fabricIndex() == fabricIndex);
        CommissioningListener l = listener;
        if (l != null) l.onCommissioningChanged(this, fabricIndex);
    }

    /** Registers or replaces a session and reports the sessions of its fabric. */
    public void openSession(SessionInfo session) {
        sessions.put(session.name(), session);
        fireSessionsChanged(session.fabricIndex());
    }

    public void closeSession(String name) {
        SessionInfo removed = sessions.remove(name);
        if (removed != null) fireSessionsChanged(removed.fabricIndex());
    }

    private void fireSessionsChanged(Integer fabricIndex) {
        CommissioningListener l = listener;
        if (l == null) return;
        int index = fabricIndex != null ? fabricIndex : 0;
        List<SessionInfo> ofFabric = sessions.values().stream()
                .filter(s -> Objects.equals(s.fabricIndex(), fabricIndex))
                .toList();
        l.onActiveSessionsChanged(this, index, ofFabric);
    }
}
