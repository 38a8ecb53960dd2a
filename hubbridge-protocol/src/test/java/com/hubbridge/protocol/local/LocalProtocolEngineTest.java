package com.hubbridge.protocol.local;

import com.hubbridge.device.BasicInformation;
import com.hubbridge.device.BridgedDevice;
import com.hubbridge.device.DeviceTypes;
import com.hubbridge.protocol.Aggregator;
import com.hubbridge.protocol.CommissioningListener;
import com.hubbridge.protocol.CommissioningServer;
import com.hubbridge.protocol.CommissioningServerOptions;
import com.hubbridge.protocol.FabricInfo;
import com.hubbridge.protocol.ProtocolException;
import com.hubbridge.protocol.SessionInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalProtocolEngineTest {

    private static final BasicInformation INFO =
            BasicInformation.of("HubBridge", "CS01", 0xfff1, "HubBridge", 0x8000, "HubBridge aggregator");

    private static CommissioningServerOptions options(int port) {
        return new CommissioningServerOptions("server-" + port, port, 20202021, 3840, DeviceTypes.AGGREGATOR, INFO);
    }

    @Test
    void start_startsServersCreatedBeforeAndAfter() {
        LocalProtocolEngine engine = new LocalProtocolEngine();
        CommissioningServer before = engine.createCommissioningServer(options(5540));
        engine.start();
        CommissioningServer after = engine.createCommissioningServer(options(5541));

        assertTrue(before.isStarted());
        assertTrue(after.isStarted());
    }

    @Test
    void createCommissioningServer_rejectsDuplicatePort() {
        LocalProtocolEngine engine = new LocalProtocolEngine();
        engine.createCommissioningServer(options(5540));

        assertThrows(ProtocolException.class, () -> engine.createCommissioningServer(options(5540)));
    }

    @Test
    void aggregator_numbersAndReleasesDevices() {
        LocalProtocolEngine engine = new LocalProtocolEngine();
        CommissioningServer server = engine.createCommissioningServer(options(5540));
        Aggregator aggregator = engine.createAggregator("agg", INFO);
        server.addEndpoint(aggregator);
        BridgedDevice device = new BridgedDevice("lamp", DeviceTypes.ON_OFF_LIGHT, INFO);

        aggregator.addBridgedDevice(device);
        assertEquals(1, aggregator.getEndpointNumber());
        assertEquals(2, device.getEndpointNumber());

        aggregator.removeBridgedDevice(device);
        assertNull(device.getEndpointNumber());
        assertTrue(aggregator.getBridgedDevices().isEmpty());
    }

    @Test
    void setReachability_propagatesToDevices() {
        LocalProtocolEngine engine = new LocalProtocolEngine();
        CommissioningServer server = engine.createCommissioningServer(options(5540));
        Aggregator aggregator = engine.createAggregator("agg", INFO);
        server.addEndpoint(aggregator);
        BridgedDevice device = new BridgedDevice("lamp", DeviceTypes.ON_OFF_LIGHT, INFO);
        aggregator.addBridgedDevice(device);

        server.setReachability(false);

        assertFalse(aggregator.isReachable());
        assertFalse(device.isReachable());
    }

    @Test
    void simulatedController_firesListenerCallbacks() {
        LocalProtocolEngine engine = new LocalProtocolEngine();
        LocalCommissioningServer server = engine.createCommissioningServer(options(5540));
        List<String> calls = new ArrayList<>();
        server.setCommissioningListener(new CommissioningListener() {
            @Override
            public void onActiveSessionsChanged(CommissioningServer s, int fabricIndex, List<SessionInfo> sessions) {
                calls.add("sessions:" + fabricIndex + ":" + sessions.size());
            }

            @Override
            public void onCommissioningChanged(CommissioningServer s, int fabricIndex) {
                calls.add("fabric:" + fabricIndex + ":" + s.isCommissioned());
            }
        });

        server.commission(new FabricInfo(1, 10L, 20L, 30L, 4937, "home"));
        server.openSession(new SessionInfo("s1", 30L, 1, true, true, 2));
        server.removeFabric(1);

        assertEquals(List.of("fabric:1:true", "sessions:1:1", "fabric:1:false"), calls);
        assertTrue(server.getActiveSessions().isEmpty());
    }

    @Test
    void close_closesEveryServer() {
        LocalProtocolEngine engine = new LocalProtocolEngine();
        LocalCommissioningServer server = engine.createCommissioningServer(options(5540));
        engine.start();

        engine.close();

        assertTrue(server.isClosed());
        assertFalse(engine.isStarted());
        assertThrows(ProtocolException.class, () -> engine.createCommissioningServer(options(5541)));
    }
}
