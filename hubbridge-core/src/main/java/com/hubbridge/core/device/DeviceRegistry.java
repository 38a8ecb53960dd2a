package com.hubbridge.core.device;

import com.hubbridge.device.BridgedDevice;
import com.hubbridge.device.SerializedDevice;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Set of (plugin, device) pairs currently exposed, in registration order.
 * A device instance can be registered once.
 */
public final class DeviceRegistry {

    public static final String DEVICES_KEY = "devices";

    private final List<RegisteredDevice> devices = new CopyOnWriteArrayList<>();

    /**
     * @throws IllegalArgumentException if the device is already registered
     */
    public void add(String pluginName, BridgedDevice device) {
        if (contains(device)) {
            throw new IllegalArgumentException("Device " + device.getDeviceName() + " is already registered");
        }
        devices.add(new RegisteredDevice(pluginName, device));
    }

    /** @return true when the pair was registered */
    public boolean remove(String pluginName, BridgedDevice device) {
        return devices.removeIf(d -> d.device() == device && d.pluginName().equals(pluginName));
    }

    /** Removes every device of a plugin and returns them in registration order. */
    public List<BridgedDevice> removeAll(String pluginName) {
        List<BridgedDevice> removed = devicesOf(pluginName);
        devices.removeIf(d -> d.pluginName().equals(pluginName));
        return removed;
    }

    public boolean contains(BridgedDevice device) {
        for (RegisteredDevice d : devices) {
            if (d.device() == device) return true;
        }
        return false;
    }

    public List<BridgedDevice> devicesOf(String pluginName) {
        List<BridgedDevice> out = new ArrayList<>();
        for (RegisteredDevice d : devices) {
            if (d.pluginName().equals(pluginName)) out.add(d.device());
        }
        return out;
    }

    public Optional<BridgedDevice> findByEndpoint(String pluginName, int endpoint) {
        for (RegisteredDevice d : devices) {
            Integer number = d.device().getEndpointNumber();
            if (d.pluginName().equals(pluginName) && number != null && number == endpoint) {
                return Optional.of(d.device());
            }
        }
        return Optional.empty();
    }

    public List<RegisteredDevice> all() {
        return new ArrayList<>(devices);
    }

    public int size() {
        return devices.size();
    }

    public List<SerializedDevice> serialize() {
        List<SerializedDevice> out = new ArrayList<>(devices.size());
        for (RegisteredDevice d : devices) {
            out.add(d.device().serialize(d.pluginName()));
        }
        return out;
    }

    public void clear() {
        devices.clear();
    }
}
