package com.hubbridge.core.admin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InterfaceAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Snapshot of the host the bridge runs on, shown by the settings query.
 */
public record SystemInformation(
        String hostName,
        String osName,
        String osVersion,
        String osArch,
        String javaVersion,
        String javaVendor,
        int availableProcessors,
        long totalMemory,
        long freeMemory,
        long maxMemory,
        List<NetworkAddress> interfaces) {

    private static final Logger log = LoggerFactory.getLogger(SystemInformation.class);

    /** One address of a network interface. */
    public record NetworkAddress(String interfaceName, String address, boolean ipv6, String macAddress) {
    }

    public static SystemInformation collect() {
        Runtime runtime = Runtime.getRuntime();
        return new SystemInformation(localHostName(),
                System.getProperty("os.name"),
                System.getProperty("os.version"),
                System.getProperty("os.arch"),
                System.getProperty("java.version"),
                System.getProperty("java.vendor"),
                runtime.availableProcessors(),
                runtime.totalMemory(),
                runtime.freeMemory(),
                runtime.maxMemory(),
                networkAddresses());
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Cannot resolve the local host name: {}", e.getMessage());
            return "localhost";
        }
    }

    /** Addresses of the interfaces that are up and not loopback. */
    public static List<NetworkAddress> networkAddresses() {
        List<NetworkAddress> out = new ArrayList<>();
        try {
            var nics = NetworkInterface.getNetworkInterfaces();
            if (nics == null) return out;
            for (NetworkInterface nic : Collections.list(nics)) {
                if (!nic.isUp() || nic.isLoopback()) continue;
                String mac = formatMac(nic.getHardwareAddress());
                for (InterfaceAddress address : nic.getInterfaceAddresses()) {
                    InetAddress inet = address.getAddress();
                    out.add(new NetworkAddress(nic.getName(), inet.getHostAddress(), inet.getAddress().length == 16, mac));
                }
            }
        } catch (SocketException e) {
            log.warn("Cannot list network interfaces: {}", e.getMessage());
        }
        return out;
    }

    private static String formatMac(byte[] mac) {
        if (mac == null) return null;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < mac.length; i++) {
            if (i > 0) sb.append(':');
            sb.append(String.format("%02x", mac[i]));
        }
        return sb.toString();
    }
}
