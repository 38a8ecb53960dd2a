/**
 * Bridge orchestration core. {@link com.hubbridge.core.HubBridge} wires the registries, the commissioning
 * identities, the topology, the plugin lifecycle and the shutdown coordinator around one bridge scheduler.
 */
package com.hubbridge.core;
