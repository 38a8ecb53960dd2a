/**
 * Plugin lifecycle and startup.
 * <ul>
 *   <li>{@link com.hubbridge.core.lifecycle.PluginLifecycleOrchestrator} – load, start, configure and shutdown hooks with error isolation</li>
 *   <li>{@link com.hubbridge.core.lifecycle.StartupSupervisor} – polls until every enabled plugin has started</li>
 *   <li>{@link com.hubbridge.core.lifecycle.NetworkStarter} – starts the protocol engine and publishes pairing state</li>
 *   <li>{@link com.hubbridge.core.lifecycle.CommissioningMonitor} – controller sessions and fabric changes</li>
 * </ul>
 */
package com.hubbridge.core.lifecycle;
