/**
 * Plugin SPI: what a plugin implements and what it sees of the bridge.
 * <ul>
 *   <li>{@link com.hubbridge.plugin.PlatformFactory} – plugin entry point named in {@code plugin.json}</li>
 *   <li>{@link com.hubbridge.plugin.BridgePlatform}, {@link com.hubbridge.plugin.DynamicPlatform},
 *       {@link com.hubbridge.plugin.AccessoryPlatform} – platform hooks and device registration helpers</li>
 *   <li>{@link com.hubbridge.plugin.BridgeHandle} – bridge operations available to platforms</li>
 *   <li>{@link com.hubbridge.plugin.PlatformConfig} – per-plugin JSON configuration</li>
 *   <li>{@link com.hubbridge.plugin.PluginLoader} / {@link com.hubbridge.plugin.PluginManifest} – manifest resolution and class loading</li>
 *   <li>{@link com.hubbridge.plugin.event} – typed events and the event bus</li>
 * </ul>
 */
package com.hubbridge.plugin;
