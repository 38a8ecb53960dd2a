/**
 * Device handles plugins hand to the bridge: {@link com.hubbridge.device.BridgedDevice},
 * its {@link com.hubbridge.device.BasicInformation} and the persisted {@link com.hubbridge.device.SerializedDevice}.
 */
package com.hubbridge.device;
