/**
 * Protocol engine boundary: {@link com.hubbridge.protocol.ProtocolEngine},
 * {@link com.hubbridge.protocol.CommissioningServer}, {@link com.hubbridge.protocol.Aggregator} and the
 * records describing pairing codes, fabrics and sessions. {@code com.hubbridge.protocol.local} holds the
 * in-process engine used when no network stack is plugged in.
 */
package com.hubbridge.protocol;
