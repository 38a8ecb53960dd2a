package com.hubbridge.core.commissioning;

/** Stable serial number and unique id of an aggregator endpoint. */
public record AggregatorIdentity(String serialNumber, String uniqueId) {
}
