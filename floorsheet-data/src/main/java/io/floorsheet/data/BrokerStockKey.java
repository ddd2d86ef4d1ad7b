package io.floorsheet.data;

/** Identity of a broker's position in one stock. The broker name is deliberately not part of it. */
public record BrokerStockKey(String brokerId, String symbol) {}
