package io.floorsheet.data;

import java.time.LocalDate;

/**
 * Mutable running totals for one broker in one stock, finalized into immutable summary rows.
 */
final class BrokerStockAccumulator {
    private final String brokerId;
    private final String brokerName;
    private final String symbol;
    private long buyQuantity;
    private double buyAmount;
    private long sellQuantity;
    private double sellAmount;

    BrokerStockAccumulator(String brokerId, String brokerName, String symbol) {
        this.brokerId = brokerId;
        this.brokerName = brokerName;
        this.symbol = symbol;
    }

    void addBuy(long quantity, double amount) {
        buyQuantity += quantity;
        buyAmount += amount;
    }

    void addSell(long quantity, double amount) {
        sellQuantity += quantity;
        sellAmount += amount;
    }

    String brokerName() { return brokerName; }

    DerivedMetrics metrics() {
        return DerivedMetrics.of(buyQuantity, buyAmount, sellQuantity, sellAmount);
    }

    DateSummary toDateSummary(LocalDate date) {
        DerivedMetrics m = metrics();
        return new DateSummary(date, brokerId, brokerName, symbol,
                buyQuantity, buyAmount, sellQuantity, sellAmount,
                m.avgBuyPrice(), m.avgSellPrice(), m.netQuantity(), m.avgHoldingPrice());
    }

    GlobalSummary toGlobalSummary(LocalDate lastUpdated) {
        DerivedMetrics m = metrics();
        return new GlobalSummary(brokerId, brokerName, symbol,
                buyQuantity, buyAmount, sellQuantity, sellAmount, lastUpdated,
                m.avgBuyPrice(), m.avgSellPrice(), m.netQuantity(), m.avgHoldingPrice());
    }
}
