package io.floorsheet.data;

/**
 * Averages and net position computed from buy/sell accumulators. Every division is guarded:
 * an average over a zero quantity is 0, and the holding price is 0 unless the net position is long.
 */
public record DerivedMetrics(double avgBuyPrice, double avgSellPrice, long netQuantity, double avgHoldingPrice) {

    public static DerivedMetrics of(long buyQuantity, double buyAmount, long sellQuantity, double sellAmount) {
        double avgBuy = buyQuantity > 0 ? buyAmount / buyQuantity : 0.0;
        double avgSell = sellQuantity > 0 ? sellAmount / sellQuantity : 0.0;
        long net = buyQuantity - sellQuantity;
        // a net short position also reports 0
        double avgHolding = net > 0 ? (buyAmount - sellAmount) / net : 0.0;
        return new DerivedMetrics(avgBuy, avgSell, net, avgHolding);
    }
}
