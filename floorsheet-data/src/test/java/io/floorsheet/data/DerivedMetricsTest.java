package io.floorsheet.data;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DerivedMetricsTest {

    @Test
    void longPositionHasHoldingPrice() {
        DerivedMetrics m = DerivedMetrics.of(100, 10_000, 40, 4_200);
        assertEquals(100.0, m.avgBuyPrice(), 1e-9);
        assertEquals(105.0, m.avgSellPrice(), 1e-9);
        assertEquals(60, m.netQuantity());
        assertEquals(5_800.0 / 60, m.avgHoldingPrice(), 1e-9);
    }

    @Test
    void shortAndFlatPositionsReportZeroHoldingPrice() {
        assertEquals(0.0, DerivedMetrics.of(40, 4_200, 100, 10_000).avgHoldingPrice());
        assertEquals(-60, DerivedMetrics.of(40, 4_200, 100, 10_000).netQuantity());
        assertEquals(0.0, DerivedMetrics.of(50, 5_000, 50, 5_500).avgHoldingPrice());
    }

    @Test
    void zeroQuantitiesNeverDivide() {
        DerivedMetrics m = DerivedMetrics.of(0, 0, 0, 0);
        assertEquals(0.0, m.avgBuyPrice());
        assertEquals(0.0, m.avgSellPrice());
        assertEquals(0, m.netQuantity());
        assertEquals(0.0, m.avgHoldingPrice());

        DerivedMetrics onlySold = DerivedMetrics.of(0, 0, 10, 1_000);
        assertEquals(0.0, onlySold.avgBuyPrice());
        assertEquals(100.0, onlySold.avgSellPrice(), 1e-9);
    }
}
