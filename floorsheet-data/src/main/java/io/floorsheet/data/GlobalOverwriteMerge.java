package io.floorsheet.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds every per-date summary into one row per (broker_id, symbol) across all dates. Totals are summed,
 * derived metrics recomputed from the totals, and last_updated is the latest date folded in.
 * <p>
 * A broker id recorded under different names on different dates stays in one bucket under the first
 * name seen; the mismatch is logged.
 */
public final class GlobalOverwriteMerge {
    private static final Logger log = LoggerFactory.getLogger(GlobalOverwriteMerge.class);

    private GlobalOverwriteMerge() {}

    public static List<GlobalSummary> fold(List<DateSummary> rows) {
        Map<BrokerStockKey, BrokerStockAccumulator> byKey = new LinkedHashMap<>();
        Map<BrokerStockKey, LocalDate> lastUpdated = new LinkedHashMap<>();
        for (DateSummary row : rows) {
            BrokerStockKey key = row.key();
            BrokerStockAccumulator acc = byKey.computeIfAbsent(key,
                    k -> new BrokerStockAccumulator(row.brokerId(), row.brokerName(), row.symbol()));
            if (!Objects.equals(acc.brokerName(), row.brokerName())) {
                log.warn("Broker {} appears as '{}' and '{}' for {}; keeping '{}'",
                        row.brokerId(), acc.brokerName(), row.brokerName(), row.symbol(), acc.brokerName());
            }
            acc.addBuy(row.buyQuantity(), row.buyAmount());
            acc.addSell(row.sellQuantity(), row.sellAmount());
            if (row.date() != null) {
                lastUpdated.merge(key, row.date(), (a, b) -> a.isAfter(b) ? a : b);
            }
        }
        List<GlobalSummary> out = new ArrayList<>(byKey.size());
        for (Map.Entry<BrokerStockKey, BrokerStockAccumulator> e : byKey.entrySet()) {
            out.add(e.getValue().toGlobalSummary(lastUpdated.get(e.getKey())));
        }
        return out;
    }
}
