package io.floorsheet.data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds one trading date's transactions into one summary per (broker, symbol). The buyer of a trade
 * adds to the buy side of its entry and the seller to the sell side of its own; a broker on both sides
 * of the same stock ends up in a single entry. The first name seen for a broker id is kept.
 */
public final class BrokerStockFolder {
    private BrokerStockFolder() {}

    public static FoldResult fold(LocalDate date, Collection<TransactionRecord> records) {
        Map<BrokerStockKey, BrokerStockAccumulator> byKey = new LinkedHashMap<>();
        for (TransactionRecord r : records) {
            String missing = missingField(r);
            if (missing != null) {
                return FoldResult.rejected(date, "transaction " + r.transactionNo() + " has no " + missing);
            }
            byKey.computeIfAbsent(new BrokerStockKey(r.buyerId(), r.symbol()),
                    k -> new BrokerStockAccumulator(r.buyerId(), r.buyerName(), r.symbol()))
                    .addBuy(r.quantity(), r.amount());
            byKey.computeIfAbsent(new BrokerStockKey(r.sellerId(), r.symbol()),
                    k -> new BrokerStockAccumulator(r.sellerId(), r.sellerName(), r.symbol()))
                    .addSell(r.quantity(), r.amount());
        }
        List<DateSummary> rows = new ArrayList<>(byKey.size());
        for (BrokerStockAccumulator acc : byKey.values()) {
            rows.add(acc.toDateSummary(date));
        }
        return FoldResult.ok(date, rows);
    }

    private static String missingField(TransactionRecord r) {
        if (r.symbol() == null) return "symbol";
        if (r.buyerId() == null) return "buyer_id";
        if (r.sellerId() == null) return "seller_id";
        if (r.quantity() == null) return "quantity";
        if (r.rate() == null) return "rate";
        if (r.amount() == null) return "amount";
        return null;
    }

    /** Summaries for one date, or the reason the date could not be folded. */
    public record FoldResult(LocalDate date, List<DateSummary> rows, String failure) {
        static FoldResult ok(LocalDate date, List<DateSummary> rows) {
            return new FoldResult(date, List.copyOf(rows), null);
        }

        static FoldResult rejected(LocalDate date, String reason) {
            return new FoldResult(date, List.of(), reason);
        }

        public boolean failed() { return failure != null; }
    }
}
