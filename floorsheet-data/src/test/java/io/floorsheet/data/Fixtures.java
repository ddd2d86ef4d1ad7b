package io.floorsheet.data;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

final class Fixtures {
    private Fixtures() {}

    static TransactionRecord tx(String date, String no, String symbol, String buyer, String seller, long qty, double amount) {
        return new TransactionRecord(date == null ? null : LocalDate.parse(date), no, symbol, symbol + " Ltd",
                buyer, "Broker " + buyer, seller, "Broker " + seller, qty, qty == 0 ? 0 : amount / qty, amount);
    }

    static DateSummary day(String date, String broker, String symbol, long buyQ, double buyA, long sellQ, double sellA) {
        DerivedMetrics m = DerivedMetrics.of(buyQ, buyA, sellQ, sellA);
        return new DateSummary(LocalDate.parse(date), broker, "Broker " + broker, symbol, buyQ, buyA, sellQ, sellA,
                m.avgBuyPrice(), m.avgSellPrice(), m.netQuantity(), m.avgHoldingPrice());
    }

    static void deleteRecursively(Path dir) throws IOException {
        if (dir == null || !Files.exists(dir)) return;
        try (var s = Files.walk(dir)) {
            s.sorted(Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (IOException ignore) {} });
        }
    }

    /** A floorsheet page in the exchange's layout: one header row, then one data row per cell list. */
    static String page(String asOf, int totalPages, List<List<String>> rows) {
        StringBuilder sb = new StringBuilder("<html><body>");
        if (asOf != null) sb.append("<span id=\"date\">As of ").append(asOf).append("</span>");
        sb.append("<table class=\"table table-bordered\"><thead><tr><th>#</th><th>Transact. No.</th><th>Symbol</th>")
                .append("<th>Buyer</th><th>Seller</th><th>Quantity</th><th>Rate</th><th>Amount</th></tr></thead><tbody>");
        for (List<String> cells : rows) {
            sb.append("<tr>");
            for (String c : cells) sb.append("<td>").append(c).append("</td>");
            sb.append("</tr>");
        }
        sb.append("</tbody></table>");
        if (totalPages > 0) sb.append("<span class=\"pager\">Total pages: ").append(totalPages).append("</span>");
        return sb.append("</body></html>").toString();
    }

    static List<String> row(int n, String no, String symbol, String buyer, String seller, String qty, String rate, String amount) {
        return List.of(String.valueOf(n), no,
                "<a href=\"/CompanyDetail.aspx?symbol=" + symbol + "\" title=\"" + symbol + " Limited\">" + symbol + "</a>",
                "<a href=\"#\" title=\"Broker " + buyer + " Securities\">" + buyer + "</a>",
                "<a href=\"#\" title=\"Broker " + seller + " Securities\">" + seller + "</a>",
                qty, rate, amount);
    }

    /** Serves canned pages by number; a missing page fails like an HTTP error. */
    static final class FakeClient implements FloorsheetClient {
        private final Map<Integer, String> pages;
        final List<Integer> requested = new CopyOnWriteArrayList<>();
        final List<Optional<LocalDate>> dates = new CopyOnWriteArrayList<>();

        FakeClient(Map<Integer, String> pages) { this.pages = pages; }

        @Override
        public String fetchPage(int page, Optional<LocalDate> date) throws IOException {
            requested.add(page);
            dates.add(date);
            String html = pages.get(page);
            if (html == null) throw new IOException("Floorsheet page " + page + " returned HTTP 503");
            return html;
        }
    }
}
