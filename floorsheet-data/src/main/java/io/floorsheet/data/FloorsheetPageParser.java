package io.floorsheet.data;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extraction of floorsheet pages. Expects the page layout of the exchange's floorsheet listing: a
 * {@code table.table} whose data rows have the cells #, transaction no, symbol, buyer, seller,
 * quantity, rate, amount. Symbol, buyer and seller cells hold a link whose text is the code and whose
 * title is the full name.
 * <p>
 * Pages go through jsoup, so omitted end tags, unquoted attributes and named entities read the way a
 * browser reads them.
 */
final class FloorsheetPageParser {
    static final int CELLS_PER_ROW = 8;

    private static final Pattern AS_OF = Pattern.compile("As of\\s*(\\d{4}/\\d{1,2}/\\d{1,2})");
    private static final Pattern TOTAL_PAGES = Pattern.compile("Total pages:\\s*(\\d+)");
    private static final DateTimeFormatter AS_OF_DATE = DateTimeFormatter.ofPattern("yyyy/M/d");

    private FloorsheetPageParser() {}

    /** The trading date from the "As of yyyy/MM/dd" text. */
    static Optional<LocalDate> tradingDate(String html) {
        Matcher m = AS_OF.matcher(pageText(html));
        if (!m.find()) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(m.group(1), AS_OF_DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Page count from the "Total pages: N" text; 1 when the page does not say. */
    static int totalPages(String html) {
        Matcher m = TOTAL_PAGES.matcher(pageText(html));
        if (!m.find()) return 1;
        try {
            return Math.max(1, Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    /**
     * Parses every data row of the floorsheet table. Rows without td cells (headers) are not counted,
     * nor are rows of tables nested inside it. An absent table yields no rows.
     */
    static List<RowParseResult> rows(String html, LocalDate tradingDate) {
        Element table = Jsoup.parse(html).selectFirst("table.table");
        if (table == null) return List.of();
        List<RowParseResult> out = new ArrayList<>();
        int rowNo = 0;
        for (Element tr : ownRows(table)) {
            List<Element> cells = childrenTagged(tr, "td");
            if (cells.isEmpty()) continue;
            rowNo++;
            out.add(parseRow(rowNo, cells, tradingDate));
        }
        return out;
    }

    static RowParseResult parseRow(int rowNo, List<Element> cells, LocalDate tradingDate) {
        if (cells.size() < CELLS_PER_ROW) {
            return RowParseResult.skipped(rowNo, "expected " + CELLS_PER_ROW + " cells, found " + cells.size());
        }
        String transactionNo = text(cells.get(1));
        if (transactionNo.isEmpty()) return RowParseResult.skipped(rowNo, "missing transaction_no");

        Link symbol = link(cells.get(2));
        Link buyer = link(cells.get(3));
        Link seller = link(cells.get(4));
        if (symbol.code().isEmpty()) return RowParseResult.skipped(rowNo, "missing symbol");
        if (buyer.code().isEmpty()) return RowParseResult.skipped(rowNo, "missing buyer_id");
        if (seller.code().isEmpty()) return RowParseResult.skipped(rowNo, "missing seller_id");

        String qtyText = text(cells.get(5));
        OptionalLong quantity = parseLong(qtyText);
        if (quantity.isEmpty()) return RowParseResult.skipped(rowNo, "quantity is not a non-negative integer: '" + qtyText + "'");
        String rateText = text(cells.get(6));
        OptionalDouble rate = parseDecimal(rateText);
        if (rate.isEmpty()) return RowParseResult.skipped(rowNo, "rate is not a non-negative number: '" + rateText + "'");
        String amountText = text(cells.get(7));
        OptionalDouble amount = parseDecimal(amountText);
        if (amount.isEmpty()) return RowParseResult.skipped(rowNo, "amount is not a non-negative number: '" + amountText + "'");

        return RowParseResult.parsed(rowNo, new TransactionRecord(tradingDate, transactionNo,
                symbol.code(), symbol.title(), buyer.code(), buyer.title(), seller.code(), seller.title(),
                quantity.getAsLong(), rate.getAsDouble(), amount.getAsDouble()));
    }

    /** Rows of this table only: its direct tr children and those of its thead, tbody and tfoot. */
    private static List<Element> ownRows(Element table) {
        List<Element> rows = new ArrayList<>();
        for (Element child : table.children()) {
            String tag = child.normalName();
            if (tag.equals("tr")) {
                rows.add(child);
            } else if (tag.equals("thead") || tag.equals("tbody") || tag.equals("tfoot")) {
                rows.addAll(childrenTagged(child, "tr"));
            }
        }
        return rows;
    }

    private static List<Element> childrenTagged(Element parent, String tag) {
        List<Element> out = new ArrayList<>();
        for (Element child : parent.children()) {
            if (child.normalName().equals(tag)) out.add(child);
        }
        return out;
    }

    /** Code and full name from a cell's link; a cell without a link gives its text and an empty title. */
    private static Link link(Element cell) {
        Element a = cell.selectFirst("a");
        if (a == null) return new Link(text(cell), "");
        return new Link(text(a), clean(a.attr("title")));
    }

    private record Link(String code, String title) {}

    private static String text(Element el) {
        return clean(el.text());
    }

    private static String clean(String s) {
        return s.replace('\u00a0', ' ').trim();
    }

    private static String pageText(String html) {
        return clean(Jsoup.parse(html).text());
    }

    private static OptionalLong parseLong(String s) {
        String digits = s.replace(",", "");
        try {
            long v = Long.parseLong(digits);
            return v < 0 ? OptionalLong.empty() : OptionalLong.of(v);
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static OptionalDouble parseDecimal(String s) {
        String digits = s.replace(",", "");
        try {
            double v = Double.parseDouble(digits);
            return (Double.isNaN(v) || Double.isInfinite(v) || v < 0) ? OptionalDouble.empty() : OptionalDouble.of(v);
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
