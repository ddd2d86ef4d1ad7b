package io.floorsheet.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;

/**
 * One matched trade from the floorsheet. Natural key: (date, transactionNo).
 * <p>
 * Blank text becomes null, the form a stored table reads back, so a fetched row equals its stored copy.
 * Quantity, rate and amount are null when the source had no value for them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"date", "transaction_no", "symbol", "symbol_full", "buyer_id", "buyer_name",
        "seller_id", "seller_name", "quantity", "rate", "amount"})
public record TransactionRecord(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("transaction_no") String transactionNo,
        @JsonProperty("symbol") String symbol,
        @JsonProperty("symbol_full") String symbolFull,
        @JsonProperty("buyer_id") String buyerId,
        @JsonProperty("buyer_name") String buyerName,
        @JsonProperty("seller_id") String sellerId,
        @JsonProperty("seller_name") String sellerName,
        @JsonProperty("quantity") Long quantity,
        @JsonProperty("rate") Double rate,
        @JsonProperty("amount") Double amount
) implements Dated {

    public TransactionRecord {
        transactionNo = blankToNull(transactionNo);
        symbol = blankToNull(symbol);
        symbolFull = blankToNull(symbolFull);
        buyerId = blankToNull(buyerId);
        buyerName = blankToNull(buyerName);
        sellerId = blankToNull(sellerId);
        sellerName = blankToNull(sellerName);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    public Key key() {
        return new Key(date, transactionNo);
    }

    public record Key(LocalDate date, String transactionNo) {}
}
