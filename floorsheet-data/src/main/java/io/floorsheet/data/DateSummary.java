package io.floorsheet.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;

/**
 * A broker's position in one stock on one trading date. Keyed by (date, brokerId, symbol).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"date", "broker_id", "broker_name", "symbol", "buy_quantity", "buy_amount",
        "sell_quantity", "sell_amount", "avg_buy_price", "avg_sell_price", "net_quantity", "avg_holding_price"})
public record DateSummary(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("broker_id") String brokerId,
        @JsonProperty("broker_name") String brokerName,
        @JsonProperty("symbol") String symbol,
        @JsonProperty("buy_quantity") long buyQuantity,
        @JsonProperty("buy_amount") double buyAmount,
        @JsonProperty("sell_quantity") long sellQuantity,
        @JsonProperty("sell_amount") double sellAmount,
        @JsonProperty("avg_buy_price") double avgBuyPrice,
        @JsonProperty("avg_sell_price") double avgSellPrice,
        @JsonProperty("net_quantity") long netQuantity,
        @JsonProperty("avg_holding_price") double avgHoldingPrice
) implements Dated {

    public BrokerStockKey key() {
        return new BrokerStockKey(brokerId, symbol);
    }
}
