package com.taxledger.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
    "sequence", "account_id", "instrument_code", "action", "quantity", "price", "currency",
    "executed_at", "reason", "open_quantity", "message"
})
public class AnomalyExportRow {

    @JsonProperty("sequence")
    private long sequence;

    @JsonProperty("account_id")
    private String accountId;

    @JsonProperty("instrument_code")
    private String instrumentCode;

    @JsonProperty("action")
    private String action;

    @JsonProperty("quantity")
    private BigDecimal quantity;

    @JsonProperty("price")
    private BigDecimal price;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("executed_at")
    private String executedAt;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("open_quantity")
    private BigDecimal openQuantity;

    @JsonProperty("message")
    private String message;
}
