package com.taxledger.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat ledger line as written to {@code ledger.csv} and the per-year reports. Summary lines in a
 * yearly report reuse the columns with {@code direction = SUMMARY}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
    "account_id", "instrument_code", "instrument_type", "direction", "quantity", "execution_price",
    "currency", "fee_total", "executed_at", "matched_unit_cost", "proceeds", "cost_basis",
    "realized_gain_loss", "note"
})
public class LedgerExportRow {

    @JsonProperty("account_id")
    private String accountId;

    @JsonProperty("instrument_code")
    private String instrumentCode;

    @JsonProperty("instrument_type")
    private String instrumentType;

    @JsonProperty("direction")
    private String direction;

    @JsonProperty("quantity")
    private BigDecimal quantity;

    @JsonProperty("execution_price")
    private BigDecimal executionPrice;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("fee_total")
    private BigDecimal feeTotal;

    @JsonProperty("executed_at")
    private String executedAt;

    @JsonProperty("matched_unit_cost")
    private BigDecimal matchedUnitCost;

    @JsonProperty("proceeds")
    private BigDecimal proceeds;

    @JsonProperty("cost_basis")
    private BigDecimal costBasis;

    @JsonProperty("realized_gain_loss")
    private BigDecimal realizedGainLoss;

    @JsonProperty("note")
    private String note;
}
