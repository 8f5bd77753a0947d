package com.taxledger.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Line of {@code cash_flow.csv}. Per-transaction lines have an action and instrument; yearly
 * total lines carry {@code action = TOTAL} and the tax year label.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"account_id", "tax_year", "instrument_code", "action", "amount", "currency", "executed_at"})
public class CashFlowExportRow {

    @JsonProperty("account_id")
    private String accountId;

    @JsonProperty("tax_year")
    private String taxYear;

    @JsonProperty("instrument_code")
    private String instrumentCode;

    @JsonProperty("action")
    private String action;

    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("executed_at")
    private String executedAt;
}
