package com.taxledger.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Realized gain/loss for one account, tax year and currency, derived from ledger rows.
 * Stock and option subtotals always add up to {@code totalGainLoss}.
 */
@Value
@Builder
public class AnnualSummaryRow {

    String accountId;
    int taxYear;
    String taxYearLabel;
    String currency;
    BigDecimal totalGainLoss;
    BigDecimal stockGainLoss;
    BigDecimal optionGainLoss;
    BigDecimal totalProceeds;
    BigDecimal totalCostBasis;
    BigDecimal totalFees;
    int disposalCount;
}
