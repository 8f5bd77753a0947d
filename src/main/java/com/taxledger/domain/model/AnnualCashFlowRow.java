package com.taxledger.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Dividend income and withholding tax for one account, tax year and currency. */
@Value
@Builder
public class AnnualCashFlowRow {

    String accountId;
    int taxYear;
    String taxYearLabel;
    String currency;
    BigDecimal dividends;
    BigDecimal withholding;
    BigDecimal net;
}
