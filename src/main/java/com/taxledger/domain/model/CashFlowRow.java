package com.taxledger.domain.model;

import com.taxledger.domain.enums.TransactionAction;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** A dividend or withholding-tax entry passed through untouched by lot accounting. */
@Value
@Builder
public class CashFlowRow {

    long sequence;
    String accountId;
    String instrumentId;
    TransactionAction action;
    BigDecimal amount;
    String currency;
    LocalDateTime timestamp;
}
