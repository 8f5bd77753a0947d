package com.taxledger.domain.model;

import com.taxledger.domain.enums.AnomalyReason;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A transaction the ledger could not resolve, kept for manual review. */
@Value
@Builder
public class AnomalyRecord {

    TransactionRecord record;
    AnomalyReason reason;

    /** Open quantity of the lot when the transaction was rejected. */
    BigDecimal openQuantity;

    String message;
}
