package com.taxledger.domain.model;

import com.taxledger.domain.enums.DisposalType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One resolved disposal.
 *
 * <p>{@code realizedGainLoss = quantity * (disposalPrice - matchedUnitCost) - feeTotal}, in the
 * record's currency. Synthetic rows come from options auto-expired after their expiry date with
 * no expiration record in the input.
 */
@Value
@Builder(toBuilder = true)
public class LedgerRow {

    TransactionRecord record;
    DisposalType disposalType;
    BigDecimal quantity;
    BigDecimal disposalPrice;
    BigDecimal matchedUnitCost;
    BigDecimal proceeds;
    BigDecimal costBasis;
    BigDecimal feeTotal;
    BigDecimal realizedGainLoss;
    String currency;
    boolean synthetic;
    String note;

    public String getAccountId() {
        return record.getAccountId();
    }

    public String getInstrumentId() {
        return record.getInstrumentId();
    }

    public LocalDateTime getTimestamp() {
        return record.getTimestamp();
    }
}
