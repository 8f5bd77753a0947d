package com.taxledger.domain.model;

import com.taxledger.domain.enums.InstrumentType;
import com.taxledger.domain.enums.TransactionAction;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the normalized trade and dividend stream, as handed to the ledger engine.
 *
 * <p>Monetary fields share a single {@code currency}; fee and price in different currencies are
 * rejected at the import boundary. For options, {@code unitPrice} is the price per contract
 * (the importer applies the contract multiplier), so quantity always counts contracts.
 *
 * <p>{@code sequence} is the record's position in the input and breaks timestamp ties.
 */
@Value
@Builder(toBuilder = true)
public class TransactionRecord {

    long sequence;
    String accountId;
    String instrumentId;
    InstrumentType instrumentType;
    TransactionAction action;

    /** Unsigned for BUY/SELL, signed for OPTION_ASSIGN (negative = deliver), ignored for OPTION_EXPIRE. */
    BigDecimal quantity;

    BigDecimal unitPrice;
    String currency;
    BigDecimal feeTotal;

    /** Cash amount for DIVIDEND and TAX_WITHHOLDING rows. Null for trades. */
    BigDecimal amount;

    LocalDateTime timestamp;

    public LotKey lotKey() {
        return LotKey.of(accountId, instrumentId);
    }

    public BigDecimal absQuantity() {
        return quantity == null ? BigDecimal.ZERO : quantity.abs();
    }

    public BigDecimal feeOrZero() {
        return feeTotal == null ? BigDecimal.ZERO : feeTotal;
    }

    /** True when an OPTION_ASSIGN row delivers the position away (negative quantity). */
    public boolean isAssignmentDelivery() {
        return action == TransactionAction.OPTION_ASSIGN && quantity != null && quantity.signum() < 0;
    }
}
