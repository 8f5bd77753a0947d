package com.taxledger.domain.model;

import com.taxledger.domain.enums.InstrumentType;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import lombok.Getter;

/**
 * Running weighted-average position for one {@link LotKey}.
 *
 * <p>Mutated only by the lot ledger that owns it. {@code totalCost} is the exact fee-inclusive
 * cost of the open quantity; the average is always derived from it, so the same acquisitions give
 * the same average in any order. The average is unchanged by disposals; it stays on the state
 * (inert) when the position is closed and is replaced by the next acquisition.
 */
@Getter
public class LotState {

    private final LotKey key;
    private final InstrumentType instrumentType;
    private BigDecimal openQuantity = BigDecimal.ZERO;
    private BigDecimal totalCost = BigDecimal.ZERO;
    private BigDecimal averageUnitCost = BigDecimal.ZERO;
    private String currency;

    /** Number of configured splits already applied to this lot. */
    private int appliedSplits;

    public LotState(LotKey key, InstrumentType instrumentType, int appliedSplits) {
        this.key = key;
        this.instrumentType = instrumentType;
        this.appliedSplits = appliedSplits;
    }

    public boolean isOpen() {
        return openQuantity.signum() > 0;
    }

    /**
     * Adds {@code qty*price + fee} to the total cost and re-derives the average as
     * {@code totalCost / openQuantity}.
     */
    public void acquire(BigDecimal quantity, BigDecimal unitPrice, BigDecimal fee, String tradeCurrency,
            MathContext mathContext) {
        if (!isOpen()) {
            currency = tradeCurrency;
        }
        totalCost = totalCost.add(quantity.multiply(unitPrice)).add(fee);
        openQuantity = openQuantity.add(quantity);
        averageUnitCost = totalCost.divide(openQuantity, mathContext);
    }

    /**
     * Reduces the open quantity and removes {@code qty*average} from the total cost. The caller has
     * already checked the disposal fits.
     */
    public void dispose(BigDecimal quantity) {
        openQuantity = openQuantity.subtract(quantity);
        totalCost = isOpen() ? totalCost.subtract(quantity.multiply(averageUnitCost)) : BigDecimal.ZERO;
    }

    /** Applies an N:M split: quantity * N / M, total cost unchanged, average re-derived. */
    public void applySplit(SplitEvent split, MathContext mathContext) {
        BigDecimal numerator = BigDecimal.valueOf(split.getNumerator());
        BigDecimal denominator = BigDecimal.valueOf(split.getDenominator());
        openQuantity = openQuantity.multiply(numerator).divide(denominator, mathContext);
        averageUnitCost = isOpen()
                ? totalCost.divide(openQuantity, mathContext)
                : averageUnitCost.multiply(denominator).divide(numerator, mathContext);
        appliedSplits++;
    }

    public LotSnapshot snapshot(int moneyScale) {
        return LotSnapshot.builder()
                .accountId(key.getAccountId())
                .instrumentId(key.getInstrumentId())
                .instrumentType(instrumentType)
                .openQuantity(openQuantity)
                .averageUnitCost(averageUnitCost.setScale(moneyScale, RoundingMode.HALF_UP))
                .currency(currency)
                .build();
    }
}
