package com.taxledger.ledger;

import com.taxledger.config.LedgerConfig;
import com.taxledger.domain.enums.AnomalyReason;
import com.taxledger.domain.enums.DisposalType;
import com.taxledger.domain.model.LedgerRow;
import com.taxledger.domain.model.LotState;
import com.taxledger.domain.model.TransactionRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Turns a disposal plus the current lot state into a ledger row, or explains why it cannot.
 *
 * <p>Formula: {@code realized = quantity * (price - averageUnitCost) - fee}. The fee reduces
 * proceeds. Expirations use price 0 and always dispose of the whole open quantity, so the full
 * remaining basis is realized as a loss.
 *
 * <p>Never mutates the lot; the ledger applies the quantity change only for resolved outcomes,
 * so a rejected disposal leaves the position exactly as it was.
 */
@Component
public class DisposalResolver {

    private final LedgerConfig ledgerConfig;

    public DisposalResolver(LedgerConfig ledgerConfig) {
        this.ledgerConfig = ledgerConfig;
    }

    /**
     * @param record the disposal transaction
     * @param lot    current state for the record's key, or null if the key was never acquired
     * @param type   how the lot is being reduced
     */
    public DisposalOutcome resolve(TransactionRecord record, LotState lot, DisposalType type) {
        BigDecimal openQuantity = lot == null ? BigDecimal.ZERO : lot.getOpenQuantity();
        if (openQuantity.signum() <= 0) {
            return DisposalOutcome.unresolved(
                    AnomalyReason.NO_OPENING_POSITION,
                    String.format("%s of %s with no open position", type, record.getInstrumentId()));
        }

        BigDecimal quantity = type == DisposalType.EXPIRATION ? openQuantity : record.absQuantity();
        if (quantity.compareTo(openQuantity) > 0) {
            return DisposalOutcome.unresolved(
                    AnomalyReason.OVERSELL,
                    String.format(
                            "%s of %s exceeds open position of %s",
                            quantity.toPlainString(), record.getInstrumentId(), openQuantity.toPlainString()));
        }

        BigDecimal price = type == DisposalType.EXPIRATION ? BigDecimal.ZERO : record.getUnitPrice();
        BigDecimal fee = record.feeOrZero();
        BigDecimal averageUnitCost = lot.getAverageUnitCost();

        BigDecimal proceeds = quantity.multiply(price);
        BigDecimal costBasis = quantity.multiply(averageUnitCost);
        BigDecimal realized = proceeds.subtract(costBasis).subtract(fee);

        int scale = ledgerConfig.getMoneyScale();
        return DisposalOutcome.resolved(LedgerRow.builder()
                .record(record)
                .disposalType(type)
                .quantity(quantity)
                .disposalPrice(price)
                .matchedUnitCost(averageUnitCost.setScale(scale, RoundingMode.HALF_UP))
                .proceeds(proceeds.setScale(scale, RoundingMode.HALF_UP))
                .costBasis(costBasis.setScale(scale, RoundingMode.HALF_UP))
                .feeTotal(fee)
                .realizedGainLoss(realized.setScale(scale, RoundingMode.HALF_UP))
                .currency(record.getCurrency())
                .build());
    }
}
