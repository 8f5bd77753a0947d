package com.taxledger.ledger;

import com.taxledger.domain.enums.AnomalyReason;
import com.taxledger.domain.model.LedgerRow;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** Either a resolved ledger row or the reason the disposal could not be resolved. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DisposalOutcome {

    LedgerRow ledgerRow;
    AnomalyReason anomalyReason;
    String message;

    public static DisposalOutcome resolved(LedgerRow ledgerRow) {
        return new DisposalOutcome(ledgerRow, null, null);
    }

    public static DisposalOutcome unresolved(AnomalyReason reason, String message) {
        return new DisposalOutcome(null, reason, message);
    }

    public boolean isResolved() {
        return ledgerRow != null;
    }
}
