package com.taxledger.ledger;

import com.taxledger.domain.enums.AnomalyReason;
import com.taxledger.domain.model.AnomalyRecord;
import com.taxledger.domain.model.TransactionRecord;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Records transactions that need manual review. Flagging never interrupts the run. */
@Component
public class AnomalyFlagger {

    private static final Logger log = LoggerFactory.getLogger(AnomalyFlagger.class);

    public AnomalyRecord flag(TransactionRecord record, AnomalyReason reason, BigDecimal openQuantity, String message) {
        log.warn(
                "Anomaly {} on #{} {} {} {} at {}: {}",
                reason,
                record.getSequence(),
                record.getAccountId(),
                record.getAction(),
                record.getInstrumentId(),
                record.getTimestamp(),
                message);
        return AnomalyRecord.builder()
                .record(record)
                .reason(reason)
                .openQuantity(openQuantity)
                .message(message)
                .build();
    }
}
