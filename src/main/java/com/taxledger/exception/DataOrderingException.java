package com.taxledger.exception;

import com.taxledger.domain.model.LotKey;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Transactions for one lot arrived out of timestamp order.
 *
 * <p>Fatal to the run: applying them anyway would silently corrupt the running average cost.
 */
public class DataOrderingException extends BaseException {

    public DataOrderingException(LotKey key, LocalDateTime previous, LocalDateTime offending, long sequence) {
        super(
                ErrorCode.DATA_ORDERING_ERROR,
                String.format(
                        "Transaction #%d for %s at %s precedes an already applied transaction at %s",
                        sequence, key, offending, previous),
                Map.of(
                        "lot", key.toString(),
                        "sequence", sequence,
                        "previousTimestamp", String.valueOf(previous),
                        "offendingTimestamp", String.valueOf(offending)));
    }
}
