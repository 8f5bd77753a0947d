package com.taxledger.importer;

import com.taxledger.domain.enums.TransactionAction;
import com.taxledger.domain.model.TransactionRecord;
import com.taxledger.exception.MalformedRecordException;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Boundary checks applied to every normalized record before the ledger sees it. The ledger
 * assumes these hold and does not re-check them.
 */
@Component
public class TransactionRecordValidator {

    public void validateAll(List<TransactionRecord> records) {
        records.forEach(this::validate);
    }

    /**
     * @throws MalformedRecordException naming every problem found on the record
     */
    public void validate(TransactionRecord record) {
        Map<String, Object> problems = new LinkedHashMap<>();

        requirePresent(problems, "accountId", record.getAccountId());
        requirePresent(problems, "instrumentId", record.getInstrumentId());
        requirePresent(problems, "currency", record.getCurrency());
        if (record.getInstrumentType() == null) {
            problems.put("instrumentType", "is required");
        }
        if (record.getTimestamp() == null) {
            problems.put("timestamp", "is required");
        }
        if (record.getFeeTotal() != null && record.getFeeTotal().signum() < 0) {
            problems.put("feeTotal", "must not be negative");
        }

        TransactionAction action = record.getAction();
        if (action == null) {
            problems.put("action", "is required");
        } else if (action.isCashFlow()) {
            if (record.getAmount() == null) {
                problems.put("amount", "is required for " + action);
            }
        } else if (action != TransactionAction.OPTION_EXPIRE) {
            BigDecimal quantity = record.getQuantity();
            if (quantity == null || quantity.signum() == 0) {
                problems.put("quantity", "must be non-zero for " + action);
            }
            if (record.getUnitPrice() == null) {
                problems.put("unitPrice", "is required for " + action);
            } else if (record.getUnitPrice().signum() < 0) {
                problems.put("unitPrice", "must not be negative");
            }
        }

        if (!problems.isEmpty()) {
            problems.put("sequence", record.getSequence());
            throw new MalformedRecordException(
                    String.format("Transaction #%d (%s %s) is malformed",
                            record.getSequence(), action, record.getInstrumentId()),
                    problems);
        }
    }

    /**
     * Fees are folded into the lot basis in the trade currency, so a fee charged in another
     * currency cannot be accepted.
     */
    public void validateFeeCurrency(long row, String tradeCurrency, String feeCurrency) {
        if (feeCurrency == null || feeCurrency.isBlank() || tradeCurrency == null) {
            return;
        }
        if (!feeCurrency.trim().equalsIgnoreCase(tradeCurrency.trim())) {
            throw new MalformedRecordException(
                    String.format("Row %d charges fees in %s but trades in %s",
                            row, feeCurrency.trim(), tradeCurrency.trim()),
                    Map.of("currency", tradeCurrency, "feeCurrency", feeCurrency));
        }
    }

    private static void requirePresent(Map<String, Object> problems, String field, String value) {
        if (value == null || value.isBlank()) {
            problems.put(field, "is required");
        }
    }
}
