package com.taxledger.ledger;

import com.taxledger.domain.enums.AnomalyReason;
import com.taxledger.domain.enums.DisposalType;
import com.taxledger.domain.enums.InstrumentType;
import com.taxledger.domain.enums.TransactionAction;
import com.taxledger.domain.model.AnomalyRecord;
import com.taxledger.domain.model.CashFlowRow;
import com.taxledger.domain.model.LedgerRow;
import com.taxledger.domain.model.LotKey;
import com.taxledger.domain.model.LotState;
import com.taxledger.domain.model.TransactionRecord;
import com.taxledger.exception.DataOrderingException;
import com.taxledger.instrument.OptionSymbolParser;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moving weighted-average lot ledger.
 *
 * <p>Owns every {@link LotState} for the records it is given and applies them strictly in order:
 * <ul>
 *   <li><b>BUY / OPTION_ASSIGN receive:</b> blends quantity, price and fee into the average cost.</li>
 *   <li><b>SELL / OPTION_ASSIGN deliver / OPTION_EXPIRE:</b> resolved against the current average by
 *       {@link DisposalResolver}; the average is untouched and the open quantity shrinks.
 *       Unresolvable disposals become anomalies and leave the lot unchanged.</li>
 *   <li><b>DIVIDEND / TAX_WITHHOLDING:</b> passed through as cash flows.</li>
 * </ul>
 *
 * <p><b>Thread safety:</b> none. One instance per partition per run; the engine never shares an
 * instance between workers.
 */
public class LotLedger {

    private static final Logger log = LoggerFactory.getLogger(LotLedger.class);

    private static final LocalTime EXPIRY_CLOSE = LocalTime.of(23, 59, 59);

    private final DisposalResolver disposalResolver;
    private final AnomalyFlagger anomalyFlagger;
    private final SplitAdjuster splitAdjuster;
    private final MathContext mathContext;

    private final Map<LotKey, LotState> lots = new LinkedHashMap<>();
    private final Map<LotKey, TransactionRecord> lastApplied = new HashMap<>();
    private final List<LedgerRow> ledgerRows = new ArrayList<>();
    private final List<AnomalyRecord> anomalies = new ArrayList<>();
    private final List<CashFlowRow> cashFlows = new ArrayList<>();

    public LotLedger(
            DisposalResolver disposalResolver,
            AnomalyFlagger anomalyFlagger,
            SplitAdjuster splitAdjuster,
            MathContext mathContext) {
        this.disposalResolver = disposalResolver;
        this.anomalyFlagger = anomalyFlagger;
        this.splitAdjuster = splitAdjuster;
        this.mathContext = mathContext;
    }

    /**
     * Applies one transaction.
     *
     * @throws DataOrderingException if the record is older than the last one applied to its lot
     */
    public void apply(TransactionRecord record) {
        LotKey key = record.lotKey();
        checkOrdering(key, record);
        lastApplied.put(key, record);

        LotState lot = lots.get(key);
        if (lot != null) {
            splitAdjuster.applyDue(lot, record.getTimestamp().toLocalDate(), mathContext);
        }

        if (!isModelled(record)) {
            flag(record, lot, AnomalyReason.UNRECOGNIZED_INSTRUMENT_TYPE, String.format(
                    "%s is not supported for %s instrument %s",
                    record.getAction(), record.getInstrumentType(), record.getInstrumentId()));
            return;
        }

        switch (record.getAction()) {
            case BUY -> acquire(record, lot);
            case SELL -> dispose(record, lot, DisposalType.SALE);
            case OPTION_ASSIGN -> {
                if (record.isAssignmentDelivery()) {
                    dispose(record, lot, DisposalType.ASSIGNMENT);
                } else {
                    acquire(record, lot);
                }
            }
            case OPTION_EXPIRE -> dispose(record, lot, DisposalType.EXPIRATION);
            case DIVIDEND, TAX_WITHHOLDING -> cashFlows.add(toCashFlow(record));
        }
    }

    /**
     * End-of-stream processing: brings every lot up to date with splits effective by
     * {@code asOfDate} and, when enabled, closes options whose expiry date is before it. An option
     * code without a readable expiry takes the date of its last transaction instead.
     */
    public void finish(LocalDate asOfDate, boolean autoExpireOptions, OptionSymbolParser optionSymbolParser) {
        for (LotState lot : lots.values()) {
            splitAdjuster.applyDue(lot, asOfDate, mathContext);
            if (autoExpireOptions && lot.getInstrumentType() == InstrumentType.OPTION && lot.isOpen()) {
                expireIfPast(lot, asOfDate, optionSymbolParser);
            }
        }
    }

    public Optional<LotState> lot(LotKey key) {
        return Optional.ofNullable(lots.get(key));
    }

    public LedgerPartitionResult result(int moneyScale) {
        return LedgerPartitionResult.builder()
                .ledgerRows(List.copyOf(ledgerRows))
                .anomalies(List.copyOf(anomalies))
                .cashFlows(List.copyOf(cashFlows))
                .lotSnapshots(lots.values().stream().map(lot -> lot.snapshot(moneyScale)).toList())
                .build();
    }

    private void checkOrdering(LotKey key, TransactionRecord record) {
        TransactionRecord previous = lastApplied.get(key);
        if (previous != null && record.getTimestamp().isBefore(previous.getTimestamp())) {
            throw new DataOrderingException(
                    key, previous.getTimestamp(), record.getTimestamp(), record.getSequence());
        }
    }

    private boolean isModelled(TransactionRecord record) {
        InstrumentType type = record.getInstrumentType();
        return switch (record.getAction()) {
            case DIVIDEND, TAX_WITHHOLDING -> true;
            case BUY, SELL -> type == InstrumentType.STOCK || type == InstrumentType.OPTION;
            case OPTION_EXPIRE -> type == InstrumentType.OPTION;
            case OPTION_ASSIGN -> record.isAssignmentDelivery()
                    ? type == InstrumentType.STOCK || type == InstrumentType.OPTION
                    : type == InstrumentType.STOCK;
        };
    }

    private void acquire(TransactionRecord record, LotState lot) {
        if (lot == null) {
            LotKey key = record.lotKey();
            int splitsInEffect = splitAdjuster.countEffective(
                    key.getInstrumentId(), record.getTimestamp().toLocalDate());
            lot = new LotState(key, record.getInstrumentType(), splitsInEffect);
            lots.put(key, lot);
        } else if (isCurrencyMismatch(record, lot)) {
            flagCurrencyMismatch(record, lot);
            return;
        }

        lot.acquire(record.absQuantity(), record.getUnitPrice(), record.feeOrZero(), record.getCurrency(), mathContext);
        log.debug(
                "{} {} {} @ {} -> open={}, avgCost={}",
                record.getAction(),
                record.lotKey(),
                record.absQuantity().toPlainString(),
                record.getUnitPrice(),
                lot.getOpenQuantity().toPlainString(),
                lot.getAverageUnitCost());
    }

    private void dispose(TransactionRecord record, LotState lot, DisposalType type) {
        if (lot != null && isCurrencyMismatch(record, lot)) {
            flagCurrencyMismatch(record, lot);
            return;
        }

        DisposalOutcome outcome = disposalResolver.resolve(record, lot, type);
        if (!outcome.isResolved()) {
            flag(record, lot, outcome.getAnomalyReason(), outcome.getMessage());
            return;
        }

        LedgerRow row = outcome.getLedgerRow();
        lot.dispose(row.getQuantity());
        ledgerRows.add(row);
        log.debug(
                "{} {} {} @ {} vs avgCost {} -> realized={}, open={}",
                type,
                record.lotKey(),
                row.getQuantity().toPlainString(),
                row.getDisposalPrice(),
                row.getMatchedUnitCost(),
                row.getRealizedGainLoss(),
                lot.getOpenQuantity().toPlainString());
    }

    private void expireIfPast(LotState lot, LocalDate asOfDate, OptionSymbolParser optionSymbolParser) {
        // every lot is opened by an applied record
        TransactionRecord last = lastApplied.get(lot.getKey());
        Optional<LocalDate> parsedExpiry = optionSymbolParser.expiryOf(lot.getKey().getInstrumentId());
        LocalDate expiryDate = parsedExpiry.orElse(last.getTimestamp().toLocalDate());
        if (!expiryDate.isBefore(asOfDate)) {
            return;
        }
        String note = "Expired worthless on " + expiryDate;
        if (parsedExpiry.isEmpty()) {
            log.warn("No expiry in option code {}; using last trade date {}", lot.getKey(), expiryDate);
            note += " (expiry not in code, last trade date used)";
        }

        TransactionRecord expiration = TransactionRecord.builder()
                .sequence(last.getSequence())
                .accountId(lot.getKey().getAccountId())
                .instrumentId(lot.getKey().getInstrumentId())
                .instrumentType(InstrumentType.OPTION)
                .action(TransactionAction.OPTION_EXPIRE)
                .quantity(lot.getOpenQuantity())
                .unitPrice(BigDecimal.ZERO)
                .currency(lot.getCurrency())
                .feeTotal(BigDecimal.ZERO)
                .timestamp(LocalDateTime.of(expiryDate, EXPIRY_CLOSE))
                .build();

        DisposalOutcome outcome = disposalResolver.resolve(expiration, lot, DisposalType.EXPIRATION);
        LedgerRow row = outcome.getLedgerRow().toBuilder()
                .synthetic(true)
                .note(note)
                .build();
        lot.dispose(row.getQuantity());
        ledgerRows.add(row);
        log.info("Auto-expired {} {} contracts of {}, realized={}",
                lot.getKey().getAccountId(), row.getQuantity().toPlainString(),
                lot.getKey().getInstrumentId(), row.getRealizedGainLoss());
    }

    private boolean isCurrencyMismatch(TransactionRecord record, LotState lot) {
        return lot.isOpen() && lot.getCurrency() != null && !lot.getCurrency().equals(record.getCurrency());
    }

    private void flagCurrencyMismatch(TransactionRecord record, LotState lot) {
        flag(record, lot, AnomalyReason.CURRENCY_MISMATCH, String.format(
                "%s in %s against a lot held in %s", record.getAction(), record.getCurrency(), lot.getCurrency()));
    }

    private void flag(TransactionRecord record, LotState lot, AnomalyReason reason, String message) {
        BigDecimal openQuantity = lot == null ? BigDecimal.ZERO : lot.getOpenQuantity();
        anomalies.add(anomalyFlagger.flag(record, reason, openQuantity, message));
    }

    private CashFlowRow toCashFlow(TransactionRecord record) {
        return CashFlowRow.builder()
                .sequence(record.getSequence())
                .accountId(record.getAccountId())
                .instrumentId(record.getInstrumentId())
                .action(record.getAction())
                .amount(record.getAmount())
                .currency(record.getCurrency())
                .timestamp(record.getTimestamp())
                .build();
    }
}
