package com.taxledger.core.engine;

import com.taxledger.config.LedgerConfig;
import com.taxledger.domain.model.AnomalyRecord;
import com.taxledger.domain.model.CashFlowRow;
import com.taxledger.domain.model.LedgerRow;
import com.taxledger.domain.model.LotKey;
import com.taxledger.domain.model.LotSnapshot;
import com.taxledger.domain.model.TaxRunResult;
import com.taxledger.domain.model.TransactionRecord;
import com.taxledger.event.EventPublisherHelper;
import com.taxledger.instrument.OptionSymbolParser;
import com.taxledger.ledger.AnomalyFlagger;
import com.taxledger.ledger.DisposalResolver;
import com.taxledger.ledger.LedgerPartitionResult;
import com.taxledger.ledger.LotLedger;
import com.taxledger.ledger.SplitAdjuster;
import com.taxledger.reporting.AnnualAggregator;
import com.taxledger.reporting.CashFlowAggregator;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the lot ledger over a full transaction stream.
 *
 * <p>Records are partitioned by (account, instrument) with input order kept inside each
 * partition. Each partition gets its own {@link LotLedger}, so partitions share no state and can
 * run on the {@code ledgerExecutor} when {@code taxledger.ledger.parallel} is set. Partition
 * outputs are merged by (timestamp, sequence), which makes the result identical whichever way
 * the partitions were run.
 *
 * <p>A {@link com.taxledger.exception.DataOrderingException} from any partition fails the whole
 * run; no partial result is returned.
 */
@Service
public class TaxLotEngine {

    private static final Logger log = LoggerFactory.getLogger(TaxLotEngine.class);

    private static final Comparator<LedgerRow> LEDGER_ORDER = Comparator.comparing(LedgerRow::getTimestamp)
            .thenComparingLong(row -> row.getRecord().getSequence());

    private static final Comparator<AnomalyRecord> ANOMALY_ORDER = Comparator.comparing(
                    (AnomalyRecord anomaly) -> anomaly.getRecord().getTimestamp())
            .thenComparingLong(anomaly -> anomaly.getRecord().getSequence());

    private static final Comparator<CashFlowRow> CASH_FLOW_ORDER =
            Comparator.comparing(CashFlowRow::getTimestamp).thenComparingLong(CashFlowRow::getSequence);

    private static final Comparator<LotSnapshot> SNAPSHOT_ORDER =
            Comparator.comparing(LotSnapshot::getAccountId).thenComparing(LotSnapshot::getInstrumentId);

    private final LedgerConfig ledgerConfig;
    private final DisposalResolver disposalResolver;
    private final AnomalyFlagger anomalyFlagger;
    private final AnnualAggregator annualAggregator;
    private final CashFlowAggregator cashFlowAggregator;
    private final OptionSymbolParser optionSymbolParser;
    private final Executor ledgerExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public TaxLotEngine(
            LedgerConfig ledgerConfig,
            DisposalResolver disposalResolver,
            AnomalyFlagger anomalyFlagger,
            AnnualAggregator annualAggregator,
            CashFlowAggregator cashFlowAggregator,
            OptionSymbolParser optionSymbolParser,
            @Qualifier("ledgerExecutor") Executor ledgerExecutor,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.ledgerConfig = ledgerConfig;
        this.disposalResolver = disposalResolver;
        this.anomalyFlagger = anomalyFlagger;
        this.annualAggregator = annualAggregator;
        this.cashFlowAggregator = cashFlowAggregator;
        this.optionSymbolParser = optionSymbolParser;
        this.ledgerExecutor = ledgerExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public TaxRunResult run(List<TransactionRecord> records) {
        long started = System.nanoTime();
        String runId = UUID.randomUUID().toString();
        Map<LotKey, List<TransactionRecord>> partitions = partition(records);
        LocalDate asOfDate = asOfDate();
        log.info(
                "Tax run {} started: {} transactions in {} lots, parallel={}, asOf={}",
                runId,
                records.size(),
                partitions.size(),
                ledgerConfig.isParallel(),
                asOfDate);

        List<LedgerPartitionResult> partitionResults;
        try {
            partitionResults = ledgerConfig.isParallel()
                    ? runParallel(partitions, asOfDate)
                    : partitions.values().stream()
                            .map(partition -> runPartition(partition, asOfDate))
                            .toList();
        } catch (RuntimeException e) {
            log.error("Tax run {} failed: {}", runId, e.getMessage());
            eventPublisherHelper.publishRunFailed(this, records.size(), e);
            throw e;
        }

        TaxRunResult result = merge(runId, records.size(), partitionResults);
        long elapsed = System.nanoTime() - started;
        log.info(
                "Tax run {} completed: {} ledger rows, {} anomalies, {} cash flows in {} ms",
                runId,
                result.getLedgerRows().size(),
                result.getAnomalies().size(),
                result.getCashFlows().size(),
                elapsed / 1_000_000);
        eventPublisherHelper.publishRunCompleted(this, result, elapsed);
        return result;
    }

    private Map<LotKey, List<TransactionRecord>> partition(List<TransactionRecord> records) {
        Map<LotKey, List<TransactionRecord>> partitions = new LinkedHashMap<>();
        for (TransactionRecord record : records) {
            partitions.computeIfAbsent(record.lotKey(), key -> new ArrayList<>()).add(record);
        }
        return partitions;
    }

    private List<LedgerPartitionResult> runParallel(
            Map<LotKey, List<TransactionRecord>> partitions, LocalDate asOfDate) {
        List<CompletableFuture<LedgerPartitionResult>> futures = partitions.values().stream()
                .map(partition -> CompletableFuture.supplyAsync(() -> runPartition(partition, asOfDate), ledgerExecutor))
                .toList();
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private LedgerPartitionResult runPartition(List<TransactionRecord> partition, LocalDate asOfDate) {
        LotLedger ledger = new LotLedger(
                disposalResolver,
                anomalyFlagger,
                new SplitAdjuster(ledgerConfig.splitEvents()),
                ledgerConfig.mathContext());
        partition.forEach(ledger::apply);
        ledger.finish(asOfDate, ledgerConfig.isAutoExpireOptions(), optionSymbolParser);
        return ledger.result(ledgerConfig.getMoneyScale());
    }

    private TaxRunResult merge(String runId, int transactionCount, List<LedgerPartitionResult> partitionResults) {
        List<LedgerRow> ledgerRows = partitionResults.stream()
                .flatMap(result -> result.getLedgerRows().stream())
                .sorted(LEDGER_ORDER)
                .toList();
        List<AnomalyRecord> anomalies = partitionResults.stream()
                .flatMap(result -> result.getAnomalies().stream())
                .sorted(ANOMALY_ORDER)
                .toList();
        List<CashFlowRow> cashFlows = partitionResults.stream()
                .flatMap(result -> result.getCashFlows().stream())
                .sorted(CASH_FLOW_ORDER)
                .toList();
        List<LotSnapshot> lotSnapshots = partitionResults.stream()
                .flatMap(result -> result.getLotSnapshots().stream())
                .sorted(SNAPSHOT_ORDER)
                .toList();

        return TaxRunResult.builder()
                .runId(runId)
                .transactionCount(transactionCount)
                .ledgerRows(ledgerRows)
                .annualSummaries(annualAggregator.aggregate(ledgerRows))
                .anomalies(anomalies)
                .cashFlows(cashFlows)
                .annualCashFlows(cashFlowAggregator.aggregate(cashFlows))
                .lotSnapshots(lotSnapshots)
                .build();
    }

    private LocalDate asOfDate() {
        return ledgerConfig.getAsOfDate() != null ? ledgerConfig.getAsOfDate() : LocalDate.now(clock);
    }
}
