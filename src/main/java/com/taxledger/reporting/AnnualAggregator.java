package com.taxledger.reporting;

import com.taxledger.domain.enums.InstrumentType;
import com.taxledger.domain.model.AnnualSummaryRow;
import com.taxledger.domain.model.LedgerRow;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Groups resolved disposals by account, tax year and currency and sums realized gain/loss,
 * with separate stock and option subtotals.
 *
 * <p>Pure: the same rows always produce the same summaries, in any input order. Amounts in
 * different currencies are never added together; conversion is left to the report consumer.
 */
@Component
public class AnnualAggregator {

    private static final Logger log = LoggerFactory.getLogger(AnnualAggregator.class);

    private static final Comparator<SummaryKey> KEY_ORDER = Comparator.comparing(SummaryKey::accountId)
            .thenComparingInt(SummaryKey::taxYear)
            .thenComparing(SummaryKey::currency);

    private final TaxYearPolicy taxYearPolicy;

    public AnnualAggregator(TaxYearPolicy taxYearPolicy) {
        this.taxYearPolicy = taxYearPolicy;
    }

    public List<AnnualSummaryRow> aggregate(Collection<LedgerRow> ledgerRows) {
        Map<SummaryKey, List<LedgerRow>> grouped = ledgerRows.stream()
                .collect(Collectors.groupingBy(
                        row -> new SummaryKey(
                                row.getAccountId(), taxYearPolicy.taxYearOf(row.getTimestamp()), row.getCurrency()),
                        () -> new TreeMap<>(KEY_ORDER),
                        Collectors.toList()));

        List<AnnualSummaryRow> summaries = grouped.entrySet().stream()
                .map(entry -> summarize(entry.getKey(), entry.getValue()))
                .toList();

        log.debug("Aggregated {} ledger rows into {} annual summaries", ledgerRows.size(), summaries.size());
        return summaries;
    }

    private AnnualSummaryRow summarize(SummaryKey key, List<LedgerRow> rows) {
        BigDecimal stock = sum(rows, InstrumentType.STOCK);
        BigDecimal option = sum(rows, InstrumentType.OPTION);

        return AnnualSummaryRow.builder()
                .accountId(key.accountId())
                .taxYear(key.taxYear())
                .taxYearLabel(taxYearPolicy.label(key.taxYear()))
                .currency(key.currency())
                .totalGainLoss(stock.add(option))
                .stockGainLoss(stock)
                .optionGainLoss(option)
                .totalProceeds(rows.stream().map(LedgerRow::getProceeds).reduce(BigDecimal.ZERO, BigDecimal::add))
                .totalCostBasis(rows.stream().map(LedgerRow::getCostBasis).reduce(BigDecimal.ZERO, BigDecimal::add))
                .totalFees(rows.stream().map(LedgerRow::getFeeTotal).reduce(BigDecimal.ZERO, BigDecimal::add))
                .disposalCount(rows.size())
                .build();
    }

    private BigDecimal sum(List<LedgerRow> rows, InstrumentType type) {
        return rows.stream()
                .filter(row -> row.getRecord().getInstrumentType() == type)
                .map(LedgerRow::getRealizedGainLoss)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private record SummaryKey(String accountId, int taxYear, String currency) {}
}
