package com.taxledger.reporting;

import com.taxledger.domain.enums.TransactionAction;
import com.taxledger.domain.model.AnnualCashFlowRow;
import com.taxledger.domain.model.CashFlowRow;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Sums dividends and withholding tax per account, tax year and currency.
 * Withholding is reported as a positive amount whatever sign the broker used.
 */
@Component
public class CashFlowAggregator {

    private static final Comparator<CashFlowKey> KEY_ORDER = Comparator.comparing(CashFlowKey::accountId)
            .thenComparingInt(CashFlowKey::taxYear)
            .thenComparing(CashFlowKey::currency);

    private final TaxYearPolicy taxYearPolicy;

    public CashFlowAggregator(TaxYearPolicy taxYearPolicy) {
        this.taxYearPolicy = taxYearPolicy;
    }

    public List<AnnualCashFlowRow> aggregate(Collection<CashFlowRow> cashFlows) {
        Map<CashFlowKey, List<CashFlowRow>> grouped = cashFlows.stream()
                .collect(Collectors.groupingBy(
                        row -> new CashFlowKey(
                                row.getAccountId(), taxYearPolicy.taxYearOf(row.getTimestamp()), row.getCurrency()),
                        () -> new TreeMap<>(KEY_ORDER),
                        Collectors.toList()));

        return grouped.entrySet().stream()
                .map(entry -> {
                    BigDecimal dividends = total(entry.getValue(), TransactionAction.DIVIDEND);
                    BigDecimal withholding = total(entry.getValue(), TransactionAction.TAX_WITHHOLDING);
                    CashFlowKey key = entry.getKey();
                    return AnnualCashFlowRow.builder()
                            .accountId(key.accountId())
                            .taxYear(key.taxYear())
                            .taxYearLabel(taxYearPolicy.label(key.taxYear()))
                            .currency(key.currency())
                            .dividends(dividends)
                            .withholding(withholding)
                            .net(dividends.subtract(withholding))
                            .build();
                })
                .toList();
    }

    private BigDecimal total(List<CashFlowRow> rows, TransactionAction action) {
        return rows.stream()
                .filter(row -> row.getAction() == action)
                .map(row -> row.getAmount() == null ? BigDecimal.ZERO : row.getAmount().abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private record CashFlowKey(String accountId, int taxYear, String currency) {}
}
