package com.taxledger.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a completed run produces. Anomalies are always reported next to the resolved rows,
 * never merged into them.
 */
@Value
@Builder
public class TaxRunResult {

    String runId;
    int transactionCount;
    List<LedgerRow> ledgerRows;
    List<AnnualSummaryRow> annualSummaries;
    List<AnomalyRecord> anomalies;
    List<CashFlowRow> cashFlows;
    List<AnnualCashFlowRow> annualCashFlows;
    List<LotSnapshot> lotSnapshots;

    public boolean hasAnomalies() {
        return anomalies != null && !anomalies.isEmpty();
    }
}
