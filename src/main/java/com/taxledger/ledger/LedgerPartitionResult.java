package com.taxledger.ledger;

import com.taxledger.domain.model.AnomalyRecord;
import com.taxledger.domain.model.CashFlowRow;
import com.taxledger.domain.model.LedgerRow;
import com.taxledger.domain.model.LotSnapshot;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Output of one lot ledger, merged with the other partitions by the engine. */
@Value
@Builder
public class LedgerPartitionResult {

    List<LedgerRow> ledgerRows;
    List<AnomalyRecord> anomalies;
    List<CashFlowRow> cashFlows;
    List<LotSnapshot> lotSnapshots;
}
