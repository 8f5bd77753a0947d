package com.taxledger.mapper;

import com.taxledger.domain.model.AnnualSummaryRow;
import com.taxledger.domain.model.AnomalyRecord;
import com.taxledger.domain.model.CashFlowRow;
import com.taxledger.domain.model.LedgerRow;
import com.taxledger.export.AnomalyExportRow;
import com.taxledger.export.CashFlowExportRow;
import com.taxledger.export.LedgerExportRow;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from run results to the flat CSV rows written by the report writer.
 */
@Mapper
public interface LedgerExportMapper {

    String EXECUTED_AT_FORMAT = "yyyy-MM-dd HH:mm:ss";

    @Mapping(source = "record.accountId", target = "accountId")
    @Mapping(source = "record.instrumentId", target = "instrumentCode")
    @Mapping(source = "record.instrumentType", target = "instrumentType")
    @Mapping(target = "direction", expression = "java(row.getDisposalType().direction())")
    @Mapping(source = "disposalPrice", target = "executionPrice")
    @Mapping(source = "record.timestamp", target = "executedAt", dateFormat = EXECUTED_AT_FORMAT)
    LedgerExportRow toLedgerRow(LedgerRow row);

    List<LedgerExportRow> toLedgerRows(List<LedgerRow> rows);

    @Mapping(source = "record.sequence", target = "sequence")
    @Mapping(source = "record.accountId", target = "accountId")
    @Mapping(source = "record.instrumentId", target = "instrumentCode")
    @Mapping(source = "record.action", target = "action")
    @Mapping(source = "record.quantity", target = "quantity")
    @Mapping(source = "record.unitPrice", target = "price")
    @Mapping(source = "record.currency", target = "currency")
    @Mapping(source = "record.timestamp", target = "executedAt", dateFormat = EXECUTED_AT_FORMAT)
    AnomalyExportRow toAnomalyRow(AnomalyRecord anomaly);

    List<AnomalyExportRow> toAnomalyRows(List<AnomalyRecord> anomalies);

    @Mapping(source = "instrumentId", target = "instrumentCode")
    @Mapping(source = "timestamp", target = "executedAt", dateFormat = EXECUTED_AT_FORMAT)
    @Mapping(target = "taxYear", ignore = true)
    CashFlowExportRow toCashFlowRow(CashFlowRow cashFlow);

    List<CashFlowExportRow> toCashFlowRows(List<CashFlowRow> cashFlows);

    /** Closing line of a yearly report: totals for one account and currency. */
    default LedgerExportRow toSummaryRow(AnnualSummaryRow summary) {
        return LedgerExportRow.builder()
                .accountId(summary.getAccountId())
                .direction("SUMMARY")
                .currency(summary.getCurrency())
                .feeTotal(summary.getTotalFees())
                .proceeds(summary.getTotalProceeds())
                .costBasis(summary.getTotalCostBasis())
                .realizedGainLoss(summary.getTotalGainLoss())
                .note(String.format(
                        "Tax year %s: stock %s, option %s, %d disposals",
                        summary.getTaxYearLabel(),
                        summary.getStockGainLoss().toPlainString(),
                        summary.getOptionGainLoss().toPlainString(),
                        summary.getDisposalCount()))
                .build();
    }
}
