package com.taxledger.export;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.taxledger.domain.model.AnnualCashFlowRow;
import com.taxledger.domain.model.AnnualSummaryRow;
import com.taxledger.domain.model.LedgerRow;
import com.taxledger.domain.model.TaxRunResult;
import com.taxledger.exception.ReportExportException;
import com.taxledger.mapper.LedgerExportMapper;
import com.taxledger.reporting.TaxYearPolicy;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes the report folder for a run:
 * <ul>
 *   <li>{@code ledger.csv}: every disposal in ledger order</li>
 *   <li>{@code {taxYear}_report.csv}: the year's disposals followed by one summary line per
 *       account and currency</li>
 *   <li>{@code anomalies.csv}: transactions that need manual review</li>
 *   <li>{@code cash_flow.csv}: dividends and withholding, then yearly totals</li>
 * </ul>
 *
 * <p>Amounts are written in plain notation. Existing files with the same names are overwritten.
 */
@Component
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    public static final String LEDGER_FILE = "ledger.csv";
    public static final String ANOMALY_FILE = "anomalies.csv";
    public static final String CASH_FLOW_FILE = "cash_flow.csv";
    public static final String ANNUAL_REPORT_SUFFIX = "_report.csv";

    private final TaxYearPolicy taxYearPolicy;
    private final LedgerExportMapper ledgerExportMapper = Mappers.getMapper(LedgerExportMapper.class);
    private final CsvMapper csvMapper;

    public ReportWriter(TaxYearPolicy taxYearPolicy) {
        this.taxYearPolicy = taxYearPolicy;
        this.csvMapper = CsvMapper.builder()
                .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
                .build();
    }

    /**
     * @return the files written, in writing order
     * @throws ReportExportException if the folder or any file cannot be written
     */
    public List<Path> writeAll(TaxRunResult result, Path outputDir) {
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ReportExportException("Cannot create report folder " + outputDir, e);
        }

        written.add(write(
                outputDir.resolve(LEDGER_FILE),
                LedgerExportRow.class,
                ledgerExportMapper.toLedgerRows(result.getLedgerRows())));

        Map<Integer, List<LedgerRow>> rowsByYear = result.getLedgerRows().stream()
                .collect(Collectors.groupingBy(
                        row -> taxYearPolicy.taxYearOf(row.getTimestamp()), TreeMap::new, Collectors.toList()));
        Map<Integer, List<AnnualSummaryRow>> summariesByYear = result.getAnnualSummaries().stream()
                .collect(Collectors.groupingBy(AnnualSummaryRow::getTaxYear));
        rowsByYear.forEach((taxYear, rows) -> {
            List<LedgerExportRow> lines = new ArrayList<>(ledgerExportMapper.toLedgerRows(rows));
            summariesByYear.getOrDefault(taxYear, List.of()).stream()
                    .map(ledgerExportMapper::toSummaryRow)
                    .forEach(lines::add);
            Path file = outputDir.resolve(taxYearPolicy.label(taxYear) + ANNUAL_REPORT_SUFFIX);
            written.add(write(file, LedgerExportRow.class, lines));
        });

        written.add(write(
                outputDir.resolve(ANOMALY_FILE),
                AnomalyExportRow.class,
                ledgerExportMapper.toAnomalyRows(result.getAnomalies())));

        List<CashFlowExportRow> cashFlowLines = new ArrayList<>(ledgerExportMapper.toCashFlowRows(result.getCashFlows()));
        result.getAnnualCashFlows().forEach(total -> cashFlowLines.addAll(totalLines(total)));
        written.add(write(outputDir.resolve(CASH_FLOW_FILE), CashFlowExportRow.class, cashFlowLines));

        log.info("Run {}: wrote {} report files to {}", result.getRunId(), written.size(), outputDir);
        return written;
    }

    private <T> Path write(Path file, Class<T> rowType, List<T> rows) {
        ObjectWriter writer = csvMapper.writer(csvMapper.schemaFor(rowType).withHeader());
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                SequenceWriter sequence = writer.writeValues(out)) {
            sequence.writeAll(rows);
        } catch (IOException e) {
            throw new ReportExportException("Cannot write " + file, e);
        }
        log.debug("Wrote {} rows to {}", rows.size(), file);
        return file;
    }

    private List<CashFlowExportRow> totalLines(AnnualCashFlowRow total) {
        return List.of(
                totalLine(total, "DIVIDEND_TOTAL", total.getDividends()),
                totalLine(total, "WITHHOLDING_TOTAL", total.getWithholding()),
                totalLine(total, "NET", total.getNet()));
    }

    private CashFlowExportRow totalLine(AnnualCashFlowRow total, String action, BigDecimal amount) {
        return CashFlowExportRow.builder()
                .accountId(total.getAccountId())
                .taxYear(total.getTaxYearLabel())
                .action(action)
                .amount(amount)
                .currency(total.getCurrency())
                .build();
    }
}
