package com.taxledger.service;

import com.taxledger.api.dto.request.TransactionRequest;
import com.taxledger.api.dto.response.ReportExportResponse;
import com.taxledger.core.engine.TaxLotEngine;
import com.taxledger.domain.model.OptionContract;
import com.taxledger.domain.model.TaxRunResult;
import com.taxledger.domain.model.TransactionRecord;
import com.taxledger.exception.ResourceNotFoundException;
import com.taxledger.export.ReportWriter;
import com.taxledger.importer.CsvTransactionImporter;
import com.taxledger.importer.TransactionRecordValidator;
import com.taxledger.instrument.OptionSymbolParser;
import com.taxledger.mapper.TransactionRequestMapper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point shared by the REST API and the batch runner: normalizes input, runs the engine and,
 * for report requests, writes the report folder.
 */
@Service
public class TaxCalculationService {

    private static final Logger log = LoggerFactory.getLogger(TaxCalculationService.class);

    private final TaxLotEngine taxLotEngine;
    private final CsvTransactionImporter csvTransactionImporter;
    private final TransactionRecordValidator transactionRecordValidator;
    private final OptionSymbolParser optionSymbolParser;
    private final ReportWriter reportWriter;
    private final TransactionRequestMapper transactionRequestMapper = Mappers.getMapper(TransactionRequestMapper.class);

    public TaxCalculationService(
            TaxLotEngine taxLotEngine,
            CsvTransactionImporter csvTransactionImporter,
            TransactionRecordValidator transactionRecordValidator,
            OptionSymbolParser optionSymbolParser,
            ReportWriter reportWriter) {
        this.taxLotEngine = taxLotEngine;
        this.csvTransactionImporter = csvTransactionImporter;
        this.transactionRecordValidator = transactionRecordValidator;
        this.optionSymbolParser = optionSymbolParser;
        this.reportWriter = reportWriter;
    }

    /**
     * Runs already normalized transactions in the order given. Unlike CSV input they are not
     * sorted, so out-of-order history for a lot fails the run.
     */
    public TaxRunResult run(List<TransactionRequest> requests) {
        List<TransactionRecord> records = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            TransactionRequest request = requests.get(i);
            long sequence = i + 1L;
            transactionRecordValidator.validateFeeCurrency(sequence, request.getCurrency(), request.getFeeCurrency());

            TransactionRecord record = transactionRequestMapper.toRecord(request, sequence);
            if (record.getInstrumentType() == null) {
                record = record.toBuilder()
                        .instrumentType(optionSymbolParser.classify(record.getInstrumentId()))
                        .build();
            }
            records.add(record);
        }
        transactionRecordValidator.validateAll(records);
        return taxLotEngine.run(records);
    }

    public TaxRunResult runCsv(String csv) {
        return taxLotEngine.run(csvTransactionImporter.importCsv(csv));
    }

    public TaxRunResult runFiles(List<Path> files) {
        return taxLotEngine.run(csvTransactionImporter.importFiles(files));
    }

    public ReportExportResponse exportReports(String csv, Path outputDir) {
        return export(runCsv(csv), outputDir);
    }

    public ReportExportResponse export(TaxRunResult result, Path outputDir) {
        List<Path> files = reportWriter.writeAll(result, outputDir);
        if (result.hasAnomalies()) {
            log.warn(
                    "Run {} has {} anomalies; review {} before filing",
                    result.getRunId(),
                    result.getAnomalies().size(),
                    outputDir.resolve(ReportWriter.ANOMALY_FILE));
        }
        return ReportExportResponse.builder()
                .runId(result.getRunId())
                .outputDirectory(outputDir.toAbsolutePath().toString())
                .files(files.stream().map(path -> path.getFileName().toString()).toList())
                .ledgerRowCount(result.getLedgerRows().size())
                .anomalyCount(result.getAnomalies().size())
                .build();
    }

    public OptionContract parseOption(String code) {
        return optionSymbolParser.parse(code)
                .orElseThrow(() -> new ResourceNotFoundException("Option contract", code));
    }
}
