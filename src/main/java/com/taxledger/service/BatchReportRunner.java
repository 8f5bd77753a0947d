package com.taxledger.service;

import com.taxledger.api.dto.response.ReportExportResponse;
import com.taxledger.config.BatchConfig;
import com.taxledger.domain.model.AnnualSummaryRow;
import com.taxledger.domain.model.TaxRunResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Startup batch run over broker exports on disk, enabled with {@code taxledger.batch.enabled=true}.
 *
 * <p>Required input files must exist; optional ones (an RSU vesting history, say) are merged in
 * when present and skipped with a log line otherwise. A failure aborts startup.
 */
@Component
@ConditionalOnProperty(prefix = "taxledger.batch", name = "enabled", havingValue = "true")
public class BatchReportRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchReportRunner.class);

    private final BatchConfig batchConfig;
    private final TaxCalculationService taxCalculationService;

    public BatchReportRunner(BatchConfig batchConfig, TaxCalculationService taxCalculationService) {
        this.batchConfig = batchConfig;
        this.taxCalculationService = taxCalculationService;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<Path> inputs = resolveInputs();
        log.info("Batch tax run over {}", inputs);

        TaxRunResult result = taxCalculationService.runFiles(inputs);
        ReportExportResponse export = taxCalculationService.export(result, Path.of(batchConfig.getOutputDir()));

        for (AnnualSummaryRow summary : result.getAnnualSummaries()) {
            log.info(
                    "{} {} {}: realized {} (stock {}, option {}) over {} disposals",
                    summary.getAccountId(),
                    summary.getTaxYearLabel(),
                    summary.getCurrency(),
                    summary.getTotalGainLoss().toPlainString(),
                    summary.getStockGainLoss().toPlainString(),
                    summary.getOptionGainLoss().toPlainString(),
                    summary.getDisposalCount());
        }
        log.info("Batch tax run {} wrote {} to {}", export.getRunId(), export.getFiles(), export.getOutputDirectory());
    }

    List<Path> resolveInputs() {
        List<Path> inputs = new ArrayList<>();
        for (String file : batchConfig.getInputFiles()) {
            Path path = Path.of(file);
            if (!Files.isRegularFile(path)) {
                throw new IllegalStateException("Batch input file not found: " + path.toAbsolutePath());
            }
            inputs.add(path);
        }
        for (String file : batchConfig.getOptionalInputFiles()) {
            Path path = Path.of(file);
            if (Files.isRegularFile(path)) {
                inputs.add(path);
            } else {
                log.info("Optional batch input {} not present; skipped", path);
            }
        }
        if (inputs.isEmpty()) {
            throw new IllegalStateException("taxledger.batch.enabled is set but no input files were found");
        }
        return inputs;
    }
}
