package com.taxledger.api.controller;

import com.taxledger.api.dto.request.TaxRunRequest;
import com.taxledger.api.dto.response.ReportExportResponse;
import com.taxledger.domain.model.OptionContract;
import com.taxledger.domain.model.TaxRunResult;
import com.taxledger.export.ReportFolderResolver;
import com.taxledger.service.TaxCalculationService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for tax runs.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/tax/runs: normalized transactions as JSON, applied in the order given</li>
 *   <li>POST /api/tax/runs/csv: broker export as text/csv, sorted by execution time</li>
 *   <li>POST /api/tax/reports?outputDir=: broker export as text/csv, writes a report folder
 *       under {@code taxledger.batch.output-dir}</li>
 *   <li>GET /api/tax/options/{code}: decodes an option contract code</li>
 * </ul>
 *
 * <p>Anomalies never fail a run; they are returned next to the ledger.
 */
@RestController
@RequestMapping("/api/tax")
public class TaxRunController {

    private final TaxCalculationService taxCalculationService;
    private final ReportFolderResolver reportFolderResolver;

    public TaxRunController(
            TaxCalculationService taxCalculationService, ReportFolderResolver reportFolderResolver) {
        this.taxCalculationService = taxCalculationService;
        this.reportFolderResolver = reportFolderResolver;
    }

    @PostMapping("/runs")
    public ResponseEntity<TaxRunResult> run(@Valid @RequestBody TaxRunRequest request) {
        return ResponseEntity.ok(taxCalculationService.run(request.getTransactions()));
    }

    @PostMapping(value = "/runs/csv", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<TaxRunResult> runCsv(@RequestBody String csv) {
        return ResponseEntity.ok(taxCalculationService.runCsv(csv));
    }

    @PostMapping(value = "/reports", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<ReportExportResponse> exportReports(
            @RequestBody String csv, @RequestParam(required = false) String outputDir) {
        return ResponseEntity.ok(
                taxCalculationService.exportReports(csv, reportFolderResolver.resolve(outputDir)));
    }

    @GetMapping("/options/{code}")
    public ResponseEntity<OptionContract> getOption(@PathVariable String code) {
        return ResponseEntity.ok(taxCalculationService.parseOption(code));
    }
}
