package com.taxledger.api.dto.response;

import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Result of writing a report folder: the files written plus headline counts. */
@Data
@Builder
public class ReportExportResponse {

    private String runId;
    private String outputDirectory;
    private List<String> files;
    private int ledgerRowCount;
    private int anomalyCount;
}
