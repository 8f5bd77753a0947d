package com.taxledger.exception;

import java.util.Map;

/** A requested report folder lies outside the configured report root. */
public class InvalidReportPathException extends BaseException {

    public InvalidReportPathException(String requested) {
        super(
                ErrorCode.BAD_REQUEST,
                String.format("Report folder '%s' is outside the report root", requested),
                Map.of("outputDir", requested));
    }
}
