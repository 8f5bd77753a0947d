package com.taxledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    MALFORMED_RECORD("MALFORMED_RECORD", 400),
    NOT_FOUND("NOT_FOUND", 404),
    DATA_ORDERING_ERROR("DATA_ORDERING_ERROR", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    REPORT_EXPORT_ERROR("REPORT_EXPORT_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
