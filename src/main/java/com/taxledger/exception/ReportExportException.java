package com.taxledger.exception;

public class ReportExportException extends BaseException {

    public ReportExportException(String message, Throwable cause) {
        super(ErrorCode.REPORT_EXPORT_ERROR, message, cause);
    }
}
