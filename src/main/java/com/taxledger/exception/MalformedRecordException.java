package com.taxledger.exception;

import java.util.Map;

/** An input row is missing fields or carries values the ledger cannot accept. Raised before the engine runs. */
public class MalformedRecordException extends BaseException {

    public MalformedRecordException(String message) {
        super(ErrorCode.MALFORMED_RECORD, message);
    }

    public MalformedRecordException(String message, Map<String, Object> details) {
        super(ErrorCode.MALFORMED_RECORD, message, details);
    }

    public MalformedRecordException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.MALFORMED_RECORD, message, details, cause);
    }
}
