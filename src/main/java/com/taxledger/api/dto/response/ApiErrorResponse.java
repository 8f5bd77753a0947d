package com.taxledger.api.dto.response;

import com.taxledger.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Error envelope rendered by {@link com.taxledger.exception.GlobalExceptionHandler}. */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Getter
    @Builder
    public static class ErrorDetail {

        private final String code;
        private final int status;
        private final String message;

        /** Field errors for validation failures; lot and timestamps for ordering failures. */
        private final Map<String, Object> details;

        private final Instant timestamp;
        private final String path;
    }
}
