package com.taxledger.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope applied to every {@code /api} response by {@link com.taxledger.config.ApiResponseAdvice}.
 *
 * <p>{@code warnings} counts anomalies in a tax run result. A run with anomalies still succeeds;
 * the count tells clients to look at the anomaly list before filing.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final int warnings;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data, int warnings) {
        this.success = true;
        this.warnings = warnings;
        this.data = data;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, 0);
    }

    public static <T> ApiResponse<T> withWarnings(T data, int warnings) {
        return new ApiResponse<>(data, warnings);
    }
}
