package com.taxledger.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A stock split or reverse split. Ratio "N:M" means N new shares for every M held
 * ("2:1" doubles the position, "1:2" halves it). Transactions dated on or after
 * {@code effectiveDate} see the post-split position.
 */
@Value
@Builder
public class SplitEvent {

    String instrumentId;
    LocalDate effectiveDate;
    int numerator;
    int denominator;

    public static SplitEvent parse(String instrumentId, LocalDate effectiveDate, String ratio) {
        if (ratio == null || !ratio.contains(":")) {
            throw new IllegalArgumentException("Split ratio must look like N:M, got: " + ratio);
        }
        String[] parts = ratio.trim().split(":");
        int numerator = Integer.parseInt(parts[0].trim());
        int denominator = Integer.parseInt(parts[1].trim());
        if (numerator <= 0 || denominator <= 0) {
            throw new IllegalArgumentException("Split ratio terms must be positive, got: " + ratio);
        }
        return SplitEvent.builder()
                .instrumentId(instrumentId)
                .effectiveDate(effectiveDate)
                .numerator(numerator)
                .denominator(denominator)
                .build();
    }
}
