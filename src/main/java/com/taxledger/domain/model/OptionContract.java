package com.taxledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * An option contract decoded from a broker code such as {@code US.AAPL240419C200000}:
 * market US, underlying AAPL, expiry 2024-04-19, call, strike 200.000.
 */
@Value
@Builder
public class OptionContract {

    String code;

    /** "US", "HK", or null when the code carries no market prefix. */
    String market;

    String underlying;
    LocalDate expiry;

    /** 'C' or 'P'. */
    char right;

    BigDecimal strike;
}
