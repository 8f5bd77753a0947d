package com.taxledger.reporting;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import lombok.Getter;

/**
 * Maps dates to tax years.
 *
 * <p>A tax year is identified by the calendar year it starts in. With the default January start
 * that is simply the calendar year ("2024"); with an April start, 15 May 2024 and 10 Feb 2025
 * both fall in tax year 2024, labelled "2024-25".
 */
@Getter
public class TaxYearPolicy {

    private final Month startMonth;

    public TaxYearPolicy(Month startMonth) {
        this.startMonth = startMonth;
    }

    public static TaxYearPolicy calendarYear() {
        return new TaxYearPolicy(Month.JANUARY);
    }

    public int taxYearOf(LocalDate date) {
        return date.getMonthValue() >= startMonth.getValue() ? date.getYear() : date.getYear() - 1;
    }

    public int taxYearOf(LocalDateTime timestamp) {
        return taxYearOf(timestamp.toLocalDate());
    }

    public String label(int taxYear) {
        if (startMonth == Month.JANUARY) {
            return String.valueOf(taxYear);
        }
        return taxYear + "-" + String.format("%02d", (taxYear + 1) % 100);
    }
}
