package com.taxledger.api.dto.request;

import com.taxledger.domain.enums.InstrumentType;
import com.taxledger.domain.enums.TransactionAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An already normalized transaction. Option prices are per contract here; no multiplier is applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRequest {

    @NotBlank
    private String accountId;

    /** Broker instrument code, e.g. "US.AAPL" or "US.AAPL240419C200000". */
    @NotBlank
    private String instrumentId;

    /** Derived from the instrument code when omitted. */
    private InstrumentType instrumentType;

    @NotNull
    private TransactionAction action;

    /** Unsigned for BUY/SELL; for OPTION_ASSIGN negative means the position was delivered. */
    private BigDecimal quantity;

    private BigDecimal unitPrice;

    @NotBlank
    private String currency;

    private BigDecimal feeTotal;

    /** Must equal {@code currency} when given. */
    private String feeCurrency;

    private BigDecimal amount;

    @NotNull
    private LocalDateTime timestamp;
}
