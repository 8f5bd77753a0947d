package com.taxledger.domain.model;

import com.taxledger.domain.enums.InstrumentType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Immutable view of a lot at the end of a run. */
@Value
@Builder
public class LotSnapshot {

    String accountId;
    String instrumentId;
    InstrumentType instrumentType;
    BigDecimal openQuantity;
    BigDecimal averageUnitCost;
    String currency;
}
