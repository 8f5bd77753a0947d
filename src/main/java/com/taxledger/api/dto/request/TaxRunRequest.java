package com.taxledger.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Transactions for one tax run. They are applied in the order given; a lot whose transactions
 * go back in time fails the run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaxRunRequest {

    @NotEmpty
    @Valid
    private List<TransactionRequest> transactions;
}
