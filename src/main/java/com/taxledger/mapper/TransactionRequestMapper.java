package com.taxledger.mapper;

import com.taxledger.api.dto.request.TransactionRequest;
import com.taxledger.domain.model.TransactionRecord;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from REST transaction payloads to ledger records. The sequence is the
 * payload's position in the request; fee currency is checked before mapping and not carried.
 */
@Mapper
public interface TransactionRequestMapper {

    @Mapping(target = "sequence", source = "sequence")
    TransactionRecord toRecord(TransactionRequest request, long sequence);
}
