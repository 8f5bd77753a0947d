package com.taxledger.domain.model;

import lombok.Value;

/** Identifies one lot: the position in a single instrument within a single account. */
@Value
public class LotKey {

    String accountId;
    String instrumentId;

    public static LotKey of(String accountId, String instrumentId) {
        return new LotKey(accountId, instrumentId);
    }

    @Override
    public String toString() {
        return accountId + ":" + instrumentId;
    }
}
