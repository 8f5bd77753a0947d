package com.taxledger.domain.enums;

/** How an open lot was reduced. */
public enum DisposalType {
    SALE,
    ASSIGNMENT,
    EXPIRATION;

    /** Direction label used in ledger exports. Every disposal reduces a long position. */
    public String direction() {
        return this == SALE ? "SELL" : name();
    }
}
