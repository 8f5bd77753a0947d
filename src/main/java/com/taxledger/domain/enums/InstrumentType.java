package com.taxledger.domain.enums;

/**
 * Instrument classes the ledger knows how to account for.
 * UNSUPPORTED covers anything else the broker export may contain (warrants, futures, structured products).
 */
public enum InstrumentType {
    STOCK,
    OPTION,
    UNSUPPORTED
}
