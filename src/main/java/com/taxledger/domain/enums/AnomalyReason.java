package com.taxledger.domain.enums;

/** Reason a transaction could not be resolved against the current lot state. */
public enum AnomalyReason {
    /** Disposal quantity exceeds the open position. */
    OVERSELL,

    /** Disposal while the open quantity is zero (pure short sale or missing history). */
    NO_OPENING_POSITION,

    /** Action/instrument combination the ledger does not model. */
    UNRECOGNIZED_INSTRUMENT_TYPE,

    /** Transaction currency differs from the currency of the open lot. */
    CURRENCY_MISMATCH
}
