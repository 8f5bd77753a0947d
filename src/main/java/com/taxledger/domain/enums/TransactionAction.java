package com.taxledger.domain.enums;

/**
 * Action carried by a normalized transaction record.
 *
 * <p>Lot-affecting actions (BUY, SELL, OPTION_ASSIGN, OPTION_EXPIRE) are applied by the lot ledger.
 * Cash-flow actions (DIVIDEND, TAX_WITHHOLDING) never touch lot state and are summed separately.
 *
 * <p>OPTION_ASSIGN is the only action whose quantity sign matters: positive quantity means the
 * account received the position (acquisition), negative means it delivered it (disposal).
 */
public enum TransactionAction {
    BUY,
    SELL,
    OPTION_ASSIGN,
    OPTION_EXPIRE,
    DIVIDEND,
    TAX_WITHHOLDING;

    /** True for actions routed to the cash-flow totals instead of the lot ledger. */
    public boolean isCashFlow() {
        return this == DIVIDEND || this == TAX_WITHHOLDING;
    }
}
