package com.subledger.ledger;

public enum PostingType {
    PURCHASE,
    SALE,
    SALE_PNL,
    MTM,
    MTM_REVERSAL;

    public boolean isTradePosting() {
        return this == PURCHASE || this == SALE || this == SALE_PNL;
    }
}
