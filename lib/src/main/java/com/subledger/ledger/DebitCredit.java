package com.subledger.ledger;

import java.math.BigDecimal;

public enum DebitCredit {
    DR,
    CR;

    /** Debits count positive, credits negative. */
    public BigDecimal sign(BigDecimal amount) {
        return this == DR ? amount : amount.negate();
    }
}
