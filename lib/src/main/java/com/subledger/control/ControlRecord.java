package com.subledger.control;

import java.math.BigDecimal;

/** A derived-versus-source comparison row produced by one of the reconciliation controls. */
public interface ControlRecord {

    /** Figure taken from the independently sourced feed (zero when the feed has no row). */
    BigDecimal getExpected();

    /** Figure reconstructed by the subledger (zero when nothing was derived). */
    BigDecimal getDerived();

    BigDecimal getDifference();

    ControlStatus getStatus();

    default boolean isBreak() {
        return getStatus().isBreak();
    }
}
