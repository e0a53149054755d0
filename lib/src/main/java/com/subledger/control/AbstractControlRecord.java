package com.subledger.control;

import java.math.BigDecimal;
import java.util.Objects;

/** Holds the compared figures; {@code difference = derived - expected}. */
abstract class AbstractControlRecord implements ControlRecord {
    private final BigDecimal expected;
    private final BigDecimal derived;
    private final BigDecimal difference;
    private final ControlStatus status;

    AbstractControlRecord(BigDecimal expected, BigDecimal derived, ControlStatus status) {
        this.expected = Objects.requireNonNull(expected, "expected");
        this.derived = Objects.requireNonNull(derived, "derived");
        this.difference = derived.subtract(expected);
        this.status = Objects.requireNonNull(status, "status");
    }

    @Override
    public BigDecimal getExpected() {
        return expected;
    }

    @Override
    public BigDecimal getDerived() {
        return derived;
    }

    @Override
    public BigDecimal getDifference() {
        return difference;
    }

    @Override
    public ControlStatus getStatus() {
        return status;
    }
}
