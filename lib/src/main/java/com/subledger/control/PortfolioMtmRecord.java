package com.subledger.control;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** Total front-office MTM of one currency on one date against the total revaluation balance. */
public final class PortfolioMtmRecord extends AbstractControlRecord {
    private final LocalDate date;
    private final String currency;

    public PortfolioMtmRecord(
            LocalDate date, String currency, BigDecimal foTotal, BigDecimal glTotal, ControlStatus status) {
        super(foTotal, glTotal, status);
        this.date = Objects.requireNonNull(date, "date");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public LocalDate getDate() {
        return date;
    }

    public String getCurrency() {
        return currency;
    }

    public BigDecimal getFoTotal() {
        return getExpected();
    }

    public BigDecimal getGlTotal() {
        return getDerived();
    }
}
