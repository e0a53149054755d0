package com.subledger.engine;

import com.subledger.ledger.LedgerBalance;
import com.subledger.ledger.PositionSnapshot;
import com.subledger.ledger.Trade;
import com.subledger.ledger.ValuationSnapshot;
import java.util.List;

/**
 * The feeds of one run. {@code valuations} is the position-level MTM allocated to open lots (one
 * date, or undated); {@code mtmSeries} is the dated MTM history booked into the GL. The thin ledger
 * is optional and only feeds the rebuild control.
 */
public final class SubledgerInput {
    private final List<Trade> trades;
    private final List<PositionSnapshot> positions;
    private final List<ValuationSnapshot> valuations;
    private final List<ValuationSnapshot> mtmSeries;
    private final List<LedgerBalance> thinLedger;

    private SubledgerInput(Builder builder) {
        this.trades = List.copyOf(builder.trades);
        this.positions = List.copyOf(builder.positions);
        this.valuations = List.copyOf(builder.valuations);
        this.mtmSeries = List.copyOf(builder.mtmSeries);
        this.thinLedger = List.copyOf(builder.thinLedger);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Trade> getTrades() {
        return trades;
    }

    public List<PositionSnapshot> getPositions() {
        return positions;
    }

    public List<ValuationSnapshot> getValuations() {
        return valuations;
    }

    public List<ValuationSnapshot> getMtmSeries() {
        return mtmSeries;
    }

    public List<LedgerBalance> getThinLedger() {
        return thinLedger;
    }

    public static final class Builder {
        private List<Trade> trades = List.of();
        private List<PositionSnapshot> positions = List.of();
        private List<ValuationSnapshot> valuations = List.of();
        private List<ValuationSnapshot> mtmSeries = List.of();
        private List<LedgerBalance> thinLedger = List.of();

        private Builder() {}

        public Builder trades(List<Trade> value) {
            this.trades = value != null ? value : List.of();
            return this;
        }

        public Builder positions(List<PositionSnapshot> value) {
            this.positions = value != null ? value : List.of();
            return this;
        }

        public Builder valuations(List<ValuationSnapshot> value) {
            this.valuations = value != null ? value : List.of();
            return this;
        }

        public Builder mtmSeries(List<ValuationSnapshot> value) {
            this.mtmSeries = value != null ? value : List.of();
            return this;
        }

        public Builder thinLedger(List<LedgerBalance> value) {
            this.thinLedger = value != null ? value : List.of();
            return this;
        }

        public SubledgerInput build() {
            return new SubledgerInput(this);
        }
    }
}
