package com.subledger.validation;

import com.subledger.ledger.GlPosting;
import com.subledger.ledger.Trade;
import java.util.List;

/** What the rules inspect: the trades of a run and every journal leg posted from them. */
public record ValidationContext(List<Trade> trades, List<GlPosting> postings) {
    public ValidationContext {
        trades = List.copyOf(trades);
        postings = List.copyOf(postings);
    }
}
