package com.subledger.validation;

import com.subledger.engine.SubledgerMessage;
import com.subledger.engine.SubledgerMessage.Level;
import com.subledger.ledger.Trade;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Warns about trades the calculations accept but that are probably bad data. */
final class TradeInputRule implements ValidationRule {

    @Override
    public List<SubledgerMessage> validate(ValidationContext context) {
        List<SubledgerMessage> messages = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Trade trade : context.trades()) {
            if (!seen.add(trade.getTradeId())) {
                messages.add(warning(trade, "Duplicate trade id"));
            }
            if (trade.getQuantity().signum() <= 0) {
                messages.add(warning(trade, "Non-positive quantity " + trade.getQuantity().toPlainString()));
            }
            if (trade.getPrice().signum() <= 0) {
                messages.add(warning(trade, "Non-positive price " + trade.getPrice().toPlainString()));
            }
        }
        return messages;
    }

    private static SubledgerMessage warning(Trade trade, String text) {
        return new SubledgerMessage(Level.WARNING, text, trade.getTradeId());
    }
}
