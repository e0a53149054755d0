package com.subledger.validation;

import com.subledger.engine.SubledgerMessage;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Runs a fixed list of rules and concatenates their diagnostics in rule order. */
public final class ValidationRunner {

    private final List<ValidationRule> rules;

    public ValidationRunner(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public static ValidationRunner defaultRules(BigDecimal tolerance) {
        return new ValidationRunner(List.of(new TradeInputRule(), new DoubleEntryBalanceRule(tolerance)));
    }

    public List<SubledgerMessage> run(ValidationContext context) {
        List<SubledgerMessage> diagnostics = new ArrayList<>();
        for (ValidationRule rule : rules) {
            diagnostics.addAll(rule.validate(context));
        }
        return diagnostics;
    }
}
