package com.subledger.validation;

import com.subledger.engine.SubledgerMessage;
import java.util.List;

/**
 * A single check over a completed run. Rules report in the order they find problems and never
 * alter the run's output.
 */
public interface ValidationRule {

    /**
     * @return diagnostics, possibly empty, never null
     */
    List<SubledgerMessage> validate(ValidationContext context);
}
