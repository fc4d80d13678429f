package com.vision.flow.operator;

import java.util.List;

/** Errors block execution, warnings do not. */
public record FlowValidationReport(List<String> errors, List<String> warnings) {

    public FlowValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
