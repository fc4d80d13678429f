package com.vision.flow.api;

import com.vision.flow.model.Node;

/** Checks a node's parameters before execution or at edit time. */
@FunctionalInterface
public interface ParameterValidator {

    ValidationResult validate(Node node);

    /**
     * Calls {@code validator} on behalf of the engine. A validator that throws
     * or returns null yields an invalid result instead of an exception.
     */
    static ValidationResult check(ParameterValidator validator, Node node) {
        ValidationResult result;
        try {
            result = validator.validate(node);
        } catch (RuntimeException e) {
            return ValidationResult.invalid("parameter validation threw " + e);
        }
        return result != null ? result : ValidationResult.invalid("validator returned no result");
    }
}
