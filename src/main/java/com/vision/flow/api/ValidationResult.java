package com.vision.flow.api;

import java.util.List;

/** Outcome of a {@link ParameterValidator}. {@code errors} is empty iff valid. */
public record ValidationResult(boolean valid, List<String> errors) {

    public static final ValidationResult VALID = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
        if (valid != errors.isEmpty())
            throw new IllegalArgumentException("A valid result has no errors, an invalid one has at least one");
    }

    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? VALID : new ValidationResult(false, errors);
    }

    public static ValidationResult invalid(String... errors) {
        return new ValidationResult(false, List.of(errors));
    }
}
