package com.rulesdsl.validation;

import java.util.List;

/**
 * Outcome of validating a rule draft. Warnings never make a draft invalid.
 *
 * @param valid    Whether the draft can be saved
 * @param error    First rejection reason, null when valid
 * @param warnings Advisory findings
 */
public record ValidationResult(boolean valid, String error, List<String> warnings) {

    public ValidationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult valid(List<String> warnings) {
        return new ValidationResult(true, null, warnings);
    }

    public static ValidationResult invalid(String error, List<String> warnings) {
        return new ValidationResult(false, error, warnings);
    }
}
