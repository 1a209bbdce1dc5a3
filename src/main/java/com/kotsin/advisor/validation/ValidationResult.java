package com.kotsin.advisor.validation;

import lombok.Getter;
import java.util.ArrayList;
import java.util.List;

/**
 * Errors and warnings collected while checking a signal.
 */
@Getter
public class ValidationResult {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!errors.isEmpty()) {
            sb.append("Errors: ").append(errors);
        }
        if (!warnings.isEmpty()) {
            if (sb.length() > 0) sb.append("; ");
            sb.append("Warnings: ").append(warnings);
        }
        return sb.toString();
    }
}
