package io.ledgersim.core.validation;

/** One phase-1 ledger rule. */
public interface ValidationRule {

    ValidationResult check(ValidationContext ctx);
}
