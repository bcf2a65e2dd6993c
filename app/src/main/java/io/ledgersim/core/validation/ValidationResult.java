package io.ledgersim.core.validation;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of validating a transaction: valid, or invalid with one or more typed errors.
 * Only the value-preservation rule reports more than one error (one per unbalanced asset).
 */
public final class ValidationResult {
    private static final ValidationResult VALID = new ValidationResult(List.of());

    private final List<ValidationError> errors;

    private ValidationResult(List<ValidationError> errors) {
        this.errors = List.copyOf(errors);
    }

    public static ValidationResult valid() { return VALID; }

    public static ValidationResult invalid(ValidationError error) {
        return new ValidationResult(List.of(error));
    }

    public static ValidationResult invalid(List<ValidationError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one error");
        }
        return new ValidationResult(errors);
    }

    public boolean isValid() { return errors.isEmpty(); }

    public List<ValidationError> errors() { return errors; }

    /** First error; throws if the result is valid. */
    public ValidationError error() {
        if (errors.isEmpty()) {
            throw new IllegalStateException("Result is valid");
        }
        return errors.get(0);
    }

    public ProtocolError code() {
        return error().code();
    }

    /** First error of the given variant, if any. */
    public <T extends ValidationError> Optional<T> find(Class<T> type) {
        for (ValidationError e : errors) {
            if (type.isInstance(e)) {
                return Optional.of(type.cast(e));
            }
        }
        return Optional.empty();
    }

    @Override public String toString() {
        if (isValid()) return "OK";
        StringBuilder sb = new StringBuilder();
        for (ValidationError e : errors) {
            if (sb.length() > 0) sb.append("; ");
            sb.append("ERR[").append(e.code()).append("]: ").append(e.message());
        }
        return sb.toString();
    }
}
