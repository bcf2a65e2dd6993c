package io.ledgersim.core.mempool;

import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.validation.ValidationResult;

import java.util.Optional;

/**
 * Outcome of a submission: the id of the queued transaction, or the validation
 * result explaining why it was not queued.
 */
public final class SubmitResult {
    private final TransactionId id;
    private final ValidationResult rejection;

    private SubmitResult(TransactionId id, ValidationResult rejection) {
        this.id = id;
        this.rejection = rejection;
    }

    public static SubmitResult accepted(TransactionId id) {
        return new SubmitResult(id, null);
    }

    public static SubmitResult rejected(ValidationResult result) {
        if (result == null || result.isValid()) {
            throw new IllegalArgumentException("Rejection needs an invalid result");
        }
        return new SubmitResult(null, result);
    }

    public boolean isAccepted() { return id != null; }

    public Optional<TransactionId> id() { return Optional.ofNullable(id); }

    /** Queued id; throws if the transaction was rejected. */
    public TransactionId requireId() {
        if (id == null) {
            throw new IllegalStateException("Transaction rejected: " + rejection);
        }
        return id;
    }

    /** Validation result; {@link ValidationResult#valid()} when accepted. */
    public ValidationResult result() {
        return rejection != null ? rejection : ValidationResult.valid();
    }

    @Override public String toString() {
        return isAccepted() ? "Accepted(" + id + ")" : "Rejected(" + rejection + ")";
    }
}
