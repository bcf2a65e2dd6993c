package io.ledgersim.core.node;

import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.validation.ValidationResult;

/** A queued transaction excluded from a block because it no longer validated. */
public final class DroppedTransaction {
    private final TransactionId id;
    private final Transaction transaction;
    private final ValidationResult reason;

    public DroppedTransaction(TransactionId id, Transaction transaction, ValidationResult reason) {
        this.id = id;
        this.transaction = transaction;
        this.reason = reason;
    }

    public TransactionId id() { return id; }
    public Transaction transaction() { return transaction; }
    public ValidationResult reason() { return reason; }

    @Override
    public String toString() {
        return "DroppedTransaction(" + id + ": " + reason + ")";
    }
}
