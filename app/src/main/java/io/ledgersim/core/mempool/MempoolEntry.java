package io.ledgersim.core.mempool;

import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TransactionId;

import java.util.Objects;

/** A queued transaction; {@code admissionOrder} is its only ordering key. */
public final class MempoolEntry {
    private final Transaction transaction;
    private final TransactionId id;
    private final long serializedSize;
    private final long admissionOrder;

    public MempoolEntry(Transaction transaction, TransactionId id, long serializedSize, long admissionOrder) {
        this.transaction = Objects.requireNonNull(transaction, "transaction");
        this.id = Objects.requireNonNull(id, "id");
        this.serializedSize = serializedSize;
        this.admissionOrder = admissionOrder;
    }

    public Transaction transaction() { return transaction; }
    public TransactionId id() { return id; }
    public long serializedSize() { return serializedSize; }
    public long admissionOrder() { return admissionOrder; }

    @Override
    public String toString() {
        return "MempoolEntry(#" + admissionOrder + " " + id + ", " + serializedSize + " bytes)";
    }
}
