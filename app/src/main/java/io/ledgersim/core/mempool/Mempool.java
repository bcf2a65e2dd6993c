package io.ledgersim.core.mempool;

import io.ledgersim.core.codec.TxSerializer;
import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.state.LedgerView;
import io.ledgersim.core.validation.TxValidator;
import io.ledgersim.core.validation.ValidationError;
import io.ledgersim.core.validation.ValidationResult;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Strict FIFO admission queue:
 * - transactions are validated against the confirmed ledger at submission time
 * - admission order is a commitment; draining returns entries in exactly that order
 * - aggregate queued bytes are capped at {@code maxBytes}
 * The mempool only reads the ledger, it never changes it.
 */
public final class Mempool {
    private static final Logger LOG = Logger.getLogger(Mempool.class.getName());

    private final Deque<MempoolEntry> fifo = new ArrayDeque<>();
    private final TxValidator validator;
    private final TxSerializer serializer;
    private final LedgerView ledger;
    private final long maxBytes;
    private long totalBytes;
    private long nextAdmission;

    public Mempool(TxValidator validator, LedgerView ledger, long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("Mempool capacity must be > 0");
        }
        this.validator = validator;
        this.serializer = validator.serializer();
        this.ledger = ledger;
        this.maxBytes = maxBytes;
    }

    /** Validate and enqueue. Nothing is queued unless the result is accepted. */
    public synchronized SubmitResult submit(Transaction tx) {
        ValidationResult result = validator.validate(tx, ledger);
        if (!result.isValid()) {
            LOG.fine(() -> "Refused transaction: " + result);
            return SubmitResult.rejected(result);
        }
        long size = serializer.serializedSize(tx);
        if (totalBytes + size > maxBytes) {
            return SubmitResult.rejected(ValidationResult.invalid(
                    new ValidationError.QueueFull(totalBytes, size, maxBytes)));
        }
        TransactionId id = serializer.hash(tx);
        fifo.addLast(new MempoolEntry(tx, id, size, nextAdmission++));
        totalBytes += size;
        LOG.fine(() -> "Queued " + id + " (" + size + " bytes, " + fifo.size() + " pending)");
        return SubmitResult.accepted(id);
    }

    /** Oldest entry without removing it. */
    public synchronized Optional<MempoolEntry> peek() {
        return Optional.ofNullable(fifo.peekFirst());
    }

    /** Remove and return the oldest entry. */
    public synchronized Optional<MempoolEntry> poll() {
        MempoolEntry e = fifo.pollFirst();
        if (e != null) {
            totalBytes -= e.serializedSize();
        }
        return Optional.ofNullable(e);
    }

    /** Ordered copy of the queue. */
    public synchronized List<MempoolEntry> snapshot() {
        return List.copyOf(fifo);
    }

    public synchronized boolean contains(TransactionId id) {
        for (MempoolEntry e : fifo) {
            if (e.id().equals(id)) return true;
        }
        return false;
    }

    public synchronized int size() { return fifo.size(); }
    public synchronized boolean isEmpty() { return fifo.isEmpty(); }
    public synchronized long totalBytes() { return totalBytes; }
    public long maxBytes() { return maxBytes; }
}
