package io.ledgersim.core.protocol;

import java.util.List;

/**
 * Record of one block boundary: the transactions applied there, in order.
 * Blocks are kept for inspection only; the ledger never replays them.
 */
public final class Block {
    private final long height;
    private final long slot;
    private final long timeMs;
    private final List<Transaction> transactions;
    private final List<TransactionId> ids;
    private final long bodySize;

    public Block(long height, long slot, long timeMs, List<Transaction> txs, List<TransactionId> ids, long bodySize) {
        this.height = height;
        this.slot = slot;
        this.timeMs = timeMs;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        this.ids = ids != null ? List.copyOf(ids) : List.of();
        this.bodySize = bodySize;
        basicValidate();
    }

    public long height() { return height; }
    public long slot() { return slot; }
    public long timeMs() { return timeMs; }
    public List<Transaction> transactions() { return transactions; }
    public List<TransactionId> transactionIds() { return ids; }
    public long bodySize() { return bodySize; }
    public boolean isEmpty() { return transactions.isEmpty(); }

    public void basicValidate() {
        if (height < 0) throw new IllegalArgumentException("negative height");
        if (transactions.size() != ids.size()) throw new IllegalArgumentException("tx/id count mismatch");
        if (bodySize < 0) throw new IllegalArgumentException("negative body size");
    }

    @Override public String toString() {
        return "Block{height=" + height + ", slot=" + slot + ", txs=" + transactions.size() + ", bodySize=" + bodySize + "}";
    }
}
