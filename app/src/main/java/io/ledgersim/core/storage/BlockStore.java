package io.ledgersim.core.storage;

import io.ledgersim.core.protocol.Block;
import io.ledgersim.core.protocol.TransactionId;

import java.util.List;
import java.util.Optional;

/**
 * History of produced blocks, keyed by height.
 * Append-only: there is no fork choice and no rollback.
 */
public interface BlockStore {

    /** Append a block; its height must be greater than the current head's. */
    void putBlock(Block block);

    Optional<Block> getBlock(long height);

    /** Most recently produced block, if any. */
    Optional<Block> getHead();

    /** Height of the block that included {@code txId}, if it was included. */
    Optional<Long> findTransaction(TransactionId txId);

    /** Number of blocks stored (debug/metrics). */
    long size();

    List<Block> getBlocksInOrder();
}
