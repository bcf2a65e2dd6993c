package io.ledgersim.core.storage;

import io.ledgersim.core.protocol.Block;
import io.ledgersim.core.protocol.TransactionId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Simple, fast in-memory block store.
 */
public final class InMemoryBlockStore implements BlockStore {

    /** Map: height -> Block */
    private final NavigableMap<Long, Block> blocks = new TreeMap<>();

    /** Map: txId -> including block height */
    private final Map<TransactionId, Long> txIndex = new HashMap<>();

    @Override
    public synchronized void putBlock(Block block) {
        if (block == null) return;
        if (!blocks.isEmpty() && block.height() <= blocks.lastKey()) {
            throw new IllegalArgumentException("Block height " + block.height()
                    + " does not extend head at " + blocks.lastKey());
        }
        blocks.put(block.height(), block);
        for (TransactionId id : block.transactionIds()) {
            txIndex.put(id, block.height());
        }
    }

    @Override
    public synchronized Optional<Block> getBlock(long height) {
        return Optional.ofNullable(blocks.get(height));
    }

    @Override
    public synchronized Optional<Block> getHead() {
        return blocks.isEmpty() ? Optional.empty() : Optional.of(blocks.lastEntry().getValue());
    }

    @Override
    public synchronized Optional<Long> findTransaction(TransactionId txId) {
        return Optional.ofNullable(txIndex.get(txId));
    }

    @Override
    public synchronized long size() {
        return blocks.size();
    }

    @Override
    public synchronized List<Block> getBlocksInOrder() {
        return new ArrayList<>(blocks.values());
    }
}
