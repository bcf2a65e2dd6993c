package io.ledgersim.core.node;

import io.ledgersim.core.protocol.Block;

import java.util.List;

/** What happened at one block boundary: the block produced and what was dropped. */
public final class BlockReport {
    private final Block block;
    private final List<DroppedTransaction> dropped;

    public BlockReport(Block block, List<DroppedTransaction> dropped) {
        this.block = block;
        this.dropped = List.copyOf(dropped);
    }

    public Block block() { return block; }
    public List<DroppedTransaction> dropped() { return dropped; }
}
