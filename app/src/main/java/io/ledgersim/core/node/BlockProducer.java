package io.ledgersim.core.node;

import io.ledgersim.core.mempool.Mempool;
import io.ledgersim.core.mempool.MempoolEntry;
import io.ledgersim.core.metrics.EmulatorMetrics;
import io.ledgersim.core.protocol.Block;
import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.state.UtxoStore;
import io.ledgersim.core.storage.BlockStore;
import io.ledgersim.core.validation.TxValidator;
import io.ledgersim.core.validation.ValidationError;
import io.ledgersim.core.validation.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Drains the mempool into a block at a block boundary.
 *
 * Entries are taken strictly in admission order and re-validated against the ledger
 * as it stands at that moment, so a transaction whose input was consumed earlier in
 * the same pass now fails with a missing input and is dropped. Draining stops when the
 * next entry would push the block over the body-size limit; that entry stays queued.
 */
public final class BlockProducer {
    private static final Logger LOG = Logger.getLogger(BlockProducer.class.getName());

    private final UtxoStore ledger;
    private final Mempool mempool;
    private final TxValidator validator;
    private final BlockStore blocks;
    private final EmulatorMetrics metrics;
    private final long maxBlockBodySize;
    private volatile ProducerState state = ProducerState.IDLE;

    public BlockProducer(UtxoStore ledger, Mempool mempool, TxValidator validator, BlockStore blocks,
                         EmulatorMetrics metrics) {
        this.ledger = ledger;
        this.mempool = mempool;
        this.validator = validator;
        this.blocks = blocks;
        this.metrics = metrics;
        this.maxBlockBodySize = validator.params().maxBlockBodySize;
    }

    /** Produce the block for the boundary at {@code slot}. Runs to completion. */
    public synchronized BlockReport produceBlock(long height, long slot, long timeMs) {
        return metrics.recordProduction(() -> drain(height, slot, timeMs));
    }

    private BlockReport drain(long height, long slot, long timeMs) {
        state = ProducerState.PRODUCING;
        try {
            List<Transaction> included = new ArrayList<>();
            List<TransactionId> ids = new ArrayList<>();
            List<DroppedTransaction> dropped = new ArrayList<>();
            long bodySize = 0L;

            while (true) {
                Optional<MempoolEntry> next = mempool.peek();
                if (next.isEmpty()) {
                    break;
                }
                MempoolEntry entry = next.get();
                if (entry.serializedSize() > maxBlockBodySize) {
                    // could never fit any block
                    mempool.poll();
                    drop(dropped, entry, ValidationResult.invalid(
                            new ValidationError.OversizedTransaction(entry.serializedSize(), maxBlockBodySize)));
                    continue;
                }
                if (bodySize + entry.serializedSize() > maxBlockBodySize) {
                    break;
                }
                mempool.poll();

                ValidationResult result = validator.validate(entry.transaction(), ledger);
                if (!result.isValid()) {
                    drop(dropped, entry, result);
                    continue;
                }
                ledger.apply(entry.transaction(), entry.id());
                included.add(entry.transaction());
                ids.add(entry.id());
                bodySize += entry.serializedSize();
            }

            Block block = new Block(height, slot, timeMs, included, ids, bodySize);
            blocks.putBlock(block);
            metrics.recordApplied(included.size());
            metrics.recordDropped(dropped.size());
            if (!included.isEmpty() || !dropped.isEmpty()) {
                LOG.info("Produced " + block + ", dropped " + dropped.size());
            }
            return new BlockReport(block, dropped);
        } finally {
            state = ProducerState.IDLE;
        }
    }

    private static void drop(List<DroppedTransaction> dropped, MempoolEntry entry, ValidationResult reason) {
        LOG.warning("Dropping " + entry.id() + " from block: " + reason);
        dropped.add(new DroppedTransaction(entry.id(), entry.transaction(), reason));
    }

    public ProducerState state() {
        return state;
    }
}
