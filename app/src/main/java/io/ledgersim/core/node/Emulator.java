package io.ledgersim.core.node;

import io.ledgersim.core.clock.GenesisInfo;
import io.ledgersim.core.clock.SlotClock;
import io.ledgersim.core.codec.BinaryTxSerializer;
import io.ledgersim.core.codec.TxSerializer;
import io.ledgersim.core.mempool.Mempool;
import io.ledgersim.core.mempool.MempoolEntry;
import io.ledgersim.core.mempool.SubmitResult;
import io.ledgersim.core.metrics.EmulatorMetrics;
import io.ledgersim.core.protocol.Block;
import io.ledgersim.core.protocol.OutputReference;
import io.ledgersim.core.protocol.ProtocolParameters;
import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.protocol.TxOutput;
import io.ledgersim.core.protocol.UnspentOutput;
import io.ledgersim.core.state.InMemoryUtxoStore;
import io.ledgersim.core.state.LedgerJson;
import io.ledgersim.core.state.LedgerView;
import io.ledgersim.core.state.UtxoStore;
import io.ledgersim.core.storage.BlockStore;
import io.ledgersim.core.storage.InMemoryBlockStore;
import io.ledgersim.core.validation.TxValidator;
import io.ledgersim.core.validation.ValidationResult;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Wires clock, ledger, validator, mempool, block store and the block producer
 * into a single deterministic emulator.
 *
 * Submitted transactions are validated against the confirmed ledger and queued;
 * nothing reaches the ledger until the clock crosses a block boundary, at which
 * point the mempool is drained in admission order.
 */
public final class Emulator {
    private static final Logger LOG = Logger.getLogger(Emulator.class.getName());

    private final EmulatorConfig config;
    private final SlotClock clock;
    private final UtxoStore ledger;
    private final TxValidator validator;
    private final Mempool mempool;
    private final BlockStore blocks;
    private final BlockProducer producer;
    private final EmulatorMetrics metrics;

    public Emulator(EmulatorConfig config, TxSerializer serializer, EmulatorMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        this.clock = new SlotClock(config.genesis, config.params.activeSlotCoefficient, config.initialSlot);
        this.ledger = new InMemoryUtxoStore();
        this.validator = new TxValidator(config.params, serializer);
        this.mempool = new Mempool(validator, ledger, config.maxMempoolBytes);
        this.blocks = new InMemoryBlockStore();
        this.producer = new BlockProducer(ledger, mempool, validator, blocks, metrics);

        GenesisBuilder.seed(ledger, config.initialUtxos);
        metrics.gaugeMempool(mempool, Mempool::size);
        LOG.info("Emulator started at slot " + clock.currentSlot() + " with " + ledger.size()
                + " genesis UTxOs, " + clock.slotsPerBlock() + " slots per block");
    }

    public Emulator(EmulatorConfig config) {
        this(config, new BinaryTxSerializer(), new EmulatorMetrics());
    }

    public Emulator(List<UnspentOutput> initialUtxos, GenesisInfo genesis, ProtocolParameters params) {
        this(EmulatorConfig.defaultLocal()
                .withGenesis(genesis)
                .withProtocolParameters(params)
                .withMaxMempoolBytes(params.maxBlockBodySize * EmulatorConfig.DEFAULT_MEMPOOL_BLOCKS)
                .withInitialUtxos(initialUtxos));
    }

    /** Convenience factory: mainnet parameters and the given genesis UTxOs. */
    public static Emulator withDefaults(List<UnspentOutput> initialUtxos) {
        return new Emulator(EmulatorConfig.defaultLocal().withInitialUtxos(initialUtxos));
    }

    // -------------------- submission --------------------

    /** Validate against the confirmed ledger and queue; the ledger itself is not touched. */
    public synchronized SubmitResult submitTx(Transaction tx) {
        metrics.recordSubmitted();
        SubmitResult result = mempool.submit(tx);
        if (!result.isAccepted()) {
            metrics.recordRejected(result.result().code());
        }
        return result;
    }

    /** Dry run of the validation rules against the confirmed ledger. */
    public synchronized ValidationResult validate(Transaction tx) {
        return validator.validate(tx, ledger);
    }

    // -------------------- time --------------------

    /**
     * Advance the clock by {@code n} slots. Each block boundary crossed on the way
     * produces one block at that boundary slot.
     */
    public synchronized List<BlockReport> advanceSlots(long n) {
        if (n <= 0) {
            throw new IllegalArgumentException("slots to advance must be > 0, got " + n);
        }
        List<BlockReport> reports = new ArrayList<>();
        long remaining = n;
        while (remaining > 0) {
            long toBoundary = clock.slotsUntilNextBlock();
            if (toBoundary > remaining) {
                clock.advanceSlots(remaining);
                break;
            }
            clock.advanceSlots(toBoundary);
            remaining -= toBoundary;
            reports.add(producer.produceBlock(clock.blockHeight(), clock.currentSlot(), clock.currentTime()));
        }
        return reports;
    }

    /** Produce {@code n} blocks, advancing the clock by {@code n * slotsPerBlock} slots. */
    public synchronized List<BlockReport> advanceBlocks(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("blocks to advance must be > 0, got " + n);
        }
        return advanceSlots(Math.multiplyExact((long) n, clock.slotsPerBlock()));
    }

    public synchronized BlockReport advanceToNextBlock() {
        return advanceSlots(clock.slotsUntilNextBlock()).get(0);
    }

    // -------------------- ledger --------------------

    public synchronized Map<OutputReference, UnspentOutput> getUtxos() {
        return ledger.utxos();
    }

    public synchronized Optional<UnspentOutput> getUtxo(OutputReference ref) {
        return ledger.resolve(ref);
    }

    public synchronized List<UnspentOutput> getUtxosAt(String address) {
        return ledger.utxosAt(address);
    }

    public synchronized LedgerView ledgerSnapshot() {
        return ledger.snapshot();
    }

    public synchronized String prettyPrintLedger() {
        return LedgerJson.toJson(ledger);
    }

    // -------------------- clock --------------------

    public synchronized long getCurrentSlot() { return clock.currentSlot(); }
    public synchronized long getCurrentEpoch() { return clock.currentEpoch(); }
    public synchronized long getCurrentBlockHeight() { return clock.blockHeight(); }
    public synchronized long getCurrentTime() { return clock.currentTime(); }
    public long slotsPerBlock() { return clock.slotsPerBlock(); }

    public long slotToPosix(long slot) {
        return clock.slotToTime(slot);
    }

    public long posixToSlot(long timeMs) {
        return clock.timeToSlot(timeMs);
    }

    // -------------------- mempool / builder helpers --------------------

    public synchronized List<MempoolEntry> getMempoolSnapshot() {
        return mempool.snapshot();
    }

    public BigInteger getMinimumOutputDeposit(TxOutput output) {
        return validator.minimumOutputDeposit(output);
    }

    public BigInteger getMinimumFee(Transaction tx) {
        return validator.minimumFee(tx);
    }

    public TransactionId hash(Transaction tx) {
        return validator.serializer().hash(tx);
    }

    // -------------------- blocks --------------------

    public synchronized Optional<Block> getBlock(long height) {
        return blocks.getBlock(height);
    }

    public synchronized List<Block> getBlocks() {
        return blocks.getBlocksInOrder();
    }

    public synchronized Optional<Long> findTransactionBlock(TransactionId id) {
        return blocks.findTransaction(id);
    }

    public synchronized boolean isConfirmed(TransactionId id) {
        return blocks.findTransaction(id).isPresent();
    }

    public ProtocolParameters protocolParameters() { return config.params; }
    public GenesisInfo genesis() { return config.genesis; }
    public EmulatorMetrics metrics() { return metrics; }
    public ProducerState producerState() { return producer.state(); }
}
