package io.ledgersim.core.state;

import io.ledgersim.core.protocol.AssetBundle;
import io.ledgersim.core.protocol.Hashes;
import io.ledgersim.core.protocol.OutputReference;
import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.protocol.TxOutput;
import io.ledgersim.core.protocol.UnspentOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryUtxoStoreTest {

    private static final String ALICE = "addr_test1qalice00000";
    private static final String BOB = "addr_test1qbob0000000";
    private static final TransactionId GENESIS = id("genesis");
    private static final OutputReference G0 = new OutputReference(GENESIS, 0);
    private static final OutputReference G1 = new OutputReference(GENESIS, 1);

    private InMemoryUtxoStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryUtxoStore();
        store.seed(new UnspentOutput(G0, new TxOutput(ALICE, AssetBundle.lovelace(100))));
        store.seed(new UnspentOutput(G1, new TxOutput(BOB, AssetBundle.lovelace(50))));
    }

    @Test
    void applyConsumesInputsAndAddsOutputs() {
        Transaction tx = Transaction.builder()
                .input(G0)
                .output(BOB, AssetBundle.lovelace(60))
                .output(ALICE, AssetBundle.lovelace(30))
                .fee(10)
                .build();
        TransactionId txId = id("tx1");

        store.apply(tx, txId);

        assertFalse(store.contains(G0));
        assertTrue(store.contains(G1));
        assertEquals(3, store.size());
        assertEquals(AssetBundle.lovelace(60), store.resolve(new OutputReference(txId, 0)).orElseThrow().value());
        assertEquals(2, store.utxosAt(BOB).size());
    }

    @Test
    void failedApplyLeavesStoreUntouched() {
        OutputReference missing = new OutputReference(GENESIS, 7);
        Transaction tx = Transaction.builder()
                .input(G0)
                .input(missing)
                .output(BOB, AssetBundle.lovelace(90))
                .build();

        assertThrows(IllegalStateException.class, () -> store.apply(tx, id("tx2")));
        assertTrue(store.contains(G0));
        assertEquals(2, store.size());
    }

    @Test
    void applyRefusesToOverwriteAnExistingOutput() {
        Transaction tx = Transaction.builder()
                .input(G0)
                .output(BOB, AssetBundle.lovelace(90))
                .build();

        // output 0 would land on G0
        assertThrows(IllegalStateException.class, () -> store.apply(tx, GENESIS));
        assertTrue(store.contains(G0));
    }

    @Test
    void seedRejectsDuplicates() {
        assertThrows(IllegalStateException.class,
                () -> store.seed(new UnspentOutput(G0, new TxOutput(BOB, AssetBundle.lovelace(1)))));
    }

    @Test
    void snapshotIsIsolatedFromLaterChanges() {
        LedgerView before = store.snapshot();

        store.apply(Transaction.builder().input(G1).output(ALICE, AssetBundle.lovelace(50)).build(), id("tx3"));

        assertTrue(before.contains(G1));
        assertEquals(2, before.size());
        assertFalse(store.contains(G1));
    }

    @Test
    void utxosKeepInsertionOrderAndAreReadOnly() {
        assertEquals(List.of(G0, G1), List.copyOf(store.utxos().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> store.utxos().clear());
    }

    private static TransactionId id(String seed) {
        return new TransactionId(Hashes.sha256(seed.getBytes(StandardCharsets.UTF_8)));
    }
}
