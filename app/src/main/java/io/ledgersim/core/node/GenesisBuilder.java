package io.ledgersim.core.node;

import io.ledgersim.core.protocol.AssetBundle;
import io.ledgersim.core.protocol.Hashes;
import io.ledgersim.core.protocol.OutputReference;
import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.protocol.TxOutput;
import io.ledgersim.core.protocol.UnspentOutput;
import io.ledgersim.core.state.UtxoStore;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds and seeds the initial UTxO set.
 * Genesis outputs hang off a synthetic transaction id; they have no producing transaction.
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    public static final TransactionId GENESIS_TX_ID =
            new TransactionId(Hashes.sha256("ledgersim-genesis".getBytes(StandardCharsets.UTF_8)));

    public static final long DEFAULT_INITIAL_LOVELACE = 100_000_000L;

    private static final String BECH32_CHARS = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";

    public static OutputReference genesisReference(int index) {
        return new OutputReference(GENESIS_TX_ID, index);
    }

    /** Place each output at {@code GENESIS_TX_ID#i}. */
    public static List<UnspentOutput> fromOutputs(List<TxOutput> outputs) {
        List<UnspentOutput> out = new ArrayList<>(outputs.size());
        for (int i = 0; i < outputs.size(); i++) {
            out.add(new UnspentOutput(genesisReference(i), outputs.get(i)));
        }
        return out;
    }

    /** {@code count} UTxOs of 100 ADA at pseudo-random test addresses, reproducible for a given seed. */
    public static List<UnspentOutput> randomInitialUtxos(int count, long seed) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        Random random = new Random(seed);
        List<TxOutput> outputs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            outputs.add(new TxOutput(randomTestAddress(random), AssetBundle.lovelace(DEFAULT_INITIAL_LOVELACE)));
        }
        return fromOutputs(outputs);
    }

    public static String randomTestAddress(Random random) {
        StringBuilder sb = new StringBuilder("addr_test1q");
        for (int i = 0; i < 52; i++) {
            sb.append(BECH32_CHARS.charAt(random.nextInt(BECH32_CHARS.length())));
        }
        return sb.toString();
    }

    /** Load genesis UTxOs into an empty store. */
    public static void seed(UtxoStore store, List<UnspentOutput> utxos) {
        if (utxos == null || utxos.isEmpty()) return;
        for (UnspentOutput u : utxos) {
            store.seed(u);
        }
    }
}
