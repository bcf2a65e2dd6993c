package io.ledgersim.core.state;

import io.ledgersim.core.protocol.OutputReference;
import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.protocol.TxOutput;
import io.ledgersim.core.protocol.UnspentOutput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of UtxoStore.
 * Insertion-ordered map guarded by the instance monitor.
 * Not persistent: resets every process run.
 */
public final class InMemoryUtxoStore implements UtxoStore {

    private final Map<OutputReference, UnspentOutput> utxos = new LinkedHashMap<>();

    @Override
    public synchronized Optional<UnspentOutput> resolve(OutputReference reference) {
        return Optional.ofNullable(utxos.get(reference));
    }

    @Override
    public synchronized boolean contains(OutputReference reference) {
        return utxos.containsKey(reference);
    }

    @Override
    public synchronized int size() {
        return utxos.size();
    }

    @Override
    public synchronized Map<OutputReference, UnspentOutput> utxos() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(utxos));
    }

    @Override
    public synchronized List<UnspentOutput> utxosAt(String address) {
        List<UnspentOutput> out = new ArrayList<>();
        for (UnspentOutput u : utxos.values()) {
            if (u.address().equals(address)) {
                out.add(u);
            }
        }
        return out;
    }

    @Override
    public synchronized void seed(UnspentOutput utxo) {
        if (utxos.containsKey(utxo.reference())) {
            throw new IllegalStateException("UTxO already present: " + utxo.reference());
        }
        utxos.put(utxo.reference(), utxo);
    }

    @Override
    public synchronized void apply(Transaction tx, TransactionId id) {
        // check everything before touching the map so a failure leaves it unchanged
        for (OutputReference in : tx.inputs()) {
            if (!utxos.containsKey(in)) {
                throw new IllegalStateException("Cannot apply " + id + ": input " + in + " is not unspent");
            }
        }
        List<TxOutput> outputs = tx.outputs();
        for (int i = 0; i < outputs.size(); i++) {
            OutputReference ref = new OutputReference(id, i);
            if (utxos.containsKey(ref)) {
                throw new IllegalStateException("Cannot apply " + id + ": output " + ref + " already exists");
            }
        }

        for (OutputReference in : tx.inputs()) {
            utxos.remove(in);
        }
        for (int i = 0; i < outputs.size(); i++) {
            OutputReference ref = new OutputReference(id, i);
            utxos.put(ref, new UnspentOutput(ref, outputs.get(i)));
        }
    }

    @Override
    public synchronized LedgerView snapshot() {
        return new Snapshot(new LinkedHashMap<>(utxos));
    }

    private static final class Snapshot implements LedgerView {
        private final Map<OutputReference, UnspentOutput> utxos;

        Snapshot(LinkedHashMap<OutputReference, UnspentOutput> copy) {
            this.utxos = Collections.unmodifiableMap(copy);
        }

        @Override public Optional<UnspentOutput> resolve(OutputReference reference) {
            return Optional.ofNullable(utxos.get(reference));
        }

        @Override public int size() { return utxos.size(); }

        @Override public Map<OutputReference, UnspentOutput> utxos() { return utxos; }
    }
}
