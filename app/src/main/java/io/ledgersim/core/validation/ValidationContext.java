package io.ledgersim.core.validation;

import io.ledgersim.core.codec.TxSerializer;
import io.ledgersim.core.protocol.OutputReference;
import io.ledgersim.core.protocol.ProtocolParameters;
import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.UnspentOutput;
import io.ledgersim.core.state.LedgerView;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Everything a rule may look at for one transaction. The serialized size is computed
 * at most once and shared between the size and fee rules.
 */
public final class ValidationContext {
    private final Transaction tx;
    private final LedgerView ledger;
    private final ProtocolParameters params;
    private final TxSerializer serializer;
    private long txSize = -1L;

    public ValidationContext(Transaction tx, LedgerView ledger, ProtocolParameters params, TxSerializer serializer) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        this.tx = tx;
        this.ledger = ledger;
        this.params = params;
        this.serializer = serializer;
    }

    public Transaction tx() { return tx; }
    public LedgerView ledger() { return ledger; }
    public ProtocolParameters params() { return params; }
    public TxSerializer serializer() { return serializer; }

    public long txSize() {
        if (txSize < 0) {
            txSize = serializer.serializedSize(tx);
        }
        return txSize;
    }

    /** Resolved inputs in input order. Callers must run the structural rule first. */
    public List<UnspentOutput> resolvedInputs() {
        List<UnspentOutput> out = new ArrayList<>(tx.inputs().size());
        for (OutputReference ref : tx.inputs()) {
            Optional<UnspentOutput> utxo = ledger.resolve(ref);
            if (utxo.isEmpty()) {
                throw new IllegalStateException("Input " + ref + " does not resolve; structural rule not applied");
            }
            out.add(utxo.get());
        }
        return out;
    }
}
