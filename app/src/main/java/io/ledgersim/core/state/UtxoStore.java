package io.ledgersim.core.state;

import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.protocol.UnspentOutput;

import java.util.List;

/**
 * The authoritative UTxO set. {@link #apply} is the only mutation path after genesis.
 */
public interface UtxoStore extends LedgerView {

    /**
     * Consume every input of {@code tx} and add its outputs under {@code (id, index)}.
     * The caller must have validated {@code tx} against this exact state; if an input
     * is missing or an output reference already exists nothing is changed and an
     * {@link IllegalStateException} is thrown.
     */
    void apply(Transaction tx, TransactionId id);

    /** Insert a genesis output. Fails if the reference is already present. */
    void seed(UnspentOutput utxo);

    /** Immutable copy of the current state; never observes a half-applied transaction. */
    LedgerView snapshot();

    List<UnspentOutput> utxosAt(String address);
}
