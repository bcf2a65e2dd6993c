package io.ledgersim.core.state;

import io.ledgersim.core.protocol.OutputReference;
import io.ledgersim.core.protocol.UnspentOutput;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of a UTxO set.
 */
public interface LedgerView {

    Optional<UnspentOutput> resolve(OutputReference reference);

    default boolean contains(OutputReference reference) {
        return resolve(reference).isPresent();
    }

    int size();

    /** All unspent outputs, in insertion order. The returned map is immutable. */
    Map<OutputReference, UnspentOutput> utxos();
}
