package io.ledgersim.core.protocol;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An output that has been produced and not yet consumed, paired with its reference.
 */
public final class UnspentOutput {
    private final OutputReference reference;
    private final TxOutput output;

    public UnspentOutput(OutputReference reference, TxOutput output) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.output = Objects.requireNonNull(output, "output");
    }

    public OutputReference reference() { return reference; }
    public TxOutput output() { return output; }

    public String address() { return output.address(); }
    public AssetBundle value() { return output.value(); }
    public BigInteger lovelace() { return output.lovelace(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnspentOutput)) return false;
        UnspentOutput other = (UnspentOutput) o;
        return reference.equals(other.reference) && output.equals(other.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, output);
    }

    @Override
    public String toString() {
        return "UnspentOutput(" + reference + " -> " + output + ")";
    }
}
