package io.ledgersim.core.protocol;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable transaction body: consumed inputs, produced outputs, fee and mint.
 * Identity (the hash) is derived by a {@link io.ledgersim.core.codec.TxSerializer}.
 */
public final class Transaction {

    private final List<OutputReference> inputs;
    private final List<TxOutput> outputs;
    private final BigInteger fee;
    private final AssetBundle mint;

    private Transaction(List<OutputReference> inputs, List<TxOutput> outputs, BigInteger fee, AssetBundle mint) {
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.fee = fee;
        this.mint = mint;
        basicValidate();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final List<OutputReference> inputs = new ArrayList<>();
        private final List<TxOutput> outputs = new ArrayList<>();
        private BigInteger fee = BigInteger.ZERO;
        private AssetBundle mint = AssetBundle.empty();

        public Builder input(OutputReference ref) { this.inputs.add(Objects.requireNonNull(ref, "input")); return this; }
        public Builder inputs(Collection<OutputReference> refs) { for (OutputReference r : refs) input(r); return this; }
        public Builder output(TxOutput out) { this.outputs.add(Objects.requireNonNull(out, "output")); return this; }
        public Builder output(String address, AssetBundle value) { return output(new TxOutput(address, value)); }
        public Builder outputs(Collection<TxOutput> outs) { for (TxOutput o : outs) output(o); return this; }
        public Builder fee(BigInteger f) { this.fee = f; return this; }
        public Builder fee(long f) { this.fee = BigInteger.valueOf(f); return this; }
        public Builder mint(AssetBundle m) { this.mint = m != null ? m : AssetBundle.empty(); return this; }

        public Transaction build() {
            return new Transaction(inputs, outputs, fee, mint);
        }
    }

    /** Builder pre-filled with this transaction's fields. */
    public Builder toBuilder() {
        return builder().inputs(inputs).outputs(outputs).fee(fee).mint(mint);
    }

    // -------------------- getters --------------------
    public List<OutputReference> inputs() { return inputs; }
    public List<TxOutput> outputs() { return outputs; }
    public BigInteger fee() { return fee; }
    public AssetBundle mint() { return mint; }

    /** Sum of all output values. */
    public AssetBundle outputTotal() {
        AssetBundle total = AssetBundle.empty();
        for (TxOutput o : outputs) {
            total = total.add(o.value());
        }
        return total;
    }

    public void basicValidate() {
        if (fee == null) throw new IllegalArgumentException("Missing fee");
        if (fee.signum() < 0) throw new IllegalArgumentException("fee must be >= 0");
        if (mint == null) throw new IllegalArgumentException("Missing mint");
        Set<OutputReference> seen = new HashSet<>();
        for (OutputReference ref : inputs) {
            if (!seen.add(ref)) throw new IllegalArgumentException("Duplicate input " + ref);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        Transaction other = (Transaction) o;
        return inputs.equals(other.inputs) && outputs.equals(other.outputs)
                && fee.equals(other.fee) && mint.equals(other.mint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputs, outputs, fee, mint);
    }

    @Override
    public String toString() {
        return "Transaction{inputs=" + inputs.size() + ", outputs=" + outputs.size() + ", fee=" + fee
                + (mint.isZero() ? "" : ", mint=" + mint) + "}";
    }
}
