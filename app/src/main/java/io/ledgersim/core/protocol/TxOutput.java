package io.ledgersim.core.protocol;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * A transaction output: owner address, held value and optional opaque datum and
 * reference script. Holdings can never be negative.
 */
public final class TxOutput {
    private final String address;
    private final AssetBundle value;
    private final byte[] datum;      // null when absent
    private final byte[] scriptRef;  // null when absent

    public TxOutput(String address, AssetBundle value, byte[] datum, byte[] scriptRef) {
        if (!Address.isValid(address)) {
            throw new IllegalArgumentException("Invalid address: " + address);
        }
        Objects.requireNonNull(value, "value");
        for (BigInteger q : value.asMap().values()) {
            if (q.signum() < 0) {
                throw new IllegalArgumentException("Output holds a negative quantity: " + value);
            }
        }
        this.address = address;
        this.value = value;
        this.datum = datum != null ? datum.clone() : null;
        this.scriptRef = scriptRef != null ? scriptRef.clone() : null;
    }

    public TxOutput(String address, AssetBundle value) {
        this(address, value, null, null);
    }

    public TxOutput withDatum(byte[] d) { return new TxOutput(address, value, d, scriptRef); }
    public TxOutput withScriptRef(byte[] s) { return new TxOutput(address, value, datum, s); }
    public TxOutput withValue(AssetBundle v) { return new TxOutput(address, v, datum, scriptRef); }

    public String address() { return address; }
    public AssetBundle value() { return value; }
    public BigInteger lovelace() { return value.lovelace(); }
    public boolean hasDatum() { return datum != null; }
    public boolean hasScriptRef() { return scriptRef != null; }
    public byte[] datum() { return datum != null ? datum.clone() : null; }
    public byte[] scriptRef() { return scriptRef != null ? scriptRef.clone() : null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TxOutput)) return false;
        TxOutput other = (TxOutput) o;
        return address.equals(other.address)
                && value.equals(other.value)
                && Arrays.equals(datum, other.datum)
                && Arrays.equals(scriptRef, other.scriptRef);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(address, value);
        h = 31 * h + Arrays.hashCode(datum);
        return 31 * h + Arrays.hashCode(scriptRef);
    }

    @Override
    public String toString() {
        return "TxOutput{" + address + ", " + value
                + (datum != null ? ", datum=" + datum.length + "B" : "")
                + (scriptRef != null ? ", scriptRef=" + scriptRef.length + "B" : "") + "}";
    }
}
