package io.ledgersim.core.protocol;

import java.util.Objects;

/**
 * Points at output {@code index} of transaction {@code txId}. UTxO-set key.
 */
public final class OutputReference implements Comparable<OutputReference> {
    private final TransactionId txId;
    private final int index;

    public OutputReference(TransactionId txId, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Output index must be >= 0, got " + index);
        }
        this.txId = Objects.requireNonNull(txId, "txId");
        this.index = index;
    }

    public TransactionId txId() { return txId; }
    public int index() { return index; }

    /** Parses the {@code <hex>#<index>} form produced by {@link #toString()}. */
    public static OutputReference parse(String text) {
        int sep = text == null ? -1 : text.lastIndexOf('#');
        if (sep <= 0) {
            throw new IllegalArgumentException("Expected <txId>#<index>: " + text);
        }
        try {
            return new OutputReference(TransactionId.fromHex(text.substring(0, sep)),
                    Integer.parseInt(text.substring(sep + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad output index in " + text, e);
        }
    }

    @Override
    public int compareTo(OutputReference other) {
        int c = txId.compareTo(other.txId);
        return c != 0 ? c : Integer.compare(index, other.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutputReference)) return false;
        OutputReference other = (OutputReference) o;
        return index == other.index && txId.equals(other.txId);
    }

    @Override
    public int hashCode() {
        return 31 * txId.hashCode() + index;
    }

    @Override
    public String toString() {
        return txId.hex() + "#" + index;
    }
}
