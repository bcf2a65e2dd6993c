package io.ledgersim.core.protocol;

import java.util.Arrays;

/**
 * 32-byte content hash identifying a transaction.
 */
public final class TransactionId implements Comparable<TransactionId> {
    public static final int LENGTH = 32;
    private final byte[] bytes;

    public TransactionId(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Transaction id must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static TransactionId fromHex(String hex) {
        return new TransactionId(Hashes.fromHex(hex));
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hashes.toHex(bytes); }

    @Override public int compareTo(TransactionId other) { return Arrays.compareUnsigned(bytes, other.bytes); }
    @Override public boolean equals(Object o){ return o instanceof TransactionId && Arrays.equals(bytes, ((TransactionId)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return hex(); }
}
