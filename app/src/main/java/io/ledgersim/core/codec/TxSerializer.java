package io.ledgersim.core.codec;

import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.protocol.TxOutput;

import java.math.BigInteger;

/**
 * Wire encoding boundary. The ledger never interprets the bytes; it only needs
 * their length (for fee, size and deposit rules) and the content hash.
 */
public interface TxSerializer {

    byte[] serialize(Transaction tx);

    /** Encoded length of {@code tx}; must equal {@code serialize(tx).length}. */
    long serializedSize(Transaction tx);

    /** Encoded length of a single output as it appears inside a transaction. */
    long serializedSize(TxOutput output);

    TransactionId hash(Transaction tx);

    /** Whether {@code quantity} fits the encoding's quantity field; {@link #serialize} rejects it otherwise. */
    boolean canEncode(BigInteger quantity);
}
