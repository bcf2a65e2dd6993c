package io.ledgersim.core.codec;

import io.ledgersim.core.protocol.AssetBundle;
import io.ledgersim.core.protocol.Hashes;
import io.ledgersim.core.protocol.OutputReference;
import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.protocol.TxOutput;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.SortedMap;

/**
 * Deterministic big-endian encoding.
 *
 * <pre>
 * tx      = version:u8 | nIn:u32 | (txId:32 | index:u32)* | nOut:u32 | output* | fee:i128 | mint:bundle
 * output  = len:u32 address | value:bundle | hasDatum:u8 [len:u32 datum] | hasScript:u8 [len:u32 script]
 * bundle  = lovelace:i128 | nPolicy:u32 | (policy:28 | nAsset:u32 | (len:u32 name | qty:i128)*)*
 * </pre>
 *
 * Quantities are fixed-width 128-bit two's complement, so an encoding's length
 * depends only on the shape of the transaction, never on its amounts.
 */
public final class BinaryTxSerializer implements TxSerializer {

    public static final int VERSION = 1;
    public static final int QUANTITY_BYTES = 16;
    private static final int INPUT_BYTES = TransactionId.LENGTH + 4;
    private static final int POLICY_BYTES = 28;

    @Override
    public byte[] serialize(Transaction tx) {
        ByteBuffer buf = ByteBuffer.allocate(Math.toIntExact(serializedSize(tx)));
        buf.put((byte) VERSION);
        buf.putInt(tx.inputs().size());
        for (OutputReference in : tx.inputs()) {
            buf.put(in.txId().bytes());
            buf.putInt(in.index());
        }
        buf.putInt(tx.outputs().size());
        for (TxOutput out : tx.outputs()) {
            putOutput(buf, out);
        }
        putQuantity(buf, tx.fee());
        putBundle(buf, tx.mint());
        return sliceToArray(buf);
    }

    public byte[] serialize(TxOutput output) {
        ByteBuffer buf = ByteBuffer.allocate(Math.toIntExact(serializedSize(output)));
        putOutput(buf, output);
        return sliceToArray(buf);
    }

    @Override
    public long serializedSize(Transaction tx) {
        long size = 1 + 4 + (long) INPUT_BYTES * tx.inputs().size() + 4;
        for (TxOutput out : tx.outputs()) {
            size += serializedSize(out);
        }
        size += QUANTITY_BYTES;
        size += bundleSize(tx.mint());
        return size;
    }

    @Override
    public long serializedSize(TxOutput output) {
        long size = 4 + output.address().getBytes(StandardCharsets.UTF_8).length;
        size += bundleSize(output.value());
        size += 1 + (output.hasDatum() ? 4 + output.datum().length : 0);
        size += 1 + (output.hasScriptRef() ? 4 + output.scriptRef().length : 0);
        return size;
    }

    @Override
    public TransactionId hash(Transaction tx) {
        return new TransactionId(Hashes.sha256(serialize(tx)));
    }

    @Override
    public boolean canEncode(BigInteger quantity) {
        return quantity.bitLength() < QUANTITY_BYTES * 8;
    }

    // -------------------- helpers --------------------

    static long bundleSize(AssetBundle bundle) {
        long size = QUANTITY_BYTES + 4;
        for (SortedMap<String, BigInteger> assets : bundle.policies().values()) {
            size += POLICY_BYTES + 4;
            for (String name : assets.keySet()) {
                size += 4 + name.length() / 2 + QUANTITY_BYTES;
            }
        }
        return size;
    }

    private static void putOutput(ByteBuffer buf, TxOutput out) {
        putBytes(buf, out.address().getBytes(StandardCharsets.UTF_8));
        putBundle(buf, out.value());
        putOptional(buf, out.datum());
        putOptional(buf, out.scriptRef());
    }

    private static void putBundle(ByteBuffer buf, AssetBundle bundle) {
        putQuantity(buf, bundle.lovelace());
        SortedMap<String, SortedMap<String, BigInteger>> policies = bundle.policies();
        buf.putInt(policies.size());
        for (Map.Entry<String, SortedMap<String, BigInteger>> p : policies.entrySet()) {
            buf.put(Hashes.fromHex(p.getKey()));
            buf.putInt(p.getValue().size());
            for (Map.Entry<String, BigInteger> a : p.getValue().entrySet()) {
                putBytes(buf, Hashes.fromHex(a.getKey()));
                putQuantity(buf, a.getValue());
            }
        }
    }

    private static void putQuantity(ByteBuffer buf, BigInteger q) {
        byte[] raw = q.toByteArray();
        if (raw.length > QUANTITY_BYTES) {
            throw new IllegalArgumentException("Quantity does not fit in 128 bits: " + q);
        }
        byte pad = (byte) (q.signum() < 0 ? 0xff : 0x00);
        for (int i = raw.length; i < QUANTITY_BYTES; i++) {
            buf.put(pad);
        }
        buf.put(raw);
    }

    private static void putOptional(ByteBuffer buf, byte[] b) {
        if (b == null) {
            buf.put((byte) 0);
        } else {
            buf.put((byte) 1);
            putBytes(buf, b);
        }
    }

    private static void putBytes(ByteBuffer buf, byte[] b){
        buf.putInt(b.length); buf.put(b);
    }

    private static byte[] sliceToArray(ByteBuffer buf){
        buf.flip(); byte[] out = new byte[buf.remaining()]; buf.get(out); return out;
    }
}
