package io.ledgersim.core.protocol;

import java.math.BigInteger;

/** Ledger protocol parameters; supplied once and never mutated. */
public final class ProtocolParameters {
    public final BigInteger txFeePerByte;
    public final BigInteger txFeeFixed;
    public final long maxTxSize;
    public final long maxBlockBodySize;
    public final BigInteger coinsPerUtxoByte;
    public final double activeSlotCoefficient;

    public ProtocolParameters(BigInteger txFeePerByte, BigInteger txFeeFixed, long maxTxSize,
                              long maxBlockBodySize, BigInteger coinsPerUtxoByte, double activeSlotCoefficient) {
        if (txFeePerByte.signum() < 0 || txFeeFixed.signum() < 0 || coinsPerUtxoByte.signum() < 0) {
            throw new IllegalArgumentException("Fee and deposit coefficients must be >= 0");
        }
        if (maxTxSize <= 0 || maxBlockBodySize <= 0) {
            throw new IllegalArgumentException("Size limits must be > 0");
        }
        this.txFeePerByte = txFeePerByte;
        this.txFeeFixed = txFeeFixed;
        this.maxTxSize = maxTxSize;
        this.maxBlockBodySize = maxBlockBodySize;
        this.coinsPerUtxoByte = coinsPerUtxoByte;
        this.activeSlotCoefficient = activeSlotCoefficient;
    }

    /** Mainnet values (Babbage era). */
    public static ProtocolParameters defaultMainnet() {
        return new ProtocolParameters(
                BigInteger.valueOf(44L),       // minFeeA
                BigInteger.valueOf(155_381L),  // minFeeB
                16_384L,
                90_112L,
                BigInteger.valueOf(4_310L),
                0.05
        );
    }

    public ProtocolParameters withMaxTxSize(long size) {
        return new ProtocolParameters(txFeePerByte, txFeeFixed, size, maxBlockBodySize, coinsPerUtxoByte, activeSlotCoefficient);
    }

    public ProtocolParameters withMaxBlockBodySize(long size) {
        return new ProtocolParameters(txFeePerByte, txFeeFixed, maxTxSize, size, coinsPerUtxoByte, activeSlotCoefficient);
    }

    @Override public String toString() {
        return "ProtocolParameters{feePerByte=" + txFeePerByte + ", feeFixed=" + txFeeFixed
                + ", maxTxSize=" + maxTxSize + ", maxBlockBodySize=" + maxBlockBodySize
                + ", coinsPerUtxoByte=" + coinsPerUtxoByte + ", f=" + activeSlotCoefficient + "}";
    }
}
