package io.ledgersim.core.validation;

import io.ledgersim.core.protocol.AssetId;
import io.ledgersim.core.protocol.OutputReference;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single reason for refusing a transaction. Every variant carries the exact
 * quantities it compared so callers can assert on numbers, not just on the code.
 */
public interface ValidationError {

    ProtocolError code();

    String message();

    final class EmptyInputsOrOutputs implements ValidationError {
        private final int inputCount;
        private final int outputCount;

        public EmptyInputsOrOutputs(int inputCount, int outputCount) {
            this.inputCount = inputCount;
            this.outputCount = outputCount;
        }

        public int inputCount() { return inputCount; }
        public int outputCount() { return outputCount; }

        @Override public ProtocolError code() { return ProtocolError.EMPTY_INPUTS_OR_OUTPUTS; }
        @Override public String message() {
            return "Transaction needs at least one input and one output (inputs=" + inputCount
                    + ", outputs=" + outputCount + ")";
        }
        @Override public String toString() { return code() + ": " + message(); }
    }

    final class MissingInput implements ValidationError {
        private final List<OutputReference> unresolved;

        public MissingInput(List<OutputReference> unresolved) {
            this.unresolved = List.copyOf(unresolved);
        }

        public List<OutputReference> unresolved() { return unresolved; }

        @Override public ProtocolError code() { return ProtocolError.MISSING_INPUT; }
        @Override public String message() {
            return "Missing inputs in ledger: " + unresolved.stream()
                    .map(OutputReference::toString)
                    .collect(Collectors.joining(", "));
        }
        @Override public String toString() { return code() + ": " + message(); }
    }

    final class OversizedTransaction implements ValidationError {
        private final long actual;
        private final long limit;

        public OversizedTransaction(long actual, long limit) {
            this.actual = actual;
            this.limit = limit;
        }

        public long actual() { return actual; }
        public long limit() { return limit; }

        @Override public ProtocolError code() { return ProtocolError.OVERSIZED_TRANSACTION; }
        @Override public String message() {
            return "Transaction size " + actual + " bytes exceeds limit of " + limit + " bytes";
        }
        @Override public String toString() { return code() + ": " + message(); }
    }

    /** A quantity in {@code field} ("output N", "fee" or "mint") too wide for the wire encoding. */
    final class QuantityOutOfRange implements ValidationError {
        private final String field;
        private final AssetId asset;
        private final BigInteger quantity;

        public QuantityOutOfRange(String field, AssetId asset, BigInteger quantity) {
            this.field = Objects.requireNonNull(field, "field");
            this.asset = Objects.requireNonNull(asset, "asset");
            this.quantity = Objects.requireNonNull(quantity, "quantity");
        }

        public String field() { return field; }
        public AssetId asset() { return asset; }
        public BigInteger quantity() { return quantity; }

        @Override public ProtocolError code() { return ProtocolError.QUANTITY_OUT_OF_RANGE; }
        @Override public String message() {
            return "Quantity " + quantity + " of " + asset + " in " + field + " cannot be encoded";
        }
        @Override public String toString() { return code() + ": " + message(); }
    }

    final class InsufficientFee implements ValidationError {
        private final BigInteger required;
        private final BigInteger actual;
        private final long txSize;

        public InsufficientFee(BigInteger required, BigInteger actual, long txSize) {
            this.required = required;
            this.actual = actual;
            this.txSize = txSize;
        }

        public BigInteger required() { return required; }
        public BigInteger actual() { return actual; }
        public long txSize() { return txSize; }

        @Override public ProtocolError code() { return ProtocolError.INSUFFICIENT_FEE; }
        @Override public String message() {
            return "Insufficient fee: required " + required + " lovelace for " + txSize
                    + " bytes, got " + actual + " (short by " + required.subtract(actual) + ")";
        }
        @Override public String toString() { return code() + ": " + message(); }
    }

    final class InsufficientDeposit implements ValidationError {
        private final int outputIndex;
        private final BigInteger required;
        private final BigInteger actual;

        public InsufficientDeposit(int outputIndex, BigInteger required, BigInteger actual) {
            this.outputIndex = outputIndex;
            this.required = required;
            this.actual = actual;
        }

        public int outputIndex() { return outputIndex; }
        public BigInteger required() { return required; }
        public BigInteger actual() { return actual; }

        @Override public ProtocolError code() { return ProtocolError.INSUFFICIENT_DEPOSIT; }
        @Override public String message() {
            return "Output " + outputIndex + " has insufficient ADA: requires at least " + required
                    + " lovelace, holds " + actual;
        }
        @Override public String toString() { return code() + ": " + message(); }
    }

    final class IllegalBaseCurrencyMint implements ValidationError {
        private final BigInteger attemptedMint;
        private final BigInteger attemptedBurn;

        public IllegalBaseCurrencyMint(BigInteger attemptedMint, BigInteger attemptedBurn) {
            this.attemptedMint = attemptedMint;
            this.attemptedBurn = attemptedBurn;
        }

        public BigInteger attemptedMint() { return attemptedMint; }
        public BigInteger attemptedBurn() { return attemptedBurn; }

        @Override public ProtocolError code() { return ProtocolError.ILLEGAL_BASE_CURRENCY_MINT; }
        @Override public String message() {
            return "Cannot mint or burn lovelace (mint=" + attemptedMint + ", burn=" + attemptedBurn + ")";
        }
        @Override public String toString() { return code() + ": " + message(); }
    }

    /** Direction of an unbalanced asset. */
    enum Imbalance {
        /** outputs (+ fee) exceed inputs + minted: inflation. */
        CREATED_FROM_NOTHING,
        /** inputs + minted exceed outputs (+ fee): burn without a mint declaration. */
        DESTROYED
    }

    /**
     * {@code expected = inputAmount + mintedAmount} is what the transaction may spend;
     * {@code actual = outputAmount (+ fee for lovelace)} is what it spends;
     * {@code difference = actual - expected}.
     */
    final class ValuePreservationViolation implements ValidationError {
        private final AssetId asset;
        private final BigInteger inputAmount;
        private final BigInteger outputAmount;
        private final BigInteger mintedAmount;
        private final BigInteger fee;
        private final BigInteger expected;
        private final BigInteger actual;
        private final BigInteger difference;
        private final Imbalance imbalance;

        public ValuePreservationViolation(AssetId asset,
                                          BigInteger inputAmount,
                                          BigInteger outputAmount,
                                          BigInteger mintedAmount,
                                          BigInteger fee,
                                          BigInteger expected,
                                          BigInteger actual,
                                          BigInteger difference,
                                          Imbalance imbalance) {
            this.asset = Objects.requireNonNull(asset, "asset");
            this.inputAmount = inputAmount;
            this.outputAmount = outputAmount;
            this.mintedAmount = mintedAmount;
            this.fee = fee;
            this.expected = expected;
            this.actual = actual;
            this.difference = difference;
            this.imbalance = Objects.requireNonNull(imbalance, "imbalance");
        }

        public AssetId asset() { return asset; }
        public BigInteger inputAmount() { return inputAmount; }
        public BigInteger outputAmount() { return outputAmount; }
        public BigInteger mintedAmount() { return mintedAmount; }
        public BigInteger fee() { return fee; }
        public BigInteger expected() { return expected; }
        public BigInteger actual() { return actual; }
        public BigInteger difference() { return difference; }
        public Imbalance imbalance() { return imbalance; }

        @Override public ProtocolError code() { return ProtocolError.VALUE_PRESERVATION_VIOLATION; }

        @Override public String message() {
            String verb = imbalance == Imbalance.CREATED_FROM_NOTHING ? "creating " : "destroying ";
            String tail = imbalance == Imbalance.CREATED_FROM_NOTHING ? " from nothing" : "";
            return "Value not preserved: " + verb + difference.abs() + " " + asset + tail
                    + " (inputs " + inputAmount + " + minted " + mintedAmount + " = " + expected
                    + ", outputs " + outputAmount + (asset.isLovelace() ? " + fee " + fee : "")
                    + " = " + actual + ")";
        }
        @Override public String toString() { return code() + ": " + message(); }
    }

    final class QueueFull implements ValidationError {
        private final long pendingBytes;
        private final long transactionBytes;
        private final long limit;

        public QueueFull(long pendingBytes, long transactionBytes, long limit) {
            this.pendingBytes = pendingBytes;
            this.transactionBytes = transactionBytes;
            this.limit = limit;
        }

        public long pendingBytes() { return pendingBytes; }
        public long transactionBytes() { return transactionBytes; }
        public long limit() { return limit; }

        @Override public ProtocolError code() { return ProtocolError.QUEUE_FULL; }
        @Override public String message() {
            return "Mempool full: " + pendingBytes + " bytes queued + " + transactionBytes
                    + " bytes would exceed " + limit + " bytes";
        }
        @Override public String toString() { return code() + ": " + message(); }
    }
}
