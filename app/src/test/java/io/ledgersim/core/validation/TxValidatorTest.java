package io.ledgersim.core.validation;

import io.ledgersim.core.codec.BinaryTxSerializer;
import io.ledgersim.core.protocol.AssetBundle;
import io.ledgersim.core.protocol.AssetId;
import io.ledgersim.core.protocol.Hashes;
import io.ledgersim.core.protocol.OutputReference;
import io.ledgersim.core.protocol.ProtocolParameters;
import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TransactionId;
import io.ledgersim.core.protocol.TxOutput;
import io.ledgersim.core.protocol.UnspentOutput;
import io.ledgersim.core.state.InMemoryUtxoStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TxValidatorTest {

    private static final String ALICE = "addr_test1qalice0000000000000000";
    private static final String BOB = "addr_test1qbob000000000000000000";
    private static final long HUNDRED_ADA = 100_000_000L;
    private static final long FEE = 1_000_000L;
    private static final AssetId TOKEN = AssetId.of("1f".repeat(28), "token");

    private static final OutputReference GENESIS = new OutputReference(
            new TransactionId(Hashes.sha256("genesis".getBytes(StandardCharsets.UTF_8))), 0);

    private InMemoryUtxoStore ledger;
    private TxValidator validator;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryUtxoStore();
        ledger.seed(new UnspentOutput(GENESIS, new TxOutput(ALICE, AssetBundle.lovelace(HUNDRED_ADA))));
        validator = new TxValidator(ProtocolParameters.defaultMainnet(), new BinaryTxSerializer());
    }

    // -------------------- the 100 ADA scenario --------------------

    @Test
    void balancedSpendIsAccepted() {
        ValidationResult r = validator.validate(spend(99_000_000L, FEE), ledger);
        assertTrue(r.isValid(), r::toString);
    }

    @Test
    void oneExtraLovelaceIsCreatedFromNothing() {
        ValidationResult r = validator.validate(spend(99_000_001L, FEE), ledger);

        assertEquals(ProtocolError.VALUE_PRESERVATION_VIOLATION, r.code());
        ValidationError.ValuePreservationViolation v =
                r.find(ValidationError.ValuePreservationViolation.class).orElseThrow();
        assertEquals(AssetId.LOVELACE, v.asset());
        assertEquals(BigInteger.ONE, v.difference());
        assertEquals(ValidationError.Imbalance.CREATED_FROM_NOTHING, v.imbalance());
        assertTrue(v.message().contains("creating 1 lovelace from nothing"), v.message());
    }

    @Test
    void twoExtraLovelaceIsCreatingTwo() {
        ValidationResult r = validator.validate(spend(99_000_002L, FEE), ledger);
        ValidationError.ValuePreservationViolation v =
                r.find(ValidationError.ValuePreservationViolation.class).orElseThrow();
        assertEquals(BigInteger.TWO, v.difference());
        assertEquals(BigInteger.valueOf(HUNDRED_ADA), v.expected());
        assertEquals(BigInteger.valueOf(HUNDRED_ADA + 2), v.actual());
    }

    @Test
    void underSpendingDestroysValue() {
        ValidationResult r = validator.validate(spend(98_000_000L, FEE), ledger);
        ValidationError.ValuePreservationViolation v =
                r.find(ValidationError.ValuePreservationViolation.class).orElseThrow();
        assertEquals(ValidationError.Imbalance.DESTROYED, v.imbalance());
        assertTrue(v.message().contains("destroying 1000000"), v.message());
    }

    @Test
    void mintingWithDeclarationIsAccepted() {
        Transaction tx = Transaction.builder()
                .input(GENESIS)
                .output(BOB, AssetBundle.lovelace(99_000_000L).with(TOKEN, 1_000))
                .fee(FEE)
                .mint(AssetBundle.singleAsset(TOKEN, 1_000))
                .build();

        assertTrue(validator.validate(tx, ledger).isValid());
    }

    @Test
    void mintingWithoutDeclarationIsRejected() {
        Transaction tx = Transaction.builder()
                .input(GENESIS)
                .output(BOB, AssetBundle.lovelace(99_000_000L).with(TOKEN, 1_000))
                .fee(FEE)
                .build();

        ValidationResult r = validator.validate(tx, ledger);

        assertEquals(ProtocolError.VALUE_PRESERVATION_VIOLATION, r.code());
        ValidationError.ValuePreservationViolation v =
                r.find(ValidationError.ValuePreservationViolation.class).orElseThrow();
        assertEquals(TOKEN, v.asset());
        assertEquals(BigInteger.valueOf(1_000), v.difference());
    }

    @Test
    void lovelaceCannotBeMinted() {
        Transaction tx = Transaction.builder()
                .input(GENESIS)
                .output(BOB, AssetBundle.lovelace(99_000_005L))
                .fee(FEE)
                .mint(AssetBundle.lovelace(5))
                .build();

        ValidationResult r = validator.validate(tx, ledger);

        assertEquals(ProtocolError.ILLEGAL_BASE_CURRENCY_MINT, r.code());
        ValidationError.IllegalBaseCurrencyMint e = r.find(ValidationError.IllegalBaseCurrencyMint.class).orElseThrow();
        assertEquals(BigInteger.valueOf(5), e.attemptedMint());
        assertEquals(BigInteger.ZERO, e.attemptedBurn());
    }

    @Test
    void lovelaceCannotBeBurned() {
        Transaction tx = Transaction.builder()
                .input(GENESIS)
                .output(BOB, AssetBundle.lovelace(98_999_995L))
                .fee(FEE)
                .mint(AssetBundle.lovelace(-5))
                .build();

        ValidationError.IllegalBaseCurrencyMint e = validator.validate(tx, ledger)
                .find(ValidationError.IllegalBaseCurrencyMint.class).orElseThrow();
        assertEquals(BigInteger.valueOf(5), e.attemptedBurn());
    }

    // -------------------- burns --------------------

    @Test
    void declaredBurnIsAccepted() {
        OutputReference withTokens = seedTokens(500);
        Transaction tx = Transaction.builder()
                .input(withTokens)
                .output(ALICE, AssetBundle.lovelace(99_000_000L).with(TOKEN, 300))
                .fee(FEE)
                .mint(AssetBundle.singleAsset(TOKEN, -200))
                .build();

        assertTrue(validator.validate(tx, ledger).isValid());
    }

    @Test
    void undeclaredBurnIsRejectedAsDestroyed() {
        OutputReference withTokens = seedTokens(500);
        Transaction tx = Transaction.builder()
                .input(withTokens)
                .output(ALICE, AssetBundle.lovelace(99_000_000L).with(TOKEN, 300))
                .fee(FEE)
                .build();

        ValidationError.ValuePreservationViolation v = validator.validate(tx, ledger)
                .find(ValidationError.ValuePreservationViolation.class).orElseThrow();
        assertEquals(TOKEN, v.asset());
        assertEquals(BigInteger.valueOf(-200), v.difference());
        assertEquals(ValidationError.Imbalance.DESTROYED, v.imbalance());
    }

    @Test
    void everyUnbalancedAssetIsReportedInCanonicalOrder() {
        OutputReference withTokens = seedTokens(500);
        Transaction tx = Transaction.builder()
                .input(withTokens)
                .output(ALICE, AssetBundle.lovelace(99_000_001L).with(TOKEN, 499))
                .fee(FEE)
                .build();

        List<ValidationError> errors = validator.validate(tx, ledger).errors();

        assertEquals(2, errors.size());
        assertEquals(AssetId.LOVELACE, ((ValidationError.ValuePreservationViolation) errors.get(0)).asset());
        assertEquals(TOKEN, ((ValidationError.ValuePreservationViolation) errors.get(1)).asset());
    }

    // -------------------- fees --------------------

    @Test
    void exactMinimumFeeIsAcceptedAndOneLessIsNot() {
        BigInteger minFee = validator.minimumFee(spend(1L, 0L));

        Transaction exact = spend(HUNDRED_ADA - minFee.longValueExact(), minFee.longValueExact());
        assertTrue(validator.validate(exact, ledger).isValid());

        long lower = minFee.longValueExact() - 1;
        Transaction under = spend(HUNDRED_ADA - lower, lower);
        ValidationResult r = validator.validate(under, ledger);
        assertEquals(ProtocolError.INSUFFICIENT_FEE, r.code());
        ValidationError.InsufficientFee e = r.find(ValidationError.InsufficientFee.class).orElseThrow();
        assertEquals(minFee, e.required());
        assertEquals(BigInteger.valueOf(lower), e.actual());
        assertTrue(e.message().startsWith("Insufficient fee"), e.message());
    }

    @Test
    void halfTheMinimumFeeIsRejected() {
        long half = validator.minimumFee(spend(1L, 0L)).longValueExact() / 2;
        assertEquals(ProtocolError.INSUFFICIENT_FEE,
                validator.validate(spend(HUNDRED_ADA - half, half), ledger).code());
    }

    @Test
    void minimumFeeGrowsWithTransactionSize() {
        Transaction one = spend(1L, 0L);
        Transaction two = one.toBuilder().output(ALICE, AssetBundle.lovelace(1)).build();
        assertTrue(validator.minimumFee(two).compareTo(validator.minimumFee(one)) > 0);
    }

    // -------------------- deposits --------------------

    @Test
    void tinyOutputsAreRejectedForDeposit() {
        for (long amount : new long[] {0L, 1L, 1_000L}) {
            Transaction tx = Transaction.builder()
                    .input(GENESIS)
                    .output(BOB, AssetBundle.lovelace(amount))
                    .output(ALICE, AssetBundle.lovelace(HUNDRED_ADA - FEE - amount))
                    .fee(FEE)
                    .build();

            ValidationResult r = validator.validate(tx, ledger);

            assertEquals(ProtocolError.INSUFFICIENT_DEPOSIT, r.code(), "amount " + amount);
            ValidationError.InsufficientDeposit e = r.find(ValidationError.InsufficientDeposit.class).orElseThrow();
            assertEquals(0, e.outputIndex());
            assertEquals(BigInteger.valueOf(amount), e.actual());
            assertTrue(e.message().contains("insufficient ADA"), e.message());
        }
    }

    @Test
    void exactMinimumDepositIsAccepted() {
        long min = validator.minimumOutputDeposit(new TxOutput(BOB, AssetBundle.lovelace(1))).longValueExact();
        Transaction tx = Transaction.builder()
                .input(GENESIS)
                .output(BOB, AssetBundle.lovelace(min))
                .output(ALICE, AssetBundle.lovelace(HUNDRED_ADA - FEE - min))
                .fee(FEE)
                .build();

        assertTrue(validator.validate(tx, ledger).isValid());
    }

    @Test
    void anyShortOutputFailsTheTransaction() {
        Transaction tx = Transaction.builder()
                .input(GENESIS)
                .output(BOB, AssetBundle.lovelace(5_000_000L))
                .output(ALICE, AssetBundle.lovelace(5_000_000L))
                .output(BOB, AssetBundle.lovelace(10L))
                .output(ALICE, AssetBundle.lovelace(HUNDRED_ADA - FEE - 10_000_010L))
                .fee(FEE)
                .build();

        ValidationError.InsufficientDeposit e = validator.validate(tx, ledger)
                .find(ValidationError.InsufficientDeposit.class).orElseThrow();
        assertEquals(2, e.outputIndex());
    }

    @Test
    void depositGrowsWithDatumAndAssets() {
        TxOutput plain = new TxOutput(BOB, AssetBundle.lovelace(1));
        BigInteger base = validator.minimumOutputDeposit(plain);

        BigInteger withDatum = validator.minimumOutputDeposit(plain.withDatum(new byte[32]));
        BigInteger withAsset = validator.minimumOutputDeposit(plain.withValue(plain.value().with(TOKEN, 1)));
        BigInteger withTwoAssets = validator.minimumOutputDeposit(plain.withValue(plain.value()
                .with(TOKEN, 1).with(AssetId.of("1f".repeat(28), "second"), 1)));

        assertTrue(withDatum.compareTo(base) > 0);
        assertTrue(withAsset.compareTo(base) > 0);
        assertTrue(withTwoAssets.compareTo(withAsset) > 0);
    }

    @Test
    void scriptReferenceIsPaidForByTheByte() {
        TxOutput plain = new TxOutput(BOB, AssetBundle.lovelace(1));
        BigInteger base = validator.minimumOutputDeposit(plain);
        BigInteger coinsPerByte = ProtocolParameters.defaultMainnet().coinsPerUtxoByte;

        BigInteger withScript = validator.minimumOutputDeposit(plain.withScriptRef(new byte[100]));
        BigInteger withDatum = validator.minimumOutputDeposit(plain.withDatum(new byte[32]));
        BigInteger withBoth = validator.minimumOutputDeposit(plain.withDatum(new byte[32]).withScriptRef(new byte[100]));

        // 4-byte length prefix plus the script itself
        assertEquals(base.add(coinsPerByte.multiply(BigInteger.valueOf(104))), withScript);
        assertTrue(withBoth.compareTo(withDatum) > 0);
        assertEquals(withDatum.add(withScript).subtract(base), withBoth);
    }

    // -------------------- rule order --------------------

    @Test
    void missingInputIsReportedBeforeFee() {
        OutputReference unknown = new OutputReference(GENESIS.txId(), 9);
        Transaction tx = Transaction.builder()
                .input(unknown)
                .output(BOB, AssetBundle.lovelace(1))
                .build();

        ValidationResult r = validator.validate(tx, ledger);

        assertEquals(1, r.errors().size());
        assertEquals(ProtocolError.MISSING_INPUT, r.code());
        assertEquals(List.of(unknown), r.find(ValidationError.MissingInput.class).orElseThrow().unresolved());
    }

    @Test
    void oversizeIsReportedBeforeFee() {
        TxValidator strict = new TxValidator(ProtocolParameters.defaultMainnet().withMaxTxSize(64),
                new BinaryTxSerializer());

        ValidationResult r = strict.validate(spend(99_999_999L, 1L), ledger);

        assertEquals(ProtocolError.OVERSIZED_TRANSACTION, r.code());
        assertEquals(64, r.find(ValidationError.OversizedTransaction.class).orElseThrow().limit());
    }

    @Test
    void quantityWiderThan128BitsIsRejectedNotThrown() {
        BigInteger tooWide = BigInteger.TWO.pow(127);
        Transaction tx = Transaction.builder()
                .input(GENESIS)
                .output(BOB, AssetBundle.lovelace(HUNDRED_ADA - FEE).with(TOKEN, tooWide))
                .fee(FEE)
                .mint(AssetBundle.of(Map.of(TOKEN, tooWide)))
                .build();

        ValidationResult r = validator.validate(tx, ledger);

        assertEquals(ProtocolError.QUANTITY_OUT_OF_RANGE, r.code());
        List<ValidationError.QuantityOutOfRange> wide = r.errors().stream()
                .filter(e -> e instanceof ValidationError.QuantityOutOfRange)
                .map(e -> (ValidationError.QuantityOutOfRange) e)
                .toList();
        assertEquals(List.of("output 0", "mint"), wide.stream().map(ValidationError.QuantityOutOfRange::field).toList());
        assertEquals(TOKEN, wide.get(0).asset());
        assertEquals(tooWide, wide.get(0).quantity());
    }

    @Test
    void largestEncodableQuantityPassesTheSizeRule() {
        BigInteger widest = BigInteger.TWO.pow(127).subtract(BigInteger.ONE);
        Transaction tx = Transaction.builder()
                .input(GENESIS)
                .output(BOB, AssetBundle.lovelace(HUNDRED_ADA - FEE).with(TOKEN, widest))
                .fee(FEE)
                .mint(AssetBundle.of(Map.of(TOKEN, widest)))
                .build();

        assertTrue(validator.validate(tx, ledger).isValid());
    }

    @Test
    void feeIsReportedBeforeValuePreservation() {
        ValidationResult r = validator.validate(spend(HUNDRED_ADA, 0L), ledger);
        assertEquals(ProtocolError.INSUFFICIENT_FEE, r.code());
    }

    @Test
    void validationDoesNotTouchTheLedger() {
        validator.validate(spend(99_000_000L, FEE), ledger);
        assertEquals(1, ledger.size());
        assertTrue(ledger.contains(GENESIS));
    }

    // -------------------- helpers --------------------

    private static Transaction spend(long toBob, long fee) {
        return Transaction.builder()
                .input(GENESIS)
                .output(BOB, AssetBundle.lovelace(toBob))
                .fee(fee)
                .build();
    }

    private OutputReference seedTokens(long tokens) {
        OutputReference ref = new OutputReference(GENESIS.txId(), 1);
        ledger.seed(new UnspentOutput(ref, new TxOutput(ALICE, AssetBundle.lovelace(HUNDRED_ADA).with(TOKEN, tokens))));
        return ref;
    }
}
