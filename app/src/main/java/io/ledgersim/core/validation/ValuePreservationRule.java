package io.ledgersim.core.validation;

import io.ledgersim.core.protocol.AssetBundle;
import io.ledgersim.core.protocol.AssetId;
import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.UnspentOutput;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * For every asset: {@code inputs + mint == outputs (+ fee for lovelace)}, where the
 * mint field is signed (negative entries burn). Lovelace can never be minted or burned.
 * All unbalanced assets are reported, lovelace first, then by policy id and asset name.
 */
public final class ValuePreservationRule implements ValidationRule {

    @Override
    public ValidationResult check(ValidationContext ctx) {
        Transaction tx = ctx.tx();
        AssetBundle mint = tx.mint();

        BigInteger lovelaceMint = mint.lovelace();
        if (lovelaceMint.signum() != 0) {
            BigInteger minted = lovelaceMint.max(BigInteger.ZERO);
            BigInteger burned = lovelaceMint.min(BigInteger.ZERO).negate();
            return ValidationResult.invalid(new ValidationError.IllegalBaseCurrencyMint(minted, burned));
        }

        AssetBundle inputs = AssetBundle.empty();
        for (UnspentOutput utxo : ctx.resolvedInputs()) {
            inputs = inputs.add(utxo.value());
        }
        AssetBundle outputs = tx.outputTotal();

        SortedSet<AssetId> assets = new TreeSet<>();
        assets.addAll(inputs.assetIds());
        assets.addAll(outputs.assetIds());
        assets.addAll(mint.assetIds());

        List<ValidationError> violations = new ArrayList<>();
        for (AssetId asset : assets) {
            BigInteger in = inputs.quantityOf(asset);
            BigInteger out = outputs.quantityOf(asset);
            BigInteger minted = mint.quantityOf(asset);
            BigInteger fee = asset.isLovelace() ? tx.fee() : BigInteger.ZERO;

            BigInteger expected = in.add(minted);
            BigInteger actual = out.add(fee);
            BigInteger difference = actual.subtract(expected);
            if (difference.signum() != 0) {
                ValidationError.Imbalance imbalance = difference.signum() > 0
                        ? ValidationError.Imbalance.CREATED_FROM_NOTHING
                        : ValidationError.Imbalance.DESTROYED;
                violations.add(new ValidationError.ValuePreservationViolation(
                        asset, in, out, minted, fee, expected, actual, difference, imbalance));
            }
        }
        return violations.isEmpty() ? ValidationResult.valid() : ValidationResult.invalid(violations);
    }
}
