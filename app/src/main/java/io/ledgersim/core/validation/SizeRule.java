package io.ledgersim.core.validation;

import io.ledgersim.core.codec.TxSerializer;
import io.ledgersim.core.protocol.AssetBundle;
import io.ledgersim.core.protocol.AssetId;
import io.ledgersim.core.protocol.Transaction;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rejects transactions the wire format cannot carry: a quantity wider than the
 * encoding's quantity field, or an encoded size above {@code maxTxSize}.
 */
public final class SizeRule implements ValidationRule {

    @Override
    public ValidationResult check(ValidationContext ctx) {
        List<ValidationError> errors = unencodableQuantities(ctx.tx(), ctx.serializer());
        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors);
        }
        long size = ctx.txSize();
        long limit = ctx.params().maxTxSize;
        if (size > limit) {
            return ValidationResult.invalid(new ValidationError.OversizedTransaction(size, limit));
        }
        return ValidationResult.valid();
    }

    private static List<ValidationError> unencodableQuantities(Transaction tx, TxSerializer serializer) {
        List<ValidationError> errors = new ArrayList<>();
        for (int i = 0; i < tx.outputs().size(); i++) {
            collect(errors, "output " + i, tx.outputs().get(i).value(), serializer);
        }
        if (!serializer.canEncode(tx.fee())) {
            errors.add(new ValidationError.QuantityOutOfRange("fee", AssetId.LOVELACE, tx.fee()));
        }
        collect(errors, "mint", tx.mint(), serializer);
        return errors;
    }

    private static void collect(List<ValidationError> errors, String field, AssetBundle bundle, TxSerializer serializer) {
        for (Map.Entry<AssetId, BigInteger> e : bundle.asMap().entrySet()) {
            if (!serializer.canEncode(e.getValue())) {
                errors.add(new ValidationError.QuantityOutOfRange(field, e.getKey(), e.getValue()));
            }
        }
    }
}
