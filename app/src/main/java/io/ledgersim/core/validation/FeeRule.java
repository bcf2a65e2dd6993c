package io.ledgersim.core.validation;

import io.ledgersim.core.protocol.ProtocolParameters;

import java.math.BigInteger;

/** Linear fee: {@code txFeePerByte * size + txFeeFixed}. */
public final class FeeRule implements ValidationRule {

    public static BigInteger minimumFee(ProtocolParameters params, long txSize) {
        return params.txFeePerByte.multiply(BigInteger.valueOf(txSize)).add(params.txFeeFixed);
    }

    @Override
    public ValidationResult check(ValidationContext ctx) {
        long size = ctx.txSize();
        BigInteger required = minimumFee(ctx.params(), size);
        BigInteger actual = ctx.tx().fee();
        if (actual.compareTo(required) < 0) {
            return ValidationResult.invalid(new ValidationError.InsufficientFee(required, actual, size));
        }
        return ValidationResult.valid();
    }
}
