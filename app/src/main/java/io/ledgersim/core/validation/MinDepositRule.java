package io.ledgersim.core.validation;

import io.ledgersim.core.codec.TxSerializer;
import io.ledgersim.core.protocol.ProtocolParameters;
import io.ledgersim.core.protocol.TxOutput;

import java.math.BigInteger;
import java.util.List;

/**
 * Each output must hold enough lovelace to pay for the space it occupies:
 * {@code (OUTPUT_OVERHEAD_BYTES + serializedSize(output)) * coinsPerUtxoByte}.
 */
public final class MinDepositRule implements ValidationRule {

    /** Fixed per-entry overhead of a UTxO in the ledger state, in bytes. */
    public static final long OUTPUT_OVERHEAD_BYTES = 160L;

    public static BigInteger minimumDeposit(ProtocolParameters params, TxSerializer serializer, TxOutput output) {
        long bytes = OUTPUT_OVERHEAD_BYTES + serializer.serializedSize(output);
        return params.coinsPerUtxoByte.multiply(BigInteger.valueOf(bytes));
    }

    @Override
    public ValidationResult check(ValidationContext ctx) {
        List<TxOutput> outputs = ctx.tx().outputs();
        for (int i = 0; i < outputs.size(); i++) {
            TxOutput out = outputs.get(i);
            BigInteger required = minimumDeposit(ctx.params(), ctx.serializer(), out);
            if (out.lovelace().compareTo(required) < 0) {
                return ValidationResult.invalid(new ValidationError.InsufficientDeposit(i, required, out.lovelace()));
            }
        }
        return ValidationResult.valid();
    }
}
