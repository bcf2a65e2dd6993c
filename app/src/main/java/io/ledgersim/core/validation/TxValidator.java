package io.ledgersim.core.validation;

import io.ledgersim.core.codec.TxSerializer;
import io.ledgersim.core.protocol.ProtocolParameters;
import io.ledgersim.core.protocol.Transaction;
import io.ledgersim.core.protocol.TxOutput;
import io.ledgersim.core.state.LedgerView;

import java.math.BigInteger;
import java.util.List;

/**
 * Phase-1 validation pipeline. Rules run cheapest first and stop at the first failure:
 * structure, size, fee, minimum deposit, value preservation.
 */
public class TxValidator {
    private final ProtocolParameters params;
    private final TxSerializer serializer;
    private final List<ValidationRule> rules;

    public TxValidator(ProtocolParameters params, TxSerializer serializer) {
        this(params, serializer, List.of(
                new StructuralRule(),
                new SizeRule(),
                new FeeRule(),
                new MinDepositRule(),
                new ValuePreservationRule()));
    }

    public TxValidator(ProtocolParameters params, TxSerializer serializer, List<ValidationRule> rules) {
        if (params == null || serializer == null) {
            throw new IllegalArgumentException("Protocol parameters and serializer required");
        }
        this.params = params;
        this.serializer = serializer;
        this.rules = List.copyOf(rules);
    }

    public ValidationResult validate(Transaction tx, LedgerView ledger) {
        ValidationContext ctx = new ValidationContext(tx, ledger, params, serializer);
        for (ValidationRule rule : rules) {
            ValidationResult result = rule.check(ctx);
            if (!result.isValid()) {
                return result;
            }
        }
        return ValidationResult.valid();
    }

    public BigInteger minimumFee(Transaction tx) {
        return FeeRule.minimumFee(params, serializer.serializedSize(tx));
    }

    public BigInteger minimumOutputDeposit(TxOutput output) {
        return MinDepositRule.minimumDeposit(params, serializer, output);
    }

    public ProtocolParameters params() { return params; }
    public TxSerializer serializer() { return serializer; }
}
