package io.ledgersim.core.validation;

import io.ledgersim.core.protocol.OutputReference;
import io.ledgersim.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.List;

/** Non-empty inputs and outputs; every input must resolve in the ledger. */
public final class StructuralRule implements ValidationRule {

    @Override
    public ValidationResult check(ValidationContext ctx) {
        Transaction tx = ctx.tx();
        if (tx.inputs().isEmpty() || tx.outputs().isEmpty()) {
            return ValidationResult.invalid(
                    new ValidationError.EmptyInputsOrOutputs(tx.inputs().size(), tx.outputs().size()));
        }
        List<OutputReference> missing = new ArrayList<>();
        for (OutputReference ref : tx.inputs()) {
            if (!ctx.ledger().contains(ref)) {
                missing.add(ref);
            }
        }
        if (!missing.isEmpty()) {
            return ValidationResult.invalid(new ValidationError.MissingInput(missing));
        }
        return ValidationResult.valid();
    }
}
