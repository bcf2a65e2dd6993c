package io.ledgersim.core.validation;

/** Closed set of reasons a transaction can be refused. */
public enum ProtocolError {
    EMPTY_INPUTS_OR_OUTPUTS,
    MISSING_INPUT,
    OVERSIZED_TRANSACTION,
    QUANTITY_OUT_OF_RANGE,
    INSUFFICIENT_FEE,
    INSUFFICIENT_DEPOSIT,
    ILLEGAL_BASE_CURRENCY_MINT,
    VALUE_PRESERVATION_VIOLATION,
    QUEUE_FULL
}
