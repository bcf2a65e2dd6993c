package io.ledgersim.core.node;

public enum ProducerState {
    /** Waiting for the clock to reach a block boundary. */
    IDLE,
    /** Draining the mempool into a block. */
    PRODUCING
}
