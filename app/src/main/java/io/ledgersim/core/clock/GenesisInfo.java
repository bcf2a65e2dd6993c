package io.ledgersim.core.clock;

/**
 * Fixed genesis parameters of the simulated chain.
 * Slot length is in milliseconds, epoch length in slots.
 */
public final class GenesisInfo {
    public final long startTimeMs;
    public final long slotLengthMs;
    public final long epochLengthSlots;

    public GenesisInfo(long startTimeMs, long slotLengthMs, long epochLengthSlots) {
        if (slotLengthMs <= 0) {
            throw new IllegalArgumentException("slot length must be > 0, got " + slotLengthMs);
        }
        if (epochLengthSlots <= 0) {
            throw new IllegalArgumentException("epoch length must be > 0, got " + epochLengthSlots);
        }
        this.startTimeMs = startTimeMs;
        this.slotLengthMs = slotLengthMs;
        this.epochLengthSlots = epochLengthSlots;
    }

    /** Mainnet-shaped defaults: 1s slots, 5-day epochs. */
    public static GenesisInfo defaultMainnet() {
        return new GenesisInfo(
                1_506_203_091_000L,  // mainnet system start
                1_000L,
                432_000L
        );
    }

    @Override public String toString() {
        return "GenesisInfo{start=" + startTimeMs + ", slotLengthMs=" + slotLengthMs
                + ", epochLength=" + epochLengthSlots + "}";
    }
}
