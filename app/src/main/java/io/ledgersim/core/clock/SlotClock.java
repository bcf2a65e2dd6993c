package io.ledgersim.core.clock;

import static java.lang.Math.addExact;
import static java.lang.Math.multiplyExact;

/**
 * Virtual slot clock. Only {@code currentSlot} is mutable; epoch, block height
 * and POSIX time are all derived from it and the genesis parameters.
 *
 * Block production is modelled deterministically: one block every
 * {@code round(1 / activeSlotCoefficient)} slots, counted from the initial slot.
 */
public final class SlotClock {

    private final GenesisInfo genesis;
    private final long initialSlot;
    private final long slotsPerBlock;
    private long currentSlot;

    public SlotClock(GenesisInfo genesis, double activeSlotCoefficient, long initialSlot) {
        if (genesis == null) {
            throw new IllegalArgumentException("Genesis info required");
        }
        if (!(activeSlotCoefficient > 0.0 && activeSlotCoefficient <= 1.0)) {
            throw new IllegalArgumentException("active slot coefficient must be in (0, 1], got " + activeSlotCoefficient);
        }
        if (initialSlot < 0) {
            throw new IllegalArgumentException("initial slot must be >= 0");
        }
        this.genesis = genesis;
        this.initialSlot = initialSlot;
        this.slotsPerBlock = Math.max(1L, Math.round(1.0 / activeSlotCoefficient));
        this.currentSlot = initialSlot;
    }

    public SlotClock(GenesisInfo genesis, double activeSlotCoefficient) {
        this(genesis, activeSlotCoefficient, 0L);
    }

    // -------------------- conversions --------------------

    public long slotToTime(long slot) {
        return addExact(genesis.startTimeMs, multiplyExact(slot, genesis.slotLengthMs));
    }

    public long timeToSlot(long timeMs) {
        if (timeMs < genesis.startTimeMs) {
            throw new InvalidTimeException(timeMs, genesis.startTimeMs);
        }
        return (timeMs - genesis.startTimeMs) / genesis.slotLengthMs;
    }

    public long slotToEpoch(long slot) {
        return slot / genesis.epochLengthSlots;
    }

    /** Number of whole blocks produced between the initial slot and {@code slot}. */
    public long slotToBlockHeight(long slot) {
        if (slot <= initialSlot) {
            return 0L;
        }
        return (slot - initialSlot) / slotsPerBlock;
    }

    // -------------------- current state --------------------

    public synchronized long currentSlot() { return currentSlot; }
    public synchronized long currentTime() { return slotToTime(currentSlot); }
    public synchronized long currentEpoch() { return slotToEpoch(currentSlot); }
    public synchronized long blockHeight() { return slotToBlockHeight(currentSlot); }

    public synchronized boolean isOnBlockBoundary() {
        return (currentSlot - initialSlot) % slotsPerBlock == 0;
    }

    public synchronized long slotsUntilNextBlock() {
        return slotsPerBlock - ((currentSlot - initialSlot) % slotsPerBlock);
    }

    // -------------------- mutation --------------------

    public synchronized long advanceSlots(long n) {
        if (n <= 0) {
            throw new IllegalArgumentException("slots to advance must be > 0, got " + n);
        }
        currentSlot = addExact(currentSlot, n);
        return currentSlot;
    }

    public synchronized long advanceToNextBlock() {
        return advanceSlots(slotsUntilNextBlock());
    }

    public GenesisInfo genesis() { return genesis; }
    public long initialSlot() { return initialSlot; }
    public long slotsPerBlock() { return slotsPerBlock; }
}
