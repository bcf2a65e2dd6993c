package io.ledgersim.core.clock;

/**
 * Thrown when a POSIX time precedes the genesis start time.
 */
public final class InvalidTimeException extends IllegalArgumentException {
    private final long time;
    private final long startTime;

    public InvalidTimeException(long time, long startTime) {
        super("Time " + time + " is before genesis start " + startTime);
        this.time = time;
        this.startTime = startTime;
    }

    public long time() { return time; }
    public long startTime() { return startTime; }
}
