package com.replicasim.types;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Correlation id of a call. Ids come from a single process-wide counter, so an id is
 * never handed out twice while the JVM is alive.
 *
 * @param value the numeric id
 */
public record RequestId(long value) implements Comparable<RequestId> {

    private static final AtomicLong SEQUENCE = new AtomicLong(0);

    /**
     * Generates a fresh request id.
     *
     * @return an id that has never been returned before in this process
     */
    public static RequestId next() {
        return new RequestId(SEQUENCE.incrementAndGet());
    }

    @Override
    public int compareTo(RequestId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "req-" + value;
    }
}
