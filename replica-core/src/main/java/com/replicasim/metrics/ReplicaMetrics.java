package com.replicasim.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters kept by the replica's control loop.
 */
public class ReplicaMetrics {

    private final AtomicLong canistersRegistered = new AtomicLong(0);
    private final AtomicLong requestsRouted = new AtomicLong(0);
    private final AtomicLong repliesRouted = new AtomicLong(0);
    private final AtomicLong destinationInvalid = new AtomicLong(0);
    private final AtomicLong cyclesRefunded = new AtomicLong(0);
    private final AtomicLong fatalErrors = new AtomicLong(0);

    public void canisterRegistered() {
        canistersRegistered.incrementAndGet();
    }

    public void requestRouted() {
        requestsRouted.incrementAndGet();
    }

    public void replyRouted() {
        repliesRouted.incrementAndGet();
    }

    /**
     * Records a request rejected because its destination does not exist.
     *
     * @param refunded the cycles refunded to the caller
     */
    public void destinationInvalid(long refunded) {
        destinationInvalid.incrementAndGet();
        cyclesRefunded.addAndGet(refunded);
    }

    public void fatalError() {
        fatalErrors.incrementAndGet();
    }

    public long getCanistersRegistered() {
        return canistersRegistered.get();
    }

    public long getRequestsRouted() {
        return requestsRouted.get();
    }

    public long getRepliesRouted() {
        return repliesRouted.get();
    }

    public long getDestinationInvalidCount() {
        return destinationInvalid.get();
    }

    /**
     * Gets the total cycles refunded for requests to unknown destinations.
     */
    public long getCyclesRefunded() {
        return cyclesRefunded.get();
    }

    public long getFatalErrors() {
        return fatalErrors.get();
    }

    @Override
    public String toString() {
        return "ReplicaMetrics{canisters=" + canistersRegistered.get()
                + ", requestsRouted=" + requestsRouted.get()
                + ", repliesRouted=" + repliesRouted.get()
                + ", destinationInvalid=" + destinationInvalid.get()
                + ", cyclesRefunded=" + cyclesRefunded.get()
                + ", fatalErrors=" + fatalErrors.get()
                + "}";
    }
}
