package com.replicasim;

import com.replicasim.types.Principal;
import com.replicasim.types.RequestId;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Request ids of the inter-canister calls currently in flight, with the canister waiting for
 * each. An id is live from the moment its call is issued until its outcome has been handed
 * back to the caller.
 */
final class OutstandingCalls {

    private final ConcurrentHashMap<RequestId, Principal> calls = new ConcurrentHashMap<>();

    /**
     * Marks a call as outstanding.
     *
     * @throws CorrelationException if the id is already outstanding
     */
    void register(RequestId requestId, Principal caller) {
        Principal previous = calls.putIfAbsent(requestId, caller);
        if (previous != null) {
            throw new CorrelationException(requestId, caller);
        }
    }

    /**
     * Retires an outstanding call.
     *
     * @return true if the id was outstanding
     */
    boolean retire(RequestId requestId) {
        return calls.remove(requestId) != null;
    }

    boolean isOutstanding(RequestId requestId) {
        return calls.containsKey(requestId);
    }

    int size() {
        return calls.size();
    }
}
