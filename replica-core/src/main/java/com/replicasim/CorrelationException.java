package com.replicasim;

import com.replicasim.types.Principal;
import com.replicasim.types.RequestId;

/**
 * Thrown when a call is issued with a request id that is still outstanding.
 * Letting it through would deliver a reply to the wrong caller.
 */
public class CorrelationException extends ReplicaException {

    private final RequestId requestId;

    public CorrelationException(RequestId requestId, Principal canisterId) {
        super("Request id " + requestId + " is already outstanding", canisterId);
        this.requestId = requestId;
    }

    public RequestId getRequestId() {
        return requestId;
    }
}
