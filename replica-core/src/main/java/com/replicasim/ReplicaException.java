package com.replicasim;

import com.replicasim.types.Principal;

/**
 * Base class of the unrecoverable conditions raised by the replica.
 * These indicate a programming or configuration error and are never turned into
 * an ordinary rejection.
 */
public class ReplicaException extends RuntimeException {

    /** The canister involved, if any. */
    private final Principal canisterId;

    public ReplicaException(String message) {
        super(message);
        this.canisterId = null;
    }

    public ReplicaException(String message, Throwable cause) {
        super(message, cause);
        this.canisterId = null;
    }

    public ReplicaException(String message, Principal canisterId) {
        super(message);
        this.canisterId = canisterId;
    }

    public ReplicaException(String message, Throwable cause, Principal canisterId) {
        super(message, cause);
        this.canisterId = canisterId;
    }

    /**
     * Returns the canister involved in the failure.
     *
     * @return the canister id, or null if not specified
     */
    public Principal getCanisterId() {
        return canisterId;
    }
}
