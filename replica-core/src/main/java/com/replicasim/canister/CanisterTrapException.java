package com.replicasim.canister;

import com.replicasim.types.Principal;

/**
 * Raised when canister code traps. The message is rolled back and rejected; the replica
 * itself keeps running.
 */
public class CanisterTrapException extends RuntimeException {

    private final Principal canisterId;

    public CanisterTrapException(String message, Principal canisterId) {
        super(message);
        this.canisterId = canisterId;
    }

    public Principal getCanisterId() {
        return canisterId;
    }
}
