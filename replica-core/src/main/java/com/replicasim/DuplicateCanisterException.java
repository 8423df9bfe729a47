package com.replicasim;

import com.replicasim.types.Principal;

/**
 * Thrown when a canister id is registered twice in the same replica.
 */
public class DuplicateCanisterException extends ReplicaException {

    public DuplicateCanisterException(Principal canisterId) {
        super("Canister '" + canisterId + "' is already defined in the replica.", canisterId);
    }
}
