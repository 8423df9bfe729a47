package com.replicasim;

import com.replicasim.types.Principal;

/**
 * Thrown when the replica cannot deliver a message it is responsible for: the replica or
 * a registered mailbox no longer accepts messages, or a reply targets a canister that is
 * not registered.
 */
public class RoutingException extends ReplicaException {

    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Principal canisterId) {
        super(message, canisterId);
    }
}
