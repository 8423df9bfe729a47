package com.replicasim;

/**
 * Thrown when waiting for a call reply fails because the replica could not route or deliver
 * the call. A canister rejection is a normal {@link com.replicasim.types.CallReply.Reject},
 * not an exception.
 */
public class ReplyException extends RuntimeException {

    public ReplyException(String message) {
        super(message);
    }

    public ReplyException(String message, Throwable cause) {
        super(message, cause);
    }

    public ReplyException(Throwable cause) {
        super(cause);
    }
}
