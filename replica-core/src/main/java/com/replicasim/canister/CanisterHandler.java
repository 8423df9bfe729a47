package com.replicasim.canister;

import com.replicasim.types.CallReply;
import com.replicasim.types.RequestId;

/**
 * Business logic of a {@link HandlerCanister}. The handler holds the canister's state; it is
 * only invoked from the canister's actor loop, one message at a time.
 * <p>
 * Throwing from any method traps: the message is rejected with
 * {@link com.replicasim.types.RejectionCode#CANISTER_ERROR}, the attached cycles are refunded
 * and the calls issued while handling it are dropped.
 */
public interface CanisterHandler {

    default void init(CanisterContext context) {
    }

    default void preUpgrade(CanisterContext context) {
    }

    default void postUpgrade(CanisterContext context) {
    }

    default void heartbeat(CanisterContext context) {
    }

    /**
     * Handles an update or query call; {@link CanisterContext#methodName()} names the method.
     */
    void onRequest(CanisterContext context);

    /**
     * Handles the outcome of a call this canister issued. Replies are ordinary mailbox
     * messages, so other requests may have been handled since the call went out.
     *
     * @param requestId the id returned by {@link CanisterContext#call} when the call was issued
     * @param reply     the outcome
     * @param context   the context; {@link CanisterContext#caller()} is the callee
     */
    default void onReply(RequestId requestId, CallReply reply, CanisterContext context) {
    }
}
