package com.replicasim.canister;

import com.replicasim.types.EntryMode;
import com.replicasim.types.Principal;
import com.replicasim.types.RequestId;

import java.nio.charset.StandardCharsets;

/**
 * View of the message being executed, handed to a {@link CanisterHandler}.
 * A context is only valid while the handler method it was passed to is running.
 */
public interface CanisterContext {

    /**
     * The principal of the executing canister.
     */
    Principal id();

    /**
     * The caller of the current message; in reply callbacks, the callee that answered.
     */
    Principal caller();

    EntryMode entryMode();

    String methodName();

    byte[] args();

    default String argsText() {
        return new String(args(), StandardCharsets.UTF_8);
    }

    /**
     * Current time in nanoseconds since the epoch.
     */
    long time();

    /**
     * Cycle balance of the canister, including cycles accepted and withdrawn by this message.
     */
    long balance();

    /**
     * Cycles attached to the current message that have not been accepted yet.
     */
    long msgCyclesAvailable();

    /**
     * Moves up to {@code maxAmount} of the attached cycles into the canister's balance.
     *
     * @return the amount actually accepted
     */
    long msgCyclesAccept(long maxAmount);

    /**
     * Cycles refunded by the callee; only non-zero in reply callbacks.
     */
    long msgCyclesRefunded();

    /**
     * Issues an inter-canister call. The call leaves once the current message has been
     * handled; its outcome arrives later through {@link CanisterHandler#onReply}.
     * The attached cycles are withdrawn from the balance immediately.
     *
     * @return the request id the outcome will be correlated with
     * @throws CanisterTrapException if the balance does not cover {@code cycles}, or when
     *                               executing a query
     */
    RequestId call(Principal callee, String method, byte[] payload, long cycles);

    default RequestId call(Principal callee, String method, String payload) {
        return call(callee, method, payload.getBytes(StandardCharsets.UTF_8), 0);
    }

    /**
     * Answers the current request. Cycles not accepted are refunded.
     */
    void reply(byte[] payload);

    default void reply(String payload) {
        reply(payload.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Rejects the current request with {@link com.replicasim.types.RejectionCode#CANISTER_REJECT}.
     */
    void reject(String message);

    /**
     * Keeps the current request open so it can be answered from a later message,
     * typically the reply callback of a call made on its behalf.
     */
    DeferredReply deferReply();

    /**
     * Writes a line to the canister's log.
     */
    void print(String text);

    /**
     * Aborts the current message.
     */
    default void trap(String message) {
        throw new CanisterTrapException(message, id());
    }
}
