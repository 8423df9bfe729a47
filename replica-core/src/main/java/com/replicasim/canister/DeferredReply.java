package com.replicasim.canister;

import com.replicasim.types.CallReply;
import com.replicasim.types.RejectionCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;

/**
 * A request whose answer was postponed with {@link CanisterContext#deferReply()}.
 * Exactly one of {@link #reply} or {@link #reject} may be called, from a later message of the
 * same canister. Cycles the deferring message accepted are held back until the answer is
 * delivered; if the call timed out first the answer is dropped and the canister keeps nothing.
 */
public final class DeferredReply {

    private static final Logger logger = LoggerFactory.getLogger(DeferredReply.class);

    private final CompletableFuture<CallReply> replySender;
    private final LongSupplier refund;
    private Runnable onDelivered;
    private boolean sent;

    DeferredReply(CompletableFuture<CallReply> replySender, LongSupplier refund) {
        this.replySender = replySender;
        this.refund = refund;
    }

    public void reply(byte[] payload) {
        complete(CallReply.success(payload, refund.getAsLong()));
    }

    public void reply(String payload) {
        reply(payload.getBytes(StandardCharsets.UTF_8));
    }

    public void reject(String message) {
        complete(CallReply.reject(RejectionCode.CANISTER_REJECT, message, refund.getAsLong()));
    }

    /**
     * Forwards an outcome received from another canister, keeping this request's refund.
     */
    public void forward(CallReply outcome) {
        if (outcome instanceof CallReply.Success success) {
            reply(success.payload());
        } else {
            CallReply.Reject reject = (CallReply.Reject) outcome;
            complete(CallReply.reject(reject.rejectionCode(), reject.rejectionMessage(), refund.getAsLong()));
        }
    }

    /**
     * @return true once this request was answered or its caller stopped waiting
     */
    public boolean isDone() {
        return sent || replySender.isDone();
    }

    /**
     * Called when the deferring message commits; {@code onDelivered} runs if the answer
     * reaches the caller.
     */
    void arm(Runnable onDelivered) {
        this.onDelivered = onDelivered;
    }

    private void complete(CallReply outcome) {
        if (sent) {
            throw new IllegalStateException("Reply already sent");
        }
        if (onDelivered == null && !replySender.isDone()) {
            throw new IllegalStateException("Deferred reply used in the message that deferred it, use reply() instead");
        }
        sent = true;
        if (replySender.complete(outcome)) {
            onDelivered.run();
        } else {
            logger.debug("Dropping deferred answer, the caller already has an outcome");
        }
    }
}
