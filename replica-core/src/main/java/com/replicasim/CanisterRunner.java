package com.replicasim;

import com.replicasim.canister.Canister;
import com.replicasim.config.ReplicaConfig;
import com.replicasim.dispatcher.Dispatcher;
import com.replicasim.dispatcher.DispatcherMailbox;
import com.replicasim.dispatcher.MailboxRunner;
import com.replicasim.dispatcher.MessageReceiver;
import com.replicasim.types.CallReply;
import com.replicasim.types.CanisterCall;
import com.replicasim.types.Principal;
import com.replicasim.types.RejectionCode;
import com.replicasim.types.RequestId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Actor loop of one canister. Owns the canister exclusively and feeds it the messages of its
 * mailbox one at a time. Every call the canister issues is routed through the replica, and a
 * watcher on the call's outcome channel brings the outcome back into this mailbox as a
 * reply message.
 */
final class CanisterRunner implements MessageReceiver<CanisterMessage> {

    private static final Logger logger = LoggerFactory.getLogger(CanisterRunner.class);

    private final Replica replica;
    private final Canister canister;
    private final Principal canisterId;
    private final OutstandingCalls outstandingCalls;
    private final Optional<Duration> callTimeout;
    private final DispatcherMailbox<CanisterMessage> mailbox;

    CanisterRunner(Replica replica, Canister canister, Dispatcher dispatcher, ReplicaConfig config,
                   OutstandingCalls outstandingCalls) {
        this.replica = replica;
        this.canister = canister;
        this.canisterId = canister.id();
        this.outstandingCalls = outstandingCalls;
        this.callTimeout = config.getCallTimeout();

        AtomicReference<Runnable> scheduleRef = new AtomicReference<>();
        this.mailbox = DispatcherMailbox.create(
                config.getMailboxType(),
                () -> {
                    Runnable r = scheduleRef.get();
                    if (r != null) {
                        dispatcher.schedule(r);
                    }
                },
                canisterId.toString());
        scheduleRef.set(new MailboxRunner<>(
                "canister-" + canisterId,
                mailbox,
                this,
                this::onProcessingFailure,
                dispatcher,
                config.getThroughput()));
    }

    DispatcherMailbox<CanisterMessage> mailbox() {
        return mailbox;
    }

    Principal canisterId() {
        return canisterId;
    }

    @Override
    public void receive(CanisterMessage message) {
        logger.trace("Canister {} processing {}", canisterId, message.message());
        List<CanisterCall> calls = canister.processMessage(message.message(), message.replySender());
        if (calls == null) {
            return;
        }
        for (CanisterCall call : calls) {
            issue(call);
        }
    }

    private void issue(CanisterCall call) {
        if (!call.sender().equals(canisterId)) {
            throw new ReplicaException("Canister '" + canisterId + "' issued a call as '" + call.sender() + "'",
                    canisterId);
        }
        RequestId requestId = call.requestId();
        outstandingCalls.register(requestId, canisterId);

        CompletableFuture<CallReply> outcome = new CompletableFuture<>();
        callTimeout.ifPresent(timeout -> outcome.completeOnTimeout(
                CallReply.reject(RejectionCode.SYS_TRANSIENT,
                        "Call " + requestId + " to '" + call.callee() + "' timed out after " + timeout.toMillis() + "ms",
                        call.cycles()),
                timeout.toMillis(), TimeUnit.MILLISECONDS));
        outcome.whenComplete((reply, error) -> deliver(requestId, reply, error));

        logger.debug("Canister {} calls {}.{} as {} with {} cycles",
                canisterId, call.callee(), call.method(), requestId, call.cycles());
        try {
            replica.enqueueRequest(call.callee(), call.toMessage(), outcome);
        } catch (ReplicaException e) {
            outcome.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Watcher of one outstanding call: turns its outcome into a reply message for this canister.
     */
    private void deliver(RequestId requestId, CallReply reply, Throwable error) {
        // Retired only once the reply is queued, so an idle replica has no reply in transit.
        try {
            if (error != null) {
                logger.error("Canister {}: could not get the response of inter-canister call {}",
                        canisterId, requestId, error);
                return;
            }
            replica.routeReply(canisterId, reply.toMessage(requestId));
        } catch (ReplicaException e) {
            if (replica.isShutdown()) {
                logger.debug("Canister {}: dropping response of {} after shutdown", canisterId, requestId);
            } else {
                logger.error("Canister {}: could not route the response of {}", canisterId, requestId, e);
            }
        } finally {
            outstandingCalls.retire(requestId);
        }
    }

    private void onProcessingFailure(CanisterMessage message, Throwable error) {
        CompletableFuture<CallReply> replySender = message.replySender();
        if (error instanceof ReplicaException) {
            logger.error("Canister {}: fatal error processing {}", canisterId, message.message(), error);
            if (replySender != null) {
                replySender.completeExceptionally(error);
            }
            return;
        }
        logger.error("Canister {} error processing message: {}", canisterId, message.message(), error);
        if (replySender != null) {
            replySender.complete(CallReply.reject(RejectionCode.CANISTER_ERROR,
                    "Canister '" + canisterId + "' failed: " + error.getMessage(),
                    message.message().attachedCycles()));
        }
    }
}
