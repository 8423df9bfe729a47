package com.replicasim.canister;

import com.replicasim.types.CallReply;
import com.replicasim.types.CanisterCall;
import com.replicasim.types.EntryMode;
import com.replicasim.types.Env;
import com.replicasim.types.Message;
import com.replicasim.types.Principal;
import com.replicasim.types.RejectionCode;
import com.replicasim.types.RequestId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Canister that delegates its business logic to a {@link CanisterHandler} and keeps the
 * cycle balance.
 * <p>
 * A message either commits (its balance changes and calls take effect and its reply is sent)
 * or traps (everything it did is dropped and the sender gets a
 * {@link RejectionCode#CANISTER_ERROR} rejection with all attached cycles refunded).
 * Refunds carried by replies are credited before the callback runs and survive a trap in it.
 * <p>
 * Once the caller has an outcome (the call timed out) the attached cycles are back with the
 * caller: a request that has not run yet is skipped, and one that is still running when the
 * timeout fires commits nothing.
 */
public final class HandlerCanister implements Canister {

    private static final Logger logger = LoggerFactory.getLogger(HandlerCanister.class);

    private final Principal id;
    private final CanisterHandler handler;
    private final Clock clock;
    // calls issued and not answered yet, request id -> callee
    private final Map<RequestId, Principal> awaitingReply = new HashMap<>();
    private long balance;

    public HandlerCanister(Principal id, CanisterHandler handler) {
        this(id, handler, 0L, Clock.systemUTC());
    }

    public HandlerCanister(Principal id, CanisterHandler handler, long initialBalance) {
        this(id, handler, initialBalance, Clock.systemUTC());
    }

    public HandlerCanister(Principal id, CanisterHandler handler, long initialBalance, Clock clock) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.handler = Objects.requireNonNull(handler, "handler cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        if (initialBalance < 0) {
            throw new IllegalArgumentException("Initial balance cannot be negative");
        }
        this.balance = initialBalance;
    }

    public static HandlerCanister of(String id, CanisterHandler handler) {
        return new HandlerCanister(Principal.of(id), handler);
    }

    @Override
    public Principal id() {
        return id;
    }

    /**
     * Current cycle balance. Only meaningful when read from the canister's own actor loop
     * or once the replica is idle.
     */
    public long balance() {
        return balance;
    }

    @Override
    public List<CanisterCall> processMessage(Message message, CompletableFuture<CallReply> replySender) {
        if (message instanceof Message.CustomTask task) {
            runTask(task, replySender);
            return List.of();
        }
        if (message instanceof Message.Request request) {
            return runRequest(request, replySender);
        }
        return runReply((Message.Reply) message);
    }

    private void runTask(Message.CustomTask task, CompletableFuture<CallReply> replySender) {
        long attached = task.env().cyclesAvailable();
        try {
            task.task().run();
        } catch (Exception e) {
            logger.warn("Canister {} trapped in custom task {}: {}", id, task.requestId(), e.getMessage());
            complete(replySender, trapped(e, attached));
            return;
        }
        complete(replySender, CallReply.success(new byte[0], attached));
    }

    private List<CanisterCall> runRequest(Message.Request request, CompletableFuture<CallReply> replySender) {
        Env env = request.env();
        if (replySender != null && replySender.isDone()) {
            logger.debug("Canister {} skipping {} '{}', the caller already has an outcome",
                    id, env.entryMode(), env.methodName());
            return List.of();
        }
        CallContext context = new CallContext(id, env, replySender, balance, clock);
        try {
            dispatch(env.entryMode(), context);
        } catch (RuntimeException e) {
            logger.warn("Canister {} trapped in {} '{}': {}", id, env.entryMode(), env.methodName(), e.getMessage());
            complete(replySender, trapped(e, env.cyclesAvailable()));
            return List.of();
        }
        return commit(context);
    }

    private void dispatch(EntryMode mode, CanisterContext context) {
        switch (mode) {
            case INIT -> handler.init(context);
            case PRE_UPGRADE -> handler.preUpgrade(context);
            case POST_UPGRADE -> handler.postUpgrade(context);
            case HEARTBEAT -> handler.heartbeat(context);
            case UPDATE, QUERY -> handler.onRequest(context);
            default -> context.trap("Entry mode " + mode + " cannot be used for a request");
        }
    }

    private List<CanisterCall> runReply(Message.Reply reply) {
        Principal callee = awaitingReply.remove(reply.replyTo());
        if (callee == null) {
            logger.warn("Canister {} received a reply for unknown call {}", id, reply.replyTo());
            return List.of();
        }
        CallReply outcome = reply.outcome();
        balance += outcome.cyclesRefunded();

        Env env = Env.customTask()
                .withEntryMode(outcome.isSuccess() ? EntryMode.REPLY_CALLBACK : EntryMode.REJECT_CALLBACK)
                .withSender(callee)
                .withCyclesRefunded(outcome.cyclesRefunded())
                .withArgs(outcome instanceof CallReply.Success success ? success.payload() : null);
        CallContext context = new CallContext(id, env, null, balance, clock);
        try {
            handler.onReply(reply.replyTo(), outcome, context);
        } catch (RuntimeException e) {
            logger.warn("Canister {} trapped in callback of {}: {}", id, reply.replyTo(), e.getMessage());
            return List.of();
        }
        return commit(context);
    }

    private List<CanisterCall> commit(CallContext context) {
        if (!context.completeReply()) {
            logger.debug("Canister {} dropping effects of '{}', the caller already has an outcome",
                    id, context.methodName());
            return List.of();
        }
        long delta = context.balanceDelta();
        DeferredReply deferred = context.deferred();
        if (deferred != null) {
            // accepted cycles stay in escrow until the deferred answer is delivered
            long escrow = Math.min(context.accepted(), balance + delta);
            balance += delta - escrow;
            deferred.arm(() -> balance += escrow);
        } else {
            balance += delta;
        }
        List<CanisterCall> calls = context.calls();
        for (CanisterCall call : calls) {
            awaitingReply.put(call.requestId(), call.callee());
        }
        return List.copyOf(calls);
    }

    private CallReply trapped(Exception e, long refund) {
        return CallReply.reject(RejectionCode.CANISTER_ERROR,
                "Canister '" + id + "' trapped: " + e.getMessage(), refund);
    }

    private static void complete(CompletableFuture<CallReply> replySender, CallReply outcome) {
        if (replySender != null) {
            replySender.complete(outcome);
        }
    }
}
