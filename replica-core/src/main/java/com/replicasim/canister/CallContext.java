package com.replicasim.canister;

import com.replicasim.types.CallReply;
import com.replicasim.types.CanisterCall;
import com.replicasim.types.EntryMode;
import com.replicasim.types.Env;
import com.replicasim.types.Principal;
import com.replicasim.types.RejectionCode;
import com.replicasim.types.RequestId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Context of one message executed by a {@link HandlerCanister}. Effects (balance changes,
 * issued calls, the staged reply) only take effect when the canister commits the context.
 */
final class CallContext implements CanisterContext {

    private static final Logger logger = LoggerFactory.getLogger(CallContext.class);

    private final Principal canisterId;
    private final Env env;
    private final CompletableFuture<CallReply> replySender;
    private final long startBalance;
    private final Clock clock;

    private final List<CanisterCall> calls = new ArrayList<>();
    private long accepted;
    private long withdrawn;
    private boolean responded;
    private byte[] replyPayload;
    private String rejectMessage;
    private DeferredReply deferred;

    CallContext(Principal canisterId, Env env, CompletableFuture<CallReply> replySender, long startBalance, Clock clock) {
        this.canisterId = canisterId;
        this.env = env;
        this.replySender = replySender;
        this.startBalance = startBalance;
        this.clock = clock;
    }

    @Override
    public Principal id() {
        return canisterId;
    }

    @Override
    public Principal caller() {
        return env.sender();
    }

    @Override
    public EntryMode entryMode() {
        return env.entryMode();
    }

    @Override
    public String methodName() {
        return env.methodName();
    }

    @Override
    public byte[] args() {
        return env.args();
    }

    @Override
    public long time() {
        Instant now = clock.instant();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    @Override
    public long balance() {
        return startBalance + accepted - withdrawn;
    }

    @Override
    public long msgCyclesAvailable() {
        return env.cyclesAvailable() - accepted;
    }

    @Override
    public long msgCyclesAccept(long maxAmount) {
        if (maxAmount < 0) {
            throw new IllegalArgumentException("Cannot accept a negative amount of cycles");
        }
        long amount = Math.min(maxAmount, msgCyclesAvailable());
        accepted += amount;
        return amount;
    }

    @Override
    public long msgCyclesRefunded() {
        return env.cyclesRefunded();
    }

    @Override
    public RequestId call(Principal callee, String method, byte[] payload, long cycles) {
        Objects.requireNonNull(callee, "callee cannot be null");
        Objects.requireNonNull(method, "method cannot be null");
        if (env.entryMode() == EntryMode.QUERY) {
            trap("Queries cannot perform inter-canister calls");
        }
        if (cycles < 0) {
            throw new IllegalArgumentException("Cannot attach a negative amount of cycles");
        }
        if (cycles > balance()) {
            trap("Insufficient cycles: balance " + balance() + ", call to '" + callee + "' needs " + cycles);
        }
        withdrawn += cycles;
        CanisterCall call = CanisterCall.of(canisterId, callee, method, payload, cycles);
        calls.add(call);
        return call.requestId();
    }

    @Override
    public void reply(byte[] payload) {
        ensureCanRespond();
        responded = true;
        replyPayload = payload == null ? new byte[0] : payload.clone();
    }

    @Override
    public void reject(String message) {
        ensureCanRespond();
        responded = true;
        rejectMessage = message == null ? "" : message;
    }

    @Override
    public DeferredReply deferReply() {
        ensureCanRespond();
        responded = true;
        deferred = new DeferredReply(replySender, this::msgCyclesAvailable);
        return deferred;
    }

    @Override
    public void print(String text) {
        logger.info("[{}] {}", canisterId, text);
    }

    private void ensureCanRespond() {
        if (replySender == null) {
            trap("There is no request to respond to in " + env.entryMode());
        }
        if (responded) {
            trap("Reply already sent");
        }
    }

    List<CanisterCall> calls() {
        return calls;
    }

    long accepted() {
        return accepted;
    }

    /**
     * Net change this message made to the balance.
     */
    long balanceDelta() {
        return accepted - withdrawn;
    }

    DeferredReply deferred() {
        return deferred;
    }

    /**
     * Delivers the staged outcome. A request that was neither answered nor deferred gets an
     * empty reply.
     *
     * @return false if the caller already had an outcome (the call timed out), in which case
     *         the attached cycles went back to the caller and this message must not commit
     */
    boolean completeReply() {
        if (replySender == null) {
            return true;
        }
        if (deferred != null) {
            return !replySender.isDone();
        }
        long refund = msgCyclesAvailable();
        if (rejectMessage != null) {
            return replySender.complete(CallReply.reject(RejectionCode.CANISTER_REJECT, rejectMessage, refund));
        }
        return replySender.complete(CallReply.success(replyPayload, refund));
    }
}
