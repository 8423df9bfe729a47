package com.replicasim.builder;

import com.replicasim.Awaitable;
import com.replicasim.Replica;
import com.replicasim.types.CallReply;
import com.replicasim.types.CanisterCall;
import com.replicasim.types.Principal;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builder for update calls submitted to a replica from outside any canister.
 * <p>
 * Example usage:
 * <pre>{@code
 * CallReply reply = replica.newCall(counterId, "increment")
 *     .withArgs("5")
 *     .withCaller(Principal.of("alice"))
 *     .withPayment(1_000)
 *     .perform()
 *     .get();
 * }</pre>
 */
public class CallBuilder {

    private final Replica replica;
    private final Principal callee;
    private final String method;
    private byte[] args = new byte[0];
    private Principal caller = Principal.anonymous();
    private long payment = 0;

    public CallBuilder(Replica replica, Principal callee, String method) {
        this.replica = Objects.requireNonNull(replica, "replica cannot be null");
        this.callee = Objects.requireNonNull(callee, "callee cannot be null");
        this.method = Objects.requireNonNull(method, "method cannot be null");
    }

    public CallBuilder withArgs(byte[] args) {
        this.args = args == null ? new byte[0] : args.clone();
        return this;
    }

    public CallBuilder withArgs(String args) {
        return withArgs(args.getBytes(StandardCharsets.UTF_8));
    }

    public CallBuilder withCaller(Principal caller) {
        this.caller = Objects.requireNonNull(caller, "caller cannot be null");
        return this;
    }

    /**
     * Attaches cycles to the call.
     */
    public CallBuilder withPayment(long cycles) {
        if (cycles < 0) {
            throw new IllegalArgumentException("Payment cannot be negative");
        }
        this.payment = cycles;
        return this;
    }

    /**
     * Builds the call without sending it.
     */
    public CanisterCall build() {
        return CanisterCall.of(caller, callee, method, args, payment);
    }

    /**
     * Sends the call.
     */
    public Awaitable<CallReply> perform() {
        return replica.performCall(build());
    }
}
