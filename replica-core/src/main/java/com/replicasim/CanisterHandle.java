package com.replicasim;

import com.replicasim.builder.CallBuilder;
import com.replicasim.types.CallReply;
import com.replicasim.types.CanisterTask;
import com.replicasim.types.Env;
import com.replicasim.types.Message;
import com.replicasim.types.Principal;
import com.replicasim.types.RequestId;

/**
 * Reference to a canister in a replica, used to submit work to it and await the outcome.
 * Handles do not own the canister and can be created and dropped freely.
 *
 * @param canisterId the canister this handle points to
 * @param replica    the replica hosting it
 */
public record CanisterHandle(Principal canisterId, Replica replica) {

    /**
     * Submits a message to this canister.
     */
    public Awaitable<CallReply> submit(Message message) {
        return replica.submit(canisterId, message);
    }

    /**
     * Runs the given task on the canister's actor loop.
     */
    public Awaitable<CallReply> custom(CanisterTask task, Env env) {
        return submit(new Message.CustomTask(RequestId.next(), task, env));
    }

    public Awaitable<CallReply> custom(CanisterTask task) {
        return custom(task, Env.customTask());
    }

    /**
     * Runs a raw request on the canister.
     */
    public Awaitable<CallReply> runEnv(Env env) {
        return submit(new Message.Request(RequestId.next(), env));
    }

    /**
     * Runs the init hook. Use {@link #runEnv(Env)} with {@link Env#init()} for more control.
     */
    public Awaitable<CallReply> init() {
        return runEnv(Env.init());
    }

    public Awaitable<CallReply> preUpgrade() {
        return runEnv(Env.preUpgrade());
    }

    public Awaitable<CallReply> postUpgrade() {
        return runEnv(Env.postUpgrade());
    }

    public Awaitable<CallReply> heartbeat() {
        return runEnv(Env.heartbeat());
    }

    /**
     * Creates a call builder targeting this canister.
     */
    public CallBuilder newCall(String method) {
        return new CallBuilder(replica, canisterId, method);
    }

    @Override
    public String toString() {
        return "CanisterHandle[" + canisterId + "]";
    }
}
