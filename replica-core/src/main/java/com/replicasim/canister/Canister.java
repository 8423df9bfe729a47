package com.replicasim.canister;

import com.replicasim.types.CallReply;
import com.replicasim.types.CanisterCall;
import com.replicasim.types.Message;
import com.replicasim.types.Principal;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Processing entry point of a canister.
 * <p>
 * An instance is handed to the replica when it is registered and from then on is only
 * touched by that canister's actor loop: {@link #processMessage} is never called
 * concurrently and needs no synchronization.
 */
public interface Canister {

    /**
     * The principal the canister is registered under.
     */
    Principal id();

    /**
     * Executes one message.
     *
     * @param message     the message taken from the canister's mailbox
     * @param replySender the channel the sender awaits, or null for {@link Message.Reply} messages;
     *                    it may be completed now, later, or never (the sender then waits forever).
     *                    If it is already complete, or {@code complete} returns false, the call
     *                    timed out and its cycles were refunded: the canister must not keep them
     * @return the calls to issue, in order; possibly empty, never null
     */
    List<CanisterCall> processMessage(Message message, CompletableFuture<CallReply> replySender);
}
