package com.replicasim;

import com.replicasim.dispatcher.DispatcherMailbox;
import com.replicasim.types.CallReply;
import com.replicasim.types.Message;
import com.replicasim.types.Principal;

import java.util.concurrent.CompletableFuture;

/**
 * Commands processed by the replica's control loop.
 */
sealed interface ReplicaMessage {

    /**
     * Adds a canister's mailbox to the registry.
     */
    record CanisterAdded(
            Principal canisterId,
            DispatcherMailbox<CanisterMessage> mailbox,
            CompletableFuture<Void> ack) implements ReplicaMessage {

        @Override
        public void fail(Throwable error) {
            ack.completeExceptionally(error);
        }
    }

    /**
     * Routes a task or request to a canister.
     */
    record CanisterRequest(
            Principal canisterId,
            Message message,
            CompletableFuture<CallReply> replySender) implements ReplicaMessage {

        @Override
        public void fail(Throwable error) {
            if (replySender != null) {
                replySender.completeExceptionally(error);
            }
        }
    }

    /**
     * Routes the outcome of a call back to the canister that issued it.
     */
    record CanisterReply(Principal canisterId, Message message) implements ReplicaMessage {
    }

    /**
     * Closes every registered mailbox.
     */
    record Stop(CompletableFuture<Void> ack) implements ReplicaMessage {

        @Override
        public void fail(Throwable error) {
            ack.completeExceptionally(error);
        }
    }

    /**
     * Aborts whoever is waiting on this command.
     */
    default void fail(Throwable error) {
    }
}
