package com.replicasim;

import com.replicasim.types.CallReply;
import com.replicasim.types.Message;

import java.util.concurrent.CompletableFuture;

/**
 * A message queued in a canister's mailbox, with the channel its sender awaits
 * (null for replies).
 */
record CanisterMessage(Message message, CompletableFuture<CallReply> replySender) {
}
