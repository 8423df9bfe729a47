package com.replicasim.dispatcher;

/**
 * Callback invoked by a {@link MailboxRunner} for every message taken from its mailbox.
 *
 * @param <T> The type of messages accepted
 */
@FunctionalInterface
public interface MessageReceiver<T> {

    /**
     * Processes one message. Calls for the same mailbox never overlap.
     *
     * @param message the message taken from the mailbox
     */
    void receive(T message);
}
