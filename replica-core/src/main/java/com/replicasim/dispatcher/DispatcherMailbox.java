package com.replicasim.dispatcher;

import org.jctools.queues.MpscUnboundedArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Unbounded multi-producer single-consumer mailbox with coalesced scheduling.
 * <p>
 * The schedule action runs only when the mailbox goes from "not scheduled" to "scheduled",
 * so at most one runner activation drains the mailbox at any time. Enqueueing never blocks.
 * A closed mailbox refuses every further message.
 *
 * @param <T> The type of messages in the mailbox
 */
public final class DispatcherMailbox<T> {

    private static final Logger logger = LoggerFactory.getLogger(DispatcherMailbox.class);

    private static final int MPSC_CHUNK_SIZE = 128;

    private final Queue<T> queue;
    private final MailboxType mailboxType;
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final Runnable scheduleAction;
    private final String ownerId;
    private volatile boolean closed = false;

    /**
     * Creates a mailbox of the given type.
     *
     * @param mailboxType    The queue implementation to use
     * @param scheduleAction The action that schedules the owning runner
     * @param ownerId        The owner id, for logging
     */
    public static <T> DispatcherMailbox<T> create(MailboxType mailboxType, Runnable scheduleAction, String ownerId) {
        Queue<T> queue = mailboxType == MailboxType.MPSC
                ? new MpscUnboundedArrayQueue<>(MPSC_CHUNK_SIZE)
                : new ConcurrentLinkedQueue<>();
        return new DispatcherMailbox<>(queue, mailboxType, scheduleAction, ownerId);
    }

    private DispatcherMailbox(Queue<T> queue, MailboxType mailboxType, Runnable scheduleAction, String ownerId) {
        this.queue = queue;
        this.mailboxType = mailboxType;
        this.scheduleAction = Objects.requireNonNull(scheduleAction, "scheduleAction");
        this.ownerId = ownerId;
    }

    /**
     * Enqueues a message and schedules the owner if it is idle.
     *
     * @param message The message to enqueue
     * @return true if accepted, false if the mailbox is closed
     */
    public boolean enqueue(T message) {
        Objects.requireNonNull(message, "message cannot be null");
        if (closed) {
            logger.debug("Mailbox of {} is closed, refusing message", ownerId);
            return false;
        }
        queue.offer(message);

        if (scheduled.compareAndSet(false, true)) {
            try {
                scheduleAction.run();
            } catch (RuntimeException e) {
                // Protect enqueue callers from scheduler exceptions
                logger.error("Mailbox of {}: schedule action failed", ownerId, e);
                scheduled.set(false);
            }
        }
        return true;
    }

    /**
     * Polls a message from the mailbox (consumer side).
     *
     * @return The next message, or null if empty
     */
    public T poll() {
        return queue.poll();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Gets the approximate number of queued messages.
     */
    public int size() {
        return queue.size();
    }

    /**
     * Stops accepting messages. Messages already queued stay in the queue.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Attempts to clear the scheduled flag after processing a batch.
     *
     * @return true if cleared, false if already false
     */
    public boolean tryClearScheduled() {
        return scheduled.compareAndSet(true, false);
    }

    /**
     * Attempts to set the scheduled flag.
     *
     * @return true if this caller owns the next activation
     */
    public boolean trySetScheduled() {
        return scheduled.compareAndSet(false, true);
    }

    public boolean isScheduled() {
        return scheduled.get();
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }
}
