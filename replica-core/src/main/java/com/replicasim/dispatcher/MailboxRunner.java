package com.replicasim.dispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * MailboxRunner processes messages from a DispatcherMailbox in batches.
 * <p>
 * One activation handles up to {@code throughput} messages, then re-schedules itself if
 * messages remain. Together with the mailbox's scheduled flag this keeps processing for
 * one mailbox strictly sequential and in arrival order.
 *
 * @param <T> The type of messages to process
 */
public final class MailboxRunner<T> implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(MailboxRunner.class);

    private final String ownerId;
    private final DispatcherMailbox<T> mailbox;
    private final MessageReceiver<T> receiver;
    private final BiConsumer<T, Throwable> exceptionHandler;
    private final Dispatcher dispatcher;
    private final int throughput;

    /**
     * Creates a MailboxRunner.
     *
     * @param ownerId          The owner id, for logging
     * @param mailbox          The mailbox to drain
     * @param receiver         Called for every message
     * @param exceptionHandler Called when the receiver throws
     * @param dispatcher       The dispatcher used for re-scheduling
     * @param throughput       Maximum number of messages per activation
     */
    public MailboxRunner(
            String ownerId,
            DispatcherMailbox<T> mailbox,
            MessageReceiver<T> receiver,
            BiConsumer<T, Throwable> exceptionHandler,
            Dispatcher dispatcher,
            int throughput) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.receiver = Objects.requireNonNull(receiver, "receiver");
        this.exceptionHandler = Objects.requireNonNull(exceptionHandler, "exceptionHandler");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.throughput = Math.max(1, throughput);
    }

    @Override
    public void run() {
        try {
            int processed = 0;
            T msg;

            while (processed < throughput && (msg = mailbox.poll()) != null) {
                processed++;
                try {
                    receiver.receive(msg);
                } catch (Throwable t) {
                    try {
                        exceptionHandler.accept(msg, t);
                    } catch (Throwable handlerError) {
                        logger.error("{}: exception handler failed", ownerId, handlerError);
                    }
                }
            }

            if (processed > 0) {
                logger.trace("{} processed {} messages", ownerId, processed);
            }
        } finally {
            // Clear the flag first, then re-check: a message enqueued while we were busy
            // saw the flag set and did not schedule us.
            if (mailbox.tryClearScheduled() && !mailbox.isEmpty() && mailbox.trySetScheduled()) {
                if (!dispatcher.schedule(this)) {
                    mailbox.tryClearScheduled();
                }
            }
        }
    }

    public int getThroughput() {
        return throughput;
    }

    public String getOwnerId() {
        return ownerId;
    }
}
