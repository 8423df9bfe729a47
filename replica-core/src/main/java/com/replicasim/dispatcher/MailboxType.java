package com.replicasim.dispatcher;

/**
 * Queue implementation backing a {@link DispatcherMailbox}. Both variants are unbounded.
 *
 * <ul>
 *   <li>{@link #CONCURRENT_LINKED} - JDK ConcurrentLinkedQueue</li>
 *   <li>{@link #MPSC} - JCTools lock-free MpscUnboundedArrayQueue</li>
 * </ul>
 */
public enum MailboxType {
    /**
     * Non-blocking linked queue from the JDK.
     */
    CONCURRENT_LINKED,

    /**
     * JCTools multi-producer single-consumer queue, growing in linked array chunks.
     * Matches the mailbox access pattern: any thread enqueues, only the owning runner polls.
     */
    MPSC
}
