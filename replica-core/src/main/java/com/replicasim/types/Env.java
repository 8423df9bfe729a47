package com.replicasim.types;

import java.util.Arrays;
import java.util.Objects;

/**
 * Envelope carried by every request: who is calling, through which entry point, which
 * method with which arguments, and the cycles attached to (or refunded by) the call.
 * <p>
 * Envelopes are immutable; the {@code with*} methods return modified copies.
 *
 * @param entryMode       the entry point the request is executed through
 * @param sender          the caller
 * @param cyclesAvailable cycles attached by the caller
 * @param cyclesRefunded  cycles returned to the caller, only meaningful on callbacks
 * @param methodName      the method to invoke, empty for lifecycle hooks
 * @param args            the encoded arguments
 */
public record Env(
        EntryMode entryMode,
        Principal sender,
        long cyclesAvailable,
        long cyclesRefunded,
        String methodName,
        byte[] args) {

    private static final byte[] NO_ARGS = new byte[0];

    public Env {
        Objects.requireNonNull(entryMode, "entryMode cannot be null");
        Objects.requireNonNull(sender, "sender cannot be null");
        Objects.requireNonNull(methodName, "methodName cannot be null");
        if (cyclesAvailable < 0 || cyclesRefunded < 0) {
            throw new IllegalArgumentException("Cycle amounts cannot be negative");
        }
        args = args == null ? NO_ARGS : args.clone();
    }

    /** Envelope of the {@code init} lifecycle hook. */
    public static Env init() {
        return lifecycle(EntryMode.INIT);
    }

    /** Envelope of the {@code pre_upgrade} lifecycle hook. */
    public static Env preUpgrade() {
        return lifecycle(EntryMode.PRE_UPGRADE);
    }

    /** Envelope of the {@code post_upgrade} lifecycle hook. */
    public static Env postUpgrade() {
        return lifecycle(EntryMode.POST_UPGRADE);
    }

    /** Envelope of the {@code heartbeat} lifecycle hook. */
    public static Env heartbeat() {
        return lifecycle(EntryMode.HEARTBEAT);
    }

    /**
     * Envelope of an update call to the given method, sent by the anonymous principal.
     */
    public static Env update(String methodName) {
        return new Env(EntryMode.UPDATE, Principal.anonymous(), 0, 0, methodName, NO_ARGS);
    }

    /**
     * Envelope of a query call to the given method, sent by the anonymous principal.
     */
    public static Env query(String methodName) {
        return new Env(EntryMode.QUERY, Principal.anonymous(), 0, 0, methodName, NO_ARGS);
    }

    /**
     * Envelope used for ad hoc tasks.
     */
    public static Env customTask() {
        return lifecycle(EntryMode.CUSTOM_TASK);
    }

    private static Env lifecycle(EntryMode mode) {
        return new Env(mode, Principal.anonymous(), 0, 0, "", NO_ARGS);
    }

    public Env withEntryMode(EntryMode entryMode) {
        return new Env(entryMode, sender, cyclesAvailable, cyclesRefunded, methodName, args);
    }

    public Env withSender(Principal sender) {
        return new Env(entryMode, sender, cyclesAvailable, cyclesRefunded, methodName, args);
    }

    public Env withCyclesAvailable(long cyclesAvailable) {
        return new Env(entryMode, sender, cyclesAvailable, cyclesRefunded, methodName, args);
    }

    public Env withCyclesRefunded(long cyclesRefunded) {
        return new Env(entryMode, sender, cyclesAvailable, cyclesRefunded, methodName, args);
    }

    public Env withMethodName(String methodName) {
        return new Env(entryMode, sender, cyclesAvailable, cyclesRefunded, methodName, args);
    }

    public Env withArgs(byte[] args) {
        return new Env(entryMode, sender, cyclesAvailable, cyclesRefunded, methodName, args);
    }

    @Override
    public byte[] args() {
        return args.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Env other)) return false;
        return cyclesAvailable == other.cyclesAvailable
                && cyclesRefunded == other.cyclesRefunded
                && entryMode == other.entryMode
                && sender.equals(other.sender)
                && methodName.equals(other.methodName)
                && Arrays.equals(args, other.args);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(entryMode, sender, cyclesAvailable, cyclesRefunded, methodName);
        return 31 * result + Arrays.hashCode(args);
    }

    @Override
    public String toString() {
        return "Env[" + entryMode + " " + methodName + " from " + sender
                + ", cyclesAvailable=" + cyclesAvailable + ", cyclesRefunded=" + cyclesRefunded
                + ", args=" + args.length + " bytes]";
    }
}
