package com.replicasim.types;

/**
 * The entry point a message is executed through.
 */
public enum EntryMode {
    INIT,
    PRE_UPGRADE,
    POST_UPGRADE,
    HEARTBEAT,
    UPDATE,
    QUERY,
    CUSTOM_TASK,
    REPLY_CALLBACK,
    REJECT_CALLBACK;

    /**
     * Returns true for the canister lifecycle hooks (init, upgrade, heartbeat).
     */
    public boolean isLifecycle() {
        return this == INIT || this == PRE_UPGRADE || this == POST_UPGRADE || this == HEARTBEAT;
    }

    /**
     * Returns true for callbacks that deliver the outcome of an inter-canister call.
     */
    public boolean isCallback() {
        return this == REPLY_CALLBACK || this == REJECT_CALLBACK;
    }
}
