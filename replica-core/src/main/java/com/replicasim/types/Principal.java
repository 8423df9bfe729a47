package com.replicasim.types;

import java.util.Objects;

/**
 * Identity of a canister or an external caller.
 * Principals are opaque values compared by their textual form; a canister's principal
 * never changes once it has been assigned.
 *
 * @param text the textual representation of the principal
 */
public record Principal(String text) {

    private static final Principal ANONYMOUS = new Principal("2vxsx-fae");
    private static final Principal MANAGEMENT = new Principal("aaaaa-aa");

    public Principal {
        Objects.requireNonNull(text, "text cannot be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Principal text cannot be blank");
        }
    }

    /**
     * Creates a principal from its textual representation.
     *
     * @param text the principal text
     * @return the principal
     */
    public static Principal of(String text) {
        return new Principal(text);
    }

    /**
     * The anonymous principal, used as the caller of requests submitted from outside the replica.
     */
    public static Principal anonymous() {
        return ANONYMOUS;
    }

    /**
     * The management canister principal.
     */
    public static Principal management() {
        return MANAGEMENT;
    }

    @Override
    public String toString() {
        return text;
    }
}
