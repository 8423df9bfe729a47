package com.replicasim.types;

/**
 * Rejection categories of a call. The numeric codes match the values used on the wire
 * by the Internet Computer and must not be renumbered.
 */
public enum RejectionCode {
    NO_ERROR(0),
    SYS_FATAL(1),
    SYS_TRANSIENT(2),
    /** The destination canister does not exist. */
    DESTINATION_INVALID(3),
    CANISTER_REJECT(4),
    CANISTER_ERROR(5),
    UNKNOWN(-1);

    private final int code;

    RejectionCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Maps a wire code back to its category; codes outside the known range map to {@link #UNKNOWN}.
     *
     * @param code the numeric code
     * @return the rejection category
     */
    public static RejectionCode fromCode(int code) {
        for (RejectionCode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
