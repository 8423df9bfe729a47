package com.replicasim.types;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Terminal outcome of a call: either a successful payload or a categorized rejection.
 * Both variants carry the cycles refunded to the caller.
 */
public sealed interface CallReply permits CallReply.Success, CallReply.Reject {

    /**
     * The callee replied with a payload.
     */
    record Success(byte[] payload, long cyclesRefunded) implements CallReply {
        public Success {
            payload = payload == null ? new byte[0] : payload.clone();
            if (cyclesRefunded < 0) {
                throw new IllegalArgumentException("cyclesRefunded cannot be negative");
            }
        }

        @Override
        public byte[] payload() {
            return payload.clone();
        }

        /**
         * Decodes the payload as UTF-8 text.
         */
        public String text() {
            return new String(payload, StandardCharsets.UTF_8);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Success other)) return false;
            return cyclesRefunded == other.cyclesRefunded && Arrays.equals(payload, other.payload);
        }

        @Override
        public int hashCode() {
            return 31 * Long.hashCode(cyclesRefunded) + Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return "Success[" + payload.length + " bytes, cyclesRefunded=" + cyclesRefunded + "]";
        }
    }

    /**
     * The call was rejected, by the system or by the callee.
     */
    record Reject(RejectionCode rejectionCode, String rejectionMessage, long cyclesRefunded) implements CallReply {
        public Reject {
            Objects.requireNonNull(rejectionCode, "rejectionCode cannot be null");
            Objects.requireNonNull(rejectionMessage, "rejectionMessage cannot be null");
            if (cyclesRefunded < 0) {
                throw new IllegalArgumentException("cyclesRefunded cannot be negative");
            }
        }
    }

    static CallReply success(byte[] payload, long cyclesRefunded) {
        return new Success(payload, cyclesRefunded);
    }

    static CallReply success(String text, long cyclesRefunded) {
        return new Success(text.getBytes(StandardCharsets.UTF_8), cyclesRefunded);
    }

    static CallReply reject(RejectionCode code, String message, long cyclesRefunded) {
        return new Reject(code, message, cyclesRefunded);
    }

    long cyclesRefunded();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Wraps this outcome into the reply message delivered to the caller's mailbox.
     *
     * @param requestId the request id of the call this outcome answers
     * @return the reply message
     */
    default Message toMessage(RequestId requestId) {
        return new Message.Reply(requestId, this);
    }
}
