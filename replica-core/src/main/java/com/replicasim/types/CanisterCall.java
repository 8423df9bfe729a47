package com.replicasim.types;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A call issued by a canister (or an external client) that has not been delivered yet.
 *
 * @param sender    the calling principal
 * @param requestId the correlation id of the call
 * @param callee    the destination canister
 * @param method    the method to invoke on the callee
 * @param payload   the encoded arguments
 * @param cycles    cycles attached to the call
 */
public record CanisterCall(
        Principal sender,
        RequestId requestId,
        Principal callee,
        String method,
        byte[] payload,
        long cycles) {

    public CanisterCall {
        Objects.requireNonNull(sender, "sender cannot be null");
        Objects.requireNonNull(requestId, "requestId cannot be null");
        Objects.requireNonNull(callee, "callee cannot be null");
        Objects.requireNonNull(method, "method cannot be null");
        if (cycles < 0) {
            throw new IllegalArgumentException("cycles cannot be negative");
        }
        payload = payload == null ? new byte[0] : payload.clone();
    }

    /**
     * Creates a call with a freshly generated request id.
     */
    public static CanisterCall of(Principal sender, Principal callee, String method, byte[] payload, long cycles) {
        return new CanisterCall(sender, RequestId.next(), callee, method, payload, cycles);
    }

    /**
     * Creates a call with a UTF-8 text payload and a freshly generated request id.
     */
    public static CanisterCall of(Principal sender, Principal callee, String method, String payload, long cycles) {
        return of(sender, callee, method, payload.getBytes(StandardCharsets.UTF_8), cycles);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Converts this call into the update request delivered to the callee.
     */
    public Message toMessage() {
        Env env = Env.update(method)
                .withSender(sender)
                .withArgs(payload)
                .withCyclesAvailable(cycles);
        return new Message.Request(requestId, env);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanisterCall other)) return false;
        return requestId.equals(other.requestId);
    }

    @Override
    public int hashCode() {
        return requestId.hashCode();
    }

    @Override
    public String toString() {
        return "CanisterCall[" + requestId + " " + sender + " -> " + callee + "." + method
                + ", cycles=" + cycles + "]";
    }
}
