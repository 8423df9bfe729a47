package com.replicasim;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The outcome of a call or task submitted to the replica, as seen by the code that submitted
 * it. Callers can block with {@link #get()}, receive a {@link Result} from {@link #await()},
 * or compose on the underlying {@link #future()}.
 * <p>
 * There is no implicit deadline: {@link #get()} and {@link #await()} wait until the canister
 * answers or the replica rejects the call.
 */
public interface Awaitable<T> {

    /**
     * Blocks until the call is answered and returns its reply.
     *
     * @throws ReplyException if the replica could not route or deliver the call
     */
    T get();

    /**
     * Blocks until the call is answered or the timeout expires.
     *
     * @throws TimeoutException if the timeout expires first
     * @throws ReplyException if the replica could not route or deliver the call
     */
    T get(Duration timeout) throws TimeoutException;

    Result<T> await();

    /**
     * Returns a Result holding a TimeoutException if the timeout expires first.
     */
    Result<T> await(Duration timeout);

    /**
     * Non-blocking check; empty while the call is in flight.
     */
    Optional<Result<T>> poll();

    CompletableFuture<T> future();

    <U> Awaitable<U> map(Function<T, U> fn);

    void onComplete(Consumer<T> onSuccess, Consumer<Throwable> onFailure);

    static <T> Awaitable<T> from(CompletableFuture<T> future) {
        return new PendingAwaitable<>(future);
    }

    static <T> Awaitable<T> completed(T value) {
        return new PendingAwaitable<>(CompletableFuture.completedFuture(value));
    }
}
