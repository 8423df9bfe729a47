package com.replicasim;

import com.replicasim.builder.CallBuilder;
import com.replicasim.canister.Canister;
import com.replicasim.config.ReplicaConfig;
import com.replicasim.dispatcher.Dispatcher;
import com.replicasim.dispatcher.DispatcherMailbox;
import com.replicasim.dispatcher.MailboxRunner;
import com.replicasim.metrics.ReplicaMetrics;
import com.replicasim.types.CallReply;
import com.replicasim.types.CanisterCall;
import com.replicasim.types.Message;
import com.replicasim.types.Principal;
import com.replicasim.types.RejectionCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A local replica hosting one or several canisters.
 * <p>
 * The replica is itself an actor: registration and routing are commands handled one at a
 * time by a control loop, which is the only code that reads or writes the registry of
 * canister mailboxes. Each canister runs its own actor loop on the shared dispatcher.
 * <p>
 * Requests to a canister that is not registered are answered with a
 * {@link RejectionCode#DESTINATION_INVALID} rejection refunding all attached cycles.
 * Registering a canister twice, or losing a mailbox the replica routes to, is fatal.
 */
public class Replica implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Replica.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ReplicaConfig config;
    private final Dispatcher dispatcher;
    private final DispatcherMailbox<ReplicaMessage> controlMailbox;
    private final OutstandingCalls outstandingCalls = new OutstandingCalls();
    private final ReplicaMetrics metrics = new ReplicaMetrics();

    // Owned by the control loop.
    private final Map<Principal, DispatcherMailbox<CanisterMessage>> canisters = new HashMap<>();

    private volatile boolean shutdown = false;

    /**
     * Creates an empty replica with the default configuration.
     */
    public Replica() {
        this(new ReplicaConfig());
    }

    /**
     * Creates an empty replica.
     *
     * @param config the replica configuration
     */
    public Replica(ReplicaConfig config) {
        this.config = config != null ? config : new ReplicaConfig();
        this.dispatcher = Dispatcher.create(this.config, "replica");

        AtomicReference<Runnable> scheduleRef = new AtomicReference<>();
        this.controlMailbox = DispatcherMailbox.create(
                this.config.getMailboxType(),
                () -> {
                    Runnable r = scheduleRef.get();
                    if (r != null) {
                        dispatcher.schedule(r);
                    }
                },
                "replica");
        scheduleRef.set(new MailboxRunner<>(
                "replica",
                controlMailbox,
                this::handle,
                this::onControlFailure,
                dispatcher,
                this.config.getThroughput()));

        logger.info("Replica started with {}", this.config);
    }

    /**
     * Creates a replica hosting the given canisters.
     *
     * @throws DuplicateCanisterException if two canisters share an id
     */
    public static Replica withCanisters(ReplicaConfig config, Canister... canisters) {
        Replica replica = new Replica(config);
        for (Canister canister : canisters) {
            replica.addCanister(canister);
        }
        return replica;
    }

    /**
     * Registers a canister and starts its actor loop. The replica takes ownership of the
     * canister; callers must not touch it afterwards.
     *
     * @param canister the canister to add
     * @return a handle to the canister
     * @throws DuplicateCanisterException if a canister with the same id is already registered
     */
    public CanisterHandle addCanister(Canister canister) {
        Objects.requireNonNull(canister, "canister cannot be null");
        Principal canisterId = Objects.requireNonNull(canister.id(), "canister id cannot be null");

        CanisterRunner runner = new CanisterRunner(this, canister, dispatcher, config, outstandingCalls);
        CompletableFuture<Void> ack = new CompletableFuture<>();
        send(new ReplicaMessage.CanisterAdded(canisterId, runner.mailbox(), ack));
        try {
            ack.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ReplicaException re) {
                throw re;
            }
            throw new ReplicaException("Could not register canister '" + canisterId + "'", e.getCause(), canisterId);
        }
        return new CanisterHandle(canisterId, this);
    }

    /**
     * Returns a handle to a canister. The canister does not have to exist: requests sent to an
     * unknown id are rejected with {@link RejectionCode#DESTINATION_INVALID}.
     */
    public CanisterHandle getCanister(Principal canisterId) {
        return new CanisterHandle(Objects.requireNonNull(canisterId, "canisterId cannot be null"), this);
    }

    /**
     * Creates a call builder for a request to the given canister.
     */
    public CallBuilder newCall(Principal canisterId, String method) {
        return new CallBuilder(this, canisterId, method);
    }

    /**
     * Routes the given call and returns its pending outcome.
     */
    public Awaitable<CallReply> performCall(CanisterCall call) {
        return submit(call.callee(), call.toMessage());
    }

    /**
     * Routes a task or request to a canister and returns its pending outcome.
     */
    public Awaitable<CallReply> submit(Principal canisterId, Message message) {
        CompletableFuture<CallReply> replySender = new CompletableFuture<>();
        enqueueRequest(canisterId, message, replySender);
        return Awaitable.from(replySender);
    }

    /**
     * Enqueues a task or request for the given canister. The outcome, or a
     * {@link RejectionCode#DESTINATION_INVALID} rejection, is delivered on {@code replySender}.
     *
     * @throws RoutingException if the replica has been shut down
     */
    public void enqueueRequest(Principal canisterId, Message message, CompletableFuture<CallReply> replySender) {
        Objects.requireNonNull(canisterId, "canisterId cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        send(new ReplicaMessage.CanisterRequest(canisterId, message, replySender));
    }

    /**
     * Enqueues the outcome of a call into the mailbox of the canister that issued it.
     */
    void routeReply(Principal origin, Message message) {
        send(new ReplicaMessage.CanisterReply(origin, message));
    }

    private void send(ReplicaMessage message) {
        if (!controlMailbox.enqueue(message)) {
            throw new RoutingException("Could not send message to replica: replica is shut down");
        }
    }

    // ---------------------------------------------------------------------------------------
    // Control loop
    // ---------------------------------------------------------------------------------------

    private void handle(ReplicaMessage message) {
        if (message instanceof ReplicaMessage.CanisterAdded added) {
            register(added);
        } else if (message instanceof ReplicaMessage.CanisterRequest request) {
            routeRequest(request);
        } else if (message instanceof ReplicaMessage.CanisterReply reply) {
            deliverReply(reply);
        } else if (message instanceof ReplicaMessage.Stop stop) {
            canisters.values().forEach(DispatcherMailbox::close);
            stop.ack().complete(null);
        }
    }

    private void register(ReplicaMessage.CanisterAdded added) {
        Principal canisterId = added.canisterId();
        if (canisters.containsKey(canisterId)) {
            throw new DuplicateCanisterException(canisterId);
        }
        canisters.put(canisterId, added.mailbox());
        metrics.canisterRegistered();
        logger.info("Canister {} added to the replica", canisterId);
        added.ack().complete(null);
    }

    private void routeRequest(ReplicaMessage.CanisterRequest request) {
        Principal canisterId = request.canisterId();
        Message message = request.message();
        DispatcherMailbox<CanisterMessage> mailbox = canisters.get(canisterId);

        if (mailbox != null) {
            if (!mailbox.enqueue(new CanisterMessage(message, request.replySender()))) {
                throw new RoutingException("Could not enqueue the request for canister '" + canisterId + "'",
                        canisterId);
            }
            metrics.requestRouted();
            return;
        }

        if (message instanceof Message.Reply) {
            throw new RoutingException("Reply routed to unknown canister '" + canisterId + "'", canisterId);
        }
        if (request.replySender() == null) {
            throw new RoutingException("Request to unknown canister '" + canisterId
                    + "' has no channel to reject it on", canisterId);
        }
        long refund = message.attachedCycles();
        metrics.destinationInvalid(refund);
        logger.debug("Rejecting request to unknown canister {}, refunding {} cycles", canisterId, refund);
        request.replySender().complete(CallReply.reject(
                RejectionCode.DESTINATION_INVALID,
                "Canister '" + canisterId + "' does not exist",
                refund));
    }

    private void deliverReply(ReplicaMessage.CanisterReply reply) {
        Principal origin = reply.canisterId();
        DispatcherMailbox<CanisterMessage> mailbox = canisters.get(origin);
        if (mailbox == null) {
            throw new RoutingException("Reply for canister '" + origin + "' which is not registered", origin);
        }
        if (!mailbox.enqueue(new CanisterMessage(reply.message(), null))) {
            throw new RoutingException("Could not enqueue the response for canister '" + origin + "'", origin);
        }
        metrics.replyRouted();
    }

    private void onControlFailure(ReplicaMessage message, Throwable error) {
        metrics.fatalError();
        logger.error("Replica: fatal error handling {}", message, error);
        message.fail(error);
    }

    // ---------------------------------------------------------------------------------------
    // Lifecycle & inspection
    // ---------------------------------------------------------------------------------------

    /**
     * Number of inter-canister calls whose outcome has not reached the caller yet.
     */
    public int pendingCalls() {
        return outstandingCalls.size();
    }

    OutstandingCalls outstandingCalls() {
        return outstandingCalls;
    }

    public ReplicaMetrics metrics() {
        return metrics;
    }

    public ReplicaConfig config() {
        return config;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Stops accepting messages, closes every canister mailbox and shuts the dispatcher down.
     * Outstanding calls are not answered.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down replica ({} calls outstanding)", outstandingCalls.size());

        CompletableFuture<Void> stopped = new CompletableFuture<>();
        if (controlMailbox.enqueue(new ReplicaMessage.Stop(stopped))) {
            try {
                stopped.get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                logger.warn("Replica did not close canister mailboxes cleanly", e);
            }
        }
        controlMailbox.close();
        dispatcher.shutdown();
        if (!dispatcher.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            logger.warn("Replica dispatcher did not terminate within {}s", SHUTDOWN_TIMEOUT_SECONDS);
        }
        logger.info("Replica shut down: {}", metrics);
    }

    @Override
    public void close() {
        shutdown();
    }
}
