package com.replicasim.types;

import java.util.Objects;

/**
 * The messages a canister's mailbox can receive.
 */
public sealed interface Message permits Message.CustomTask, Message.Request, Message.Reply {

    /**
     * An ad hoc task to run on the canister's actor loop.
     */
    record CustomTask(RequestId requestId, CanisterTask task, Env env) implements Message {
        public CustomTask {
            Objects.requireNonNull(requestId, "requestId cannot be null");
            Objects.requireNonNull(task, "task cannot be null");
            Objects.requireNonNull(env, "env cannot be null");
        }
    }

    /**
     * An inbound request: a lifecycle hook, or an update/query call.
     */
    record Request(RequestId requestId, Env env) implements Message {
        public Request {
            Objects.requireNonNull(requestId, "requestId cannot be null");
            Objects.requireNonNull(env, "env cannot be null");
        }
    }

    /**
     * The outcome of a call previously issued by the receiving canister.
     *
     * @param replyTo the request id of the call this outcome belongs to
     * @param outcome the outcome
     */
    record Reply(RequestId replyTo, CallReply outcome) implements Message {
        public Reply {
            Objects.requireNonNull(replyTo, "replyTo cannot be null");
            Objects.requireNonNull(outcome, "outcome cannot be null");
        }
    }

    /**
     * Cycles attached to this message by its sender. Replies carry none.
     */
    default long attachedCycles() {
        if (this instanceof CustomTask task) {
            return task.env().cyclesAvailable();
        }
        if (this instanceof Request request) {
            return request.env().cyclesAvailable();
        }
        return 0;
    }
}
