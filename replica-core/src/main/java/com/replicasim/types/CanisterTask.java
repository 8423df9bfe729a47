package com.replicasim.types;

/**
 * An ad hoc unit of work executed on a canister's actor loop.
 * A task is run at most once; exceptions it throws are reported to the submitter as a
 * {@link RejectionCode#CANISTER_ERROR} rejection.
 */
@FunctionalInterface
public interface CanisterTask {

    void run() throws Exception;
}
