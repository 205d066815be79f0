package com.questrail.interactions.executor;

/**
 * Thrown from {@link InteractionExecutor#execute} by an executor that will not
 * handle any more interactions. The client evicts it.
 */
public class ExecutorClosedException extends RuntimeException {
    public ExecutorClosedException() {
        super("Executor is closed");
    }

    public ExecutorClosedException(String message) {
        super(message);
    }
}
