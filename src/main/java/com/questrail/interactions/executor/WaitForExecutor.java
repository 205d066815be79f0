package com.questrail.interactions.executor;

import com.questrail.interactions.api.ResponseMessage;
import com.questrail.interactions.context.ComponentContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * WaitForExecutor
 * =============================================================================
 * Single-use executor that hands the next matching component interaction to
 * whoever called {@link #waitFor()}.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>Before {@link #waitFor()} is called, interactions are answered with an
 *       ephemeral "not ready" message.</li>
 *   <li>While waiting, interactions from users outside {@code authors} (when
 *       non-empty) are answered with an ephemeral "not allowed" message.</li>
 *   <li>The first accepted interaction completes the future unanswered; the
 *       waiter must respond to it.</li>
 *   <li>After that, or once the wait timed out, {@link #execute} throws
 *       {@link ExecutorClosedException} so the registry drops this executor.</li>
 * </ol>
 */
public final class WaitForExecutor implements InteractionExecutor<ComponentContext>
{
    private static final Logger log = LoggerFactory.getLogger(WaitForExecutor.class);

    public static final String NOT_READY_MESSAGE = "The bot isn't ready for that yet";
    public static final String NOT_ALLOWED_MESSAGE = "You are not allowed to use this component";

    private final Set<String> customIds;
    private final Set<String> authors;
    private final Duration waitTimeout;

    private final Object lock = new Object();
    private CompletableFuture<ComponentContext> future;
    private boolean finished;

    /**
     * @param customIds   match segments this executor answers to
     * @param authors     user ids allowed to complete the wait; empty allows anyone
     * @param waitTimeout how long {@link #waitFor()} waits before failing with
     *                    {@link java.util.concurrent.TimeoutException}
     */
    public WaitForExecutor(Set<String> customIds, Set<String> authors, Duration waitTimeout) {
        this.customIds = Set.copyOf(Objects.requireNonNull(customIds, "customIds"));
        this.authors = Set.copyOf(Objects.requireNonNull(authors, "authors"));
        this.waitTimeout = Objects.requireNonNull(waitTimeout, "waitTimeout");
        if (waitTimeout.isNegative() || waitTimeout.isZero()) {
            throw new IllegalArgumentException("waitTimeout must be > 0");
        }
    }

    /**
     * Start waiting.
     *
     * @throws IllegalStateException if called twice or after the executor finished
     */
    public CompletableFuture<ComponentContext> waitFor() {
        synchronized (lock) {
            if (finished) {
                throw new IllegalStateException("Executor has already finished");
            }
            if (future != null) {
                throw new IllegalStateException("Already waiting");
            }
            future = new CompletableFuture<>();
            // Callers observe completion only after the executor is marked finished.
            return future.orTimeout(waitTimeout.toNanos(), TimeUnit.NANOSECONDS)
                .whenComplete((ctx, error) -> markFinished());
        }
    }

    public boolean isFinished() {
        synchronized (lock) {
            return finished;
        }
    }

    @Override
    public Set<String> customIds() {
        return customIds;
    }

    @Override
    public void execute(ComponentContext context) {
        String rejection;
        synchronized (lock) {
            if (finished) {
                throw new ExecutorClosedException();
            }
            if (future == null) {
                rejection = NOT_READY_MESSAGE;
            } else if (!authors.isEmpty() && !authors.contains(context.userId())) {
                rejection = NOT_ALLOWED_MESSAGE;
            } else {
                finished = true;
                rejection = null;
            }
        }

        if (rejection != null) {
            log.debug("Rejecting {} from user {}: {}", context.idMatch(), context.userId(), rejection);
            context.createInitialResponse(ResponseMessage.ephemeral(rejection));
            return;
        }
        future.complete(context);
    }

    private void markFinished() {
        synchronized (lock) {
            finished = true;
        }
    }
}
