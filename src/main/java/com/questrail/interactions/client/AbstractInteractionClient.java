package com.questrail.interactions.client;

import com.questrail.interactions.api.Interaction;
import com.questrail.interactions.api.InteractionKind;
import com.questrail.interactions.api.InteractionResponse;
import com.questrail.interactions.api.InteractionResponseException;
import com.questrail.interactions.api.ResponseMessage;
import com.questrail.interactions.config.InteractionClientConfig;
import com.questrail.interactions.context.DeliveryMode;
import com.questrail.interactions.context.InteractionContext;
import com.questrail.interactions.context.ResponseState;
import com.questrail.interactions.context.ResponseTimers;
import com.questrail.interactions.executor.ExecutorClosedException;
import com.questrail.interactions.executor.InteractionExecutor;
import com.questrail.interactions.id.CustomIds;
import com.questrail.interactions.id.MatchId;
import com.questrail.interactions.internal.routing.IdTable;
import com.questrail.interactions.internal.time.MonotonicClock;
import com.questrail.interactions.internal.time.MonotonicScheduler;
import com.questrail.interactions.internal.time.ScheduledExecutorScheduler;
import com.questrail.interactions.internal.time.SystemMonotonicClock;
import com.questrail.interactions.internal.time.SystemWallClock;
import com.questrail.interactions.internal.time.WallClock;
import com.questrail.interactions.observability.DispatchEvent;
import com.questrail.interactions.observability.EvictionEvent;
import com.questrail.interactions.observability.InteractionErrorEvent;
import com.questrail.interactions.observability.InteractionObservabilitySink;
import com.questrail.interactions.observability.Slf4jInteractionObservabilitySink;
import com.questrail.interactions.timeout.SlidingTimeout;
import com.questrail.interactions.timeout.Timeout;
import com.questrail.interactions.timeout.UsesDepletedException;
import com.questrail.interactions.transport.InteractionGateway;
import com.questrail.interactions.transport.InteractionGatewayListener;
import com.questrail.interactions.transport.InteractionRequestHandler;
import com.questrail.interactions.transport.InteractionServer;
import com.questrail.interactions.transport.InteractionTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * AbstractInteractionClient
 * =============================================================================
 * Registry of executors plus the push and pull ingress paths that route
 * interactions to them.
 *
 * <h2>Registry</h2>
 * Entries are keyed by the match segment of a custom id, either exactly or as
 * a prefix. Lookup tries the exact key first, then the longest prefix. All
 * mutations (register, unregister, use counting, eviction and the reaper
 * sweep) hold a single registry lock.
 *
 * <h2>Dispatch</h2>
 * <ol>
 *   <li>Split the interaction's custom id and look up the entry.</li>
 *   <li>No entry, or an expired one: answer with the ephemeral timed-out
 *       message.</li>
 *   <li>Otherwise record a use (evicting the entry when this exhausts it) and
 *       run the executor with a fresh context.</li>
 * </ol>
 *
 * <h2>Ingress</h2>
 * {@link #onPushEvent} runs the executor on the calling thread and answers
 * through the {@link InteractionTransport}. {@link #onPullRequest} runs it on
 * the worker pool and blocks until the context produces the initial response.
 *
 * <h2>Lifecycle</h2>
 * {@link #open()} starts the expiry reaper and attaches to the gateway and
 * server when configured; {@link #close()} reverses that. Both are idempotent.
 * Registrations survive a close.
 *
 * <p>Thread pools the client created itself, because the builder was given no
 * worker pool or scheduler, are shut down by {@link #close()}, together with
 * any pending delayed deletes. Such a client cannot be opened again. Pools
 * supplied through the builder belong to the caller and are left running.</p>
 *
 * @param <C> context type
 * @param <E> executor type
 */
public abstract class AbstractInteractionClient<C extends InteractionContext, E extends InteractionExecutor<C>>
    implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(AbstractInteractionClient.class);

    private final InteractionKind kind;
    private final String timedOutMessage;

    private final InteractionTransport transport;
    private final InteractionGateway gateway;
    private final InteractionServer server;
    private final InteractionClientConfig config;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final ExecutorService workers;
    private final ResponseTimers timers;
    private final InteractionObservabilitySink sink;
    private final ExpiryReaper reaper;

    // Pools created here rather than supplied; null when supplied.
    private final ExecutorService ownedWorkers;
    private final ScheduledThreadPoolExecutor ownedScheduler;
    private final AtomicBoolean poolsReleased = new AtomicBoolean(false);

    private final Object registryLock = new Object();
    private final IdTable<RegistryEntry<E>> registry = new IdTable<>();

    private final AtomicBoolean open = new AtomicBoolean(false);
    private final InteractionGatewayListener gatewayListener = this::onGatewayInteraction;
    private final InteractionRequestHandler requestHandler = this::onPullRequest;

    protected AbstractInteractionClient(InteractionKind kind, String timedOutMessage, Builder<?, ?> builder)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.timedOutMessage = Objects.requireNonNull(timedOutMessage, "timedOutMessage");

        this.transport = Objects.requireNonNull(builder.transport, "transport");
        this.gateway = builder.gateway;
        this.server = builder.server;
        this.config = Objects.requireNonNull(builder.config, "config");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.wallClock = Objects.requireNonNull(builder.wallClock, "wallClock");
        this.sink = Objects.requireNonNull(builder.sink, "sink");

        String threadPrefix = kind.name().toLowerCase() + "-client";
        if (builder.workers != null) {
            this.ownedWorkers = null;
            this.workers = builder.workers;
        } else {
            this.ownedWorkers = Executors.newCachedThreadPool(daemonThreads(threadPrefix + "-worker"));
            this.workers = ownedWorkers;
        }

        MonotonicScheduler scheduler;
        if (builder.scheduler != null) {
            this.ownedScheduler = null;
            scheduler = builder.scheduler;
        } else {
            this.ownedScheduler = new ScheduledThreadPoolExecutor(1, daemonThreads(threadPrefix + "-scheduler"));
            ownedScheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
            ownedScheduler.setRemoveOnCancelPolicy(true);
            scheduler = new ScheduledExecutorScheduler(ownedScheduler, clock);
        }

        this.timers = new ResponseTimers(scheduler, clock, wallClock);
        this.reaper = new ExpiryReaper(scheduler, clock, config.reaperInterval(), this::evictExpired);
    }

    /** Build the context handed to the executor. */
    protected abstract C newContext(
        Interaction interaction, InteractionTransport transport, DeliveryMode delivery, ResponseTimers timers);

    public InteractionKind kind() {
        return kind;
    }

    public InteractionClientConfig config() {
        return config;
    }

    public MonotonicClock clock() {
        return clock;
    }

    /** Policy used by registrations that do not supply one. */
    public Timeout defaultTimeout() {
        return new SlidingTimeout(config.defaultTimeout(), config.defaultMaxUses(), clock);
    }

    // ---------------------------------------------------------------------
    // Registry
    // ---------------------------------------------------------------------

    /**
     * Register {@code executor} under {@code customId} with the default timeout.
     *
     * @param customId id to register, or {@code null} to mint a random one
     * @return the effective custom id; put this on the outgoing component or modal
     */
    public String register(String customId, E executor) {
        return register(customId, executor, defaultTimeout(), false);
    }

    public String register(String customId, E executor, Timeout timeout) {
        return register(customId, executor, timeout, false);
    }

    /**
     * @param prefixMatch route every id whose match segment starts with this one
     * @throws IllegalArgumentException if the match segment is already registered
     */
    public String register(String customId, E executor, Timeout timeout, boolean prefixMatch)
    {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(timeout, "timeout");

        MatchId id = CustomIds.generate(customId);
        synchronized (registryLock) {
            registry.put(id.idMatch(), new RegistryEntry<>(timeout, executor), prefixMatch);
        }
        log.debug("Registered {} '{}'{}", kind, id.idMatch(), prefixMatch ? " (prefix)" : "");
        return id.customId();
    }

    public void registerExecutor(E executor) {
        registerExecutor(executor, defaultTimeout());
    }

    /**
     * Register {@code executor} under every id it declares, sharing one
     * timeout. Either all ids are registered or none is.
     *
     * @throws IllegalArgumentException if the executor declares no ids or one is already taken
     */
    public void registerExecutor(E executor, Timeout timeout)
    {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(timeout, "timeout");

        Set<String> exact = executor.customIds();
        Set<String> prefix = executor.prefixIds();
        if (exact.isEmpty() && prefix.isEmpty()) {
            throw new IllegalArgumentException("Executor declares no custom ids");
        }

        RegistryEntry<E> entry = new RegistryEntry<>(timeout, executor);
        synchronized (registryLock) {
            for (String key : exact) {
                checkFree(key);
            }
            for (String key : prefix) {
                checkFree(key);
            }
            exact.forEach(key -> registry.put(key, entry, false));
            prefix.forEach(key -> registry.put(key, entry, true));
        }
        log.debug("Registered {} executor under {} exact and {} prefix id(s)", kind, exact.size(), prefix.size());
    }

    /**
     * Find the entry an interaction with {@code customId} would be routed to.
     * Does not check expiry or record a use.
     */
    public Optional<RegistryEntry<E>> lookup(String customId)
    {
        String match = CustomIds.split(customId).idMatch();
        synchronized (registryLock) {
            return registry.find(match);
        }
    }

    /**
     * @throws NoSuchElementException if nothing is registered under the id
     */
    public void unregister(String customId)
    {
        String match = CustomIds.split(customId).idMatch();
        synchronized (registryLock) {
            if (registry.remove(match).isEmpty()) {
                throw new NoSuchElementException("'" + match + "' is not registered");
            }
        }
        log.debug("Unregistered {} '{}'", kind, match);
    }

    /**
     * Remove every key bound to {@code executor}.
     *
     * @return number of keys removed
     */
    public int unregisterExecutor(E executor)
    {
        Objects.requireNonNull(executor, "executor");
        synchronized (registryLock) {
            return registry.removeIf(entry -> entry.executor() == executor);
        }
    }

    public boolean isRegistered(String customId)
    {
        String match = CustomIds.split(customId).idMatch();
        synchronized (registryLock) {
            return registry.containsKey(match);
        }
    }

    /**
     * Evict every entry whose timeout has expired.
     *
     * @return number of keys removed
     */
    public int evictExpired()
    {
        int removed;
        synchronized (registryLock) {
            removed = registry.removeIf(entry -> entry.timeout().hasExpired());
        }
        if (removed > 0) {
            sink.onEviction(new EvictionEvent(wallClock.now(), kind, removed, EvictionEvent.Reason.EXPIRED));
        }
        return removed;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * @throws IllegalStateException if this client was closed after creating
     *         its own thread pools
     */
    public void open()
    {
        if (poolsReleased.get()) {
            throw new IllegalStateException(kind + " client was closed and its thread pools are shut down");
        }
        if (!open.compareAndSet(false, true)) {
            return;
        }
        reaper.start();
        if (gateway != null) {
            gateway.addListener(gatewayListener);
        }
        if (server != null) {
            server.setRequestHandler(kind, requestHandler);
        }
        log.info("{} client opened", kind);
    }

    @Override
    public void close()
    {
        if (open.compareAndSet(true, false)) {
            if (server != null) {
                server.clearRequestHandler(kind, requestHandler);
            }
            if (gateway != null) {
                gateway.removeListener(gatewayListener);
            }
            reaper.stop();
            log.info("{} client closed", kind);
        }
        releaseOwnedPools();
    }

    public boolean isOpen() {
        return open.get();
    }

    // ---------------------------------------------------------------------
    // Ingress
    // ---------------------------------------------------------------------

    /**
     * Dispatch a push-delivered interaction on the calling thread.
     *
     * <p>Exceptions thrown by the executor, other than closure and
     * response-carrying errors, propagate to the caller.</p>
     */
    public void onPushEvent(Interaction interaction)
    {
        checkKind(interaction);

        RegistryEntry<E> entry = acquire(interaction);
        if (entry == null) {
            transport.createInitialResponse(interaction, InteractionResponse.timedOut(timedOutMessage));
            dispatched(interaction, DispatchEvent.Ingress.PUSH, DispatchEvent.Outcome.TIMED_OUT);
            return;
        }

        C context = newContext(interaction, transport, DeliveryMode.push(), timers);
        run(entry, context, DispatchEvent.Ingress.PUSH);
    }

    /**
     * Dispatch a pull-delivered interaction and wait for its initial response.
     *
     * @throws InteractionDispatchException if no response arrives within the
     *         configured pull response timeout
     */
    public InteractionResponse onPullRequest(Interaction interaction)
    {
        checkKind(interaction);

        RegistryEntry<E> entry = acquire(interaction);
        if (entry == null) {
            dispatched(interaction, DispatchEvent.Ingress.PULL, DispatchEvent.Outcome.TIMED_OUT);
            return InteractionResponse.timedOut(timedOutMessage);
        }

        CompletableFuture<InteractionResponse> future = new CompletableFuture<>();
        C context = newContext(interaction, transport, DeliveryMode.pull(future), timers);
        try {
            workers.execute(() -> {
                try {
                    run(entry, context, DispatchEvent.Ingress.PULL);
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new InteractionDispatchException("Worker pool rejected interaction " + interaction.id(), e);
        }

        return awaitResponse(interaction, future);
    }

    private void onGatewayInteraction(Interaction interaction)
    {
        if (interaction.kind() == kind) {
            onPushEvent(interaction);
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private RegistryEntry<E> acquire(Interaction interaction)
    {
        String match = CustomIds.split(interaction.customId()).idMatch();
        EvictionEvent.Reason evicted = null;
        int removed = 0;
        RegistryEntry<E> entry;

        synchronized (registryLock) {
            entry = registry.find(match).orElse(null);
            if (entry != null) {
                evicted = recordUse(entry.timeout());
                if (evicted != null) {
                    removed = registry.removeValue(entry);
                }
                if (evicted == EvictionEvent.Reason.EXPIRED) {
                    entry = null;
                }
            }
        }

        if (evicted != null) {
            sink.onEviction(new EvictionEvent(wallClock.now(), kind, removed, evicted));
        }
        return entry;
    }

    /**
     * @return why the entry must be evicted, or {@code null} to keep it
     */
    private static EvictionEvent.Reason recordUse(Timeout timeout)
    {
        if (timeout.hasExpired()) {
            return EvictionEvent.Reason.EXPIRED;
        }
        try {
            return timeout.incrementUses() ? EvictionEvent.Reason.USES_EXHAUSTED : null;
        } catch (UsesDepletedException e) {
            // Expired between the check and the use.
            return EvictionEvent.Reason.EXPIRED;
        }
    }

    private void run(RegistryEntry<E> entry, C context, DispatchEvent.Ingress ingress)
    {
        Interaction interaction = context.interaction();
        try {
            entry.executor().execute(context);
            dispatched(interaction, ingress, DispatchEvent.Outcome.EXECUTED);
        } catch (ExecutorClosedException e) {
            log.debug("{} executor for '{}' is closed; evicting", kind, interaction.customId());
            int removed;
            synchronized (registryLock) {
                removed = registry.removeValue(entry);
            }
            sink.onEviction(new EvictionEvent(
                wallClock.now(), kind, removed, EvictionEvent.Reason.EXECUTOR_CLOSED));
            dispatched(interaction, ingress, DispatchEvent.Outcome.EXECUTOR_CLOSED);

            if (context.state() == ResponseState.FRESH) {
                context.createInitialResponse(ResponseMessage.ephemeral(timedOutMessage));
            }
        } catch (InteractionResponseException e) {
            dispatched(interaction, ingress, DispatchEvent.Outcome.ERROR_RESPONSE);
            context.respond(e.response());
        } catch (RuntimeException e) {
            dispatched(interaction, ingress, DispatchEvent.Outcome.FAILED);
            sink.onError(new InteractionErrorEvent(wallClock.now(),
                "Executor failed for " + kind + " '" + interaction.customId() + "'", e));
            throw e;
        }
    }

    // Package-private for tests.
    InteractionResponse awaitResponse(Interaction interaction, CompletableFuture<InteractionResponse> future)
    {
        try {
            if (!config.hasPullResponseTimeout()) {
                return future.get();
            }
            return future.get(config.pullResponseTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (!future.cancel(false)) {
                // Completed between the timeout and the cancel.
                return completedResponse(interaction, future);
            }
            sink.onError(new InteractionErrorEvent(wallClock.now(),
                "No initial response for " + kind + " '" + interaction.customId() + "'", e));
            throw new InteractionDispatchException("No initial response for interaction "
                + interaction.id() + " within " + config.pullResponseTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new InteractionDispatchException("Interrupted waiting for interaction " + interaction.id(), e);
        } catch (ExecutionException e) {
            throw executorFailure(interaction, e.getCause());
        }
    }

    private InteractionResponse completedResponse(Interaction interaction, CompletableFuture<InteractionResponse> future)
    {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw executorFailure(interaction, e.getCause());
        } catch (CancellationException e) {
            throw new InteractionDispatchException("Interaction " + interaction.id() + " was cancelled", e);
        }
    }

    private RuntimeException executorFailure(Interaction interaction, Throwable cause)
    {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new InteractionDispatchException("Executor failed for interaction " + interaction.id(), cause);
    }

    private void checkKind(Interaction interaction)
    {
        Objects.requireNonNull(interaction, "interaction");
        if (interaction.kind() != kind) {
            throw new IllegalArgumentException(
                "A " + kind + " client cannot dispatch a " + interaction.kind() + " interaction");
        }
    }

    // Caller holds registryLock.
    private void checkFree(String key)
    {
        if (registry.containsKey(key)) {
            throw new IllegalArgumentException("'" + key + "' is already registered");
        }
    }

    private void dispatched(Interaction interaction, DispatchEvent.Ingress ingress, DispatchEvent.Outcome outcome)
    {
        sink.onDispatch(new DispatchEvent(
            wallClock.now(), kind, interaction.id(), interaction.customId(), ingress, outcome));
    }

    private void releaseOwnedPools()
    {
        if ((ownedWorkers == null && ownedScheduler == null) || !poolsReleased.compareAndSet(false, true)) {
            return;
        }
        shutdown(ownedScheduler);
        shutdown(ownedWorkers);
        log.debug("{} client thread pools shut down", kind);
    }

    private static void shutdown(ExecutorService executor)
    {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix)
    {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    /**
     * Shared builder for clients. Only the transport is required; clocks
     * default to the system clocks, the scheduler and worker pool to daemon
     * thread pools owned by the client.
     */
    public abstract static class Builder<T extends AbstractInteractionClient<?, ?>, B extends Builder<T, B>>
    {
        private InteractionTransport transport;
        private InteractionGateway gateway;
        private InteractionServer server;
        private InteractionClientConfig config;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private ExecutorService workers;
        private InteractionObservabilitySink sink = new Slf4jInteractionObservabilitySink();

        protected Builder(InteractionClientConfig defaults) {
            this.config = defaults;
        }

        protected abstract B self();

        public abstract T build();

        public B withTransport(InteractionTransport transport) {
            this.transport = transport;
            return self();
        }

        public B withGateway(InteractionGateway gateway) {
            this.gateway = gateway;
            return self();
        }

        public B withServer(InteractionServer server) {
            this.server = server;
            return self();
        }

        public B withConfig(InteractionClientConfig config) {
            this.config = config;
            return self();
        }

        public B withClock(MonotonicClock clock) {
            this.clock = clock;
            return self();
        }

        public B withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return self();
        }

        public B withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return self();
        }

        public B withWorkers(ExecutorService workers) {
            this.workers = workers;
            return self();
        }

        public B withObservabilitySink(InteractionObservabilitySink sink) {
            this.sink = sink;
            return self();
        }
    }
}
