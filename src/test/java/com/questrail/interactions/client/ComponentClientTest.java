package com.questrail.interactions.client;

import com.questrail.interactions.api.InteractionKind;
import com.questrail.interactions.api.InteractionResponse;
import com.questrail.interactions.api.InteractionResponseException;
import com.questrail.interactions.api.ResponseType;
import com.questrail.interactions.api.Visibility;
import com.questrail.interactions.config.InteractionClientConfig;
import com.questrail.interactions.context.ComponentContext;
import com.questrail.interactions.context.ResponseStateException;
import com.questrail.interactions.executor.ComponentExecutor;
import com.questrail.interactions.executor.MultiComponentExecutor;
import com.questrail.interactions.executor.WaitForExecutor;
import com.questrail.interactions.internal.time.MonotonicClock;
import com.questrail.interactions.observability.DispatchEvent;
import com.questrail.interactions.observability.EvictionEvent;
import com.questrail.interactions.testing.FakeInteractionGateway;
import com.questrail.interactions.testing.FakeInteractionServer;
import com.questrail.interactions.testing.RecordingInteractionTransport;
import com.questrail.interactions.testing.RecordingObservabilitySink;
import com.questrail.interactions.testing.TestInteractions;
import com.questrail.interactions.time.DeterministicScheduler;
import com.questrail.interactions.time.ManualMonotonicClock;
import com.questrail.interactions.time.ManualWallClock;
import com.questrail.interactions.timeout.NeverTimeout;
import com.questrail.interactions.timeout.SlidingTimeout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ComponentClientTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingInteractionTransport transport;
    private FakeInteractionGateway gateway;
    private FakeInteractionServer server;
    private RecordingObservabilitySink sink;
    private ExecutorService workers;
    private ComponentClient client;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        transport = new RecordingInteractionTransport();
        gateway = new FakeInteractionGateway();
        server = new FakeInteractionServer();
        sink = new RecordingObservabilitySink();
        workers = Executors.newCachedThreadPool();
        client = newClient(InteractionClientConfig.componentDefaults());
    }

    @AfterEach
    void tearDown() {
        client.close();
        workers.shutdownNow();
    }

    private ComponentClient newClient(InteractionClientConfig config) {
        return ComponentClient.builder()
            .withTransport(transport)
            .withGateway(gateway)
            .withServer(server)
            .withConfig(config)
            .withClock(clock)
            .withWallClock(new ManualWallClock(TestInteractions.CREATED_AT))
            .withScheduler(scheduler)
            .withWorkers(workers)
            .withObservabilitySink(sink)
            .build();
    }

    private String lastInitialContent() {
        var initial = transport.initialResponses();
        return ((InteractionResponse.Message) initial.get(initial.size() - 1).response()).content();
    }

    // ---------------------------------------------------------------------
    // Registry
    // ---------------------------------------------------------------------

    @Test
    void registerWithoutIdMintsOne() {
        String id = client.register(null, new ComponentExecutor());

        assertTrue(id.matches("[0-9a-f]{32}"));
        assertTrue(client.isRegistered(id));
    }

    @Test
    void registerReturnsIdWithMetadataButKeysOnMatch() {
        String id = client.register("vote:42", new ComponentExecutor());

        assertEquals("vote:42", id);
        assertTrue(client.lookup("vote:other").isPresent());
        assertThrows(IllegalArgumentException.class, () -> client.register("vote", new ComponentExecutor()));
    }

    @Test
    void lookupIsExactThenLongestPrefix() {
        ComponentExecutor shortPrefix = new ComponentExecutor();
        ComponentExecutor longPrefix = new ComponentExecutor();
        ComponentExecutor exact = new ComponentExecutor();
        client.register("ab", shortPrefix, NeverTimeout.INSTANCE, true);
        client.register("abc", longPrefix, NeverTimeout.INSTANCE, true);
        client.register("abcd", exact, NeverTimeout.INSTANCE, false);

        assertSame(exact, client.lookup("abcd:1").orElseThrow().executor());
        assertSame(longPrefix, client.lookup("abcde").orElseThrow().executor());
        assertSame(shortPrefix, client.lookup("abx").orElseThrow().executor());
        assertTrue(client.lookup("zz").isEmpty());
    }

    @Test
    void unregisterUnknownIdFails() {
        client.register("a", new ComponentExecutor());
        client.unregister("a:meta");

        assertFalse(client.isRegistered("a"));
        assertThrows(NoSuchElementException.class, () -> client.unregister("a"));
    }

    @Test
    void registerExecutorBindsAllDeclaredIds() {
        ComponentExecutor executor = new ComponentExecutor()
            .addCallback("yes", ctx -> ctx.respond("yes"))
            .addCallback("no", ctx -> ctx.respond("no"))
            .addPrefixCallback("page-", ctx -> ctx.respond("page"));

        client.registerExecutor(executor);

        assertTrue(client.isRegistered("yes"));
        assertTrue(client.isRegistered("page-"));
        assertThrows(IllegalArgumentException.class,
            () -> client.registerExecutor(new ComponentExecutor().addCallback("other", c -> {}).addCallback("no", c -> {})));
        assertFalse(client.isRegistered("other"));

        assertEquals(3, client.unregisterExecutor(executor));
    }

    @Test
    void multiExecutorRegistersEveryChildId() {
        MultiComponentExecutor multi = new MultiComponentExecutor()
            .add(new ComponentExecutor().addCallback("yes", ctx -> ctx.respond("yes")))
            .add(new ComponentExecutor().addCallback("no", ctx -> ctx.respond("no")));

        client.registerExecutor(multi);
        client.onPushEvent(TestInteractions.component("no"));

        assertTrue(client.isRegistered("yes"));
        assertEquals("no", lastInitialContent());
        assertEquals(2, client.unregisterExecutor(multi));
    }

    // ---------------------------------------------------------------------
    // Push dispatch
    // ---------------------------------------------------------------------

    @Test
    void twoUseRegistrationIsEvictedAfterSecondUse() {
        List<String> metadata = new ArrayList<>();
        ComponentExecutor executor = new ComponentExecutor()
            .addCallback("vote", ctx -> {
                metadata.add(ctx.idMetadata());
                ctx.respond("counted");
            });
        client.register("vote", executor, new SlidingTimeout(Duration.ofSeconds(30), 2, clock));

        client.onPushEvent(TestInteractions.component("vote:1"));
        client.onPushEvent(TestInteractions.component("vote:2"));
        assertFalse(client.isRegistered("vote"));

        client.onPushEvent(TestInteractions.component("vote:3"));

        assertEquals(List.of("1", "2"), metadata);
        InteractionResponse.Message fallback =
            (InteractionResponse.Message) transport.initialResponses().get(2).response();
        assertEquals(ComponentClient.TIMED_OUT_MESSAGE, fallback.content());
        assertEquals(ResponseType.MESSAGE_CREATE, fallback.type());
        assertTrue(fallback.ephemeral());
        assertEquals(List.of(DispatchEvent.Outcome.EXECUTED, DispatchEvent.Outcome.EXECUTED, DispatchEvent.Outcome.TIMED_OUT),
            sink.outcomes());
        assertEquals(EvictionEvent.Reason.USES_EXHAUSTED, sink.evictions.get(0).reason());
    }

    @Test
    void expiredRegistrationIsEvictedOnLookup() {
        client.register("menu", new ComponentExecutor().addCallback("menu", ctx -> ctx.respond("open")),
            new SlidingTimeout(Duration.ofSeconds(30), clock));

        clock.advance(Duration.ofSeconds(31));
        client.onPushEvent(TestInteractions.component("menu"));

        assertEquals(ComponentClient.TIMED_OUT_MESSAGE, lastInitialContent());
        assertFalse(client.isRegistered("menu"));
        assertEquals(EvictionEvent.Reason.EXPIRED, sink.evictions.get(0).reason());
    }

    @Test
    void expiryBetweenCheckAndUseIsTreatedAsExpired() {
        // Every read moves the clock on by a nanosecond, so the entry is alive
        // when checked and expired by the time the use is recorded.
        AtomicLong ticks = new AtomicLong();
        MonotonicClock ticking = ticks::getAndIncrement;
        List<String> ran = new ArrayList<>();
        client.register("a", new ComponentExecutor().addCallback("a", ctx -> ran.add(ctx.idMatch())),
            new SlidingTimeout(Duration.ofNanos(1), ticking));

        client.onPushEvent(TestInteractions.component("a"));

        assertTrue(ran.isEmpty());
        assertEquals(ComponentClient.TIMED_OUT_MESSAGE, lastInitialContent());
        assertFalse(client.isRegistered("a"));
        assertEquals(EvictionEvent.Reason.EXPIRED, sink.evictions.get(0).reason());
        assertEquals(List.of(DispatchEvent.Outcome.TIMED_OUT), sink.outcomes());
    }

    @Test
    void unknownIdGetsTimedOutResponse() {
        client.onPushEvent(TestInteractions.component("ghost"));

        assertEquals(ComponentClient.TIMED_OUT_MESSAGE, lastInitialContent());
    }

    @Test
    void closedExecutorIsEvictedAndAnswered() throws Exception {
        WaitForExecutor waitFor = new WaitForExecutor(Set.of("confirm"), Set.of(), Duration.ofSeconds(5));
        client.registerExecutor(waitFor, NeverTimeout.INSTANCE);
        CompletableFuture<ComponentContext> waiting = waitFor.waitFor();

        client.onPushEvent(TestInteractions.component("confirm"));
        waiting.get(1, TimeUnit.SECONDS).respond("confirmed");

        client.onPushEvent(TestInteractions.component("confirm"));

        assertFalse(client.isRegistered("confirm"));
        assertEquals(ComponentClient.TIMED_OUT_MESSAGE, lastInitialContent());
        assertEquals(DispatchEvent.Outcome.EXECUTOR_CLOSED, sink.outcomes().get(1));
        assertEquals(EvictionEvent.Reason.EXECUTOR_CLOSED, sink.evictions.get(0).reason());
    }

    @Test
    void responseExceptionBecomesResponse() {
        client.register("buy", new ComponentExecutor().addCallback("buy", ctx -> {
            throw new InteractionResponseException("Out of stock");
        }));

        client.onPushEvent(TestInteractions.component("buy"));

        InteractionResponse.Message message =
            (InteractionResponse.Message) transport.initialResponses().get(0).response();
        assertEquals("Out of stock", message.content());
        assertTrue(message.ephemeral());
        assertEquals(DispatchEvent.Outcome.ERROR_RESPONSE, sink.outcomes().get(0));
    }

    @Test
    void executorFailurePropagatesUnchanged() {
        IllegalStateException boom = new IllegalStateException("boom");
        client.register("x", new ComponentExecutor().addCallback("x", ctx -> {
            throw boom;
        }));

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> client.onPushEvent(TestInteractions.component("x")));

        assertSame(boom, thrown);
        assertSame(boom, sink.errors.get(0).cause());
        assertEquals(DispatchEvent.Outcome.FAILED, sink.outcomes().get(0));
    }

    @Test
    void rejectsInteractionsOfOtherKind() {
        assertThrows(IllegalArgumentException.class,
            () -> client.onPushEvent(TestInteractions.modal("m", Map.of())));
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Test
    void openAndCloseAreIdempotent() {
        client.open();
        client.open();

        assertTrue(client.isOpen());
        assertEquals(1, gateway.listenerCount());
        assertTrue(server.hasHandler(InteractionKind.COMPONENT));
        assertEquals(1, scheduler.pendingCount());

        client.close();
        client.close();

        assertFalse(client.isOpen());
        assertEquals(0, gateway.listenerCount());
        assertFalse(server.hasHandler(InteractionKind.COMPONENT));
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void gatewayDeliversOnlyComponentInteractions() {
        List<String> seen = new ArrayList<>();
        client.register("a", new ComponentExecutor().addCallback("a", ctx -> {
            seen.add(ctx.idMatch());
            ctx.respond("ok");
        }));
        client.open();

        gateway.inject(TestInteractions.component("a"));
        gateway.inject(TestInteractions.modal("a", Map.of()));

        assertEquals(List.of("a"), seen);
        assertEquals(1, transport.initialResponses().size());
    }

    @Test
    void registrationsSurviveReopen() {
        client.register("keep", new ComponentExecutor());
        client.open();
        client.close();
        client.open();

        assertTrue(client.isRegistered("keep"));
        assertEquals(1, gateway.listenerCount());
    }

    @Test
    void suppliedPoolsOutliveClose() {
        client.open();
        client.close();

        assertFalse(workers.isShutdown());
    }

    @Test
    void ownedPoolsAreShutDownOnClose() throws Exception {
        Set<Thread> before = clientThreads();
        ComponentClient owning = ComponentClient.builder()
            .withTransport(transport)
            .withObservabilitySink(sink)
            .build();
        owning.register("hello", new ComponentExecutor().addCallback("hello", ctx -> ctx.respond("hi")));
        owning.open();

        assertEquals(new InteractionResponse.Message(ResponseType.MESSAGE_CREATE, "hi", false),
            owning.onPullRequest(TestInteractions.component("hello")));

        Set<Thread> started = clientThreads();
        started.removeAll(before);
        assertTrue(started.stream().anyMatch(t -> t.getName().startsWith("component-client-worker")));
        assertTrue(started.stream().anyMatch(t -> t.getName().startsWith("component-client-scheduler")));

        owning.close();
        for (Thread thread : started) {
            thread.join(1_000);
        }

        assertEquals(0, started.stream().filter(Thread::isAlive).count());
        IllegalStateException e = assertThrows(IllegalStateException.class, owning::open);
        assertEquals("COMPONENT client was closed and its thread pools are shut down", e.getMessage());
        assertDoesNotThrow(owning::close);
    }

    private static Set<Thread> clientThreads() {
        return Thread.getAllStackTraces().keySet().stream()
            .filter(t -> t.getName().startsWith("component-client-"))
            .collect(Collectors.toSet());
    }

    // ---------------------------------------------------------------------
    // Pull dispatch
    // ---------------------------------------------------------------------

    @Test
    void pullRequestReturnsInitialResponse() {
        client.register("hello", new ComponentExecutor().addCallback("hello", ctx -> ctx.respond("hi")));
        client.open();

        InteractionResponse response = server.request(TestInteractions.component("hello"));

        assertEquals(new InteractionResponse.Message(ResponseType.MESSAGE_CREATE, "hi", false), response);
        assertTrue(transport.initialResponses().isEmpty());
    }

    @Test
    void pullRequestForUnknownIdReturnsTimedOutResponse() {
        InteractionResponse response = client.onPullRequest(TestInteractions.component("ghost"));

        assertEquals(InteractionResponse.timedOut(ComponentClient.TIMED_OUT_MESSAGE), response);
        assertTrue(transport.calls().isEmpty());
    }

    @Test
    void pullDeferThenEditGoesThroughTransport() throws Exception {
        CountDownLatch edited = new CountDownLatch(1);
        client.register("slow", new ComponentExecutor().addCallback("slow", ctx -> {
            ctx.defer(ResponseType.DEFERRED_MESSAGE_CREATE, Visibility.EPHEMERAL);
            ctx.editInitialResponse("finished");
            edited.countDown();
        }));

        InteractionResponse response = client.onPullRequest(TestInteractions.component("slow"));

        assertEquals(new InteractionResponse.Deferred(ResponseType.DEFERRED_MESSAGE_CREATE, true), response);
        assertTrue(edited.await(1, TimeUnit.SECONDS));
        assertEquals("finished", transport.edits().get(0).content());
    }

    @Test
    void pullExecutorFailureSurfacesToCaller() {
        client.register("x", new ComponentExecutor().addCallback("x", ctx -> {
            throw new UnsupportedOperationException("nope");
        }));

        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
            () -> client.onPullRequest(TestInteractions.component("x")));
        assertEquals("nope", e.getMessage());
    }

    @Test
    void pullWithoutResponseTimesOut() throws Exception {
        ComponentClient impatient = newClient(InteractionClientConfig.builder()
            .withPullResponseTimeout(Duration.ofMillis(50))
            .build());
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<RuntimeException> late = new AtomicReference<>();
        CountDownLatch lateDone = new CountDownLatch(1);
        impatient.register("silent", new ComponentExecutor().addCallback("silent", ctx -> {
            try {
                release.await(1, TimeUnit.SECONDS);
                ctx.respond("too late");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                late.set(e);
            } finally {
                lateDone.countDown();
            }
        }));

        assertThrows(InteractionDispatchException.class,
            () -> impatient.onPullRequest(TestInteractions.component("silent")));

        release.countDown();
        assertTrue(lateDone.await(1, TimeUnit.SECONDS));
        assertInstanceOf(ResponseStateException.class, late.get());
    }

    @Test
    void failureRacingThePullTimeoutIsRethrown() {
        ComponentClient impatient = newClient(InteractionClientConfig.builder()
            .withPullResponseTimeout(Duration.ofMillis(50))
            .build());
        IllegalStateException boom = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> impatient.awaitResponse(TestInteractions.component("x"), new SettlesOnTimeout(f -> f.completeExceptionally(boom))));

        assertSame(boom, thrown);
        assertTrue(sink.errors.isEmpty());
    }

    @Test
    void checkedFailureRacingThePullTimeoutIsWrapped() {
        ComponentClient impatient = newClient(InteractionClientConfig.builder()
            .withPullResponseTimeout(Duration.ofMillis(50))
            .build());
        IOException io = new IOException("socket closed");

        InteractionDispatchException thrown = assertThrows(InteractionDispatchException.class,
            () -> impatient.awaitResponse(TestInteractions.component("x"), new SettlesOnTimeout(f -> f.completeExceptionally(io))));

        assertSame(io, thrown.getCause());
    }

    @Test
    void responseRacingThePullTimeoutIsReturned() {
        ComponentClient impatient = newClient(InteractionClientConfig.builder()
            .withPullResponseTimeout(Duration.ofMillis(50))
            .build());
        InteractionResponse hi = new InteractionResponse.Message(ResponseType.MESSAGE_CREATE, "hi", false);

        assertEquals(hi, impatient.awaitResponse(TestInteractions.component("x"), new SettlesOnTimeout(f -> f.complete(hi))));
    }

    /** Settles itself the instant the timed wait gives up, before the caller can cancel. */
    private static final class SettlesOnTimeout extends CompletableFuture<InteractionResponse> {

        private final Consumer<CompletableFuture<InteractionResponse>> settle;

        SettlesOnTimeout(Consumer<CompletableFuture<InteractionResponse>> settle) {
            this.settle = settle;
        }

        @Override
        public InteractionResponse get(long timeout, TimeUnit unit) throws TimeoutException {
            settle.accept(this);
            throw new TimeoutException();
        }
    }
}
