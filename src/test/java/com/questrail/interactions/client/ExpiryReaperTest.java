package com.questrail.interactions.client;

import com.questrail.interactions.executor.ComponentExecutor;
import com.questrail.interactions.observability.EvictionEvent;
import com.questrail.interactions.testing.RecordingInteractionTransport;
import com.questrail.interactions.testing.RecordingObservabilitySink;
import com.questrail.interactions.time.DeterministicScheduler;
import com.questrail.interactions.time.ManualMonotonicClock;
import com.questrail.interactions.timeout.NeverTimeout;
import com.questrail.interactions.timeout.SlidingTimeout;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExpiryReaperTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);

    private void tick() {
        clock.advance(Duration.ofSeconds(5));
        scheduler.runDueTasks();
    }

    @Test
    void sweepsEveryInterval() {
        AtomicInteger sweeps = new AtomicInteger();
        ExpiryReaper reaper = new ExpiryReaper(scheduler, clock, Duration.ofSeconds(5), sweeps::incrementAndGet);

        reaper.start();
        tick();
        tick();
        tick();

        assertEquals(3, sweeps.get());
        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void startAndStopAreIdempotent() {
        AtomicInteger sweeps = new AtomicInteger();
        ExpiryReaper reaper = new ExpiryReaper(scheduler, clock, Duration.ofSeconds(5), sweeps::incrementAndGet);

        reaper.start();
        reaper.start();
        assertEquals(1, scheduler.pendingCount());

        reaper.stop();
        reaper.stop();
        tick();

        assertFalse(reaper.isRunning());
        assertEquals(0, sweeps.get());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void restartRunsSingleChain() {
        AtomicInteger sweeps = new AtomicInteger();
        ExpiryReaper reaper = new ExpiryReaper(scheduler, clock, Duration.ofSeconds(5), sweeps::incrementAndGet);

        reaper.start();
        reaper.stop();
        reaper.start();
        tick();

        assertEquals(1, sweeps.get());
        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void failingSweepKeepsTicking() {
        AtomicInteger sweeps = new AtomicInteger();
        ExpiryReaper reaper = new ExpiryReaper(scheduler, clock, Duration.ofSeconds(5), () -> {
            sweeps.incrementAndGet();
            throw new IllegalStateException("sweep failed");
        });

        reaper.start();
        tick();
        tick();

        assertEquals(2, sweeps.get());
    }

    @Test
    void clientReaperEvictsExpiredEntries() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        ComponentClient client = ComponentClient.builder()
            .withTransport(new RecordingInteractionTransport())
            .withClock(clock)
            .withScheduler(scheduler)
            .withObservabilitySink(sink)
            .build();
        client.register("short", new ComponentExecutor(), new SlidingTimeout(Duration.ofSeconds(10), clock));
        client.register("forever", new ComponentExecutor(), NeverTimeout.INSTANCE);
        client.open();

        tick();
        tick();
        assertTrue(client.isRegistered("short"), "elapsed equal to the timeout is still alive");

        tick();
        assertFalse(client.isRegistered("short"));
        assertTrue(client.isRegistered("forever"));
        assertEquals(EvictionEvent.Reason.EXPIRED, sink.evictions.get(0).reason());
        assertEquals(1, sink.evictions.get(0).removedKeys());

        client.close();
        assertEquals(0, scheduler.pendingCount());
    }
}
