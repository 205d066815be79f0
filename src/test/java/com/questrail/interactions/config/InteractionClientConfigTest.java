package com.questrail.interactions.config;

import com.questrail.interactions.timeout.Timeout;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InteractionClientConfigTest {

    @Test
    void defaults() {
        InteractionClientConfig components = InteractionClientConfig.componentDefaults();
        InteractionClientConfig modals = InteractionClientConfig.modalDefaults();

        assertEquals(Duration.ofMinutes(2), components.defaultTimeout());
        assertEquals(Timeout.UNLIMITED_USES, components.defaultMaxUses());
        assertEquals(1, modals.defaultMaxUses());
        assertEquals(Duration.ofSeconds(5), components.reaperInterval());
        assertEquals(Duration.ofSeconds(3), components.pullResponseTimeout());
        assertTrue(components.hasPullResponseTimeout());
    }

    @Test
    void builderStartsFromBase() {
        InteractionClientConfig config = InteractionClientConfig.builder(InteractionClientConfig.modalDefaults())
            .withPullResponseTimeout(Duration.ZERO)
            .withReaperInterval(Duration.ofSeconds(1))
            .build();

        assertEquals(1, config.defaultMaxUses());
        assertEquals(Duration.ofSeconds(1), config.reaperInterval());
        assertFalse(config.hasPullResponseTimeout());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
            () -> InteractionClientConfig.builder().withReaperInterval(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> InteractionClientConfig.builder().withDefaultMaxUses(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> InteractionClientConfig.builder().withDefaultTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(NullPointerException.class,
            () -> InteractionClientConfig.builder().withPullResponseTimeout(null).build());
    }
}
