package com.questrail.interactions.config;

import com.questrail.interactions.timeout.Timeout;

import java.time.Duration;
import java.util.Objects;

/**
 * InteractionClientConfig
 * -----------------------------------------------------------------------------
 * Operational settings of an interaction client.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>defaultTimeout</b>: idle period of the sliding timeout used when a
 *       registration does not supply its own policy.</li>
 *   <li><b>defaultMaxUses</b>: uses allowed by that default policy, or
 *       {@link Timeout#UNLIMITED_USES}.</li>
 *   <li><b>reaperInterval</b>: spacing between sweeps that evict expired
 *       registrations.</li>
 *   <li><b>pullResponseTimeout</b>: how long a pull request waits for the
 *       initial response. {@link Duration#ZERO} waits without bound.</li>
 * </ul>
 */
public record InteractionClientConfig(
    Duration defaultTimeout,
    int defaultMaxUses,
    Duration reaperInterval,
    Duration pullResponseTimeout
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);
    public static final Duration DEFAULT_REAPER_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_PULL_RESPONSE_TIMEOUT = Duration.ofSeconds(3);

    public InteractionClientConfig {
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(reaperInterval, "reaperInterval");
        Objects.requireNonNull(pullResponseTimeout, "pullResponseTimeout");

        if (defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be non-negative");
        }
        Timeout.checkMaxUses(defaultMaxUses);
        if (reaperInterval.isNegative() || reaperInterval.isZero()) {
            throw new IllegalArgumentException("reaperInterval must be positive");
        }
        if (pullResponseTimeout.isNegative()) {
            throw new IllegalArgumentException("pullResponseTimeout must be non-negative");
        }
    }

    /** Components stay registered until idle for two minutes. */
    public static InteractionClientConfig componentDefaults() {
        return new InteractionClientConfig(
            DEFAULT_TIMEOUT, Timeout.UNLIMITED_USES, DEFAULT_REAPER_INTERVAL, DEFAULT_PULL_RESPONSE_TIMEOUT);
    }

    /** A modal is submitted once, so its default policy allows a single use. */
    public static InteractionClientConfig modalDefaults() {
        return new InteractionClientConfig(
            DEFAULT_TIMEOUT, 1, DEFAULT_REAPER_INTERVAL, DEFAULT_PULL_RESPONSE_TIMEOUT);
    }

    public boolean hasPullResponseTimeout() {
        return !pullResponseTimeout.isZero();
    }

    public static Builder builder() {
        return new Builder(componentDefaults());
    }

    public static Builder builder(InteractionClientConfig base) {
        return new Builder(base);
    }

    public static final class Builder {
        private Duration defaultTimeout;
        private int defaultMaxUses;
        private Duration reaperInterval;
        private Duration pullResponseTimeout;

        private Builder(InteractionClientConfig base) {
            this.defaultTimeout = base.defaultTimeout();
            this.defaultMaxUses = base.defaultMaxUses();
            this.reaperInterval = base.reaperInterval();
            this.pullResponseTimeout = base.pullResponseTimeout();
        }

        public Builder withDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder withDefaultMaxUses(int defaultMaxUses) {
            this.defaultMaxUses = defaultMaxUses;
            return this;
        }

        public Builder withReaperInterval(Duration reaperInterval) {
            this.reaperInterval = reaperInterval;
            return this;
        }

        public Builder withPullResponseTimeout(Duration pullResponseTimeout) {
            this.pullResponseTimeout = pullResponseTimeout;
            return this;
        }

        public InteractionClientConfig build() {
            return new InteractionClientConfig(defaultTimeout, defaultMaxUses, reaperInterval, pullResponseTimeout);
        }
    }
}
