package com.questrail.interactions.timeout;

/**
 * Timeout
 * =============================================================================
 * Lifetime policy attached to a registry entry.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #hasExpired()} has no side effects and may be called from any thread.</li>
 *   <li>{@link #incrementUses()} records one dispatch. It returns {@code true}
 *       when this call used up the policy, after which the entry is evicted.</li>
 *   <li>Calling {@link #incrementUses()} on an expired policy throws
 *       {@link UsesDepletedException}.</li>
 * </ul>
 *
 * <p>The registry calls both methods while holding its own lock, so
 * implementations only need to be safe for reads from the reaper thread.</p>
 */
public interface Timeout
{
    /** Sentinel for {@code maxUses} meaning no limit. */
    int UNLIMITED_USES = -1;

    boolean hasExpired();

    boolean incrementUses();

    static void checkMaxUses(int maxUses) {
        if (maxUses == 0 || maxUses < UNLIMITED_USES) {
            throw new IllegalArgumentException("maxUses must be positive or -1 (unlimited), got " + maxUses);
        }
    }
}
