package com.questrail.interactions.timeout;

/**
 * Policy that never expires and never runs out of uses.
 *
 * <p>Entries registered with it live until they are unregistered or their
 * executor reports itself closed.</p>
 */
public enum NeverTimeout implements Timeout {
    INSTANCE;

    @Override
    public boolean hasExpired() {
        return false;
    }

    @Override
    public boolean incrementUses() {
        return false;
    }
}
