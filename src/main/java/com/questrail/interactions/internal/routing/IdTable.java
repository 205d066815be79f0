package com.questrail.interactions.internal.routing;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * IdTable
 * =============================================================================
 * Two disjoint maps keyed by custom id match segments: exact keys and prefix
 * keys.
 *
 * <h2>Lookup</h2>
 * Exact keys win. Otherwise the longest prefix key that the match starts with
 * is used, so {@code "vote"} beats {@code "vo"} for {@code "voter"}.
 *
 * <h2>Thread safety</h2>
 * Not thread-safe. Owners guard every call with their own lock.
 */
public final class IdTable<V>
{
    private final Map<String, V> exact = new HashMap<>();
    private final Map<String, V> prefix = new HashMap<>();

    /**
     * @throws IllegalArgumentException if {@code key} is already present in either map
     */
    public void put(String key, V value, boolean prefixMatch)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        if (exact.containsKey(key)) {
            throw new IllegalArgumentException("'" + key + "' is already registered as a constant id");
        }
        if (prefix.containsKey(key)) {
            throw new IllegalArgumentException("'" + key + "' is already registered as a prefix match");
        }
        (prefixMatch ? prefix : exact).put(key, value);
    }

    public Optional<V> find(String match)
    {
        Objects.requireNonNull(match, "match");

        V value = exact.get(match);
        if (value != null) {
            return Optional.of(value);
        }
        if (prefix.isEmpty()) {
            return Optional.empty();
        }
        for (int end = match.length(); end >= 0; end--) {
            value = prefix.get(match.substring(0, end));
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Remove {@code key} from whichever map holds it.
     *
     * @return the removed value, or empty if the key was not present
     */
    public Optional<V> remove(String key)
    {
        V value = exact.remove(key);
        if (value == null) {
            value = prefix.remove(key);
        }
        return Optional.ofNullable(value);
    }

    /**
     * Remove every key bound to {@code value} (by identity).
     *
     * @return number of keys removed
     */
    public int removeValue(V value)
    {
        return removeIf(v -> v == value);
    }

    public int removeIf(Predicate<? super V> filter)
    {
        int before = exact.size() + prefix.size();
        exact.values().removeIf(filter);
        prefix.values().removeIf(filter);
        return before - (exact.size() + prefix.size());
    }

    public Set<String> exactKeys() {
        return Set.copyOf(exact.keySet());
    }

    public Set<String> prefixKeys() {
        return Set.copyOf(prefix.keySet());
    }

    public boolean containsKey(String key) {
        return exact.containsKey(key) || prefix.containsKey(key);
    }
}
