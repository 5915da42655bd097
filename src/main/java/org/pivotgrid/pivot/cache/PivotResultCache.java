package org.pivotgrid.pivot.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-memory cache of materialized pivots keyed by request fingerprint.
 *
 * <p><strong>Characteristics:</strong>
 * <ul>
 *   <li>Entries expire once they are {@code ttl} old; expired entries are never returned</li>
 *   <li>At most {@code maxEntries} entries; the oldest entry is evicted first</li>
 *   <li>All map access is serialized on this instance and never spans a computation</li>
 * </ul>
 * </p>
 */
public class PivotResultCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotResultCache.class);

    // insertion order = creation order
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    public PivotResultCache(final Duration ttl, final int maxEntries) {
        this(ttl, maxEntries, Clock.systemUTC());
    }

    /**
     * @param ttl        age at which entries expire
     * @param maxEntries capacity
     * @param clock      time source for expiry checks
     */
    public PivotResultCache(final Duration ttl, final int maxEntries, final Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive, got " + ttl);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive, got " + maxEntries);
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * @return the live entry for the fingerprint, or empty if absent or expired
     */
    public synchronized Optional<CacheEntry> get(final String fingerprint) {
        final CacheEntry entry = entries.get(fingerprint);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(fingerprint);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * Inserts or replaces an entry. A replaced entry counts as newly created.
     */
    public synchronized void put(final CacheEntry entry) {
        entries.remove(entry.fingerprint());
        entries.put(entry.fingerprint(), entry);
        final Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while (entries.size() > maxEntries && it.hasNext()) {
            final String evicted = it.next().getKey();
            it.remove();
            LOGGER.debug("Evicted pivot {} (capacity {})", evicted, maxEntries);
        }
    }

    public synchronized boolean invalidate(final String fingerprint) {
        return entries.remove(fingerprint) != null;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Removes all expired entries. Expired keys are collected under the lock, then removed one
     * at a time so concurrent readers are never blocked for the whole sweep. A failure on one
     * entry is logged and the sweep continues.
     *
     * @return the number of entries removed
     */
    public int sweep() {
        final Instant now = clock.instant();
        final List<String> expired = new ArrayList<>();
        synchronized (this) {
            for (final CacheEntry entry : entries.values()) {
                if (isExpired(entry, now)) {
                    expired.add(entry.fingerprint());
                }
            }
        }

        int removed = 0;
        for (final String fingerprint : expired) {
            try {
                if (removeIfExpired(fingerprint, now)) {
                    removed++;
                }
            } catch (final RuntimeException e) {
                LOGGER.warn("Failed to remove expired pivot {}: {}", fingerprint, e.getMessage());
            }
        }
        if (removed > 0) {
            LOGGER.debug("Swept {} expired pivot(s), {} remaining", removed, size());
        }
        return removed;
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    private synchronized boolean removeIfExpired(final String fingerprint, final Instant now) {
        final CacheEntry entry = entries.get(fingerprint);
        // a fresh entry may have replaced the expired one since the snapshot
        if (entry != null && isExpired(entry, now)) {
            entries.remove(fingerprint);
            return true;
        }
        return false;
    }

    private boolean isExpired(final CacheEntry entry, final Instant now) {
        return !now.isBefore(entry.createdAt().plus(ttl));
    }
}
