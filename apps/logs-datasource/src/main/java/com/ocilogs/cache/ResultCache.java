package com.ocilogs.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.jboss.logging.Logger;

/**
 * Shared cache of metadata lookups, bounded by the total cost of its entries rather than by
 * their number.
 *
 * <p>The cache enforces no staleness itself: callers compare {@link CacheEntry#insertedAt()}
 * against their own refresh interval (see {@link CachedLookup}).
 */
public class ResultCache {

    private static final Logger LOGGER = Logger.getLogger("DS.ResultCache");

    private final Cache<String, CacheEntry> entries;
    private final Clock clock;
    private final long maxCost;

    public ResultCache(long maxCost) {
        this(maxCost, ForkJoinPool.commonPool(), Clock.systemUTC());
    }

    /**
     * @param executor runs eviction maintenance; tests pass {@code Runnable::run} to evict
     *                 synchronously
     */
    public ResultCache(long maxCost, Executor executor, Clock clock) {
        if (maxCost <= 0) {
            throw new IllegalArgumentException("maxCost must be positive: " + maxCost);
        }
        this.maxCost = maxCost;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumWeight(maxCost)
                .weigher((String key, CacheEntry entry) -> (int) Math.min(Integer.MAX_VALUE, entry.cost()))
                .executor(executor)
                .build();
        LOGGER.infov("[INIT] ResultCache listo. maxCost={0}", maxCost);
    }

    public Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    /**
     * Stores the value, replacing any previous entry for the key. Returns {@code false} when the
     * cost alone exceeds the budget; such a value is not admitted.
     */
    public boolean set(String key, Object value, long cost) {
        if (cost > maxCost) {
            LOGGER.warnv("[CACHE] valor descartado, coste {0} supera el máximo {1}. key={2}", cost, maxCost, key);
            return false;
        }
        entries.put(key, new CacheEntry(key, value, cost, clock.instant()));
        return true;
    }

    public boolean has(String key) {
        return entries.getIfPresent(key) != null;
    }

    public void invalidateAll() {
        entries.invalidateAll();
    }

    /**
     * Sum of the costs of the entries currently held, after pending maintenance.
     */
    public long totalCost() {
        entries.cleanUp();
        return entries.policy().eviction()
                .map(eviction -> eviction.weightedSize().orElse(0L))
                .orElse(0L);
    }

    Clock clock() {
        return clock;
    }
}
