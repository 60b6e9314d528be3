package com.ocilogs.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.ToLongFunction;
import org.jboss.logging.Logger;

/**
 * A value held in a {@link ResultCache} under a fixed key and recomputed when older than its
 * refresh interval.
 *
 * <p>No lock is taken around the staleness check: concurrent callers that both observe a stale
 * entry both run the loader and the last write wins. A failing loader leaves the cached entry
 * untouched.
 */
public final class CachedLookup<T> {

    private static final Logger LOGGER = Logger.getLogger("DS.CachedLookup");

    private final ResultCache cache;
    private final String key;
    private final Class<T> type;
    private final Duration refreshInterval;
    private final Clock clock;
    private final Supplier<T> loader;
    private final ToLongFunction<T> cost;

    public CachedLookup(ResultCache cache,
                        String key,
                        Class<T> type,
                        Duration refreshInterval,
                        Supplier<T> loader,
                        ToLongFunction<T> cost) {
        this(cache, key, type, refreshInterval, cache.clock(), loader, cost);
    }

    public CachedLookup(ResultCache cache,
                        String key,
                        Class<T> type,
                        Duration refreshInterval,
                        Clock clock,
                        Supplier<T> loader,
                        ToLongFunction<T> cost) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.key = Objects.requireNonNull(key, "key");
        this.type = Objects.requireNonNull(type, "type");
        this.refreshInterval = Objects.requireNonNull(refreshInterval, "refreshInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.cost = Objects.requireNonNull(cost, "cost");
    }

    public T get() {
        Instant now = clock.instant();
        Optional<CacheEntry> cached = cache.get(key).filter(entry -> type.isInstance(entry.value()));
        if (cached.isPresent() && !cached.get().olderThan(refreshInterval, now)) {
            return type.cast(cached.get().value());
        }

        LOGGER.debugv("[CACHE] {0} key={1}", cached.isPresent() ? "refresco" : "carga", key);
        T value;
        try {
            value = loader.get();
        } catch (RuntimeException e) {
            LOGGER.warnv("[CACHE] fallo al refrescar key={0}: {1}", key, e.getMessage());
            throw e;
        }
        if (!cache.set(key, value, cost.applyAsLong(value))) {
            LOGGER.warnv("[CACHE] key={0} no admitida en la caché, se recargará en cada consulta", key);
        }
        return value;
    }

    public String key() {
        return key;
    }
}
