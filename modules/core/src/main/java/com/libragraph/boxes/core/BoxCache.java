package com.libragraph.boxes.core;

import com.libragraph.boxes.core.label.NestedKey;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Content-addressed memo of Sum and Product results, least recently used first out.
 *
 * <p>Entries are keyed by operand content, so structurally equal operands built
 * independently share one entry. Both operators are commutative; operands are stored in
 * key order. Values are computed outside the lock, so a computation may itself use the
 * cache; two threads racing on the same key compute equal boxes and either may win.
 */
public final class BoxCache {

    private static final Logger log = Logger.getLogger(BoxCache.class);

    public enum Op { SUM, PRODUCT }

    private record CacheKey(Op op, NestedKey left, NestedKey right) {
        static CacheKey of(Op op, Box a, Box b) {
            NestedKey ka = a.canonicalKey();
            NestedKey kb = b.canonicalKey();
            return ka.compareTo(kb) <= 0 ? new CacheKey(op, ka, kb) : new CacheKey(op, kb, ka);
        }
    }

    private final int maxEntries;
    private final Map<CacheKey, Box> entries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public BoxCache(int maxEntries) {
        if (maxEntries < 0) {
            throw new IllegalArgumentException("maxEntries must be >= 0, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, Box> eldest) {
                boolean evict = size() > BoxCache.this.maxEntries;
                if (evict) {
                    log.debugf("Evicting %s result for %s", eldest.getKey().op(), eldest.getKey().left());
                }
                return evict;
            }
        };
    }

    public boolean enabled() {
        return maxEntries > 0;
    }

    public Box computeIfAbsent(Op op, Box a, Box b, Supplier<Box> compute) {
        if (!enabled()) {
            return compute.get();
        }
        CacheKey key = CacheKey.of(op, a, b);
        Box cached;
        synchronized (entries) {
            cached = entries.get(key);
        }
        if (cached != null) {
            hits.incrementAndGet();
            log.debugf("Cache hit: %s %s %s", op, key.left(), key.right());
            return cached;
        }
        misses.incrementAndGet();
        Box result = compute.get();
        synchronized (entries) {
            entries.putIfAbsent(key, result);
        }
        return result;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
        log.debug("Cache cleared");
    }
}
