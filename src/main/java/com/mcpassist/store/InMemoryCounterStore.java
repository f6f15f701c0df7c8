package com.mcpassist.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local counter store.
 *
 * <p>Writes take the exclusive lock, reads the shared one. A single daemon thread
 * periodically drops buckets that have not been touched for {@code idleTtl} so that
 * churned keys do not accumulate.</p>
 */
public class InMemoryCounterStore implements CounterStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCounterStore.class);

    public static final Duration DEFAULT_EVICTION_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_IDLE_TTL = Duration.ofMinutes(10);

    private final Map<String, Bucket> buckets = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final Duration idleTtl;
    private final ScheduledExecutorService evictor;

    public InMemoryCounterStore() {
        this(Clock.systemUTC(), DEFAULT_EVICTION_INTERVAL, DEFAULT_IDLE_TTL);
    }

    public InMemoryCounterStore(Clock clock, Duration evictionInterval, Duration idleTtl) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(evictionInterval, "evictionInterval");
        this.idleTtl = Objects.requireNonNull(idleTtl, "idleTtl");
        if (evictionInterval.isZero() || evictionInterval.isNegative()) {
            throw new IllegalArgumentException("evictionInterval must be positive: " + evictionInterval);
        }
        if (idleTtl.isNegative()) {
            throw new IllegalArgumentException("idleTtl cannot be negative: " + idleTtl);
        }

        this.evictor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "counter-store-evictor");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = evictionInterval.toMillis();
        this.evictor.scheduleAtFixedRate(this::evictIdleSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public int increment(String key, Duration window) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(window, "window");
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            Bucket bucket = buckets.get(key);
            if (bucket == null) {
                buckets.put(key, new Bucket(now, window));
                return 1;
            }
            return bucket.increment(now, window);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int get(String key) {
        lock.readLock().lock();
        try {
            Bucket bucket = buckets.get(key);
            if (bucket == null || bucket.isExpired(clock.instant())) {
                return 0;
            }
            return bucket.getCount();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void reset(String key) {
        remove(key);
    }

    @Override
    public void delete(String key) {
        remove(key);
    }

    private void remove(String key) {
        lock.writeLock().lock();
        try {
            buckets.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes buckets whose last update is older than the idle TTL.
     *
     * @return number of buckets removed
     */
    public int evictIdle() {
        lock.writeLock().lock();
        try {
            Instant cutoff = clock.instant().minus(idleTtl);
            int removed = 0;
            Iterator<Bucket> it = buckets.values().iterator();
            while (it.hasNext()) {
                if (it.next().getLastUpdate().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void evictIdleSafely() {
        try {
            int removed = evictIdle();
            if (removed > 0) {
                logger.debug("Evicted {} idle rate limit buckets", removed);
            }
        } catch (RuntimeException e) {
            // keep the schedule alive
            logger.warn("Counter store eviction failed", e);
        }
    }

    /**
     * Number of buckets currently held, expired ones included.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return buckets.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isClosed() {
        return evictor.isShutdown();
    }

    @Override
    public void close() {
        evictor.shutdown();
        try {
            evictor.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
