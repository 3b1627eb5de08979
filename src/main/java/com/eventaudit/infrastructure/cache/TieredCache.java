package com.eventaudit.infrastructure.cache;

import com.eventaudit.domain.exception.AuditException;
import com.eventaudit.domain.exception.BackendUnavailableException;
import com.eventaudit.domain.exception.CacheCorruptException;
import com.eventaudit.domain.exception.CacheWaitTimeoutException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Two-tier result cache in front of the query backend.
 *
 * Lookup order:
 * 1. Memory tier, if fresh: returned without touching disk or the supplier
 * 2. Persisted tier, if fresh: promoted into memory and returned
 * 3. Supplier: result written through both tiers
 *
 * Loads are single-flight per key. The first caller on a miss registers an
 * in-flight future and runs the load on the loader executor; later callers
 * for the same key wait on that future. Callers for other keys never touch
 * it. A waiter may time out without cancelling the load.
 *
 * Persisted tier problems (unreadable, corrupt, unwritable) degrade the
 * operation to memory-only. Supplier failures propagate and nothing is
 * cached.
 */
@Slf4j
public class TieredCache {

    private final ConcurrentHashMap<CacheKey, CacheEntry> memory = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CacheKey, CompletableFuture<CacheLookup<Object>>> inFlight = new ConcurrentHashMap<>();

    private final PersistedCacheTier persisted;
    private final Executor loaderExecutor;
    private final Clock clock;
    private final Duration defaultWaitTimeout;

    // bumped by clear(); loads started before a clear do not commit
    private final AtomicLong generation = new AtomicLong();

    // commits hold the read side, clear() the write side
    private final ReadWriteLock commitLock = new ReentrantReadWriteLock();

    private final AtomicLong memoryHits = new AtomicLong();
    private final AtomicLong persistedHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong supplierInvocations = new AtomicLong();
    private final AtomicLong corruptArtifacts = new AtomicLong();

    private final Counter memoryHitCounter;
    private final Counter persistedHitCounter;
    private final Counter missCounter;
    private final Counter supplierCounter;
    private final Counter corruptCounter;

    public TieredCache(PersistedCacheTier persisted,
                       Executor loaderExecutor,
                       Clock clock,
                       Duration defaultWaitTimeout,
                       MeterRegistry meterRegistry) {
        this.persisted = persisted;
        this.loaderExecutor = loaderExecutor;
        this.clock = clock;
        this.defaultWaitTimeout = defaultWaitTimeout;

        this.memoryHitCounter = Counter.builder("audit.cache")
                .tag("tier", "memory").tag("result", "hit")
                .register(meterRegistry);
        this.persistedHitCounter = Counter.builder("audit.cache")
                .tag("tier", "persisted").tag("result", "hit")
                .register(meterRegistry);
        this.missCounter = Counter.builder("audit.cache")
                .tag("tier", "all").tag("result", "miss")
                .register(meterRegistry);
        this.supplierCounter = Counter.builder("audit.cache.supplier")
                .register(meterRegistry);
        this.corruptCounter = Counter.builder("audit.cache")
                .tag("tier", "persisted").tag("result", "corrupt")
                .register(meterRegistry);
    }

    /**
     * Return the cached value for {@code key}, computing it with {@code supplier} on a miss.
     */
    public <T> T getOrCompute(CacheKey key, Duration ttl, Class<T> type, Callable<T> supplier) {
        return lookup(key, ttl, type, supplier, defaultWaitTimeout).getValue();
    }

    public <T> CacheLookup<T> lookup(CacheKey key, Duration ttl, Class<T> type, Callable<T> supplier) {
        return lookup(key, ttl, type, supplier, defaultWaitTimeout);
    }

    /**
     * Same as {@link #getOrCompute} but reports provenance and bounds the wait.
     *
     * @throws BackendUnavailableException if the supplier failed
     * @throws CacheWaitTimeoutException if the wait exceeded {@code waitTimeout}
     */
    public <T> CacheLookup<T> lookup(CacheKey key, Duration ttl, Class<T> type,
                                     Callable<T> supplier, Duration waitTimeout) {
        validate(key, ttl, type, supplier);

        CacheEntry cached = memory.get(key);
        if (cached != null && cached.isFresh(clock.instant(), ttl)) {
            recordMemoryHit(key);
            return new CacheLookup<>(type.cast(cached.getValue()), CacheSource.MEMORY, cached.getCreatedAt());
        }

        CompletableFuture<CacheLookup<Object>> created = new CompletableFuture<>();
        CompletableFuture<CacheLookup<Object>> existing = inFlight.putIfAbsent(key, created);
        CompletableFuture<CacheLookup<Object>> pending;
        if (existing == null) {
            pending = created;
            startLoad(key, ttl, type, supplier, created);
        } else {
            log.debug("Joining in-flight load for key: {}", key);
            pending = existing;
        }

        CacheLookup<Object> result = await(key, pending, waitTimeout);
        return new CacheLookup<>(type.cast(result.getValue()), result.getSource(), result.getCreatedAt());
    }

    /**
     * Remove every entry from both tiers.
     *
     * @return number of entries removed across both tiers
     */
    public int clear() {
        int memoryRemoved = 0;
        int persistedRemoved;
        commitLock.writeLock().lock();
        try {
            generation.incrementAndGet();
            inFlight.clear();

            for (CacheKey key : memory.keySet()) {
                if (memory.remove(key) != null) {
                    memoryRemoved++;
                }
            }
            persistedRemoved = persisted.clear();
        } finally {
            commitLock.writeLock().unlock();
        }

        log.info("Cache cleared: {} memory entries, {} persisted artifacts", memoryRemoved, persistedRemoved);
        return memoryRemoved + persistedRemoved;
    }

    public CacheStats stats() {
        return CacheStats.builder()
                .memoryEntries(memory.size())
                .persistedEntries(persisted.size())
                .memoryHits(memoryHits.get())
                .persistedHits(persistedHits.get())
                .misses(misses.get())
                .supplierInvocations(supplierInvocations.get())
                .corruptArtifacts(corruptArtifacts.get())
                .build();
    }

    private <T> void startLoad(CacheKey key, Duration ttl, Class<T> type, Callable<T> supplier,
                               CompletableFuture<CacheLookup<Object>> future) {
        long startedIn = generation.get();
        try {
            loaderExecutor.execute(() -> load(key, ttl, type, supplier, future, startedIn));
        } catch (RuntimeException e) {
            inFlight.remove(key, future);
            future.completeExceptionally(new AuditException("Could not schedule cache load for " + key, e));
        }
    }

    private <T> void load(CacheKey key, Duration ttl, Class<T> type, Callable<T> supplier,
                          CompletableFuture<CacheLookup<Object>> future, long startedIn) {
        try {
            future.complete(resolve(key, ttl, type, supplier, startedIn));
        } catch (AuditException e) {
            future.completeExceptionally(e);
        } catch (Exception e) {
            future.completeExceptionally(new BackendUnavailableException(
                    "Query for " + key.getQueryClass() + " failed: " + e.getMessage(), e));
        } catch (Throwable t) {
            future.completeExceptionally(t);
        } finally {
            inFlight.remove(key, future);
        }
    }

    private <T> CacheLookup<Object> resolve(CacheKey key, Duration ttl, Class<T> type,
                                            Callable<T> supplier, long startedIn) throws Exception {
        // a load for this key may have committed between the memory check and registration
        CacheEntry cached = memory.get(key);
        if (cached != null && cached.isFresh(clock.instant(), ttl)) {
            recordMemoryHit(key);
            return new CacheLookup<>(cached.getValue(), CacheSource.MEMORY, cached.getCreatedAt());
        }

        Optional<CacheEntry> stored = readPersisted(key, type);
        if (stored.isPresent() && stored.get().isFresh(clock.instant(), ttl)) {
            persistedHits.incrementAndGet();
            persistedHitCounter.increment();
            log.debug("Persisted cache hit for key: {}", key);
            CacheEntry promoted = commitIfCurrent(stored.get().inTier(CacheTier.MEMORY), startedIn, false);
            return new CacheLookup<>(promoted.getValue(), CacheSource.PERSISTED, promoted.getCreatedAt());
        }

        misses.incrementAndGet();
        missCounter.increment();
        supplierInvocations.incrementAndGet();
        supplierCounter.increment();
        log.info("Cache miss for key: {}, querying backend", key);

        T value = supplier.call();
        CacheEntry entry = commitIfCurrent(
                new CacheEntry(key, value, clock.instant(), ttl, CacheTier.MEMORY), startedIn, true);
        return new CacheLookup<>(entry.getValue(), CacheSource.QUERY, entry.getCreatedAt());
    }

    /**
     * Store the entry unless clear() ran since the load started. The
     * generation check and the writes happen under the read lock, so a
     * clear() either precedes the check or removes what was written.
     */
    private CacheEntry commitIfCurrent(CacheEntry entry, long startedIn, boolean writeThrough) {
        commitLock.readLock().lock();
        try {
            if (generation.get() != startedIn) {
                log.debug("Cache cleared during load of {}, result not stored", entry.getKey());
                return entry;
            }
            CacheEntry committed = commitToMemory(entry);
            if (writeThrough) {
                writePersisted(committed);
            }
            return committed;
        } finally {
            commitLock.readLock().unlock();
        }
    }

    // keeps the newer entry so readers never see created_at go backwards
    private CacheEntry commitToMemory(CacheEntry entry) {
        return memory.merge(entry.getKey(), entry,
                (current, candidate) -> candidate.getCreatedAt().isBefore(current.getCreatedAt()) ? current : candidate);
    }

    private <T> Optional<CacheEntry> readPersisted(CacheKey key, Class<T> type) {
        try {
            return persisted.read(key, type);
        } catch (CacheCorruptException e) {
            corruptArtifacts.incrementAndGet();
            corruptCounter.increment();
            log.warn("Treating persisted entry for {} as a miss: {}", key, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Persisted tier unreadable for {}, continuing memory-only: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writePersisted(CacheEntry entry) {
        try {
            persisted.write(entry.inTier(CacheTier.PERSISTED));
        } catch (Exception e) {
            log.warn("Persisted tier unwritable for {}, continuing memory-only: {}", entry.getKey(), e.getMessage());
        }
    }

    private CacheLookup<Object> await(CacheKey key, CompletableFuture<CacheLookup<Object>> pending, Duration waitTimeout) {
        try {
            if (waitTimeout == null) {
                return pending.get();
            }
            return pending.get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new CacheWaitTimeoutException(
                    "Gave up waiting " + waitTimeout + " for in-flight load of " + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheWaitTimeoutException("Interrupted while waiting for load of " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new BackendUnavailableException("Load failed for " + key, cause);
        }
    }

    private void recordMemoryHit(CacheKey key) {
        memoryHits.incrementAndGet();
        memoryHitCounter.increment();
        log.debug("Memory cache hit for key: {}", key);
    }

    private static void validate(CacheKey key, Duration ttl, Class<?> type, Callable<?> supplier) {
        if (key == null) {
            throw new IllegalArgumentException("Cache key is required");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got " + ttl);
        }
        if (type == null || supplier == null) {
            throw new IllegalArgumentException("Payload type and supplier are required");
        }
    }
}
