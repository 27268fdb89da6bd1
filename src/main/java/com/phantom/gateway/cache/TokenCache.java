package com.phantom.gateway.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Token Cache
 *
 * <p>Maps a derived credential key ({@link CacheKeys}) to the JWT obtained by
 * introspection. Entries live until the token's expiry minus the configured
 * clock skew; an entry that would already be expired under that margin is
 * never stored.
 *
 * <p>Reads share a read lock, writes take the write lock. Expired entries are
 * dropped lazily on lookup and by a periodic reclamation pass, which also
 * enforces the capacity bound.
 */
public class TokenCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TokenCache.class);

    /** Entries this close to expiry are evicted first when over capacity */
    static final Duration EVICTION_GRACE = Duration.ofMinutes(2);

    private final Map<String, CacheEntry> entries = new HashMap<>(1024);
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Clock clock;
    private final Duration clockSkew;
    private final int maxEntries;

    private ScheduledExecutorService reclaimer;

    /**
     * @param clock      time source
     * @param clockSkew  margin subtracted from every token expiry
     * @param maxEntries capacity bound; zero or negative disables capacity enforcement
     */
    public TokenCache(Clock clock, Duration clockSkew, int maxEntries) {
        this.clock = clock;
        this.clockSkew = clockSkew;
        this.maxEntries = maxEntries;
    }

    /**
     * Look up the JWT for a cache key
     *
     * @return the JWT, or empty if absent or expired
     */
    public Optional<String> get(String key) {
        Instant now = clock.instant();
        CacheEntry entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(now)) {
            removeIfExpired(key, now);
            return Optional.empty();
        }
        return Optional.of(entry.jwt());
    }

    /**
     * Store a JWT until {@code tokenExpiry} minus the clock skew.
     *
     * <p>No-op when that instant is not strictly after now.
     *
     * @return {@code true} if the entry was stored
     */
    public boolean set(String key, String jwt, Instant tokenExpiry) {
        Instant storeUntil = tokenExpiry.minus(clockSkew);
        lock.writeLock().lock();
        try {
            if (!storeUntil.isAfter(clock.instant())) {
                log.debug("Not caching token already expired under skew: key={}", CacheKeys.abbreviate(key));
                return false;
            }
            entries.put(key, new CacheEntry(jwt, storeUntil));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Number of entries currently held, expired ones included
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Run one reclamation pass: sweep expired entries, then enforce capacity.
     */
    public void reclaim() {
        int purged = purgeExpired();
        int evicted = enforceCapacity();
        if (purged > 0 || evicted > 0) {
            log.debug("Token cache reclaimed: purged={}, evicted={}, size={}", purged, evicted, size());
        }
    }

    /**
     * Start the background reclamation task at a fixed rate.
     */
    public synchronized void startReclaimer(Duration interval) {
        if (reclaimer != null) {
            throw new IllegalStateException("Reclaimer already started");
        }
        reclaimer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "token-cache-reclaimer");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = interval.toMillis();
        reclaimer.scheduleAtFixedRate(this::reclaimSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Token cache reclaimer started: interval={}s, maxEntries={}, clockSkew={}s",
            interval.toSeconds(), maxEntries, clockSkew.toSeconds());
    }

    /**
     * Stop the background reclamation task, if running.
     */
    @Override
    public synchronized void close() {
        if (reclaimer != null) {
            reclaimer.shutdownNow();
            reclaimer = null;
            log.info("Token cache reclaimer stopped");
        }
    }

    private void reclaimSafely() {
        try {
            reclaim();
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            log.error("Token cache reclamation failed", e);
        }
    }

    private void removeIfExpired(String key, Instant now) {
        lock.writeLock().lock();
        try {
            CacheEntry current = entries.get(key);
            if (current != null && current.isExpiredAt(now)) {
                entries.remove(key);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int purgeExpired() {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.values().removeIf(entry -> entry.isExpiredAt(now));
            return before - entries.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int enforceCapacity() {
        if (maxEntries <= 0) {
            return 0;
        }
        lock.writeLock().lock();
        try {
            int toDrop = entries.size() - maxEntries;
            if (toDrop <= 0) {
                return 0;
            }
            List<Map.Entry<String, CacheEntry>> candidates = new ArrayList<>(entries.entrySet());
            candidates.sort(Comparator.comparing(candidate -> candidate.getValue().expiresAt()));

            Instant graceLimit = clock.instant().plus(EVICTION_GRACE);
            List<String> victims = new ArrayList<>(toDrop);
            // nearly dead entries first
            for (Map.Entry<String, CacheEntry> candidate : candidates) {
                if (victims.size() >= toDrop) {
                    break;
                }
                if (candidate.getValue().expiresAt().isBefore(graceLimit)) {
                    victims.add(candidate.getKey());
                }
            }
            int nearlyDead = victims.size();
            // then live entries, soonest expiry first
            for (Map.Entry<String, CacheEntry> candidate : candidates.subList(nearlyDead, candidates.size())) {
                if (victims.size() >= toDrop) {
                    break;
                }
                victims.add(candidate.getKey());
            }
            victims.forEach(entries::remove);

            log.warn("Token cache over capacity: evicted {} entries ({} nearly expired), maxEntries={}",
                victims.size(), nearlyDead, maxEntries);
            return victims.size();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
