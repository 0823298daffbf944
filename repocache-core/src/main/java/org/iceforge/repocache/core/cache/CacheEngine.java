package org.iceforge.repocache.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.repocache.core.model.RankEntry;
import org.iceforge.repocache.core.model.RankedList;
import org.iceforge.repocache.core.model.RepoMetrics;
import org.iceforge.repocache.core.model.Snapshot;
import org.iceforge.repocache.core.model.ViewKind;
import org.iceforge.repocache.core.upstream.UpstreamClient;
import org.iceforge.repocache.core.upstream.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the current {@link Snapshot} of the organization, its members, its repositories and
 * the ranked views over them, and keeps it fresh from an {@link UpstreamClient}.
 * <p>
 * Reads never touch the network; they take the shared side of a read/write lock and return
 * whatever the last successful hydration installed. A hydration either installs a complete
 * new snapshot under the write lock or leaves the previous one untouched.
 * <p>
 * The sync loop runs on a single daemon thread: up to {@link CacheSettings#startupAttempts()}
 * startup hydrations separated by a cancellable pause, then one hydration every
 * {@link CacheSettings#ttl()} until {@link #close()}.
 */
public final class CacheEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CacheEngine.class);

    /** Recorded when hydration fails with something other than an {@link UpstreamException}. */
    static final int UNEXPECTED_FAILURE_STATUS = 500;

    private final UpstreamClient upstream;
    private final CacheSettings settings;
    private final Clock clock;
    private final RepoMetricsExtractor extractor;

    private final ReentrantReadWriteLock snapshotLock = new ReentrantReadWriteLock();
    private Snapshot snapshot; // guarded by snapshotLock

    // serializes hydrations so an older fetch never overwrites a newer snapshot
    private final ReentrantLock hydrationLock = new ReentrantLock();

    private final AtomicReference<SyncState> state = new AtomicReference<>(SyncState.NEW);
    private volatile SyncStatus lastSyncStatus = SyncStatus.notYetSynced();

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final ScheduledExecutorService scheduler;

    public CacheEngine(UpstreamClient upstream, CacheSettings settings, Clock clock) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.extractor = new RepoMetricsExtractor(settings.organization());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "repocache-sync");
            t.setDaemon(true);
            return t;
        });
    }

    // ------------------------------------------------------------------
    // Sync loop
    // ------------------------------------------------------------------

    /**
     * Starts the background loop and returns immediately. Startup retries happen on the
     * loop's own thread, so callers can serve (and force hydrations) while it is retrying.
     *
     * @throws IllegalStateException if the loop was already started or the engine is closed
     */
    public void startSyncLoop() {
        if (!state.compareAndSet(SyncState.NEW, SyncState.STARTING)) {
            throw new IllegalStateException("Sync loop cannot start from state " + state.get());
        }
        try {
            scheduler.execute(this::runStartup);
        } catch (RejectedExecutionException e) {
            state.set(SyncState.STOPPED);
            throw new IllegalStateException("Sync loop executor is shut down", e);
        }
    }

    private void runStartup() {
        int attempts = settings.startupAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            logger.info("Hydrating cache for startup, attempt {} of {}", attempt, attempts);
            if (tryHydrate()) {
                logger.info("Successfully hydrated cache on startup attempt {}", attempt);
                break;
            }
            if (attempt == attempts) {
                logger.warn("All {} startup hydration attempts failed (last status {}); starting degraded",
                        attempts, lastSyncStatus.statusCode());
                break;
            }
            logger.warn("Startup hydration attempt {} failed with status {}, backing off for {}",
                    attempt, lastSyncStatus.statusCode(), settings.startupRetryDelay());
            if (awaitStop(settings.startupRetryDelay())) {
                return;
            }
        }

        if (!state.compareAndSet(SyncState.STARTING, SyncState.RUNNING)) {
            return;
        }
        long ttlMs = settings.ttl().toMillis();
        try {
            scheduler.scheduleAtFixedRate(this::scheduledHydrate, ttlMs, ttlMs, TimeUnit.MILLISECONDS);
            logger.info("Cache sync loop running, re-hydrating every {}", settings.ttl());
        } catch (RejectedExecutionException e) {
            logger.debug("Sync loop closed before periodic hydration could be scheduled");
        }
    }

    private void scheduledHydrate() {
        if (stopSignal.getCount() == 0) return;
        logger.info("Attempting to re-hydrate cache");
        if (tryHydrate()) {
            logger.info("Successfully re-hydrated cache");
        } else {
            logger.error("Failed to re-hydrate cache, status {}: {}",
                    lastSyncStatus.statusCode(), lastSyncStatus.error());
        }
    }

    /** One hydration for the loop; never throws, so the periodic schedule is never cancelled. */
    private boolean tryHydrate() {
        try {
            hydrateNow();
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    /** @return true if the stop signal fired during the wait */
    private boolean awaitStop(Duration delay) {
        try {
            return stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * Stops the loop: interrupts a pending startup pause, cancels the periodic timer and waits
     * up to {@link CacheSettings#shutdownTimeout()} for an in-flight hydration to finish.
     * In-flight upstream calls are not cancelled; they are bounded by the client's request timeout.
     */
    @Override
    public void close() {
        SyncState previous = state.getAndSet(SyncState.STOPPED);
        if (previous == SyncState.STOPPED) return;

        stopSignal.countDown();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Hydration still running after {}, abandoning it", settings.shutdownTimeout());
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        logger.info("Cache sync loop stopped");
    }

    // ------------------------------------------------------------------
    // Hydration
    // ------------------------------------------------------------------

    /**
     * One synchronous hydration: fetch members, repositories and the organization (in that
     * order), rank the repositories and install the result atomically.
     * Used by the sync loop, and by the serving layer when a read finds the cache empty.
     *
     * @return the success status that was recorded
     * @throws UpstreamException from the first failing step; the previous snapshot stays in place
     */
    public SyncStatus hydrateNow() {
        hydrationLock.lock();
        try {
            Snapshot next = fetchAndBuild();
            install(next);
            SyncStatus ok = SyncStatus.success(next.hydratedAt());
            lastSyncStatus = ok;
            return ok;
        } catch (UpstreamException e) {
            lastSyncStatus = SyncStatus.failure(e.statusCode(), e.getMessage(), clock.instant());
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected hydration failure", e);
            lastSyncStatus = SyncStatus.failure(UNEXPECTED_FAILURE_STATUS, e.toString(), clock.instant());
            throw e;
        } finally {
            hydrationLock.unlock();
        }
    }

    /**
     * Hydrates only if no snapshot is installed yet. Callers that queue up behind a running
     * hydration return as soon as it has installed a snapshot instead of fetching again.
     *
     * @return the snapshot now installed
     * @throws UpstreamException if the cache was empty and the hydration failed
     */
    public Snapshot hydrateIfEmpty() {
        Optional<Snapshot> current = snapshot();
        if (current.isPresent()) return current.get();

        hydrationLock.lock();
        try {
            current = snapshot();
            if (current.isPresent()) return current.get();
            hydrateNow();
            return snapshot().orElseThrow(() -> new IllegalStateException("No snapshot after hydration"));
        } finally {
            hydrationLock.unlock();
        }
    }

    private Snapshot fetchAndBuild() {
        List<JsonNode> members = upstream.fetchMembers();
        List<JsonNode> repos = upstream.fetchRepos();
        JsonNode organization = upstream.fetchOrganization();

        List<RepoMetrics> metrics = extractor.extractAll(repos);
        return new Snapshot(organization, members, repos, RankedViews.build(metrics), clock.instant());
    }

    private void install(Snapshot next) {
        snapshotLock.writeLock().lock();
        try {
            snapshot = next;
        } finally {
            snapshotLock.writeLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public Optional<Snapshot> snapshot() {
        snapshotLock.readLock().lock();
        try {
            return Optional.ofNullable(snapshot);
        } finally {
            snapshotLock.readLock().unlock();
        }
    }

    public boolean isHydrated() {
        return snapshot().isPresent();
    }

    public Optional<JsonNode> getOrganization() {
        return snapshot().map(Snapshot::organization);
    }

    public Optional<List<JsonNode>> getMembers() {
        return snapshot().map(Snapshot::members);
    }

    public Optional<List<JsonNode>> getRepos() {
        return snapshot().map(Snapshot::repos);
    }

    public Optional<RankedList> getView(ViewKind kind) {
        Objects.requireNonNull(kind, "kind");
        return snapshot().map(s -> s.view(kind));
    }

    /**
     * The {@code n} lowest-ranked entries of a view, ascending. {@code n} beyond the view's
     * length is clamped.
     *
     * @throws IllegalArgumentException if {@code n} is not positive
     */
    public Optional<List<RankEntry>> getBottomN(ViewKind kind, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be a positive integer, got " + n);
        }
        return getView(kind).map(view -> view.bottom(n));
    }

    public Map<ViewKind, RankedList> getViews() {
        return snapshot().map(Snapshot::views).orElse(Map.of());
    }

    public SyncStatus lastSyncStatus() {
        return lastSyncStatus;
    }

    public SyncState state() {
        return state.get();
    }

    public CacheSettings settings() {
        return settings;
    }
}
