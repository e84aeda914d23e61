package fr.lapetina.thesis.client.pool;

import fr.lapetina.thesis.client.domain.exception.ConfigurationException;
import fr.lapetina.thesis.client.domain.model.BackendKind;
import fr.lapetina.thesis.client.infrastructure.config.ClientConfig;
import fr.lapetina.thesis.client.infrastructure.config.ClientEnvironment;
import fr.lapetina.thesis.client.infrastructure.http.BackendFactory;
import fr.lapetina.thesis.client.infrastructure.http.BackendHandle;
import fr.lapetina.thesis.client.infrastructure.metrics.ClientMetrics;
import fr.lapetina.thesis.client.session.Session;
import fr.lapetina.thesis.client.session.SessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of backend handles plus the registry of active sessions.
 *
 * Exactly {@code maxConnections} handles are created at initialization. When they are all
 * lent out, {@link #getSession} creates a temporary handle instead of blocking; temporary
 * handles are closed when their session is released.
 *
 * Thread safety: the active session map is guarded by a single lock, never held across
 * handle creation or backend calls.
 */
public final class ConnectionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final ClientConfig config;
    private final ClientEnvironment environment;
    private final BackendFactory backendFactory;
    private final BackendDetector detector;
    private final SessionFactory sessionFactory;
    private final ClientMetrics metrics;
    private final Clock clock;

    private final int maxConnections;
    private final Duration maxIdle;
    private final Duration sweepInterval;

    private final BlockingQueue<BackendHandle> availableHandles;
    private final Map<String, Lease> activeSessions = new LinkedHashMap<>();
    private final ReentrantLock sessionLock = new ReentrantLock();

    private final AtomicLong sessionCounter = new AtomicLong();
    private final AtomicLong sessionsCreated = new AtomicLong();
    private final AtomicLong overflowHandles = new AtomicLong();
    private final AtomicLong sessionsExpired = new AtomicLong();

    private volatile BackendKind backendKind;
    private volatile boolean initialized;
    private ScheduledExecutorService sweeper;

    public ConnectionPool(
            ClientConfig config,
            ClientEnvironment environment,
            BackendFactory backendFactory,
            BackendDetector detector,
            SessionFactory sessionFactory,
            ClientMetrics metrics,
            Clock clock
    ) {
        this.config = config;
        this.environment = environment;
        this.backendFactory = backendFactory;
        this.detector = detector;
        this.sessionFactory = sessionFactory;
        this.metrics = metrics;
        this.clock = clock;
        this.maxConnections = config.getPool().getMaxConnections();
        this.maxIdle = Duration.ofSeconds(config.getSession().getMaxIdleSeconds());
        this.sweepInterval = Duration.ofMillis(config.getSession().getSweepIntervalMs());
        this.availableHandles = new ArrayBlockingQueue<>(Math.max(1, maxConnections));
    }

    public ConnectionPool(ClientConfig config, ClientEnvironment environment,
                          BackendFactory backendFactory, ClientMetrics metrics) {
        this(config, environment, backendFactory, new BackendDetector(),
                new SessionFactory(config, metrics), metrics, Clock.systemUTC());
    }

    /**
     * Detects the backend, fills the pool and starts the expiry sweep. Idempotent.
     *
     * @throws ConfigurationException when no backend can be detected or a handle cannot be created;
     *                                the pool then stays uninitialized
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        BackendKind kind = detector.detect(config, environment);

        List<BackendHandle> created = new ArrayList<>(maxConnections);
        try {
            for (int i = 0; i < maxConnections; i++) {
                created.add(backendFactory.create(kind));
            }
        } catch (RuntimeException e) {
            created.forEach(ConnectionPool::closeQuietly);
            log.error("Pool initialization failed: kind={}, created={}/{}, error={}",
                    kind, created.size(), maxConnections, e.getMessage());
            if (e instanceof ConfigurationException) {
                throw e;
            }
            throw new ConfigurationException("Failed to create backend handle: " + e.getMessage(), e);
        }

        availableHandles.addAll(created);
        this.backendKind = kind;

        metrics.registerActiveSessions(this::activeSessionCount);
        metrics.registerAvailableHandles(availableHandles::size);

        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleWithFixedDelay(
                this::sweepSafely,
                sweepInterval.toMillis(),
                sweepInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );

        initialized = true;
        log.info("Connection pool initialized: kind={}, maxConnections={}, maxIdle={}, sweepInterval={}",
                kind, maxConnections, maxIdle, sweepInterval);
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Returns a new session with a generated id.
     */
    public Session getSession() {
        return getSession(null);
    }

    /**
     * Returns the live session registered under {@code sessionId}, or registers a new one.
     * An expired session under that id is evicted first.
     *
     * @param sessionId requested id, or null to generate one
     */
    public Session getSession(String sessionId) {
        if (!initialized) {
            initialize();
        }

        Lease expired = null;
        String id = sessionId;
        sessionLock.lock();
        try {
            if (id != null) {
                Lease existing = activeSessions.get(id);
                if (existing != null) {
                    if (!existing.session().isExpired(maxIdle)) {
                        return existing.session();
                    }
                    activeSessions.remove(id);
                    expired = existing;
                }
            } else {
                id = nextSessionId();
            }
        } finally {
            sessionLock.unlock();
        }

        if (expired != null) {
            sessionsExpired.incrementAndGet();
            metrics.incrementExpiredSessions();
            log.debug("Evicted expired session on access: sessionId={}", id);
            returnHandle(id, expired.handle());
        }

        PooledHandle handle = borrowHandle();
        Session session;
        try {
            session = sessionFactory.create(id, handle.handle());
        } catch (RuntimeException e) {
            returnHandle(id, handle);
            throw e;
        }

        Lease raced;
        sessionLock.lock();
        try {
            raced = activeSessions.putIfAbsent(id, new Lease(session, handle));
        } finally {
            sessionLock.unlock();
        }
        if (raced != null) {
            // Another caller registered the same id while the handle was being prepared
            returnHandle(id, handle);
            return raced.session();
        }

        sessionsCreated.incrementAndGet();
        log.debug("Session created: sessionId={}, handle={}, temporary={}",
                id, handle.handle().getId(), handle.temporary());
        return session;
    }

    /**
     * Unregisters the session and gives its handle back. Unknown ids are ignored.
     */
    public void releaseSession(String sessionId) {
        if (sessionId == null) {
            return;
        }
        Lease lease;
        sessionLock.lock();
        try {
            lease = activeSessions.remove(sessionId);
        } finally {
            sessionLock.unlock();
        }
        if (lease != null) {
            returnHandle(sessionId, lease.handle());
        }
    }

    /**
     * Evicts every session idle for longer than the configured maximum.
     *
     * @return number of evicted sessions
     */
    public int sweepExpiredSessions() {
        Map<String, Lease> expired = new LinkedHashMap<>();
        sessionLock.lock();
        try {
            var iterator = activeSessions.entrySet().iterator();
            while (iterator.hasNext()) {
                var entry = iterator.next();
                if (entry.getValue().session().isExpired(maxIdle)) {
                    expired.put(entry.getKey(), entry.getValue());
                    iterator.remove();
                }
            }
        } finally {
            sessionLock.unlock();
        }

        expired.forEach((id, lease) -> {
            returnHandle(id, lease.handle());
            sessionsExpired.incrementAndGet();
            metrics.incrementExpiredSessions();
            log.info("Cleaned up expired session: sessionId={}", id);
        });
        return expired.size();
    }

    private void sweepSafely() {
        try {
            sweepExpiredSessions();
        } catch (Exception e) {
            log.error("Session sweep failed: error={}", e.getMessage(), e);
        }
    }

    private PooledHandle borrowHandle() {
        BackendHandle pooled = availableHandles.poll();
        if (pooled != null) {
            return new PooledHandle(pooled, false);
        }
        BackendHandle temporary = backendFactory.create(backendKind);
        overflowHandles.incrementAndGet();
        metrics.incrementOverflowHandles();
        log.warn("Pool exhausted, created temporary handle: handle={}, maxConnections={}",
                temporary.getId(), maxConnections);
        return new PooledHandle(temporary, true);
    }

    private void returnHandle(String sessionId, PooledHandle handle) {
        if (handle.temporary()) {
            closeQuietly(handle.handle());
            log.debug("Released session, temporary handle discarded: sessionId={}", sessionId);
            return;
        }
        if (!initialized || !availableHandles.offer(handle.handle())) {
            closeQuietly(handle.handle());
            log.debug("Released session, handle closed: sessionId={}", sessionId);
            return;
        }
        log.debug("Released session, handle returned to pool: sessionId={}", sessionId);
    }

    private String nextSessionId() {
        return "session_" + sessionCounter.incrementAndGet() + "_" + clock.instant().getEpochSecond();
    }

    private int activeSessionCount() {
        sessionLock.lock();
        try {
            return activeSessions.size();
        } finally {
            sessionLock.unlock();
        }
    }

    public List<String> getActiveSessionIds() {
        sessionLock.lock();
        try {
            return List.copyOf(activeSessions.keySet());
        } finally {
            sessionLock.unlock();
        }
    }

    /**
     * Detected backend, or null before initialization.
     */
    public BackendKind getBackendKind() {
        return backendKind;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public PoolStats getStats() {
        return new PoolStats(
                backendKind,
                maxConnections,
                availableHandles.size(),
                activeSessionCount(),
                sessionsCreated.get(),
                overflowHandles.get(),
                sessionsExpired.get()
        );
    }

    /**
     * Stops the sweep, forgets every session and closes all handles.
     */
    public synchronized void shutdown() {
        if (!initialized) {
            return;
        }
        initialized = false;

        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(config.getPool().getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }

        List<Lease> leases;
        sessionLock.lock();
        try {
            leases = new ArrayList<>(activeSessions.values());
            activeSessions.clear();
        } finally {
            sessionLock.unlock();
        }
        leases.forEach(lease -> closeQuietly(lease.handle().handle()));

        List<BackendHandle> drained = new ArrayList<>();
        availableHandles.drainTo(drained);
        drained.forEach(ConnectionPool::closeQuietly);

        log.info("Connection pool shut down: closedSessions={}, closedHandles={}",
                leases.size(), drained.size());
    }

    @Override
    public void close() {
        shutdown();
    }

    private static void closeQuietly(BackendHandle handle) {
        try {
            handle.close();
        } catch (Exception e) {
            log.warn("Failed to close backend handle: handle={}, error={}", handle.getId(), e.getMessage());
        }
    }

    private record Lease(Session session, PooledHandle handle) {
    }
}
