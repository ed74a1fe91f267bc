package fr.imt.pbdeployer.infrastructure.ssh;

import fr.imt.pbdeployer.business.model.CommandResult;
import fr.imt.pbdeployer.configuration.PbDeployerProperties;
import fr.imt.pbdeployer.exception.ConnectionException;
import fr.imt.pbdeployer.exception.LockedIdentityException;
import fr.imt.pbdeployer.exception.PbDeployerException;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keyed pool of authenticated SSH sessions.
 * <p>
 * Each {@link ConnectionKey} owns a slot holding at most one connection and a fair single-permit guard.
 * Every use of the connection and every change to the slot happens while holding that guard, so a
 * session is never shared and a key's state is never mutated concurrently. Different keys do not
 * contend with each other. A global semaphore bounds the number of open sessions.
 */
@Slf4j
@Component
public class SshConnectionPool {

    private static final String HEALTH_PROBE = "true";

    private final SessionFactory sessionFactory;
    private final PbDeployerProperties.Pool settings;
    private final RetryTemplate retryTemplate;
    private final Clock clock;

    private final Map<ConnectionKey, KeySlot> slots = new ConcurrentHashMap<>();
    private final Semaphore capacity;
    private final AtomicBoolean shutdown = new AtomicBoolean();
    private ScheduledExecutorService healthScheduler;

    public SshConnectionPool(SessionFactory sessionFactory,
                             PbDeployerProperties properties,
                             RetryTemplate sshRetryTemplate,
                             Clock clock) {
        this.sessionFactory = sessionFactory;
        this.settings = properties.getPool();
        this.retryTemplate = sshRetryTemplate;
        this.clock = clock;
        this.capacity = new Semaphore(settings.getMaxConnections(), true);
    }

    @PostConstruct
    public void startHealthTimer() {
        long period = settings.getHealthInterval().toMillis();
        healthScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ssh-pool-health");
            thread.setDaemon(true);
            return thread;
        });
        healthScheduler.scheduleWithFixedDelay(this::scheduledHealthCheck, period, period, TimeUnit.MILLISECONDS);
        log.info("[SSH-POOL] Health checks every {}s, max {} connections",
                settings.getHealthInterval().toSeconds(), settings.getMaxConnections());
    }

    /**
     * Leases a connection for the given identity, opening one when the key has none usable.
     *
     * @throws LockedIdentityException when asking for the privileged identity of a locked server
     * @throws ConnectionException     when the pool is shut down, exhausted, or the host is unreachable
     */
    public ConnectionHandle acquire(ServerTarget target, boolean asPrivileged) {
        ensureOpen();
        if (asPrivileged && target.isSecurityLocked()) {
            throw new LockedIdentityException(target.getPrivilegedUsername(), target.getHost());
        }

        ConnectionKey key = ConnectionKey.of(target, asPrivileged);
        KeySlot slot = lockCurrentSlot(key);
        try {
            ensureOpen();
            PooledConnection connection = slot.connection;
            if (connection != null && !connection.isReusable(clock.instant(), settings.getMaxAge(),
                    settings.getUnhealthyThreshold())) {
                log.info("[SSH-POOL] Dropping stale connection {}", key);
                discard(slot);
                connection = null;
            }
            if (connection == null) {
                connection = openConnection(key, target);
                slot.connection = connection;
            }
            connection.checkout(clock.instant());
            return new ConnectionHandle(this, connection);
        } catch (RuntimeException e) {
            slot.guard.release();
            throw e;
        }
    }

    /**
     * Returns a leased connection. Releasing the same handle twice has no effect.
     */
    public void release(ConnectionHandle handle) {
        if (!handle.markReleased()) {
            return;
        }
        KeySlot slot = slots.get(handle.key());
        PooledConnection connection = handle.connection();
        try {
            if (handle.isBroken() || shutdown.get()) {
                if (handle.isBroken()) {
                    log.warn("[SSH-POOL] Condemning connection {} after a transport failure", handle.key());
                }
                if (slot.connection == connection) {
                    discard(slot);
                }
            } else {
                connection.checkin(clock.instant());
            }
        } finally {
            slot.guard.release();
        }
    }

    /**
     * Probes every idle connection and evicts the ones that are too old, idle for too long,
     * or that failed the configured number of consecutive probes. Connections in use are skipped.
     */
    public PoolHealthReport healthCheck() {
        Instant checkedAt = clock.instant();
        List<ConnectionStatus> statuses = new ArrayList<>();
        int evicted = 0;

        for (Map.Entry<ConnectionKey, KeySlot> entry : slots.entrySet()) {
            KeySlot slot = entry.getValue();
            if (!slot.guard.tryAcquire()) {
                PooledConnection busy = slot.connection;
                if (busy != null) {
                    statuses.add(busy.describe());
                }
                continue;
            }
            try {
                PooledConnection connection = slot.connection;
                if (connection == null) {
                    slots.remove(entry.getKey(), slot);
                    continue;
                }
                String reason = evictionReason(connection);
                if (reason != null) {
                    log.info("[SSH-POOL] Evicting {}: {}", entry.getKey(), reason);
                    discard(slot);
                    slots.remove(entry.getKey(), slot);
                    evicted++;
                }
                statuses.add(connection.describe());
            } finally {
                slot.guard.release();
            }
        }
        return new PoolHealthReport(checkedAt, statuses, evicted);
    }

    /**
     * Closes the pooled connection of one identity, if idle. Used when an identity stops being valid.
     */
    public void evict(ServerTarget target, boolean asPrivileged) {
        ConnectionKey key = ConnectionKey.of(target, asPrivileged);
        KeySlot slot = slots.get(key);
        if (slot == null) {
            return;
        }
        lockSlot(slot, key);
        try {
            if (slot.connection != null) {
                log.info("[SSH-POOL] Evicting {} on request", key);
                discard(slot);
            }
        } finally {
            slot.guard.release();
        }
    }

    public PoolHealthReport snapshot() {
        List<ConnectionStatus> statuses = new ArrayList<>();
        slots.values().forEach(slot -> {
            PooledConnection connection = slot.connection;
            if (connection != null) {
                statuses.add(connection.describe());
            }
        });
        return new PoolHealthReport(clock.instant(), statuses, 0);
    }

    /**
     * Closes idle connections, stops the health timer and rejects further acquisitions.
     * Connections still leased are closed when released.
     */
    @PreDestroy
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        if (healthScheduler != null) {
            healthScheduler.shutdownNow();
        }
        int closed = 0;
        for (KeySlot slot : slots.values()) {
            if (slot.guard.tryAcquire()) {
                try {
                    if (slot.connection != null) {
                        discard(slot);
                        closed++;
                    }
                } finally {
                    slot.guard.release();
                }
            }
        }
        log.info("[SSH-POOL] Shut down, closed {} idle connections", closed);
    }

    private void scheduledHealthCheck() {
        try {
            PoolHealthReport report = healthCheck();
            log.debug("[SSH-POOL] Health check: {} connections, {} evicted", report.total(), report.evicted());
        } catch (RuntimeException e) {
            log.error("[SSH-POOL] Health check run failed", e);
        }
    }

    private String evictionReason(PooledConnection connection) {
        Instant now = clock.instant();
        if (connection.isExpired(now, settings.getMaxAge())) {
            return "age ceiling reached";
        }
        if (connection.isIdleFor(now, settings.getMaxIdleTime())) {
            return "idle timeout";
        }
        connection.recordHealthCheck(probe(connection));
        if (connection.getConsecutiveFailures() >= settings.getUnhealthyThreshold()) {
            return connection.getConsecutiveFailures() + " consecutive failed health checks";
        }
        return null;
    }

    private boolean probe(PooledConnection connection) {
        RemoteSession session = connection.getSession();
        if (!session.isConnected()) {
            return false;
        }
        try {
            CommandResult result = session.exec(HEALTH_PROBE, settings.getHealthCheckTimeout());
            return result.isSuccess();
        } catch (PbDeployerException e) {
            log.debug("[SSH-POOL] Health probe failed on {}: {}", connection.getKey(), e.getMessage());
            return false;
        }
    }

    private PooledConnection openConnection(ConnectionKey key, ServerTarget target) {
        reserveCapacity(key);
        try {
            RemoteSession session = retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("[SSH-POOL] Connecting to {} (attempt {})", key, context.getRetryCount() + 1);
                }
                return sessionFactory.open(target, key.username());
            });
            log.info("[SSH-POOL] Opened connection {}", key);
            return new PooledConnection(key, session, clock.instant());
        } catch (RuntimeException e) {
            capacity.release();
            throw e;
        }
    }

    private void reserveCapacity(ConnectionKey requester) {
        if (capacity.tryAcquire()) {
            return;
        }
        if (evictOneIdle(requester) && capacity.tryAcquire()) {
            return;
        }
        try {
            if (capacity.tryAcquire(settings.getAcquireTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while waiting for a free connection slot", e);
        }
        throw new ConnectionException("Connection pool exhausted: " + settings.getMaxConnections()
                + " connections open, none released within " + settings.getAcquireTimeout().toSeconds() + "s");
    }

    private boolean evictOneIdle(ConnectionKey requester) {
        for (Map.Entry<ConnectionKey, KeySlot> entry : slots.entrySet()) {
            if (entry.getKey().equals(requester)) {
                continue;
            }
            KeySlot slot = entry.getValue();
            if (slot.guard.tryAcquire()) {
                try {
                    if (slot.connection != null) {
                        log.info("[SSH-POOL] Evicting idle {} to make room for {}", entry.getKey(), requester);
                        discard(slot);
                        return true;
                    }
                } finally {
                    slot.guard.release();
                }
            }
        }
        return false;
    }

    int trackedKeys() {
        return slots.size();
    }

    /**
     * Locks the slot currently mapped to the key. A slot dropped by a health check while we waited
     * for it is left alone and the lookup starts over.
     */
    private KeySlot lockCurrentSlot(ConnectionKey key) {
        while (true) {
            KeySlot slot = slots.computeIfAbsent(key, k -> new KeySlot());
            lockSlot(slot, key);
            if (slots.get(key) == slot) {
                return slot;
            }
            slot.guard.release();
        }
    }

    private void lockSlot(KeySlot slot, ConnectionKey key) {
        try {
            if (!slot.guard.tryAcquire(settings.getAcquireTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ConnectionException("Timed out waiting for connection " + key + " to be released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while waiting for connection " + key, e);
        }
    }

    // caller holds slot.guard
    private void discard(KeySlot slot) {
        PooledConnection connection = slot.connection;
        slot.connection = null;
        connection.condemnAndClose();
        capacity.release();
    }

    private void ensureOpen() {
        if (shutdown.get()) {
            throw new ConnectionException("Connection pool is shut down");
        }
    }

    private static final class KeySlot {
        private final Semaphore guard = new Semaphore(1, true);
        private volatile PooledConnection connection;
    }
}
