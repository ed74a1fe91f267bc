package fr.imt.pbdeployer.infrastructure.ssh;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * A pooled session and its bookkeeping. Mutated only by the holder of its key's guard.
 */
@Slf4j
@Getter
public class PooledConnection {

    private final ConnectionKey key;
    private final RemoteSession session;
    private final Instant createdAt;
    private volatile Instant lastUsedAt;
    private volatile ConnectionState state = ConnectionState.IDLE;
    private volatile long useCount;
    private volatile int consecutiveFailures;
    private volatile Boolean lastCheckPassed;

    public PooledConnection(ConnectionKey key, RemoteSession session, Instant createdAt) {
        this.key = key;
        this.session = session;
        this.createdAt = createdAt;
        this.lastUsedAt = createdAt;
    }

    void checkout(Instant now) {
        state = ConnectionState.IN_USE;
        useCount++;
        lastUsedAt = now;
    }

    void checkin(Instant now) {
        if (state != ConnectionState.CONDEMNED) {
            state = ConnectionState.IDLE;
        }
        lastUsedAt = now;
    }

    void recordHealthCheck(boolean passed) {
        lastCheckPassed = passed;
        consecutiveFailures = passed ? 0 : consecutiveFailures + 1;
    }

    boolean isExpired(Instant now, Duration maxAge) {
        return !now.isBefore(createdAt.plus(maxAge));
    }

    boolean isIdleFor(Instant now, Duration maxIdle) {
        return state == ConnectionState.IDLE && !now.isBefore(lastUsedAt.plus(maxIdle));
    }

    boolean isReusable(Instant now, Duration maxAge, int unhealthyThreshold) {
        return state != ConnectionState.CONDEMNED
                && consecutiveFailures < unhealthyThreshold
                && !isExpired(now, maxAge)
                && session.isConnected();
    }

    void condemnAndClose() {
        state = ConnectionState.CONDEMNED;
        session.close();
        log.debug("[SSH-POOL] Closed connection {} after {} uses", key, useCount);
    }

    ConnectionStatus describe() {
        return new ConnectionStatus(key.toString(), state, useCount, consecutiveFailures,
                lastCheckPassed, createdAt, lastUsedAt);
    }
}
