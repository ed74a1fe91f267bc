package fr.imt.pbdeployer.infrastructure.ssh;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive lease on a pooled connection. Closing the handle returns the connection to the pool.
 */
public class ConnectionHandle implements AutoCloseable {

    private final SshConnectionPool pool;
    private final PooledConnection connection;
    private final AtomicBoolean released = new AtomicBoolean();
    private volatile boolean broken;

    ConnectionHandle(SshConnectionPool pool, PooledConnection connection) {
        this.pool = pool;
        this.connection = connection;
    }

    public RemoteSession session() {
        if (released.get()) {
            throw new IllegalStateException("Connection " + connection.getKey() + " was already released");
        }
        return connection.getSession();
    }

    public ConnectionKey key() {
        return connection.getKey();
    }

    /**
     * Flags the underlying transport as failed so the pool closes it on release.
     */
    public void markBroken() {
        broken = true;
    }

    public boolean isBroken() {
        return broken;
    }

    PooledConnection connection() {
        return connection;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        pool.release(this);
    }
}
