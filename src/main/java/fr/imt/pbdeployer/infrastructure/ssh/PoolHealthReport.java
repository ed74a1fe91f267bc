package fr.imt.pbdeployer.infrastructure.ssh;

import java.time.Instant;
import java.util.List;

public record PoolHealthReport(Instant checkedAt, List<ConnectionStatus> connections, int evicted) {

    public long count(ConnectionState state) {
        return connections.stream().filter(c -> c.state() == state).count();
    }

    public int total() {
        return (int) (connections.size() - count(ConnectionState.CONDEMNED));
    }
}
