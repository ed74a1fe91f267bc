package fr.imt.pbdeployer.business.port;

import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;

import java.util.Optional;

public interface ServerRepositoryPort {
    Optional<ServerTarget> findById(String serverId);
    ServerTarget save(ServerTarget server);
}
