package fr.imt.pbdeployer.infrastructure.persistence.repository;

import fr.imt.pbdeployer.business.port.ServerRepositoryPort;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoServerRepositoryAdapter implements ServerRepositoryPort {

    private final ServerRepository serverRepository;

    @Override
    public Optional<ServerTarget> findById(String serverId) {
        return serverRepository.findById(serverId);
    }

    @Override
    public ServerTarget save(ServerTarget server) {
        return serverRepository.save(server);
    }
}
