package fr.imt.pbdeployer.infrastructure.persistence.repository;

import fr.imt.pbdeployer.business.port.VersionRepositoryPort;
import fr.imt.pbdeployer.infrastructure.persistence.AppVersion;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoVersionRepositoryAdapter implements VersionRepositoryPort {

    private final VersionRepository versionRepository;

    @Override
    public Optional<AppVersion> findById(String versionId) {
        return versionRepository.findById(versionId);
    }
}
