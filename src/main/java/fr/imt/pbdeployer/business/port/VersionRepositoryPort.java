package fr.imt.pbdeployer.business.port;

import fr.imt.pbdeployer.infrastructure.persistence.AppVersion;

import java.util.Optional;

public interface VersionRepositoryPort {
    Optional<AppVersion> findById(String versionId);
}
