package fr.imt.pbdeployer.business.port;

import fr.imt.pbdeployer.business.model.AppStatus;
import fr.imt.pbdeployer.infrastructure.persistence.ManagedApplication;

import java.util.Optional;

public interface ApplicationRepositoryPort {
    Optional<ManagedApplication> findById(String appId);
    ManagedApplication save(ManagedApplication application);

    /**
     * Updates only the deployed version and status, leaving fields owned by other writers intact.
     */
    void updateReleaseState(String appId, String currentVersion, AppStatus status);
}
