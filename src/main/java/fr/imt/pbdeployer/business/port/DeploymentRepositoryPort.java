package fr.imt.pbdeployer.business.port;

import fr.imt.pbdeployer.infrastructure.persistence.DeploymentRecord;

import java.util.Optional;

public interface DeploymentRepositoryPort {
    DeploymentRecord save(DeploymentRecord record);
    Optional<DeploymentRecord> findById(String deploymentId);
}
