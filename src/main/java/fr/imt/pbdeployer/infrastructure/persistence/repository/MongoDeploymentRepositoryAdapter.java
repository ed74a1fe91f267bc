package fr.imt.pbdeployer.infrastructure.persistence.repository;

import fr.imt.pbdeployer.business.port.DeploymentRepositoryPort;
import fr.imt.pbdeployer.infrastructure.persistence.DeploymentRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoDeploymentRepositoryAdapter implements DeploymentRepositoryPort {

    private final DeploymentRepository deploymentRepository;

    @Override
    public DeploymentRecord save(DeploymentRecord record) {
        return deploymentRepository.save(record);
    }

    @Override
    public Optional<DeploymentRecord> findById(String deploymentId) {
        return deploymentRepository.findById(deploymentId);
    }
}
