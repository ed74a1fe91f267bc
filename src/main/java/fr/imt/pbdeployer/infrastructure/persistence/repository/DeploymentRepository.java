package fr.imt.pbdeployer.infrastructure.persistence.repository;

import fr.imt.pbdeployer.infrastructure.persistence.DeploymentRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DeploymentRepository extends MongoRepository<DeploymentRecord, String> {
}
