package fr.imt.pbdeployer.infrastructure.persistence.repository;

import fr.imt.pbdeployer.infrastructure.persistence.AppVersion;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface VersionRepository extends MongoRepository<AppVersion, String> {
}
