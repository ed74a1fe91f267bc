package fr.imt.pbdeployer.infrastructure.persistence.repository;

import fr.imt.pbdeployer.infrastructure.persistence.ManagedApplication;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ApplicationRepository extends MongoRepository<ManagedApplication, String> {
}
