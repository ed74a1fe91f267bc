package fr.imt.pbdeployer.infrastructure.persistence.repository;

import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ServerRepository extends MongoRepository<ServerTarget, String> {
}
