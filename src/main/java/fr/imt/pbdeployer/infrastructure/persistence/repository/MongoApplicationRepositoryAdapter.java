package fr.imt.pbdeployer.infrastructure.persistence.repository;

import fr.imt.pbdeployer.business.model.AppStatus;
import fr.imt.pbdeployer.business.port.ApplicationRepositoryPort;
import fr.imt.pbdeployer.infrastructure.persistence.ManagedApplication;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoApplicationRepositoryAdapter implements ApplicationRepositoryPort {

    private final ApplicationRepository applicationRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<ManagedApplication> findById(String appId) {
        return applicationRepository.findById(appId);
    }

    @Override
    public ManagedApplication save(ManagedApplication application) {
        return applicationRepository.save(application);
    }

    @Override
    public void updateReleaseState(String appId, String currentVersion, AppStatus status) {
        Query query = Query.query(Criteria.where("_id").is(appId));
        Update update = Update.update("currentVersion", currentVersion)
                .set("status", status)
                .set("updatedAt", LocalDateTime.now());
        mongoTemplate.updateFirst(query, update, ManagedApplication.class);
    }
}
