package fr.imt.pbdeployer.support;

import fr.imt.pbdeployer.business.model.AppStatus;
import fr.imt.pbdeployer.business.port.ApplicationRepositoryPort;
import fr.imt.pbdeployer.business.port.ArtifactStoragePort;
import fr.imt.pbdeployer.business.port.DeploymentRepositoryPort;
import fr.imt.pbdeployer.business.port.ServerRepositoryPort;
import fr.imt.pbdeployer.business.port.VersionRepositoryPort;
import fr.imt.pbdeployer.exception.ResourceNotFoundException;
import fr.imt.pbdeployer.infrastructure.persistence.AppVersion;
import fr.imt.pbdeployer.infrastructure.persistence.DeploymentRecord;
import fr.imt.pbdeployer.infrastructure.persistence.ManagedApplication;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map backed implementations of the repository ports.
 */
public final class InMemoryRepositories {

    private InMemoryRepositories() {
    }

    public static class Servers implements ServerRepositoryPort {
        private final Map<String, ServerTarget> servers = new ConcurrentHashMap<>();
        private final AtomicInteger saves = new AtomicInteger();

        @Override
        public Optional<ServerTarget> findById(String serverId) {
            return Optional.ofNullable(servers.get(serverId));
        }

        @Override
        public ServerTarget save(ServerTarget server) {
            servers.put(server.getId(), server);
            saves.incrementAndGet();
            return server;
        }

        public int saveCount() {
            return saves.get();
        }
    }

    public static class Applications implements ApplicationRepositoryPort {
        private final Map<String, ManagedApplication> applications = new ConcurrentHashMap<>();

        @Override
        public Optional<ManagedApplication> findById(String appId) {
            return Optional.ofNullable(applications.get(appId));
        }

        @Override
        public ManagedApplication save(ManagedApplication application) {
            applications.put(application.getId(), application);
            return application;
        }

        @Override
        public void updateReleaseState(String appId, String currentVersion, AppStatus status) {
            ManagedApplication application = applications.get(appId);
            if (application != null) {
                application.setCurrentVersion(currentVersion);
                application.setStatus(status);
            }
        }
    }

    public static class Versions implements VersionRepositoryPort {
        private final Map<String, AppVersion> versions = new ConcurrentHashMap<>();

        @Override
        public Optional<AppVersion> findById(String versionId) {
            return Optional.ofNullable(versions.get(versionId));
        }

        public AppVersion save(AppVersion version) {
            versions.put(version.getId(), version);
            return version;
        }
    }

    public static class Deployments implements DeploymentRepositoryPort {
        private final Map<String, DeploymentRecord> records = new ConcurrentHashMap<>();

        @Override
        public DeploymentRecord save(DeploymentRecord record) {
            records.put(record.getId(), record);
            return record;
        }

        @Override
        public Optional<DeploymentRecord> findById(String deploymentId) {
            return Optional.ofNullable(records.get(deploymentId));
        }

        public List<DeploymentRecord> all() {
            return new ArrayList<>(records.values());
        }
    }

    public static class Artifacts implements ArtifactStoragePort {
        private final Map<String, byte[]> artifacts = new ConcurrentHashMap<>();
        private final AtomicInteger loads = new AtomicInteger();

        public void put(String artifactId, byte[] content) {
            artifacts.put(artifactId, content);
        }

        @Override
        public byte[] load(String artifactId) {
            loads.incrementAndGet();
            byte[] content = artifacts.get(artifactId);
            if (content == null) {
                throw new ResourceNotFoundException("Artifact", artifactId);
            }
            return content;
        }

        public int loadCount() {
            return loads.get();
        }
    }
}
