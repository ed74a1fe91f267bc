package fr.imt.pbdeployer.support;

import fr.imt.pbdeployer.business.service.OperationRunner;
import fr.imt.pbdeployer.business.service.RemoteCommandExecutor;
import fr.imt.pbdeployer.configuration.PbDeployerProperties;
import fr.imt.pbdeployer.configuration.RetryConfiguration;
import fr.imt.pbdeployer.infrastructure.ssh.SshConnectionPool;
import org.springframework.core.task.SyncTaskExecutor;

/**
 * Wires a connection pool and executor onto a {@link FakeRemoteHost}. Operations launched through
 * {@link #operationRunner} run synchronously on the calling thread.
 */
public class TestRig implements AutoCloseable {

    public final FakeRemoteHost host = new FakeRemoteHost();
    public final FakeSessionFactory sessionFactory = new FakeSessionFactory(host);
    public final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    public final PbDeployerProperties properties = TestProperties.fast();
    public final RecordingProgressPublisher progress = new RecordingProgressPublisher();
    public final InMemoryRepositories.Servers servers = new InMemoryRepositories.Servers();
    public final InMemoryRepositories.Applications applications = new InMemoryRepositories.Applications();
    public final InMemoryRepositories.Versions versions = new InMemoryRepositories.Versions();
    public final InMemoryRepositories.Deployments deployments = new InMemoryRepositories.Deployments();
    public final InMemoryRepositories.Artifacts artifacts = new InMemoryRepositories.Artifacts();
    public final SshConnectionPool pool = new SshConnectionPool(sessionFactory, properties,
            new RetryConfiguration().sshRetryTemplate(properties), clock);
    public final RemoteCommandExecutor executor = new RemoteCommandExecutor(pool, properties);
    public final OperationRunner operationRunner = new OperationRunner(new SyncTaskExecutor(), clock);

    @Override
    public void close() {
        pool.shutdown();
    }
}
