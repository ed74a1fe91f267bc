package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.AppStatus;
import fr.imt.pbdeployer.business.model.BootstrapCredentials;
import fr.imt.pbdeployer.business.model.CommandResult;
import fr.imt.pbdeployer.business.model.DeploymentKind;
import fr.imt.pbdeployer.business.model.DeploymentStatus;
import fr.imt.pbdeployer.exception.ValidationException;
import fr.imt.pbdeployer.infrastructure.persistence.AppVersion;
import fr.imt.pbdeployer.infrastructure.persistence.DeploymentRecord;
import fr.imt.pbdeployer.infrastructure.persistence.ManagedApplication;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import fr.imt.pbdeployer.support.FakeRemoteHost;
import fr.imt.pbdeployer.support.ReleaseArchives;
import fr.imt.pbdeployer.support.TestRig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Provisioning, hardening and releasing one application on a fresh server.
 */
class ServerLifecycleTest {

    private static final BootstrapCredentials ADMIN = new BootstrapCredentials("admin@example.com", "s3cret-passw0rd");

    private final TestRig rig = new TestRig();
    private final SystemdServiceController serviceController = new SystemdServiceController(rig.executor);
    private final ServerSetupService setupService = new ServerSetupService(rig.servers, rig.executor, rig.progress,
            rig.operationRunner, rig.properties, rig.clock);
    private final SecurityLockdownService lockdownService = new SecurityLockdownService(rig.servers, rig.executor,
            rig.pool, rig.progress, rig.operationRunner, rig.properties, rig.clock);
    private final DeploymentService deploymentService = new DeploymentService(rig.applications, rig.versions,
            rig.servers, rig.deployments, rig.artifacts, rig.executor, serviceController, new ArtifactInspector(),
            rig.progress, rig.operationRunner, rig.properties, rig.clock);

    private final AtomicBoolean applicationAnswers = new AtomicBoolean(true);
    private ServerTarget server;
    private ManagedApplication app;

    @BeforeEach
    void setUp() {
        server = rig.servers.save(ServerTarget.builder().id("s1").name("web").host("10.0.0.5").build());
        app = rig.applications.save(ManagedApplication.builder().id("a1").name("blog").serverId("s1").build());
        rig.versions.save(AppVersion.builder().id("v1").appId("a1").versionNumber("1.0.0").artifactId("art1").build());
        rig.artifacts.put("art1", ReleaseArchives.valid());

        rig.host.onOutput("^whoami$", "pocketbase\n");
        rig.host.onOutput("^sshd -T$", "port 22\npasswordauthentication no\npermitrootlogin no\n");
        rig.host.onOutput("^ufw status$", "Status: active\n\nTo Action From\n");
        rig.host.onOutput("^systemctl is-active fail2ban$", "active\n");
        rig.host.onOutput("^systemctl is-active pocketbase-blog$", "active\n");
        rig.host.on("^curl ", command -> applicationAnswers.get()
                ? FakeRemoteHost.ok("{\"code\":200}")
                : new CommandResult("", "curl: (22) The requested URL returned error: 503", 22));
    }

    @AfterEach
    void tearDown() {
        rig.close();
    }

    private void provisionAndDeployFirstRelease() {
        setupService.startSetup("s1");
        lockdownService.startLockdown("s1");
        DeploymentRecord first = deploymentService.requestDeploy("a1", "v1", ADMIN);
        assertThat(first.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
    }

    @Test
    void fresh_server_is_provisioned_locked_and_serves_its_first_release() {
        provisionAndDeployFirstRelease();

        assertThat(server.isSetupComplete()).isTrue();
        assertThat(server.isSecurityLocked()).isTrue();
        assertThat(app.getCurrentVersion()).isEqualTo("1.0.0");
        assertThat(app.getStatus()).isEqualTo(AppStatus.ONLINE);
        assertThat(rig.host.commandsAs("pocketbase"))
                .contains("cd '/opt/pocketbase/apps/blog' && ./pocketbase superuser upsert "
                        + "'admin@example.com' 's3cret-passw0rd'");
    }

    @Test
    void release_without_its_binary_is_refused_without_touching_the_server() {
        provisionAndDeployFirstRelease();
        rig.versions.save(AppVersion.builder().id("v2").appId("a1").versionNumber("1.1.0").artifactId("art2").build());
        rig.artifacts.put("art2", ReleaseArchives.zip(Map.of("pb_public/index.html", "<h1>blog</h1>")));
        int commands = rig.host.commands().size();
        int connections = rig.sessionFactory.totalAttempts();

        assertThatThrownBy(() -> deploymentService.requestDeploy("a1", "v2", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'pocketbase' binary");

        assertThat(rig.host.commands()).hasSize(commands);
        assertThat(rig.sessionFactory.totalAttempts()).isEqualTo(connections);
        assertThat(rig.deployments.all()).hasSize(1);
        assertThat(app.getCurrentVersion()).isEqualTo("1.0.0");
        assertThat(app.getStatus()).isEqualTo(AppStatus.ONLINE);
    }

    @Test
    void failed_upgrade_is_followed_by_a_rollback_to_the_previous_version() {
        provisionAndDeployFirstRelease();
        rig.versions.save(AppVersion.builder().id("v2").appId("a1").versionNumber("1.1.0").artifactId("art2").build());
        rig.artifacts.put("art2", ReleaseArchives.valid());

        applicationAnswers.set(false);
        DeploymentRecord upgrade = deploymentService.requestDeploy("a1", "v2", null);

        assertThat(upgrade.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(upgrade.getLogs()).contains("Step health_check failed").contains("Previous release restored");
        assertThat(app.getCurrentVersion()).isEqualTo("1.0.0");
        assertThat(app.getStatus()).isEqualTo(AppStatus.OFFLINE);

        applicationAnswers.set(true);
        DeploymentRecord rollback = deploymentService.requestRollback("a1", "v1");

        assertThat(rollback.getKind()).isEqualTo(DeploymentKind.ROLLBACK);
        assertThat(rollback.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
        assertThat(app.getCurrentVersion()).isEqualTo("1.0.0");
        assertThat(app.getStatus()).isEqualTo(AppStatus.ONLINE);
        assertThat(rig.deployments.all())
                .extracting(DeploymentRecord::getStatus)
                .containsExactlyInAnyOrder(DeploymentStatus.SUCCESS, DeploymentStatus.FAILED, DeploymentStatus.SUCCESS);
        assertThat(rig.sessionFactory.attempts("root")).isPositive();
        assertThat(rig.pool.snapshot().connections()).noneMatch(status -> status.key().startsWith("root@"));
    }
}
