package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.AppStatus;
import fr.imt.pbdeployer.business.model.ServiceState;
import fr.imt.pbdeployer.business.model.ServiceStatus;
import fr.imt.pbdeployer.exception.ResourceNotFoundException;
import fr.imt.pbdeployer.exception.ValidationException;
import fr.imt.pbdeployer.infrastructure.persistence.ManagedApplication;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import fr.imt.pbdeployer.support.TestRig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplicationControlServiceTest {

    private final TestRig rig = new TestRig();
    private final ApplicationControlService service = new ApplicationControlService(rig.applications, rig.servers,
            new SystemdServiceController(rig.executor), rig.properties, rig.clock);
    private ManagedApplication app;

    @BeforeEach
    void setUp() {
        rig.servers.save(ServerTarget.builder().id("s1").name("web").host("10.0.0.5")
                .setupComplete(true).securityLocked(true).build());
        app = rig.applications.save(ManagedApplication.builder().id("a1").name("blog").serverId("s1")
                .serviceName("pb-blog").currentVersion("1.0.0").status(AppStatus.ONLINE).build());
    }

    @AfterEach
    void tearDown() {
        rig.close();
    }

    @Test
    void stop_marks_the_application_offline() {
        rig.host.onOutput("^systemctl show pb-blog --property", "LoadState=loaded\nActiveState=inactive\nMainPID=0\n");

        ServiceStatus status = service.control("a1", "stop");

        assertThat(status.state()).isEqualTo(ServiceState.STOPPED);
        assertThat(app.getStatus()).isEqualTo(AppStatus.OFFLINE);
        assertThat(app.getCurrentVersion()).isEqualTo("1.0.0");
        assertThat(rig.host.commandsAs("pocketbase")).first().isEqualTo("sudo -n sh -c 'systemctl stop pb-blog'");
    }

    @Test
    void restart_keeps_a_running_application_online() {
        rig.host.onOutput("^systemctl show pb-blog --property", "LoadState=loaded\nActiveState=active\nMainPID=77\n");

        ServiceStatus status = service.control("a1", "RESTART");

        assertThat(status.isRunning()).isTrue();
        assertThat(app.getStatus()).isEqualTo(AppStatus.ONLINE);
        assertThat(rig.host.ran("systemctl restart pb-blog")).isTrue();
    }

    @Test
    void default_service_name_is_derived_from_the_application_name() {
        app.setServiceName(null);
        rig.host.onOutput("^systemctl show", "LoadState=loaded\nActiveState=active\nMainPID=0\n");

        service.status("a1");

        assertThat(rig.host.ran("systemctl show pocketbase-blog ")).isTrue();
    }

    @Test
    void unknown_action_is_rejected_before_any_remote_call() {
        assertThatThrownBy(() -> service.control("a1", "reload"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("expected start, stop or restart");
        assertThat(rig.host.commands()).isEmpty();
    }

    @Test
    void logs_are_tailed_from_the_journal() {
        rig.host.onOutput("--property=LoadState --value$", "loaded\n");
        rig.host.onOutput("journalctl", "line one\nline two\n");

        assertThat(service.logs("a1", 2)).isEqualTo("line one\nline two\n");
    }

    @Test
    void unknown_application_is_reported() {
        assertThatThrownBy(() -> service.status("nope")).isInstanceOf(ResourceNotFoundException.class);
    }
}
