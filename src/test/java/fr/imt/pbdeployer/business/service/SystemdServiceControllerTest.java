package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.CommandResult;
import fr.imt.pbdeployer.business.model.OperationContext;
import fr.imt.pbdeployer.business.model.ServiceState;
import fr.imt.pbdeployer.business.model.ServiceStatus;
import fr.imt.pbdeployer.exception.RemoteCommandException;
import fr.imt.pbdeployer.exception.ServiceNotFoundException;
import fr.imt.pbdeployer.exception.ValidationException;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import fr.imt.pbdeployer.support.TestRig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SystemdServiceControllerTest {

    private final TestRig rig = new TestRig();
    private final SystemdServiceController controller = new SystemdServiceController(rig.executor);
    private final OperationContext ctx = OperationContext.unbounded(rig.clock);
    private final ServerTarget locked = ServerTarget.builder().id("s1").name("web").host("10.0.0.5")
            .setupComplete(true).securityLocked(true).build();

    @AfterEach
    void tearDown() {
        rig.close();
    }

    @Test
    void status_of_a_running_service_includes_pid_and_uptime() {
        rig.host.onOutput("^systemctl show pb-blog --property", "LoadState=loaded\nActiveState=active\nMainPID=4242\n");
        rig.host.onOutput("^ps -o etimes= -p 4242$", "   3600\n");

        ServiceStatus status = controller.status(ctx, locked, "pb-blog");

        assertThat(status.state()).isEqualTo(ServiceState.RUNNING);
        assertThat(status.isRunning()).isTrue();
        assertThat(status.pid()).isEqualTo(4242);
        assertThat(status.uptime()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void status_of_a_stopped_service_has_no_pid() {
        rig.host.onOutput("^systemctl show pb-blog --property", "LoadState=loaded\nActiveState=inactive\nMainPID=0\n");

        ServiceStatus status = controller.status(ctx, locked, "pb-blog");

        assertThat(status.state()).isEqualTo(ServiceState.STOPPED);
        assertThat(status.pid()).isNull();
        assertThat(status.uptime()).isNull();
        assertThat(rig.host.ran("^ps ")).isFalse();
    }

    @Test
    void failed_unit_is_reported_as_failed() {
        rig.host.onOutput("^systemctl show", "LoadState=loaded\nActiveState=failed\nMainPID=0\n");

        assertThat(controller.status(ctx, locked, "pb-blog").state()).isEqualTo(ServiceState.FAILED);
    }

    @Test
    void unknown_unit_is_not_found() {
        rig.host.onOutput("^systemctl show", "LoadState=not-found\nActiveState=inactive\nMainPID=0\n");

        assertThatThrownBy(() -> controller.status(ctx, locked, "pb-ghost"))
                .isInstanceOf(ServiceNotFoundException.class);
    }

    @Test
    void locked_server_is_driven_through_the_service_account_with_sudo() {
        controller.restart(ctx, locked, "pb-blog");

        assertThat(rig.host.commandsAs("pocketbase")).containsExactly("sudo -n sh -c 'systemctl restart pb-blog'");
        assertThat(rig.sessionFactory.attempts("root")).isZero();
    }

    @Test
    void unlocked_server_is_driven_as_the_privileged_identity() {
        ServerTarget open = ServerTarget.builder().id("s2").name("new").host("10.0.0.6").setupComplete(true).build();

        controller.stop(ctx, open, "pb-blog");

        assertThat(rig.host.commandsAs("root")).containsExactly("systemctl stop pb-blog");
    }

    @Test
    void control_of_a_missing_unit_is_not_found() {
        rig.host.onFailure("systemctl start pb-ghost", 5, "Failed to start pb-ghost.service: Unit pb-ghost.service not found.");

        assertThatThrownBy(() -> controller.start(ctx, locked, "pb-ghost"))
                .isInstanceOf(ServiceNotFoundException.class);
    }

    @Test
    void other_control_failures_keep_the_exit_code() {
        rig.host.onFailure("systemctl start pb-blog", 1, "Job for pb-blog.service failed");

        assertThatThrownBy(() -> controller.start(ctx, locked, "pb-blog"))
                .isInstanceOf(RemoteCommandException.class)
                .hasMessageContaining("Job for pb-blog.service failed");
    }

    @Test
    void is_active_reads_the_active_state() {
        rig.host.onOutput("^systemctl is-active pb-blog$", "active\n");
        rig.host.on("^systemctl is-active pb-down$", new CommandResult("inactive\n", "", 3));

        assertThat(controller.isActive(ctx, locked, "pb-blog")).isTrue();
        assertThat(controller.isActive(ctx, locked, "pb-down")).isFalse();
    }

    @Test
    void logs_are_read_from_the_journal() {
        rig.host.onOutput("--property=LoadState --value$", "loaded\n");
        rig.host.onOutput("journalctl", "2024-05-01T10:00:00+0000 web pocketbase[1]: Server started\n");

        String logs = controller.tailLogs(ctx, locked, "pb-blog", 50);

        assertThat(logs).contains("Server started");
        assertThat(rig.host.ran("journalctl -u pb-blog -n 50 --no-pager")).isTrue();
    }

    @Test
    void logs_of_a_missing_unit_are_not_found() {
        rig.host.onOutput("--property=LoadState --value$", "not-found\n");

        assertThatThrownBy(() -> controller.tailLogs(ctx, locked, "pb-ghost", 10))
                .isInstanceOf(ServiceNotFoundException.class);
        assertThat(rig.host.ran("journalctl")).isFalse();
    }

    @Test
    void log_line_count_is_bounded() {
        assertThatThrownBy(() -> controller.tailLogs(ctx, locked, "pb-blog", 0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> controller.tailLogs(ctx, locked, "pb-blog", SystemdServiceController.MAX_LOG_LINES + 1))
                .isInstanceOf(ValidationException.class);
        assertThat(rig.host.commands()).isEmpty();
    }

    @Test
    void unit_names_with_shell_syntax_are_rejected_before_any_remote_call() {
        assertThatThrownBy(() -> controller.restart(ctx, locked, "pb-blog; reboot"))
                .isInstanceOf(ValidationException.class);
        assertThat(rig.host.commands()).isEmpty();
    }

    @Test
    void not_found_detection_covers_exit_code_and_messages() {
        assertThat(SystemdServiceController.isNotFound(new CommandResult("", "", 5))).isTrue();
        assertThat(SystemdServiceController.isNotFound(new CommandResult("", "Unit x.service could not be found.", 4)))
                .isTrue();
        assertThat(SystemdServiceController.isNotFound(new CommandResult("", "Access denied", 1))).isFalse();
    }
}
