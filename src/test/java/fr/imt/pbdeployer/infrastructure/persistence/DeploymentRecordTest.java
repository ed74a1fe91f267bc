package fr.imt.pbdeployer.infrastructure.persistence;

import fr.imt.pbdeployer.business.model.DeploymentKind;
import fr.imt.pbdeployer.business.model.DeploymentStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentRecordTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final AppVersion version = AppVersion.builder().id("v1").appId("a1").versionNumber("1.2.0").build();

    @Test
    void new_record_is_pending_with_empty_logs() {
        DeploymentRecord record = DeploymentRecord.pending("a1", version, DeploymentKind.DEPLOY, T0);

        assertThat(record.getId()).isNotBlank();
        assertThat(record.getStatus()).isEqualTo(DeploymentStatus.PENDING);
        assertThat(record.getVersionNumber()).isEqualTo("1.2.0");
        assertThat(record.getLogs()).isEmpty();
        assertThat(record.getCreatedAt()).isEqualTo(T0);
        assertThat(record.elapsed(T0.plusSeconds(30))).isEqualTo(Duration.ZERO);
    }

    @Test
    void status_moves_forward_and_records_times() {
        DeploymentRecord record = DeploymentRecord.pending("a1", version, DeploymentKind.DEPLOY, T0);

        record.markRunning(T0.plusSeconds(1));
        record.appendLog(T0.plusSeconds(2), "Uploading artifact");
        record.markSuccess(T0.plusSeconds(40));

        assertThat(record.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
        assertThat(record.getStartedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(record.getCompletedAt()).isEqualTo(T0.plusSeconds(40));
        assertThat(record.getLogs()).isEqualTo("[2024-05-01T10:00:02Z] Uploading artifact\n");
        assertThat(record.elapsed(T0.plusSeconds(11))).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void pending_record_must_run_before_it_completes() {
        DeploymentRecord record = DeploymentRecord.pending("a1", version, DeploymentKind.ROLLBACK, T0);

        assertThatThrownBy(() -> record.markFailed(T0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot move from pending to failed");
        assertThatThrownBy(() -> record.markSuccess(T0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot move from pending to success");
        assertThat(record.getStatus()).isEqualTo(DeploymentStatus.PENDING);
        assertThat(record.getCompletedAt()).isNull();
    }

    @Test
    void terminal_record_is_frozen() {
        DeploymentRecord record = DeploymentRecord.pending("a1", version, DeploymentKind.DEPLOY, T0);
        record.markRunning(T0);
        record.markFailed(T0);

        assertThatThrownBy(() -> record.markSuccess(T0)).isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already failed");
        assertThatThrownBy(() -> record.appendLog(T0, "late")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> record.markRunning(T0)).isInstanceOf(IllegalStateException.class);
        assertThat(record.getStatus()).isEqualTo(DeploymentStatus.FAILED);
    }

    @Test
    void running_twice_is_rejected() {
        DeploymentRecord record = DeploymentRecord.pending("a1", version, DeploymentKind.DEPLOY, T0);
        record.markRunning(T0);

        assertThatThrownBy(() -> record.markRunning(T0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot move from running to running");
    }
}
