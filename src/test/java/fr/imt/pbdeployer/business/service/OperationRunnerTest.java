package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.OperationHandle;
import fr.imt.pbdeployer.business.model.OperationKind;
import fr.imt.pbdeployer.exception.OperationCancelledException;
import fr.imt.pbdeployer.exception.PreconditionException;
import fr.imt.pbdeployer.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationRunnerTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private final OperationRunner runner = new OperationRunner(new SyncTaskExecutor(), clock);

    @Test
    void completed_operation_is_no_longer_in_flight() {
        AtomicBoolean visibleWhileRunning = new AtomicBoolean();
        AtomicReference<String> id = new AtomicReference<>("op-1");

        OperationHandle handle = runner.launch("op-1", OperationKind.SERVER_SETUP, "s1", null,
                ctx -> visibleWhileRunning.set(runner.find(id.get()).isPresent()));

        assertThat(visibleWhileRunning).isTrue();
        assertThat(handle.isDone()).isTrue();
        assertThat(handle.getSubscription()).isEqualTo("server_setup_s1");
        assertThat(runner.find("op-1")).isEmpty();
        assertThat(runner.cancel("op-1", "too late")).isFalse();
    }

    @Test
    void failure_is_reported_on_the_handle_not_thrown() {
        OperationHandle handle = runner.launch(OperationKind.SERVER_SECURITY, "s1", null, ctx -> {
            throw new IllegalStateException("boom");
        });

        assertThat(handle.getCompletion()).isCompletedExceptionally();
        assertThat(handle.getId()).isNotBlank();
    }

    @Test
    void cancellation_reaches_the_running_work() {
        OperationHandle handle = runner.launch("op-2", OperationKind.DEPLOYMENT_PROGRESS, "d1", null, ctx -> {
            assertThat(runner.cancel("op-2", "user request")).isTrue();
            ctx.checkActive();
        });

        assertThat(handle.getCompletion()).isCompletedExceptionally();
        assertThatThrownBy(() -> handle.getCompletion().join())
                .hasCauseInstanceOf(OperationCancelledException.class)
                .hasMessageContaining("user request");
    }

    @Test
    void timeout_sets_a_deadline_on_the_context() {
        OperationHandle handle = runner.launch(OperationKind.SERVER_SETUP, "s1", Duration.ofMinutes(5), ctx -> {
        });

        assertThat(handle.getContext().getDeadline()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
    }

    @Test
    void rejected_work_is_a_precondition_failure() {
        OperationRunner saturated = new OperationRunner(task -> {
            throw new TaskRejectedException("queue full");
        }, clock);

        assertThatThrownBy(() -> saturated.launch("op-3", OperationKind.SERVER_SETUP, "s1", null, ctx -> {
        }))
                .isInstanceOf(PreconditionException.class);
        assertThat(saturated.find("op-3")).isEmpty();
    }
}
