package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.OperationContext;
import fr.imt.pbdeployer.business.model.OperationHandle;
import fr.imt.pbdeployer.business.model.OperationKind;
import fr.imt.pbdeployer.exception.PreconditionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Runs long operations in the background and keeps a handle on the ones in flight.
 */
@Slf4j
@Component
public class OperationRunner {

    private final TaskExecutor operationExecutor;
    private final Clock clock;
    private final Map<String, OperationHandle> inFlight = new ConcurrentHashMap<>();

    public OperationRunner(TaskExecutor operationExecutor, Clock clock) {
        this.operationExecutor = operationExecutor;
        this.clock = clock;
    }

    public OperationHandle launch(OperationKind kind, String targetId, Duration timeout,
                                  Consumer<OperationContext> work) {
        return launch(UUID.randomUUID().toString(), kind, targetId, timeout, work);
    }

    /**
     * Schedules {@code work}. Its outcome is reported through the handle's completion future,
     * never thrown to the caller.
     *
     * @param timeout deadline for the whole operation, or null for none
     */
    public OperationHandle launch(String operationId, OperationKind kind, String targetId, Duration timeout,
                                  Consumer<OperationContext> work) {
        OperationContext context = timeout == null
                ? OperationContext.unbounded(clock)
                : OperationContext.withTimeout(timeout, clock);
        OperationHandle handle = new OperationHandle(operationId, kind, targetId, context);
        inFlight.put(operationId, handle);
        try {
            operationExecutor.execute(() -> runToCompletion(handle, work));
        } catch (TaskRejectedException e) {
            inFlight.remove(operationId);
            handle.getCompletion().completeExceptionally(e);
            throw new PreconditionException("Too many operations in progress, try again later");
        }
        return handle;
    }

    public Optional<OperationHandle> find(String operationId) {
        return Optional.ofNullable(inFlight.get(operationId));
    }

    /**
     * @return true if the operation was in flight and is now asked to stop
     */
    public boolean cancel(String operationId, String reason) {
        OperationHandle handle = inFlight.get(operationId);
        if (handle == null) {
            return false;
        }
        handle.cancel(reason);
        log.info("[OPERATION] Cancellation requested for {} {}: {}", handle.getKind().getPrefix(), operationId, reason);
        return true;
    }

    private void runToCompletion(OperationHandle handle, Consumer<OperationContext> work) {
        String label = handle.getSubscription();
        try {
            log.info("[OPERATION] {} started", label);
            work.accept(handle.getContext());
            handle.getCompletion().complete(null);
            log.info("[OPERATION] {} finished", label);
        } catch (RuntimeException e) {
            log.warn("[OPERATION] {} failed: {}", label, e.getMessage());
            handle.getCompletion().completeExceptionally(e);
        } catch (Error e) {
            log.error("[OPERATION] {} aborted", label, e);
            handle.getCompletion().completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(handle.getId());
        }
    }
}
