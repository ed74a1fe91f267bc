package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.OperationContext;
import fr.imt.pbdeployer.exception.PbDeployerException;
import fr.imt.pbdeployer.exception.StepFailedException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Ordered remote steps that stop at the first failure, reporting each transition.
 * Emits {@code init} at 0% and {@code complete} at 100% around the steps.
 */
@Slf4j
class StepSequence {

    static final String INIT = "init";
    static final String COMPLETE = "complete";

    record Step(String name, String description, Consumer<OperationContext> action) {
    }

    private final String label;
    private final ProgressReporter progress;
    private final List<Step> steps = new ArrayList<>();

    StepSequence(String label, ProgressReporter progress) {
        this.label = label;
        this.progress = progress;
    }

    StepSequence then(String name, String description, Consumer<OperationContext> action) {
        steps.add(new Step(name, description, action));
        return this;
    }

    /**
     * @throws StepFailedException naming the failed step and the steps applied before it
     */
    void run(OperationContext ctx) {
        progress.running(INIT, 0, label + " started");
        List<String> completed = new ArrayList<>();
        int total = steps.size();

        for (int i = 0; i < total; i++) {
            Step step = steps.get(i);
            int startPercent = 5 + i * 90 / total;
            int endPercent = 5 + (i + 1) * 90 / total;
            try {
                ctx.checkActive();
                progress.running(step.name(), startPercent, step.description());
                step.action().accept(ctx);
            } catch (PbDeployerException e) {
                throw fail(step, startPercent, completed, e);
            } catch (RuntimeException e) {
                log.error("{}: unexpected error in step {}", label, step.name(), e);
                throw fail(step, startPercent, completed, e);
            }
            completed.add(step.name());
            progress.success(step.name(), endPercent, step.description() + ": done");
        }
        progress.success(COMPLETE, 100, label + " completed");
    }

    private StepFailedException fail(Step step, int percent, List<String> completed, RuntimeException cause) {
        String applied = completed.isEmpty() ? "none" : String.join(", ", completed);
        progress.failed(step.name(), percent, step.description() + " failed: " + cause.getMessage(),
                "steps already applied: " + applied);
        progress.failed(COMPLETE, 100, label + " failed at step " + step.name(), cause.getMessage());
        return new StepFailedException(step.name(), completed, cause);
    }
}
