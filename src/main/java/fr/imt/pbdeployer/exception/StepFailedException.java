package fr.imt.pbdeployer.exception;

import lombok.Getter;

import java.util.List;

/**
 * Terminal failure of one step of a multi-step remote workflow.
 */
@Getter
public class StepFailedException extends PbDeployerException {

    public static final String ERROR_CODE = "STEP_FAILED";

    private final String step;
    private final List<String> completedSteps;

    public StepFailedException(String step, List<String> completedSteps, Throwable cause) {
        super(ERROR_CODE, "Step '" + step + "' failed: " + cause.getMessage(), cause);
        this.step = step;
        this.completedSteps = List.copyOf(completedSteps);
    }
}
