package fr.imt.pbdeployer.exception;

import java.time.Duration;

public class CommandTimeoutException extends PbDeployerException {

    public static final String ERROR_CODE = "TIMEOUT";

    public CommandTimeoutException(String message) {
        super(ERROR_CODE, message);
    }

    public CommandTimeoutException(String description, Duration timeout) {
        super(ERROR_CODE, description + " timed out after " + timeout.toSeconds() + "s");
    }
}
