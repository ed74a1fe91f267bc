package fr.imt.pbdeployer.exception;

import lombok.Getter;

/**
 * Exception thrown when a well-formed remote command exits with a nonzero status.
 */
@Getter
public class RemoteCommandException extends PbDeployerException {

    public static final String ERROR_CODE = "REMOTE_CMD_ERR";

    private final int exitCode;
    private final String stderr;

    public RemoteCommandException(String description, int exitCode, String stderr) {
        super(ERROR_CODE, buildMessage(description, exitCode, stderr));
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    private static String buildMessage(String description, int exitCode, String stderr) {
        String message = description + " failed with exit code " + exitCode;
        if (stderr != null && !stderr.isBlank()) {
            message += ": " + stderr.strip();
        }
        return message;
    }
}
