package fr.imt.pbdeployer.exception;

/**
 * Exception thrown for malformed artifacts and missing or invalid request input.
 */
public class ValidationException extends PbDeployerException {

    public static final String ERROR_CODE = "VALIDATION_ERR";

    public ValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
