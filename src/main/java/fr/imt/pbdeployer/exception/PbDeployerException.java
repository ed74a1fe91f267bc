package fr.imt.pbdeployer.exception;

/**
 * Base exception class for all pb-deployer domain exceptions.
 * Carries an error code that is surfaced as-is in API responses and progress events.
 */
public class PbDeployerException extends RuntimeException {

    private final String errorCode;

    public PbDeployerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PbDeployerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
