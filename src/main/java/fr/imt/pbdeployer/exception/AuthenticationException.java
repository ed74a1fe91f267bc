package fr.imt.pbdeployer.exception;

/**
 * Exception thrown when a remote host rejects the presented credentials.
 */
public class AuthenticationException extends PbDeployerException {

    public static final String ERROR_CODE = "AUTH_ERR";

    public AuthenticationException(String message) {
        super(ERROR_CODE, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    protected AuthenticationException(String errorCode, String message) {
        super(errorCode, message);
    }

    /**
     * @return true when the failure is a known state of the target rather than an anomaly
     */
    public boolean isExpected() {
        return false;
    }
}
