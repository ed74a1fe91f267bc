package fr.imt.pbdeployer.exception;

/**
 * Exception thrown when an operation is requested on an entity in the wrong state.
 */
public class PreconditionException extends PbDeployerException {

    public static final String ERROR_CODE = "PRECONDITION_FAILED";

    public PreconditionException(String message) {
        super(ERROR_CODE, message);
    }
}
