package fr.imt.pbdeployer.exception;

/**
 * Exception thrown when a requested server, application, version or deployment is not found.
 */
public class ResourceNotFoundException extends PbDeployerException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public ResourceNotFoundException(String resource, String id) {
        super(ERROR_CODE, resource + " not found: " + id);
    }
}
