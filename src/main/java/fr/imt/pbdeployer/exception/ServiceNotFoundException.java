package fr.imt.pbdeployer.exception;

public class ServiceNotFoundException extends PbDeployerException {

    public static final String ERROR_CODE = "SERVICE_NOT_FOUND";

    public ServiceNotFoundException(String serviceName, String host) {
        super(ERROR_CODE, "Service " + serviceName + " is not installed on " + host);
    }
}
