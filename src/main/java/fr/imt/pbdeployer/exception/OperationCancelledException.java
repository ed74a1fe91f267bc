package fr.imt.pbdeployer.exception;

public class OperationCancelledException extends PbDeployerException {

    public static final String ERROR_CODE = "CANCELLED";

    public OperationCancelledException(String message) {
        super(ERROR_CODE, message);
    }
}
