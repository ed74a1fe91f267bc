package fr.imt.pbdeployer.exception;

/**
 * Exception thrown when a target host cannot be reached or the transport breaks.
 */
public class ConnectionException extends PbDeployerException {

    public static final String ERROR_CODE = "CONN_ERR";

    private final boolean refused;

    public ConnectionException(String message) {
        this(message, false, null);
    }

    public ConnectionException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public ConnectionException(String host, int port, boolean refused, Throwable cause) {
        this((refused ? "Connection refused by " : "Failed to connect to ") + host + ":" + port, refused, cause);
    }

    private ConnectionException(String message, boolean refused, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.refused = refused;
    }

    /**
     * @return true when the remote end actively refused the connection (as opposed to a timeout)
     */
    public boolean isRefused() {
        return refused;
    }
}
