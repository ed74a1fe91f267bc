package fr.imt.pbdeployer.exception;

/**
 * Raised instead of attempting a privileged login on a security-locked server.
 */
public class LockedIdentityException extends AuthenticationException {

    public static final String ERROR_CODE = "IDENTITY_LOCKED";

    public LockedIdentityException(String username, String host) {
        super(ERROR_CODE, "Login as " + username + " is disabled on locked server " + host);
    }

    @Override
    public boolean isExpected() {
        return true;
    }
}
