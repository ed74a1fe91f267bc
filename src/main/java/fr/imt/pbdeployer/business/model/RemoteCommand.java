package fr.imt.pbdeployer.business.model;

import java.time.Duration;

/**
 * A shell command to run on a target.
 *
 * @param cmd       the command line, interpreted by the remote login shell
 * @param sudo      run through {@code sudo -n}
 * @param timeout   overrides the executor default when not null
 * @param sensitive the command line carries secrets and must not be logged
 */
public record RemoteCommand(String cmd, boolean sudo, Duration timeout, boolean sensitive) {

    public static RemoteCommand of(String cmd) {
        return new RemoteCommand(cmd, false, null, false);
    }

    public static RemoteCommand sudo(String cmd) {
        return new RemoteCommand(cmd, true, null, false);
    }

    public RemoteCommand withTimeout(Duration timeout) {
        return new RemoteCommand(cmd, sudo, timeout, sensitive);
    }

    public RemoteCommand asSensitive() {
        return new RemoteCommand(cmd, sudo, timeout, true);
    }

    public String loggable() {
        return sensitive ? "<redacted>" : cmd;
    }
}
