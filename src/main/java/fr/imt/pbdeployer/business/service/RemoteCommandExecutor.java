package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.CommandResult;
import fr.imt.pbdeployer.business.model.OperationContext;
import fr.imt.pbdeployer.business.model.RemoteCommand;
import fr.imt.pbdeployer.business.utils.ShellQuote;
import fr.imt.pbdeployer.configuration.PbDeployerProperties;
import fr.imt.pbdeployer.exception.ConnectionException;
import fr.imt.pbdeployer.exception.RemoteCommandException;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import fr.imt.pbdeployer.infrastructure.ssh.ConnectionHandle;
import fr.imt.pbdeployer.infrastructure.ssh.SshConnectionPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Runs commands and transfers files on a server through a pooled connection.
 * The connection is leased for the duration of a single call.
 */
@Slf4j
@Service
public class RemoteCommandExecutor {

    private static final String ROOT = "root";

    private final SshConnectionPool pool;
    private final Duration defaultTimeout;

    public RemoteCommandExecutor(SshConnectionPool pool, PbDeployerProperties properties) {
        this.pool = pool;
        this.defaultTimeout = properties.getSsh().getCommandTimeout();
    }

    /**
     * Runs a command. A nonzero exit code is returned, not thrown.
     */
    public CommandResult run(OperationContext ctx, ServerTarget target, boolean asPrivileged, RemoteCommand command) {
        ctx.checkActive();
        Duration timeout = ctx.bound(command.timeout() != null ? command.timeout() : defaultTimeout);
        try (ConnectionHandle handle = pool.acquire(target, asPrivileged)) {
            String line = wrap(command, handle.key().username());
            log.debug("[EXEC] {} $ {}", handle.key(), command.loggable());
            try {
                CommandResult result = handle.session().exec(line, timeout);
                if (!result.isSuccess()) {
                    log.debug("[EXEC] {} exit {}: {}", handle.key(), result.exitCode(), result.stderr().strip());
                }
                return result;
            } catch (ConnectionException e) {
                handle.markBroken();
                throw e;
            }
        }
    }

    /**
     * Runs a command and turns a nonzero exit code into a {@link RemoteCommandException}.
     */
    public CommandResult runChecked(OperationContext ctx, ServerTarget target, boolean asPrivileged,
                                    RemoteCommand command, String description) {
        CommandResult result = run(ctx, target, asPrivileged, command);
        if (!result.isSuccess()) {
            String output = result.stderr() == null || result.stderr().isBlank() ? result.stdout() : result.stderr();
            throw new RemoteCommandException(description, result.exitCode(), output);
        }
        return result;
    }

    public void upload(OperationContext ctx, ServerTarget target, boolean asPrivileged,
                       byte[] content, String remotePath) {
        ctx.checkActive();
        try (ConnectionHandle handle = pool.acquire(target, asPrivileged)) {
            log.debug("[EXEC] {} upload {} bytes to {}", handle.key(), content.length, remotePath);
            try {
                handle.session().upload(content, remotePath);
            } catch (ConnectionException e) {
                handle.markBroken();
                throw e;
            }
        }
    }

    public byte[] download(OperationContext ctx, ServerTarget target, boolean asPrivileged, String remotePath) {
        ctx.checkActive();
        try (ConnectionHandle handle = pool.acquire(target, asPrivileged)) {
            try {
                return handle.session().download(remotePath);
            } catch (ConnectionException e) {
                handle.markBroken();
                throw e;
            }
        }
    }

    static String wrap(RemoteCommand command, String username) {
        if (!command.sudo() || ROOT.equals(username)) {
            return command.cmd();
        }
        return "sudo -n sh -c " + ShellQuote.quote(command.cmd());
    }
}
