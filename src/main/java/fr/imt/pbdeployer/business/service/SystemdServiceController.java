package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.CommandResult;
import fr.imt.pbdeployer.business.model.OperationContext;
import fr.imt.pbdeployer.business.model.RemoteCommand;
import fr.imt.pbdeployer.business.model.ServiceState;
import fr.imt.pbdeployer.business.model.ServiceStatus;
import fr.imt.pbdeployer.exception.RemoteCommandException;
import fr.imt.pbdeployer.exception.ServiceNotFoundException;
import fr.imt.pbdeployer.exception.ValidationException;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static fr.imt.pbdeployer.business.utils.ShellQuote.requireSafeName;

/**
 * systemd operations on a server. Uses the privileged identity until the server is locked,
 * the service account afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SystemdServiceController {

    public static final int MAX_LOG_LINES = 10_000;

    // systemctl exit status for "unit not loaded"
    private static final int EXIT_NOT_LOADED = 5;

    private final RemoteCommandExecutor executor;

    public void start(OperationContext ctx, ServerTarget target, String serviceName) {
        control(ctx, target, serviceName, "start");
    }

    public void stop(OperationContext ctx, ServerTarget target, String serviceName) {
        control(ctx, target, serviceName, "stop");
    }

    public void restart(OperationContext ctx, ServerTarget target, String serviceName) {
        control(ctx, target, serviceName, "restart");
    }

    public void enable(OperationContext ctx, ServerTarget target, String serviceName) {
        control(ctx, target, serviceName, "enable");
    }

    public boolean isActive(OperationContext ctx, ServerTarget target, String serviceName) {
        String unit = requireSafeName("service name", serviceName);
        CommandResult result = executor.run(ctx, target, target.prefersPrivileged(),
                RemoteCommand.of("systemctl is-active " + unit));
        return "active".equals(result.trimmedStdout());
    }

    /**
     * @throws ServiceNotFoundException when no such unit is installed
     */
    public ServiceStatus status(OperationContext ctx, ServerTarget target, String serviceName) {
        String unit = requireSafeName("service name", serviceName);
        boolean asPrivileged = target.prefersPrivileged();
        CommandResult result = executor.runChecked(ctx, target, asPrivileged,
                RemoteCommand.of("systemctl show " + unit + " --property=LoadState,ActiveState,MainPID --no-pager"),
                "systemctl show " + unit);

        Map<String, String> properties = parseProperties(result.stdout());
        if ("not-found".equals(properties.get("LoadState"))) {
            throw new ServiceNotFoundException(unit, target.getHost());
        }
        ServiceState state = ServiceState.fromActiveState(properties.get("ActiveState"));
        Integer pid = parsePid(properties.get("MainPID"));
        Duration uptime = null;
        if (pid != null) {
            CommandResult elapsed = executor.run(ctx, target, asPrivileged, RemoteCommand.of("ps -o etimes= -p " + pid));
            if (elapsed.isSuccess() && elapsed.trimmedStdout().matches("\\d+")) {
                uptime = Duration.ofSeconds(Long.parseLong(elapsed.trimmedStdout()));
            }
        }
        return new ServiceStatus(unit, state, pid, uptime);
    }

    /**
     * @throws ValidationException      when {@code lines} is out of range
     * @throws ServiceNotFoundException when no such unit is installed
     */
    public String tailLogs(OperationContext ctx, ServerTarget target, String serviceName, int lines) {
        if (lines < 1 || lines > MAX_LOG_LINES) {
            throw new ValidationException("lines must be between 1 and " + MAX_LOG_LINES);
        }
        String unit = requireSafeName("service name", serviceName);
        boolean asPrivileged = target.prefersPrivileged();
        CommandResult loadState = executor.runChecked(ctx, target, asPrivileged,
                RemoteCommand.of("systemctl show " + unit + " --property=LoadState --value"),
                "systemctl show " + unit);
        if ("not-found".equals(loadState.trimmedStdout())) {
            throw new ServiceNotFoundException(unit, target.getHost());
        }
        return executor.runChecked(ctx, target, asPrivileged,
                RemoteCommand.sudo("journalctl -u " + unit + " -n " + lines + " --no-pager --output=short-iso"),
                "journalctl -u " + unit).stdout();
    }

    private void control(OperationContext ctx, ServerTarget target, String serviceName, String action) {
        String unit = requireSafeName("service name", serviceName);
        CommandResult result = executor.run(ctx, target, target.prefersPrivileged(),
                RemoteCommand.sudo("systemctl " + action + " " + unit));
        if (!result.isSuccess()) {
            if (isNotFound(result)) {
                throw new ServiceNotFoundException(unit, target.getHost());
            }
            throw new RemoteCommandException("systemctl " + action + " " + unit, result.exitCode(), result.stderr());
        }
        log.info("[SERVICE] {} {} on {}", action, unit, target.getHost());
    }

    static boolean isNotFound(CommandResult result) {
        String stderr = result.stderr() == null ? "" : result.stderr().toLowerCase(Locale.ROOT);
        return result.exitCode() == EXIT_NOT_LOADED
                || stderr.contains("not found")
                || stderr.contains("not loaded")
                || stderr.contains("could not be found");
    }

    private static Map<String, String> parseProperties(String output) {
        Map<String, String> properties = new HashMap<>();
        output.lines().forEach(line -> {
            int separator = line.indexOf('=');
            if (separator > 0) {
                properties.put(line.substring(0, separator).strip(), line.substring(separator + 1).strip());
            }
        });
        return properties;
    }

    private static Integer parsePid(String value) {
        if (value == null || !value.matches("\\d+")) {
            return null;
        }
        int pid = Integer.parseInt(value);
        return pid > 0 ? pid : null;
    }
}
