package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.CommandResult;
import fr.imt.pbdeployer.business.model.OperationContext;
import fr.imt.pbdeployer.business.model.OperationHandle;
import fr.imt.pbdeployer.business.model.OperationKind;
import fr.imt.pbdeployer.business.model.RemoteCommand;
import fr.imt.pbdeployer.business.port.ProgressPublisherPort;
import fr.imt.pbdeployer.business.port.ServerRepositoryPort;
import fr.imt.pbdeployer.configuration.PbDeployerProperties;
import fr.imt.pbdeployer.exception.PreconditionException;
import fr.imt.pbdeployer.exception.RemoteCommandException;
import fr.imt.pbdeployer.exception.ResourceNotFoundException;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static fr.imt.pbdeployer.business.utils.ShellQuote.quote;
import static fr.imt.pbdeployer.business.utils.ShellQuote.requireSafeName;
import static fr.imt.pbdeployer.business.utils.ShellQuote.requireSafePath;

/**
 * Prepares a fresh server as the privileged identity: service account, packages, directories, keys.
 * Every step can be re-run on a partially set up server.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServerSetupService {

    static final String CREATE_USER = "create_user";
    static final String SETUP_SSH_KEYS = "setup_ssh_keys";
    static final String INSTALL_PACKAGES = "install_packages";
    static final String SETUP_DIRECTORIES = "setup_directories";
    static final String CONFIGURE_FIREWALL = "configure_firewall";
    static final String VERIFY_APP_USER = "verify_app_user";

    private final ServerRepositoryPort serverRepository;
    private final RemoteCommandExecutor executor;
    private final ProgressPublisherPort progressPublisher;
    private final OperationRunner operationRunner;
    private final PbDeployerProperties properties;
    private final Clock clock;

    /**
     * Validates the request and starts the setup in the background.
     *
     * @throws PreconditionException when the server is already set up or locked
     */
    public OperationHandle startSetup(String serverId) {
        ServerTarget server = serverRepository.findById(serverId)
                .orElseThrow(() -> new ResourceNotFoundException("Server", serverId));
        checkPreconditions(server);
        log.info("[SETUP] Setup of server {} ({}) requested", server.getName(), server.getHost());
        return operationRunner.launch(OperationKind.SERVER_SETUP, serverId, null, ctx -> runSetup(ctx, server));
    }

    public void runSetup(OperationContext ctx, ServerTarget server) {
        checkPreconditions(server);
        PbDeployerProperties.Setup setup = properties.getSetup();
        ProgressReporter progress = new ProgressReporter(progressPublisher,
                OperationKind.SERVER_SETUP.subscription(server.getId()), clock);

        StepSequence sequence = new StepSequence("Server setup", progress)
                .then(CREATE_USER, "Creating user " + server.getUnprivilegedUsername(), c -> createUser(c, server))
                .then(SETUP_SSH_KEYS, "Installing authorized SSH keys", c -> installSshKeys(c, server))
                .then(INSTALL_PACKAGES, "Installing required packages", c -> installPackages(c, server))
                .then(SETUP_DIRECTORIES, "Creating application directories", c -> createDirectories(c, server));
        if (setup.isConfigureFirewall()) {
            sequence.then(CONFIGURE_FIREWALL, "Configuring basic firewall", c -> configureFirewall(c, server));
        }
        sequence.then(VERIFY_APP_USER, "Verifying login as " + server.getUnprivilegedUsername(),
                c -> verifyAppUser(c, server));

        sequence.run(ctx);

        server.setSetupComplete(true);
        serverRepository.save(server);
        log.info("[SETUP] Server {} is set up", server.getHost());
    }

    private void checkPreconditions(ServerTarget server) {
        if (server.isSetupComplete()) {
            throw new PreconditionException("Server " + server.getHost() + " is already set up");
        }
        if (server.isSecurityLocked()) {
            throw new PreconditionException("Server " + server.getHost()
                    + " is security locked, setup needs the privileged account");
        }
    }

    private void createUser(OperationContext ctx, ServerTarget server) {
        PbDeployerProperties.Setup setup = properties.getSetup();
        String user = requireSafeName("username", server.getUnprivilegedUsername());

        CommandResult existing = root(ctx, server, "id -u " + user);
        if (existing.isSuccess()) {
            log.info("[SETUP] User {} already exists on {}", user, server.getHost());
        } else {
            rootChecked(ctx, server, "useradd -m -s " + quote(setup.getShell()) + " " + user, "create user " + user);
        }
        for (String group : setup.getGroups()) {
            rootChecked(ctx, server, "usermod -aG " + requireSafeName("group", group) + " " + user,
                    "add " + user + " to group " + group);
        }

        String sudoers = "/etc/sudoers.d/pbdeployer-" + user;
        // files with a dot are ignored by #includedir, so the draft is inert until validated
        String draft = sudoers + ".new";
        rootChecked(ctx, server,
                "printf '%s\\n' " + quote(user + " " + setup.getSudoRule()) + " > " + draft
                        + " && visudo -cf " + draft
                        + " && chmod 440 " + draft
                        + " && mv " + draft + " " + sudoers,
                "install sudoers rule for " + user);
    }

    private void installSshKeys(OperationContext ctx, ServerTarget server) {
        String user = requireSafeName("username", server.getUnprivilegedUsername());
        String admin = requireSafeName("username", server.getPrivilegedUsername());

        StringBuilder script = new StringBuilder()
                .append("home=$(getent passwd ").append(user).append(" | cut -d: -f6)")
                .append(" && install -d -m 700 -o ").append(user).append(" -g ").append(user).append(" \"$home/.ssh\"")
                .append(" && keys=\"$home/.ssh/authorized_keys\" && touch \"$keys\"")
                .append(" && if [ -f ~").append(admin).append("/.ssh/authorized_keys ]; then cat ~")
                .append(admin).append("/.ssh/authorized_keys >> \"$keys\"; fi");
        for (String key : properties.getSetup().getPublicKeys()) {
            script.append(" && printf '%s\\n' ").append(quote(key.strip())).append(" >> \"$keys\"");
        }
        script.append(" && sed -i '/^[[:space:]]*$/d' \"$keys\"")
                .append(" && sort -u -o \"$keys\" \"$keys\"")
                .append(" && chown ").append(user).append(":").append(user).append(" \"$keys\"")
                .append(" && chmod 600 \"$keys\"")
                .append(" && test -s \"$keys\"");
        rootChecked(ctx, server, script.toString(), "install authorized keys for " + user);
    }

    private void installPackages(OperationContext ctx, ServerTarget server) {
        PbDeployerProperties.Setup setup = properties.getSetup();
        String packages = setup.getPackages().stream()
                .map(p -> requireSafeName("package", p))
                .collect(Collectors.joining(" "));
        if (packages.isEmpty()) {
            return;
        }

        CommandResult probe = rootChecked(ctx, server,
                "for p in " + packages + "; do dpkg -s \"$p\" >/dev/null 2>&1 || echo \"$p\"; done",
                "check installed packages");
        List<String> missing = Arrays.stream(probe.trimmedStdout().split("\\s+"))
                .filter(p -> !p.isBlank())
                .toList();
        if (missing.isEmpty()) {
            log.info("[SETUP] All required packages already present on {}", server.getHost());
            return;
        }

        log.info("[SETUP] Installing {} on {}", missing, server.getHost());
        String install = "export DEBIAN_FRONTEND=noninteractive && apt-get update -q && apt-get install -y -q "
                + String.join(" ", missing);
        executor.runChecked(ctx, server, true,
                RemoteCommand.sudo(install).withTimeout(setup.getPackageTimeout()),
                "install packages " + missing);
    }

    private void createDirectories(OperationContext ctx, ServerTarget server) {
        String user = requireSafeName("username", server.getUnprivilegedUsername());
        List<String> commands = new ArrayList<>();
        for (String directory : properties.getSetup().getDirectories()) {
            String path = requireSafePath("directory", directory);
            commands.add("mkdir -p " + path + " && chown " + user + ":" + user + " " + path + " && chmod 755 " + path);
        }
        if (!commands.isEmpty()) {
            rootChecked(ctx, server, String.join(" && ", commands), "create application directories");
        }
    }

    private void configureFirewall(OperationContext ctx, ServerTarget server) {
        rootChecked(ctx, server,
                FirewallRules.allow(server.getPort(), properties.getSecurity().getAllowedPorts()),
                "configure firewall");
    }

    private void verifyAppUser(OperationContext ctx, ServerTarget server) {
        String user = server.getUnprivilegedUsername();
        CommandResult whoami = executor.runChecked(ctx, server, false, RemoteCommand.of("whoami"), "login as " + user);
        if (!user.equals(whoami.trimmedStdout())) {
            throw new RemoteCommandException("login as " + user, 1, "logged in as " + whoami.trimmedStdout());
        }
        executor.runChecked(ctx, server, false, RemoteCommand.sudo("true"), "passwordless sudo for " + user);
    }

    private CommandResult root(OperationContext ctx, ServerTarget server, String command) {
        return executor.run(ctx, server, true, RemoteCommand.sudo(command));
    }

    private CommandResult rootChecked(OperationContext ctx, ServerTarget server, String command, String description) {
        return executor.runChecked(ctx, server, true, RemoteCommand.sudo(command), description);
    }
}
