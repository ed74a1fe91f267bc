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
import fr.imt.pbdeployer.infrastructure.ssh.SshConnectionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static fr.imt.pbdeployer.business.utils.ShellQuote.quote;
import static fr.imt.pbdeployer.business.utils.ShellQuote.requireSafeName;

/**
 * One-way hardening of a set up server. After a successful run the privileged identity
 * can no longer log in and every later operation goes through the service account.
 * A failed run is not reverted: the failure names the step so the remaining exposure can be assessed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityLockdownService {

    static final String DISABLE_PASSWORD_AUTH = "disable_password_auth";
    static final String DISABLE_ROOT_LOGIN = "disable_root_login";
    static final String CONFIGURE_FIREWALL = "configure_firewall";
    static final String SETUP_FAIL2BAN = "setup_fail2ban";
    static final String VERIFY_SECURITY = "verify_security";
    static final String VERIFY_APP_ACCESS = "verify_app_access";

    private static final String SSHD_CONFIG = "/etc/ssh/sshd_config";
    private static final String SSHD_DROP_IN = "/etc/ssh/sshd_config.d/00-pbdeployer.conf";

    private final ServerRepositoryPort serverRepository;
    private final RemoteCommandExecutor executor;
    private final SshConnectionPool pool;
    private final ProgressPublisherPort progressPublisher;
    private final OperationRunner operationRunner;
    private final PbDeployerProperties properties;
    private final Clock clock;

    /**
     * @throws PreconditionException when the server is already locked or not set up yet
     */
    public OperationHandle startLockdown(String serverId) {
        ServerTarget server = serverRepository.findById(serverId)
                .orElseThrow(() -> new ResourceNotFoundException("Server", serverId));
        checkPreconditions(server);
        log.info("[SECURITY] Lockdown of server {} ({}) requested", server.getName(), server.getHost());
        return operationRunner.launch(OperationKind.SERVER_SECURITY, serverId, null, ctx -> runLockdown(ctx, server));
    }

    public void runLockdown(OperationContext ctx, ServerTarget server) {
        checkPreconditions(server);
        ProgressReporter progress = new ProgressReporter(progressPublisher,
                OperationKind.SERVER_SECURITY.subscription(server.getId()), clock);

        new StepSequence("Security lockdown", progress)
                .then(DISABLE_PASSWORD_AUTH, "Disabling SSH password authentication",
                        c -> applySshdOptions(c, server, passwordOptions()))
                .then(DISABLE_ROOT_LOGIN, "Disabling SSH login as " + server.getPrivilegedUsername(),
                        c -> applySshdOptions(c, server, Map.of("PermitRootLogin", "no")))
                .then(CONFIGURE_FIREWALL, "Restricting firewall to the allowed ports", c -> configureFirewall(c, server))
                .then(SETUP_FAIL2BAN, "Installing fail2ban policy", c -> setupFail2ban(c, server))
                .then(VERIFY_SECURITY, "Verifying the new security configuration", c -> verifySecurity(c, server))
                .then(VERIFY_APP_ACCESS, "Verifying access as " + server.getUnprivilegedUsername(),
                        c -> verifyAppAccess(c, server))
                .run(ctx);

        server.setSecurityLocked(true);
        serverRepository.save(server);
        pool.evict(server, true);
        log.info("[SECURITY] Server {} is locked down", server.getHost());
    }

    private void checkPreconditions(ServerTarget server) {
        if (server.isSecurityLocked()) {
            throw new PreconditionException("Server " + server.getHost() + " is already security locked");
        }
        if (!server.isSetupComplete()) {
            throw new PreconditionException("Server " + server.getHost() + " must be set up before lockdown");
        }
    }

    private static Map<String, String> passwordOptions() {
        Map<String, String> options = new LinkedHashMap<>();
        options.put("PasswordAuthentication", "no");
        options.put("ChallengeResponseAuthentication", "no");
        options.put("PubkeyAuthentication", "yes");
        return options;
    }

    /**
     * Sets sshd options in the main file and in a drop-in read first, validates, then reloads sshd.
     * Existing sessions survive the reload.
     */
    private void applySshdOptions(OperationContext ctx, ServerTarget server, Map<String, String> options) {
        StringBuilder script = new StringBuilder()
                .append("cfg=").append(SSHD_CONFIG)
                .append(" && { [ -f \"$cfg.pbdeployer.bak\" ] || cp -p \"$cfg\" \"$cfg.pbdeployer.bak\"; }");
        options.forEach((key, value) -> {
            String line = key + " " + value;
            script.append(" && if grep -qiE '^[#[:space:]]*").append(key).append("[[:space:]]' \"$cfg\"; then ")
                    .append("sed -i -E 's/^[#[:space:]]*").append(key).append("[[:space:]].*/").append(line)
                    .append("/I' \"$cfg\"; else sed -i '1i ").append(line).append("' \"$cfg\"; fi")
                    .append(" && if [ -d /etc/ssh/sshd_config.d ]; then touch ").append(SSHD_DROP_IN)
                    .append(" && sed -i '/^").append(key).append(" /d' ").append(SSHD_DROP_IN)
                    .append(" && echo '").append(line).append("' >> ").append(SSHD_DROP_IN).append("; fi");
        });
        script.append(" && sshd -t")
                .append(" && { systemctl reload ssh 2>/dev/null || systemctl reload sshd; }");
        executor.runChecked(ctx, server, true, RemoteCommand.sudo(script.toString()), "update sshd configuration");
    }

    private void configureFirewall(OperationContext ctx, ServerTarget server) {
        executor.runChecked(ctx, server, true,
                RemoteCommand.sudo(FirewallRules.replaceWithAllowList(server.getPort(),
                        properties.getSecurity().getAllowedPorts())),
                "configure firewall allow-list");
    }

    private void setupFail2ban(OperationContext ctx, ServerTarget server) {
        String jail = buildJailConfig(server.getPort());
        String script = "{ command -v fail2ban-client >/dev/null 2>&1 || "
                + "DEBIAN_FRONTEND=noninteractive apt-get install -y -q fail2ban; }"
                + " && printf '%s' " + quote(jail) + " > /etc/fail2ban/jail.local"
                + " && systemctl enable fail2ban"
                + " && systemctl restart fail2ban";
        executor.runChecked(ctx, server, true,
                RemoteCommand.sudo(script).withTimeout(properties.getSetup().getPackageTimeout()),
                "configure fail2ban");
    }

    String buildJailConfig(int sshPort) {
        PbDeployerProperties.Security security = properties.getSecurity();
        StringBuilder jail = new StringBuilder()
                .append("[DEFAULT]\n")
                .append("bantime = ").append(security.getFail2banBanTime().toSeconds()).append("\n")
                .append("findtime = ").append(security.getFail2banFindTime().toSeconds()).append("\n")
                .append("maxretry = ").append(security.getFail2banMaxRetries()).append("\n")
                .append("backend = systemd\n")
                .append("ignoreip = 127.0.0.1/8 ::1\n");
        for (String service : security.getFail2banServices()) {
            jail.append("\n[").append(requireSafeName("fail2ban jail", service)).append("]\n")
                    .append("enabled = true\n");
            if ("sshd".equals(service)) {
                jail.append("port = ").append(sshPort).append("\n");
            }
        }
        return jail.toString();
    }

    private void verifySecurity(OperationContext ctx, ServerTarget server) {
        String effective = executor.runChecked(ctx, server, true, RemoteCommand.sudo("sshd -T"),
                "read effective sshd configuration").stdout().toLowerCase(Locale.ROOT);
        requireSetting(effective, "passwordauthentication no");
        requireSetting(effective, "permitrootlogin no");

        String firewall = executor.runChecked(ctx, server, true, RemoteCommand.sudo("ufw status"),
                "read firewall status").stdout();
        if (!firewall.contains("Status: active")) {
            throw new RemoteCommandException("firewall verification", 1, "ufw is not active");
        }

        CommandResult fail2ban = executor.run(ctx, server, true, RemoteCommand.sudo("systemctl is-active fail2ban"));
        if (!"active".equals(fail2ban.trimmedStdout())) {
            throw new RemoteCommandException("fail2ban verification", fail2ban.exitCode(),
                    "fail2ban is " + fail2ban.trimmedStdout());
        }
    }

    private static void requireSetting(String effectiveConfig, String setting) {
        if (!effectiveConfig.lines().anyMatch(line -> line.strip().equals(setting))) {
            throw new RemoteCommandException("sshd verification", 1, "expected '" + setting + "' to be in effect");
        }
    }

    private void verifyAppAccess(OperationContext ctx, ServerTarget server) {
        String user = server.getUnprivilegedUsername();
        CommandResult whoami = executor.runChecked(ctx, server, false, RemoteCommand.of("whoami"), "login as " + user);
        if (!user.equals(whoami.trimmedStdout())) {
            throw new RemoteCommandException("login as " + user, 1, "logged in as " + whoami.trimmedStdout());
        }
        executor.runChecked(ctx, server, false, RemoteCommand.sudo("systemctl --version"),
                "sudo systemctl as " + user);
    }
}
