package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.AutoFixResult;
import fr.imt.pbdeployer.business.model.Diagnostic;
import fr.imt.pbdeployer.business.model.DiagnosticReport;
import fr.imt.pbdeployer.business.model.DiagnosticStatus;
import fr.imt.pbdeployer.business.model.OverallHealth;
import fr.imt.pbdeployer.business.model.SafeRemediation;
import fr.imt.pbdeployer.business.port.ServerRepositoryPort;
import fr.imt.pbdeployer.configuration.PbDeployerProperties;
import fr.imt.pbdeployer.exception.AuthenticationException;
import fr.imt.pbdeployer.exception.ConnectionException;
import fr.imt.pbdeployer.exception.PbDeployerException;
import fr.imt.pbdeployer.exception.ResourceNotFoundException;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import fr.imt.pbdeployer.infrastructure.ssh.LocalSshEnvironment;
import fr.imt.pbdeployer.infrastructure.ssh.RemoteSession;
import fr.imt.pbdeployer.infrastructure.ssh.SessionFactory;
import fr.imt.pbdeployer.infrastructure.ssh.TcpProbe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Explains why a server cannot be reached or logged into, and repairs what is safe to repair locally.
 * <p>
 * Each authentication check makes a single attempt through the {@link SessionFactory}, outside the pool
 * and its retries. The privileged login of a locked server is never attempted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagnosticsService {

    static final String NETWORK_CONNECTIVITY = "network_connectivity";
    static final String SSH_SERVICE = "ssh_service";
    static final String AUTH_PRIVILEGED = "auth_privileged";
    static final String AUTH_UNPRIVILEGED = "auth_unprivileged";
    static final String LOCAL_SSH_DIRECTORY = "local_ssh_directory";
    static final String PRIVATE_KEY = "private_key";
    static final String KNOWN_HOSTS = "known_hosts";
    static final String SSH_AGENT = "ssh_agent";
    static final String INTRUSION_BAN_SUSPECTED = "intrusion_ban_suspected";

    private final ServerRepositoryPort serverRepository;
    private final SessionFactory sessionFactory;
    private final TcpProbe tcpProbe;
    private final LocalSshEnvironment localEnvironment;
    private final PbDeployerProperties properties;
    private final Clock clock;

    public DiagnosticReport diagnose(String serverId) {
        return diagnose(findServer(serverId));
    }

    public DiagnosticReport diagnose(ServerTarget server) {
        Instant startedAt = clock.instant();
        long start = System.nanoTime();
        log.info("[SSH-DIAG] Diagnosing {}:{}", server.getHost(), server.getPort());

        Run run = new Run(server);
        run.checkNetwork();
        if (run.reachable) {
            run.checkSshService();
            run.checkPrivilegedLogin();
            run.checkUnprivilegedLogin();
        }
        run.checkSshDirectory();
        run.checkPrivateKeys();
        run.checkKnownHosts();
        run.checkAgent();
        run.checkBanSignature();

        DiagnosticReport report = summarize(server.getId(), run.diagnostics, startedAt,
                Duration.ofNanos(System.nanoTime() - start));
        log.info("[SSH-DIAG] {} is {} ({} errors, {} warnings)", server.getHost(), report.getOverall(),
                report.getErrorCount(), report.getWarningCount());
        return report;
    }

    /**
     * Applies the safe remediations proposed by a fresh diagnosis, then diagnoses again.
     * Firewall and ban state on the server are never touched.
     */
    public AutoFixResult autoFix(String serverId) {
        ServerTarget server = findServer(serverId);
        DiagnosticReport before = diagnose(server);

        Set<SafeRemediation> remediations = before.getDiagnostics().stream()
                .map(Diagnostic::getRemediation)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));

        List<SafeRemediation> applied = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (SafeRemediation remediation : remediations) {
            try {
                apply(remediation, server);
                applied.add(remediation);
            } catch (RuntimeException e) {
                log.warn("[SSH-DIAG] {} failed for {}: {}", remediation, server.getHost(), e.getMessage());
                failed.add(remediation + ": " + e.getMessage());
            }
        }
        log.info("[SSH-DIAG] Auto-fix of {} applied {}", server.getHost(), applied);
        return new AutoFixResult(applied, failed, diagnose(server));
    }

    private void apply(SafeRemediation remediation, ServerTarget server) {
        switch (remediation) {
            case CREATE_SSH_DIRECTORY -> localEnvironment.createSshDirectory();
            case FIX_SSH_DIRECTORY_PERMISSIONS -> localEnvironment.restrictSshDirectory();
            case FIX_KEY_PERMISSIONS -> localEnvironment.restrictKeyPermissions(server.getManualKeyPath());
            case ACCEPT_HOST_KEY -> sessionFactory.acceptHostKey(server.getHost(), server.getPort());
        }
    }

    static DiagnosticReport summarize(String serverId, List<Diagnostic> diagnostics, Instant startedAt,
                                      Duration duration) {
        int errors = (int) diagnostics.stream().filter(d -> d.getStatus() == DiagnosticStatus.ERROR).count();
        int warnings = (int) diagnostics.stream().filter(d -> d.getStatus() == DiagnosticStatus.WARNING).count();
        OverallHealth overall = errors > 0
                ? OverallHealth.ERROR
                : warnings > 0 ? OverallHealth.DEGRADED : OverallHealth.HEALTHY;

        Set<String> suggestions = new LinkedHashSet<>();
        diagnostics.stream()
                .map(Diagnostic::getSuggestion)
                .filter(s -> s != null && !s.isBlank())
                .forEach(suggestions::add);

        return DiagnosticReport.builder()
                .serverId(serverId)
                .diagnostics(List.copyOf(diagnostics))
                .overall(overall)
                .suggestions(List.copyOf(suggestions))
                .errorCount(errors)
                .warningCount(warnings)
                .canAutoFix(diagnostics.stream().anyMatch(Diagnostic::isAutoFixable))
                .startedAt(startedAt)
                .duration(duration)
                .build();
    }

    private ServerTarget findServer(String serverId) {
        return serverRepository.findById(serverId)
                .orElseThrow(() -> new ResourceNotFoundException("Server", serverId));
    }

    /**
     * State shared by the checks of one diagnosis.
     */
    private final class Run {

        private final ServerTarget server;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private boolean reachable;
        private boolean refusedAfterReachable;
        private String localAddress;

        Run(ServerTarget server) {
            this.server = server;
        }

        void checkNetwork() {
            TcpProbe.Result result = tcpProbe.connect(server.getHost(), server.getPort(),
                    properties.getDiagnostics().getNetworkTimeout());
            reachable = result.reachable();
            localAddress = result.localAddress();
            Diagnostic.DiagnosticBuilder diagnostic = Diagnostic.builder()
                    .step(NETWORK_CONNECTIVITY)
                    .detail("address", server.getHost() + ":" + server.getPort())
                    .detail("latency_ms", String.valueOf(result.latency().toMillis()))
                    .duration(result.latency());
            if (reachable) {
                add(diagnostic.status(DiagnosticStatus.SUCCESS)
                        .message("TCP connection established in " + result.latency().toMillis() + " ms"));
            } else {
                add(diagnostic.status(DiagnosticStatus.ERROR)
                        .message(result.refused()
                                ? "Connection refused by " + server.getHost() + ":" + server.getPort()
                                : "Cannot reach " + server.getHost() + ":" + server.getPort() + ": " + result.error())
                        .detail("refused", String.valueOf(result.refused()))
                        .suggestion("Check that the server is running, the address and port are right"
                                + " and no firewall blocks port " + server.getPort()));
            }
        }

        void checkSshService() {
            TcpProbe.Result result = tcpProbe.readBanner(server.getHost(), server.getPort(),
                    properties.getDiagnostics().getBannerTimeout());
            Diagnostic.DiagnosticBuilder diagnostic = Diagnostic.builder()
                    .step(SSH_SERVICE)
                    .duration(result.latency());
            if (result.banner() != null && result.banner().startsWith("SSH-")) {
                add(diagnostic.status(DiagnosticStatus.SUCCESS)
                        .message("SSH daemon answered")
                        .detail("banner", result.banner()));
            } else if (result.banner() != null) {
                add(diagnostic.status(DiagnosticStatus.WARNING)
                        .message("Port " + server.getPort() + " answered with something other than SSH")
                        .detail("banner", result.banner())
                        .suggestion("Check which service listens on port " + server.getPort()));
            } else {
                noteRefusal(result.refused());
                add(diagnostic.status(DiagnosticStatus.ERROR)
                        .message("No SSH banner received: " + result.error())
                        .suggestion("Check the SSH daemon on the server: systemctl status ssh"));
            }
        }

        void checkPrivilegedLogin() {
            String username = server.getPrivilegedUsername();
            if (server.isSecurityLocked()) {
                add(Diagnostic.builder()
                        .step(AUTH_PRIVILEGED)
                        .status(DiagnosticStatus.SUCCESS)
                        .message("Login as " + username + " is disabled by the security lockdown")
                        .detail("username", username)
                        .detail("state", "expected_disabled")
                        .duration(Duration.ZERO));
                return;
            }
            checkLogin(AUTH_PRIVILEGED, username);
        }

        void checkUnprivilegedLogin() {
            String username = server.getUnprivilegedUsername();
            if (!server.isSetupComplete()) {
                add(Diagnostic.builder()
                        .step(AUTH_UNPRIVILEGED)
                        .status(DiagnosticStatus.SUCCESS)
                        .message("Not checked: " + username + " is created by the server setup")
                        .detail("username", username)
                        .detail("state", "not_provisioned")
                        .duration(Duration.ZERO));
                return;
            }
            checkLogin(AUTH_UNPRIVILEGED, username);
        }

        private void checkLogin(String step, String username) {
            long start = System.nanoTime();
            Diagnostic.DiagnosticBuilder diagnostic = Diagnostic.builder()
                    .step(step)
                    .detail("username", username);
            try {
                RemoteSession session = sessionFactory.open(server, username);
                session.close();
                add(diagnostic.status(DiagnosticStatus.SUCCESS)
                        .message("Authenticated as " + username)
                        .duration(elapsedSince(start)));
            } catch (AuthenticationException e) {
                add(diagnostic.status(DiagnosticStatus.ERROR)
                        .message("Authentication as " + username + " failed: " + e.getMessage())
                        .suggestion("Check that your public key is in ~" + username
                                + "/.ssh/authorized_keys on the server and loaded in your agent")
                        .duration(elapsedSince(start)));
            } catch (ConnectionException e) {
                noteRefusal(e.isRefused());
                add(diagnostic.status(DiagnosticStatus.ERROR)
                        .message("Connection failed while logging in as " + username + ": " + e.getMessage())
                        .detail("refused", String.valueOf(e.isRefused()))
                        .suggestion("Check the SSH daemon logs on the server: journalctl -u ssh -n 50")
                        .duration(elapsedSince(start)));
            } catch (PbDeployerException e) {
                add(diagnostic.status(DiagnosticStatus.ERROR)
                        .message("Login as " + username + " failed: " + e.getMessage())
                        .duration(elapsedSince(start)));
            }
        }

        void checkSshDirectory() {
            long start = System.nanoTime();
            LocalSshEnvironment.DirectoryState state = localEnvironment.inspectSshDirectory();
            Diagnostic.DiagnosticBuilder diagnostic = Diagnostic.builder()
                    .step(LOCAL_SSH_DIRECTORY)
                    .detail("path", state.path().toString());
            if (!state.exists()) {
                diagnostic.status(DiagnosticStatus.ERROR)
                        .message(state.path() + " does not exist")
                        .suggestion("Create it: mkdir -p " + state.path() + " && chmod 700 " + state.path())
                        .remediation(SafeRemediation.CREATE_SSH_DIRECTORY);
            } else if (state.tooOpen()) {
                diagnostic.status(DiagnosticStatus.WARNING)
                        .message(state.path() + " is readable by other users")
                        .detail("permissions", state.permissions())
                        .suggestion("Restrict it: chmod 700 " + state.path())
                        .remediation(SafeRemediation.FIX_SSH_DIRECTORY_PERMISSIONS);
            } else {
                diagnostic.status(DiagnosticStatus.SUCCESS)
                        .message(state.path() + " is private");
            }
            add(diagnostic.duration(elapsedSince(start)));
        }

        void checkPrivateKeys() {
            long start = System.nanoTime();
            List<LocalSshEnvironment.KeyFile> keys = localEnvironment.privateKeys(server.getManualKeyPath());
            Diagnostic.DiagnosticBuilder diagnostic = Diagnostic.builder().step(PRIVATE_KEY);
            String manualKey = server.getManualKeyPath();
            boolean manualMissing = manualKey != null && !manualKey.isBlank() && !localEnvironment.keyExists(manualKey);
            List<LocalSshEnvironment.KeyFile> tooOpen = keys.stream()
                    .filter(LocalSshEnvironment.KeyFile::tooOpen)
                    .collect(Collectors.toList());
            keys.forEach(k -> diagnostic.detail(k.path().getFileName().toString(),
                    k.permissions() == null ? "present" : k.permissions()));

            if (manualMissing) {
                diagnostic.status(DiagnosticStatus.ERROR)
                        .message("Configured key " + manualKey + " does not exist")
                        .suggestion("Fix the key path of server " + server.getName() + " or generate the key");
            } else if (keys.isEmpty()) {
                diagnostic.status(server.isUseSshAgent() ? DiagnosticStatus.WARNING : DiagnosticStatus.ERROR)
                        .message("No private key found in " + localEnvironment.sshDirectory())
                        .suggestion("Generate a key pair: ssh-keygen -t ed25519");
            } else if (!tooOpen.isEmpty()) {
                diagnostic.status(DiagnosticStatus.WARNING)
                        .message(tooOpen.size() + " private key(s) readable by other users")
                        .suggestion("Restrict them: chmod 600 ~/.ssh/id_* && chmod 644 ~/.ssh/*.pub")
                        .remediation(SafeRemediation.FIX_KEY_PERMISSIONS);
            } else {
                diagnostic.status(DiagnosticStatus.SUCCESS)
                        .message("Found " + keys.size() + " private key(s)");
            }
            add(diagnostic.duration(elapsedSince(start)));
        }

        void checkKnownHosts() {
            long start = System.nanoTime();
            Diagnostic.DiagnosticBuilder diagnostic = Diagnostic.builder()
                    .step(KNOWN_HOSTS)
                    .detail("file", properties.getSsh().getKnownHostsFile());
            if (localEnvironment.isHostKnown(server.getHost(), server.getPort())) {
                diagnostic.status(DiagnosticStatus.SUCCESS)
                        .message("Host key of " + server.getHost() + " is known");
            } else {
                String keyscan = server.getPort() == 22
                        ? "ssh-keyscan -H " + server.getHost()
                        : "ssh-keyscan -H -p " + server.getPort() + " " + server.getHost();
                diagnostic.status(DiagnosticStatus.WARNING)
                        .message(localEnvironment.knownHostsExists()
                                ? "Host key of " + server.getHost() + " is not in known_hosts"
                                : "known_hosts file does not exist")
                        .suggestion("Record the host key: " + keyscan + " >> ~/.ssh/known_hosts");
                if (reachable) {
                    diagnostic.remediation(SafeRemediation.ACCEPT_HOST_KEY);
                }
            }
            add(diagnostic.duration(elapsedSince(start)));
        }

        void checkAgent() {
            long start = System.nanoTime();
            Diagnostic.DiagnosticBuilder diagnostic = Diagnostic.builder().step(SSH_AGENT);
            if (!server.isUseSshAgent()) {
                add(diagnostic.status(DiagnosticStatus.SUCCESS)
                        .message("SSH agent not used for this server")
                        .duration(elapsedSince(start)));
                return;
            }
            LocalSshEnvironment.AgentState agent = localEnvironment.inspectAgent();
            if (agent.socket() != null) {
                diagnostic.detail("socket", agent.socket());
            }
            if (agent.error() != null) {
                diagnostic.status(DiagnosticStatus.WARNING)
                        .message("SSH agent unavailable: " + agent.error())
                        .suggestion("Start an agent and load your key: eval $(ssh-agent) && ssh-add");
            } else if (agent.identities() == 0) {
                diagnostic.status(DiagnosticStatus.WARNING)
                        .message("SSH agent holds no keys")
                        .suggestion("Load your key: ssh-add ~/.ssh/id_ed25519");
            } else {
                diagnostic.status(DiagnosticStatus.SUCCESS)
                        .message("SSH agent offers " + agent.identities() + " key(s)")
                        .detail("identities", String.valueOf(agent.identities()));
            }
            add(diagnostic.duration(elapsedSince(start)));
        }

        void checkBanSignature() {
            if (!refusedAfterReachable) {
                return;
            }
            String address = localAddress == null ? "<your-ip>" : localAddress;
            add(Diagnostic.builder()
                    .step(INTRUSION_BAN_SUSPECTED)
                    .status(DiagnosticStatus.ERROR)
                    .message("Connections were refused right after the port was reachable,"
                            + " this address is probably banned by fail2ban")
                    .detail("client_address", address)
                    .suggestion("From a console on the server: fail2ban-client set sshd unbanip " + address)
                    .duration(Duration.ZERO));
        }

        private void noteRefusal(boolean refused) {
            if (refused && reachable) {
                refusedAfterReachable = true;
            }
        }

        private void add(Diagnostic.DiagnosticBuilder diagnostic) {
            Diagnostic built = diagnostic.build();
            log.debug("[SSH-DIAG] {} {}: {}", built.getStep(), built.getStatus(), built.getMessage());
            diagnostics.add(built);
        }

        private Duration elapsedSince(long start) {
            return Duration.ofNanos(System.nanoTime() - start);
        }
    }
}
