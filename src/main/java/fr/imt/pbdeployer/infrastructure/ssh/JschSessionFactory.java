package fr.imt.pbdeployer.infrastructure.ssh;

import com.jcraft.jsch.AgentIdentityRepository;
import com.jcraft.jsch.AgentProxyException;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.SSHAgentConnector;
import com.jcraft.jsch.Session;
import fr.imt.pbdeployer.configuration.PbDeployerProperties;
import fr.imt.pbdeployer.exception.AuthenticationException;
import fr.imt.pbdeployer.exception.ConnectionException;
import fr.imt.pbdeployer.exception.PbDeployerException;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSch backed sessions. Public key authentication only: the SSH agent first, then the
 * server's private key file when one is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JschSessionFactory implements SessionFactory {

    private final PbDeployerProperties properties;

    @Override
    public RemoteSession open(ServerTarget target, String username) {
        String keyPath = target.getManualKeyPath();
        boolean hasKeyFile = keyPath != null && !keyPath.isBlank();

        if (target.isUseSshAgent()) {
            try {
                return connect(agentClient(), target, username);
            } catch (AuthenticationException e) {
                if (!hasKeyFile) {
                    throw e;
                }
                log.info("[SSH] Agent authentication failed for {}@{}, trying key file", username, target.getHost());
            }
        }
        if (!hasKeyFile) {
            throw new AuthenticationException("No SSH agent or private key configured for " + target.getHost());
        }
        return connect(keyFileClient(keyPath), target, username);
    }

    @Override
    public void acceptHostKey(String host, int port) {
        Path knownHosts = Path.of(properties.getSsh().getKnownHostsFile());
        try {
            Files.createDirectories(knownHosts.getParent());
            if (Files.notExists(knownHosts)) {
                Files.createFile(knownHosts);
            }
        } catch (IOException e) {
            throw new ConnectionException("Cannot prepare " + knownHosts, e);
        }

        JSch jsch = new JSch();
        Session session = null;
        try {
            jsch.setKnownHosts(knownHosts.toString());
            session = jsch.getSession("hostkey-probe", host, port);
            session.setConfig("StrictHostKeyChecking", "no");
            session.setConfig("PreferredAuthentications", "none");
            session.connect((int) properties.getSsh().getConnectTimeout().toMillis());
        } catch (JSchException e) {
            // key exchange completes before authentication, so the key is already stored
            if (session == null || session.getHostKey() == null) {
                throw classify(e, host, port, "hostkey-probe");
            }
            log.debug("[SSH] Host key probe of {} ended with: {}", host, e.getMessage());
        } finally {
            if (session != null) {
                session.disconnect();
            }
        }
        log.info("[SSH] Recorded host key of {}:{} in {}", host, port, knownHosts);
    }

    private RemoteSession connect(JSch jsch, ServerTarget target, String username) {
        PbDeployerProperties.Ssh ssh = properties.getSsh();
        try {
            if (Files.exists(Path.of(ssh.getKnownHostsFile()))) {
                jsch.setKnownHosts(ssh.getKnownHostsFile());
            }
            Session session = jsch.getSession(username, target.getHost(), target.getPort());
            session.setConfig("StrictHostKeyChecking", ssh.getStrictHostKeyChecking());
            session.setConfig("PreferredAuthentications", "publickey");
            session.setServerAliveInterval(ssh.getServerAliveInterval() * 1000);
            session.connect((int) ssh.getConnectTimeout().toMillis());
            log.debug("[SSH] Authenticated {}@{}:{}", username, target.getHost(), target.getPort());
            return new JschRemoteSession(session);
        } catch (JSchException e) {
            throw classify(e, target.getHost(), target.getPort(), username);
        }
    }

    private JSch agentClient() {
        JSch jsch = new JSch();
        try {
            jsch.setIdentityRepository(new AgentIdentityRepository(new SSHAgentConnector()));
        } catch (AgentProxyException e) {
            throw new AuthenticationException("SSH agent is not available", e);
        }
        return jsch;
    }

    private JSch keyFileClient(String keyPath) {
        JSch jsch = new JSch();
        try {
            jsch.addIdentity(expandHome(keyPath));
        } catch (JSchException e) {
            throw new AuthenticationException("Cannot load private key " + keyPath, e);
        }
        return jsch;
    }

    static PbDeployerException classify(JSchException e, String host, int port, String username) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase();
        Throwable cause = e.getCause();
        if (message.contains("auth fail") || message.contains("auth cancel") || message.contains("userauth")) {
            return new AuthenticationException("Authentication rejected for " + username + "@" + host, e);
        }
        if (cause instanceof ConnectException || message.contains("connection refused")) {
            return new ConnectionException(host, port, true, e);
        }
        if (cause instanceof UnknownHostException || cause instanceof NoRouteToHostException) {
            return new ConnectionException("Host " + host + " is unreachable", e);
        }
        return new ConnectionException(host, port, false, e);
    }

    static String expandHome(String path) {
        return path.startsWith("~/") ? System.getProperty("user.home") + path.substring(1) : path;
    }
}
