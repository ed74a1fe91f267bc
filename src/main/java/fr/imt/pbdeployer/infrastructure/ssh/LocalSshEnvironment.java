package fr.imt.pbdeployer.infrastructure.ssh;

import com.jcraft.jsch.AgentIdentityRepository;
import com.jcraft.jsch.AgentProxyException;
import com.jcraft.jsch.HostKey;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.SSHAgentConnector;
import fr.imt.pbdeployer.configuration.PbDeployerProperties;
import fr.imt.pbdeployer.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * The SSH client files of the account running the deployer, and the few fixes that can be applied to them.
 */
@Slf4j
@Component
public class LocalSshEnvironment {

    static final List<String> KEY_NAMES = List.of("id_ed25519", "id_ecdsa", "id_rsa", "id_dsa");

    private static final Set<PosixFilePermission> GROUP_OR_OTHER = EnumSet.of(
            PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE,
            PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE);

    private final PbDeployerProperties properties;
    private final UnaryOperator<String> environment;

    @Autowired
    public LocalSshEnvironment(PbDeployerProperties properties) {
        this(properties, System::getenv);
    }

    LocalSshEnvironment(PbDeployerProperties properties, UnaryOperator<String> environment) {
        this.properties = properties;
        this.environment = environment;
    }

    public record DirectoryState(Path path, boolean exists, String permissions, boolean tooOpen) {
    }

    public record KeyFile(Path path, String permissions, boolean tooOpen, boolean hasPublicKey) {
    }

    /**
     * @param socket     value of SSH_AUTH_SOCK, null when unset
     * @param identities keys the agent offers, -1 when the agent could not be queried
     */
    public record AgentState(String socket, int identities, String error) {
    }

    public Path sshDirectory() {
        return Path.of(JschSessionFactory.expandHome(properties.getSsh().getDirectory()));
    }

    public DirectoryState inspectSshDirectory() {
        Path dir = sshDirectory();
        if (!Files.isDirectory(dir)) {
            return new DirectoryState(dir, false, null, false);
        }
        Set<PosixFilePermission> permissions = permissionsOf(dir);
        return new DirectoryState(dir, true, format(permissions), isTooOpen(permissions));
    }

    /**
     * Default key files found in the SSH directory, plus {@code manualKeyPath} when given.
     */
    public List<KeyFile> privateKeys(String manualKeyPath) {
        List<Path> candidates = new ArrayList<>();
        KEY_NAMES.forEach(name -> candidates.add(sshDirectory().resolve(name)));
        if (manualKeyPath != null && !manualKeyPath.isBlank()) {
            Path manual = Path.of(JschSessionFactory.expandHome(manualKeyPath));
            if (!candidates.contains(manual)) {
                candidates.add(manual);
            }
        }

        List<KeyFile> found = new ArrayList<>();
        for (Path key : candidates) {
            if (Files.isRegularFile(key)) {
                Set<PosixFilePermission> permissions = permissionsOf(key);
                found.add(new KeyFile(key, format(permissions), isTooOpen(permissions),
                        Files.exists(Path.of(key + ".pub"))));
            }
        }
        return found;
    }

    public boolean keyExists(String keyPath) {
        return Files.isRegularFile(Path.of(JschSessionFactory.expandHome(keyPath)));
    }

    public boolean knownHostsExists() {
        return Files.isRegularFile(Path.of(JschSessionFactory.expandHome(properties.getSsh().getKnownHostsFile())));
    }

    /**
     * Looks the host up the way OpenSSH records it: plain {@code host} on port 22, {@code [host]:port} otherwise.
     * Hashed entries are matched too.
     */
    public boolean isHostKnown(String host, int port) {
        if (!knownHostsExists()) {
            return false;
        }
        String label = port == 22 ? host : "[" + host + "]:" + port;
        JSch jsch = new JSch();
        try {
            jsch.setKnownHosts(JschSessionFactory.expandHome(properties.getSsh().getKnownHostsFile()));
        } catch (JSchException e) {
            log.warn("[SSH-DIAG] Cannot read known_hosts: {}", e.getMessage());
            return false;
        }
        HostKey[] keys = jsch.getHostKeyRepository().getHostKey(label, null);
        return keys != null && keys.length > 0;
    }

    public AgentState inspectAgent() {
        String socket = environment.apply("SSH_AUTH_SOCK");
        if (socket == null || socket.isBlank()) {
            return new AgentState(null, -1, "SSH_AUTH_SOCK is not set");
        }
        if (!Files.exists(Path.of(socket))) {
            return new AgentState(socket, -1, "agent socket " + socket + " does not exist");
        }
        try {
            AgentIdentityRepository repository = new AgentIdentityRepository(new SSHAgentConnector());
            return new AgentState(socket, repository.getIdentities().size(), null);
        } catch (AgentProxyException e) {
            return new AgentState(socket, -1, e.getMessage());
        }
    }

    public void createSshDirectory() {
        Path dir = sshDirectory();
        try {
            Files.createDirectories(dir);
            restrict(dir, "rwx------");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create " + dir, e);
        }
        log.info("[SSH-DIAG] Created {}", dir);
    }

    public void restrictSshDirectory() {
        Path dir = sshDirectory();
        if (!Files.isDirectory(dir)) {
            throw new ValidationException(dir + " does not exist");
        }
        restrict(dir, "rwx------");
        log.info("[SSH-DIAG] Set {} to 700", dir);
    }

    /**
     * Sets every private key found to 600 and its public half to 644.
     */
    public List<Path> restrictKeyPermissions(String manualKeyPath) {
        List<Path> fixed = new ArrayList<>();
        for (KeyFile key : privateKeys(manualKeyPath)) {
            if (key.tooOpen()) {
                restrict(key.path(), "rw-------");
                fixed.add(key.path());
            }
            Path publicKey = Path.of(key.path() + ".pub");
            if (Files.exists(publicKey)) {
                restrict(publicKey, "rw-r--r--");
            }
        }
        log.info("[SSH-DIAG] Restricted permissions of {}", fixed);
        return fixed;
    }

    private static boolean isPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }

    private static Set<PosixFilePermission> permissionsOf(Path path) {
        if (!isPosix()) {
            return null;
        }
        try {
            return Files.getPosixFilePermissions(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read permissions of " + path, e);
        }
    }

    private static boolean isTooOpen(Set<PosixFilePermission> permissions) {
        return permissions != null && permissions.stream().anyMatch(GROUP_OR_OTHER::contains);
    }

    private static String format(Set<PosixFilePermission> permissions) {
        return permissions == null ? null : PosixFilePermissions.toString(permissions);
    }

    private static void restrict(Path path, String permissions) {
        if (!isPosix()) {
            return;
        }
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(permissions));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot change permissions of " + path, e);
        }
    }
}
