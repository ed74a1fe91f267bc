package fr.imt.pbdeployer.infrastructure.ssh;

import fr.imt.pbdeployer.configuration.PbDeployerProperties;
import fr.imt.pbdeployer.exception.ValidationException;
import fr.imt.pbdeployer.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LocalSshEnvironmentTest {

    @TempDir
    Path home;

    private final PbDeployerProperties properties = TestProperties.fast();
    private Path sshDir;

    @BeforeEach
    void setUp() {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        sshDir = home.resolve(".ssh");
        properties.getSsh().setDirectory(sshDir.toString());
    }

    private LocalSshEnvironment environment(Map<String, String> variables) {
        return new LocalSshEnvironment(properties, variables::get);
    }

    private Path file(Path path, String permissions) throws IOException {
        Files.createDirectories(path.getParent());
        Files.writeString(path, "key");
        Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(permissions));
        return path;
    }

    @Test
    void missing_directory_is_reported_and_created_private() {
        LocalSshEnvironment env = environment(Map.of());
        assertThat(env.inspectSshDirectory().exists()).isFalse();

        env.createSshDirectory();

        LocalSshEnvironment.DirectoryState state = env.inspectSshDirectory();
        assertThat(state.exists()).isTrue();
        assertThat(state.permissions()).isEqualTo("rwx------");
        assertThat(state.tooOpen()).isFalse();
    }

    @Test
    void group_readable_directory_is_too_open_until_restricted() throws IOException {
        Files.createDirectories(sshDir);
        Files.setPosixFilePermissions(sshDir, PosixFilePermissions.fromString("rwxr-x---"));
        LocalSshEnvironment env = environment(Map.of());

        assertThat(env.inspectSshDirectory().tooOpen()).isTrue();
        env.restrictSshDirectory();
        assertThat(env.inspectSshDirectory().tooOpen()).isFalse();
    }

    @Test
    void restricting_a_missing_directory_fails() {
        assertThatThrownBy(() -> environment(Map.of()).restrictSshDirectory())
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void default_and_manual_keys_are_listed() throws IOException {
        file(sshDir.resolve("id_rsa"), "rw-------");
        file(sshDir.resolve("id_rsa.pub"), "rw-r--r--");
        Path manual = file(home.resolve("keys/deploy"), "rw-r--r--");

        List<LocalSshEnvironment.KeyFile> keys = environment(Map.of()).privateKeys(manual.toString());

        assertThat(keys).extracting(k -> k.path().getFileName().toString()).containsExactly("id_rsa", "deploy");
        assertThat(keys.get(0).hasPublicKey()).isTrue();
        assertThat(keys.get(0).tooOpen()).isFalse();
        assertThat(keys.get(1).tooOpen()).isTrue();
    }

    @Test
    void key_permissions_are_restricted() throws IOException {
        Path key = file(sshDir.resolve("id_ed25519"), "rw-rw-r--");
        Path pub = file(sshDir.resolve("id_ed25519.pub"), "rw-rw-rw-");

        List<Path> fixed = environment(Map.of()).restrictKeyPermissions(null);

        assertThat(fixed).containsExactly(key);
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(key))).isEqualTo("rw-------");
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(pub))).isEqualTo("rw-r--r--");
    }

    @Test
    void host_is_unknown_without_a_known_hosts_file() {
        LocalSshEnvironment env = environment(Map.of());

        assertThat(env.knownHostsExists()).isFalse();
        assertThat(env.isHostKnown("10.0.0.5", 22)).isFalse();
    }

    @Test
    void agent_without_socket_is_unavailable() {
        LocalSshEnvironment.AgentState state = environment(Map.of()).inspectAgent();

        assertThat(state.socket()).isNull();
        assertThat(state.identities()).isEqualTo(-1);
        assertThat(state.error()).isEqualTo("SSH_AUTH_SOCK is not set");
    }

    @Test
    void agent_socket_that_does_not_exist_is_reported() {
        String socket = home.resolve("agent.sock").toString();

        LocalSshEnvironment.AgentState state = environment(Map.of("SSH_AUTH_SOCK", socket)).inspectAgent();

        assertThat(state.socket()).isEqualTo(socket);
        assertThat(state.error()).contains("does not exist");
    }
}
