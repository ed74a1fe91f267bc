package fr.imt.pbdeployer.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "pbdeployer")
public class PbDeployerProperties {

    private Ssh ssh = new Ssh();
    private Pool pool = new Pool();
    private Setup setup = new Setup();
    private Security security = new Security();
    private Deploy deploy = new Deploy();
    private Diagnostics diagnostics = new Diagnostics();

    @Data
    public static class Ssh {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration commandTimeout = Duration.ofMinutes(5);
        private int serverAliveInterval = 30;
        // "no" accepts and records unknown hosts, "yes" requires a known_hosts entry
        private String strictHostKeyChecking = "no";
        private String directory = System.getProperty("user.home") + "/.ssh";
        private int connectAttempts = 3;
        private Duration retryBackoff = Duration.ofSeconds(2);

        public String getKnownHostsFile() {
            return directory + "/known_hosts";
        }
    }

    @Data
    public static class Pool {
        private int maxConnections = 10;
        private Duration maxIdleTime = Duration.ofMinutes(15);
        private Duration maxAge = Duration.ofHours(1);
        private Duration healthInterval = Duration.ofSeconds(30);
        private Duration healthCheckTimeout = Duration.ofSeconds(10);
        private int unhealthyThreshold = 3;
        private Duration acquireTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Setup {
        private List<String> packages = new ArrayList<>(List.of(
                "curl", "unzip", "sudo", "ufw", "fail2ban", "libcap2-bin"));
        private List<String> directories = new ArrayList<>(List.of(
                "/opt/pocketbase",
                "/opt/pocketbase/apps",
                "/opt/pocketbase/backups",
                "/opt/pocketbase/staging",
                "/opt/pocketbase/logs"));
        private List<String> groups = new ArrayList<>(List.of("sudo"));
        private String shell = "/bin/bash";
        private String sudoRule = "ALL=(ALL) NOPASSWD: ALL";
        private List<String> publicKeys = new ArrayList<>();
        private boolean configureFirewall = false;
        private Duration packageTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class Security {
        private List<Integer> allowedPorts = new ArrayList<>(List.of(80, 443));
        private int fail2banMaxRetries = 5;
        private Duration fail2banBanTime = Duration.ofHours(1);
        private Duration fail2banFindTime = Duration.ofMinutes(10);
        private List<String> fail2banServices = new ArrayList<>(List.of("sshd"));
    }

    @Data
    public static class Deploy {
        private String basePath = "/opt/pocketbase";
        private String binaryName = "pocketbase";
        private int backupRetention = 5;
        private int serviceStartAttempts = 30;
        private Duration serviceStartInterval = Duration.ofSeconds(2);
        private int healthCheckAttempts = 15;
        private Duration healthCheckInterval = Duration.ofSeconds(2);
        private int localPort = 8090;
        private Duration operationTimeout = Duration.ofMinutes(30);
    }

    @Data
    public static class Diagnostics {
        private Duration networkTimeout = Duration.ofSeconds(10);
        private Duration bannerTimeout = Duration.ofSeconds(5);
    }
}
