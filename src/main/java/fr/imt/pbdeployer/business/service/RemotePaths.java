package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.configuration.PbDeployerProperties;
import fr.imt.pbdeployer.exception.ValidationException;
import fr.imt.pbdeployer.infrastructure.persistence.ManagedApplication;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static fr.imt.pbdeployer.business.utils.ShellQuote.requireSafeName;
import static fr.imt.pbdeployer.business.utils.ShellQuote.requireSafePath;

/**
 * Locations used on the server by one deployment run.
 */
record RemotePaths(String installDir,
                   String binary,
                   String stagingDir,
                   String backupsDir,
                   String backupDir,
                   String logFile,
                   String serviceName,
                   String unitFile) {

    private static final List<String> SYSTEM_DIRS = List.of(
            "/bin", "/boot", "/dev", "/etc", "/home", "/lib", "/lib64", "/proc",
            "/root", "/run", "/sbin", "/sys", "/usr", "/var");

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
            .withZone(ZoneOffset.UTC);

    static RemotePaths of(PbDeployerProperties.Deploy deploy, ManagedApplication app, Instant now) {
        String name = requireSafeName("application name", app.getName());
        String base = requireSafePath("base path", deploy.getBasePath());
        String installDir = app.getRemotePath() == null || app.getRemotePath().isBlank()
                ? base + "/apps/" + name
                : requireInstallDir(base, requireSafePath("install path", app.getRemotePath()));
        String release = name + "-" + STAMP.format(now);
        String serviceName = serviceName(app);
        return new RemotePaths(installDir,
                requireSafeName("binary name", deploy.getBinaryName()),
                base + "/staging/" + release,
                base + "/backups",
                base + "/backups/" + release,
                base + "/logs/" + name + ".log",
                serviceName,
                "/etc/systemd/system/" + serviceName + ".service");
    }

    /**
     * Rejects install directories whose cleanup would touch system files or the deployer's own
     * staging, backup and log directories.
     */
    static String requireInstallDir(String base, String path) {
        String dir = normalize(path);
        String root = normalize(base);
        List<String> segments = Arrays.asList(dir.substring(1).split("/"));
        boolean shallow = dir.length() < 2 || segments.size() < 2 || segments.contains(".");
        boolean system = SYSTEM_DIRS.stream().anyMatch(sys -> dir.equals(sys) || dir.startsWith(sys + "/"));
        boolean ownsBase = root.equals(dir) || root.startsWith(dir + "/");
        boolean reserved = dir.equals(root + "/apps")
                || Stream.of("/staging", "/backups", "/logs")
                        .map(root::concat)
                        .anyMatch(sub -> dir.equals(sub) || dir.startsWith(sub + "/"));
        if (shallow || system || ownsBase || reserved) {
            throw new ValidationException("Install path " + path + " is not allowed");
        }
        return dir;
    }

    private static String normalize(String path) {
        return path.replaceAll("/{2,}", "/").replaceAll("(.)/$", "$1");
    }

    static String serviceName(ManagedApplication app) {
        String serviceName = app.getServiceName() == null || app.getServiceName().isBlank()
                ? "pocketbase-" + app.getName()
                : app.getServiceName();
        return requireSafeName("service name", serviceName);
    }

    String binaryPath() {
        return installDir + "/" + binary;
    }
}
