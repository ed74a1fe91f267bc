package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.AppStatus;
import fr.imt.pbdeployer.business.model.ArtifactLayout;
import fr.imt.pbdeployer.business.model.BootstrapCredentials;
import fr.imt.pbdeployer.business.model.CommandResult;
import fr.imt.pbdeployer.business.model.DeploymentKind;
import fr.imt.pbdeployer.business.model.DeploymentStatus;
import fr.imt.pbdeployer.business.model.OperationContext;
import fr.imt.pbdeployer.business.model.OperationKind;
import fr.imt.pbdeployer.business.model.RemoteCommand;
import fr.imt.pbdeployer.business.port.ApplicationRepositoryPort;
import fr.imt.pbdeployer.business.port.ArtifactStoragePort;
import fr.imt.pbdeployer.business.port.DeploymentRepositoryPort;
import fr.imt.pbdeployer.business.port.ProgressPublisherPort;
import fr.imt.pbdeployer.business.port.ServerRepositoryPort;
import fr.imt.pbdeployer.business.port.VersionRepositoryPort;
import fr.imt.pbdeployer.configuration.PbDeployerProperties;
import fr.imt.pbdeployer.exception.OperationCancelledException;
import fr.imt.pbdeployer.exception.PbDeployerException;
import fr.imt.pbdeployer.exception.PreconditionException;
import fr.imt.pbdeployer.exception.RemoteCommandException;
import fr.imt.pbdeployer.exception.ResourceNotFoundException;
import fr.imt.pbdeployer.exception.ValidationException;
import fr.imt.pbdeployer.infrastructure.persistence.AppVersion;
import fr.imt.pbdeployer.infrastructure.persistence.DeploymentRecord;
import fr.imt.pbdeployer.infrastructure.persistence.ManagedApplication;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static fr.imt.pbdeployer.business.utils.ShellQuote.quote;

/**
 * Deploys a release to an application's server and owns the deployment record state machine.
 * <p>
 * Requests are validated synchronously, before any remote call, then run in the background.
 * The running service is stopped before its directory is backed up, so that the backup holds a
 * consistent copy of {@code pb_data}. A failure from then on restores the previous release from that
 * backup and restarts it. A rollback request runs the same pipeline with an
 * earlier version's artifact.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeploymentService {

    static final String STEP_START = "start";
    static final String STEP_STAGE = "stage_artifact";
    static final String STEP_BACKUP = "backup_current";
    static final String STEP_STOP = "stop_service";
    static final String STEP_INSTALL = "install_files";
    static final String STEP_CONFIGURE = "configure_service";
    static final String STEP_BOOTSTRAP = "bootstrap_admin";
    static final String STEP_START_SERVICE = "start_service";
    static final String STEP_HEALTH = "health_check";
    static final String STEP_FINALIZE = "finalize";
    static final String STEP_SOFT_ROLLBACK = "soft_rollback";
    static final String STEP_COMPLETE = "complete";

    private static final Duration ROLLBACK_TIMEOUT = Duration.ofMinutes(10);
    private static final int ROLLBACK_HEALTH_ATTEMPTS = 3;

    private final ApplicationRepositoryPort applicationRepository;
    private final VersionRepositoryPort versionRepository;
    private final ServerRepositoryPort serverRepository;
    private final DeploymentRepositoryPort deploymentRepository;
    private final ArtifactStoragePort artifactStorage;
    private final RemoteCommandExecutor executor;
    private final SystemdServiceController serviceController;
    private final ArtifactInspector artifactInspector;
    private final ProgressPublisherPort progressPublisher;
    private final OperationRunner operationRunner;
    private final PbDeployerProperties properties;
    private final Clock clock;

    // application id -> deployment id of the run in progress
    private final Map<String, String> activeDeployments = new ConcurrentHashMap<>();

    /**
     * Validates and starts a deployment of {@code versionId}.
     *
     * @param credentials superuser account to create, required for the first deploy of the application
     * @return the pending record; progress is published on {@code deployment_progress_<record id>}
     */
    public DeploymentRecord requestDeploy(String appId, String versionId, BootstrapCredentials credentials) {
        return submit(plan(appId, versionId, DeploymentKind.DEPLOY, credentials));
    }

    /**
     * Redeploys an earlier version of an application that has been deployed before.
     */
    public DeploymentRecord requestRollback(String appId, String versionId) {
        return submit(plan(appId, versionId, DeploymentKind.ROLLBACK, null));
    }

    /**
     * Asks a deployment to stop. The run still ends in a terminal state, failed with a cancellation note.
     * A record left non-terminal without a live run is failed directly.
     */
    public DeploymentRecord cancel(String deploymentId) {
        DeploymentRecord record = findDeployment(deploymentId);
        if (record.isTerminal()) {
            throw new PreconditionException("Deployment " + deploymentId + " is already " + record.getStatus().wireName());
        }
        if (operationRunner.cancel(deploymentId, "cancelled by request")) {
            return record;
        }

        DeploymentRecord current = findDeployment(deploymentId);
        if (!current.isTerminal()) {
            log.warn("[DEPLOY] Deployment {} has no live run, marking it failed", deploymentId);
            abandon(current, "Deployment cancelled by request");
        }
        return current;
    }

    public DeploymentRecord findDeployment(String deploymentId) {
        return deploymentRepository.findById(deploymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Deployment", deploymentId));
    }

    /**
     * Resolves and validates a request. Makes no remote call.
     */
    DeploymentPlan plan(String appId, String versionId, DeploymentKind kind, BootstrapCredentials credentials) {
        ManagedApplication app = applicationRepository.findById(appId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", appId));
        AppVersion version = versionRepository.findById(versionId)
                .orElseThrow(() -> new ResourceNotFoundException("Version", versionId));
        if (!appId.equals(version.getAppId())) {
            throw new PreconditionException("Version " + version.getVersionNumber()
                    + " does not belong to application " + app.getName());
        }
        ServerTarget server = serverRepository.findById(app.getServerId())
                .orElseThrow(() -> new ResourceNotFoundException("Server", app.getServerId()));
        if (!server.isSetupComplete()) {
            throw new PreconditionException("Server " + server.getHost() + " is not set up");
        }
        if (!server.isSecurityLocked()) {
            log.warn("[DEPLOY] Server {} is not security locked yet", server.getHost());
        }

        boolean firstDeploy = !app.hasBeenDeployed();
        if (kind == DeploymentKind.ROLLBACK && firstDeploy) {
            throw new PreconditionException("Application " + app.getName() + " has never been deployed");
        }
        if (firstDeploy && (credentials == null || !credentials.isComplete())) {
            throw new ValidationException("Superuser email and password are required for the first deployment of "
                    + app.getName());
        }
        // rejects unsafe names and paths before anything is queued
        RemotePaths.of(properties.getDeploy(), app, clock.instant());

        byte[] artifact = artifactStorage.load(version.getArtifactId());
        ArtifactLayout layout = artifactInspector.inspect(artifact, properties.getDeploy().getBinaryName());

        DeploymentRecord record = DeploymentRecord.pending(appId, version, kind, clock.instant());
        return new DeploymentPlan(record, app, version, server, artifact, layout, firstDeploy,
                firstDeploy ? credentials : null, kind);
    }

    private DeploymentRecord submit(DeploymentPlan plan) {
        DeploymentRecord record = plan.record();
        String appId = plan.application().getId();
        String running = activeDeployments.putIfAbsent(appId, record.getId());
        if (running != null) {
            throw new PreconditionException("Deployment " + running + " of application "
                    + plan.application().getName() + " is still in progress");
        }

        try {
            deploymentRepository.save(record);
            log.info("[DEPLOY] {} of {} version {} queued as {}", plan.kind(), plan.application().getName(),
                    plan.version().getVersionNumber(), record.getId());
            operationRunner.launch(record.getId(), OperationKind.DEPLOYMENT_PROGRESS, record.getId(),
                    properties.getDeploy().getOperationTimeout(), ctx -> {
                        try {
                            execute(ctx, plan);
                        } finally {
                            activeDeployments.remove(appId, record.getId());
                        }
                    });
        } catch (RuntimeException e) {
            activeDeployments.remove(appId, record.getId());
            if (!record.isTerminal()) {
                abandon(record, "Deployment could not be started: " + e.getMessage());
            }
            throw e;
        }
        return record;
    }

    /**
     * Fails a record that never got a run of its own, moving it through running first.
     */
    private void abandon(DeploymentRecord record, String reason) {
        if (record.getStatus() == DeploymentStatus.PENDING) {
            record.markRunning(clock.instant());
        }
        record.appendLog(clock.instant(), reason);
        record.markFailed(clock.instant());
        deploymentRepository.save(record);
    }

    /**
     * Runs the pipeline for a validated plan. Always leaves the record in a terminal state.
     */
    public void execute(OperationContext ctx, DeploymentPlan plan) {
        new PipelineRun(ctx, plan).run();
    }

    private final class PipelineRun {

        private final OperationContext ctx;
        private final DeploymentPlan plan;
        private final DeploymentRecord record;
        private final ManagedApplication app;
        private final ServerTarget server;
        private final boolean asPrivileged;
        private final RemotePaths paths;
        private final ProgressReporter progress;
        private final PbDeployerProperties.Deploy settings = properties.getDeploy();

        private String currentStep = STEP_START;
        private int currentPercent;
        private boolean backupTaken;
        private boolean serviceWasRunning;
        private boolean rollbackArmed;
        private boolean installStarted;
        private boolean healthy;

        PipelineRun(OperationContext ctx, DeploymentPlan plan) {
            this.ctx = ctx;
            this.plan = plan;
            this.record = plan.record();
            this.app = plan.application();
            this.server = plan.server();
            this.asPrivileged = server.prefersPrivileged();
            this.paths = RemotePaths.of(properties.getDeploy(), app, clock.instant());
            this.progress = new ProgressReporter(progressPublisher,
                    OperationKind.DEPLOYMENT_PROGRESS.subscription(record.getId()), clock);
        }

        void run() {
            record.markRunning(clock.instant());
            try {
                if (ctx.getToken().isCancelled()) {
                    throw new OperationCancelledException("Operation cancelled: " + ctx.getToken().reason());
                }
                logLine(label() + " of " + app.getName() + " version " + plan.version().getVersionNumber()
                        + " to " + server.getHost() + " started");
                progress.running(STEP_START, 0, label() + " started");

                step(STEP_STAGE, 15, "Uploading release to " + paths.stagingDir(), this::stageArtifact);
                if (!plan.firstDeploy()) {
                    step(STEP_STOP, 25, "Stopping " + paths.serviceName(), this::stopService);
                    step(STEP_BACKUP, 35, "Backing up current release", this::backupCurrent);
                }
                step(STEP_INSTALL, 50, "Installing release files in " + paths.installDir(), this::installFiles);
                step(STEP_CONFIGURE, 60, "Configuring systemd unit " + paths.serviceName(), this::configureService);
                if (plan.firstDeploy()) {
                    step(STEP_BOOTSTRAP, 70, "Creating superuser account", this::bootstrapAdmin);
                }
                step(STEP_START_SERVICE, 80, "Starting " + paths.serviceName(), this::startService);
                step(STEP_HEALTH, 90, "Probing application health", this::checkHealth);
                step(STEP_FINALIZE, 100, "Cleaning up", this::finalizeRelease);
                succeed();
            } catch (RuntimeException e) {
                fail(e);
            } finally {
                if (!record.isTerminal()) {
                    logLine("Deployment aborted during " + currentStep);
                    record.markFailed(clock.instant());
                    deploymentRepository.save(record);
                }
            }
        }

        private void step(String name, int percent, String message, Runnable action) {
            ctx.checkActive();
            currentStep = name;
            currentPercent = percent;
            progress.running(name, percent, message);
            logLine(message);
            action.run();
            progress.success(name, percent, message + ": done");
        }

        private void stageArtifact() {
            String staging = quote(paths.stagingDir());
            executor.runChecked(ctx, server, asPrivileged, RemoteCommand.of("mkdir -p " + staging),
                    "create staging directory");
            executor.upload(ctx, server, asPrivileged, plan.artifact(), paths.stagingDir() + "/release.zip");
            executor.runChecked(ctx, server, asPrivileged,
                    RemoteCommand.of("cd " + staging + " && unzip -oq release.zip -d release"
                            + " && test -f release/" + quote(paths.binary())),
                    "unpack release");
        }

        private void backupCurrent() {
            CommandResult exists = executor.run(ctx, server, asPrivileged,
                    RemoteCommand.of("test -d " + quote(paths.installDir())));
            if (!exists.isSuccess()) {
                logLine("No installation found in " + paths.installDir() + ", nothing to back up");
                return;
            }
            executor.runChecked(ctx, server, asPrivileged,
                    RemoteCommand.sudo("mkdir -p " + quote(paths.backupDir())
                            + " && cp -a " + quote(paths.installDir()) + "/. " + quote(paths.backupDir()) + "/"),
                    "back up current release");
            backupTaken = true;
            logLine("Backed up current release to " + paths.backupDir());
        }

        private void stopService() {
            rollbackArmed = true;
            serviceWasRunning = serviceController.isActive(ctx, server, paths.serviceName());
            if (serviceWasRunning) {
                serviceController.stop(ctx, server, paths.serviceName());
            } else {
                logLine("Service " + paths.serviceName() + " was not running");
            }
        }

        private void installFiles() {
            rollbackArmed = true;
            installStarted = true;
            String user = server.getUnprivilegedUsername();
            String dir = quote(paths.installDir());
            String script = "mkdir -p " + dir
                    + " && cd " + dir
                    + " && rm -rf -- ./" + paths.binary() + " ./" + ArtifactInspector.PUBLIC_DIR
                    + " ./" + ArtifactInspector.MIGRATIONS_DIR + " ./" + ArtifactInspector.HOOKS_DIR
                    + " && cp -a " + quote(paths.stagingDir() + "/release") + "/. " + dir + "/"
                    + " && chmod 755 ./" + paths.binary()
                    + " && chown -R " + user + ":" + user + " " + dir;
            executor.runChecked(ctx, server, asPrivileged, RemoteCommand.sudo(script), "install release files");
            logLine("Installed " + plan.layout().entryCount() + " archive entries"
                    + (plan.layout().hasMigrations() ? ", with migrations" : "")
                    + (plan.layout().hasHooks() ? ", with hooks" : ""));
        }

        private void configureService() {
            String draft = paths.stagingDir() + "/" + paths.serviceName() + ".service";
            executor.upload(ctx, server, asPrivileged, renderUnit().getBytes(StandardCharsets.UTF_8), draft);
            executor.runChecked(ctx, server, asPrivileged,
                    RemoteCommand.sudo("install -m 644 " + quote(draft) + " " + paths.unitFile()
                            + " && systemctl daemon-reload"),
                    "install systemd unit");
            serviceController.enable(ctx, server, paths.serviceName());
        }

        private String renderUnit() {
            String user = server.getUnprivilegedUsername();
            boolean hasDomain = app.getDomain() != null && !app.getDomain().isBlank();
            String serve = hasDomain
                    ? " serve " + app.getDomain()
                    : " serve --http=127.0.0.1:" + settings.getLocalPort();
            StringBuilder unit = new StringBuilder()
                    .append("[Unit]\n")
                    .append("Description=PocketBase application ").append(app.getName()).append("\n")
                    .append("After=network-online.target\n")
                    .append("Wants=network-online.target\n\n")
                    .append("[Service]\n")
                    .append("Type=simple\n")
                    .append("User=").append(user).append("\n")
                    .append("Group=").append(user).append("\n")
                    .append("WorkingDirectory=").append(paths.installDir()).append("\n")
                    .append("ExecStart=").append(paths.binaryPath()).append(serve).append("\n")
                    .append("Restart=always\n")
                    .append("RestartSec=5s\n")
                    .append("LimitNOFILE=4096\n")
                    .append("StandardOutput=append:").append(paths.logFile()).append("\n")
                    .append("StandardError=append:").append(paths.logFile()).append("\n");
            if (hasDomain) {
                unit.append("AmbientCapabilities=CAP_NET_BIND_SERVICE\n");
            }
            return unit.append("\n[Install]\n")
                    .append("WantedBy=multi-user.target\n")
                    .toString();
        }

        private void bootstrapAdmin() {
            BootstrapCredentials credentials = plan.credentials();
            String command = "cd " + quote(paths.installDir())
                    + " && ./" + paths.binary() + " superuser upsert "
                    + quote(credentials.email()) + " " + quote(credentials.password());
            // as the service account so that pb_data belongs to it
            executor.runChecked(ctx, server, false, RemoteCommand.of(command).asSensitive(),
                    "create superuser " + credentials.email());
            logLine("Superuser " + credentials.email() + " created");
        }

        private void startService() {
            serviceController.restart(ctx, server, paths.serviceName());
            for (int attempt = 1; attempt <= settings.getServiceStartAttempts(); attempt++) {
                if (serviceController.isActive(ctx, server, paths.serviceName())) {
                    logLine("Service " + paths.serviceName() + " active after " + attempt + " check(s)");
                    return;
                }
                ctx.pause(settings.getServiceStartInterval());
            }
            throw new RemoteCommandException("start " + paths.serviceName(), 3,
                    "service did not become active after " + settings.getServiceStartAttempts() + " checks");
        }

        private void checkHealth() {
            healthy = probeHealth(ctx, settings.getHealthCheckAttempts());
            if (!healthy) {
                throw new RemoteCommandException("health check of " + healthUrl(), 22,
                        "no healthy response after " + settings.getHealthCheckAttempts() + " attempts");
            }
        }

        private boolean probeHealth(OperationContext probeContext, int attempts) {
            RemoteCommand probe = RemoteCommand.of(healthProbeCommand()).withTimeout(Duration.ofSeconds(30));
            for (int attempt = 1; attempt <= attempts; attempt++) {
                CommandResult result = executor.run(probeContext, server, asPrivileged, probe);
                if (result.isSuccess()) {
                    logLine("Health check passed on attempt " + attempt);
                    return true;
                }
                log.debug("[DEPLOY] Health probe {}/{} of {} failed: {}", attempt, attempts, app.getName(),
                        result.stderr().strip());
                if (attempt < attempts) {
                    probeContext.pause(settings.getHealthCheckInterval());
                }
            }
            return false;
        }

        private String healthUrl() {
            boolean hasDomain = app.getDomain() != null && !app.getDomain().isBlank();
            return hasDomain
                    ? "https://" + app.getDomain() + "/api/health"
                    : "http://127.0.0.1:" + settings.getLocalPort() + "/api/health";
        }

        private String healthProbeCommand() {
            if (app.getDomain() == null || app.getDomain().isBlank()) {
                return "curl -fsS -m 10 " + quote(healthUrl());
            }
            String domain = app.getDomain();
            return "curl -fsS -m 10 -k --resolve " + quote(domain + ":443:127.0.0.1") + " " + quote(healthUrl())
                    + " || curl -fsS -m 10 --resolve " + quote(domain + ":80:127.0.0.1") + " "
                    + quote("http://" + domain + "/api/health");
        }

        private void finalizeRelease() {
            String prune = "rm -rf " + quote(paths.stagingDir())
                    + " && ls -1dt " + paths.backupsDir() + "/" + app.getName() + "-* 2>/dev/null"
                    + " | tail -n +" + (settings.getBackupRetention() + 1)
                    + " | xargs -r rm -rf";
            try {
                executor.runChecked(ctx, server, asPrivileged, RemoteCommand.sudo(prune), "clean staging and backups");
            } catch (RemoteCommandException e) {
                log.warn("[DEPLOY] Cleanup after deploying {} failed: {}", app.getName(), e.getMessage());
                logLine("Cleanup failed, release is live: " + e.getMessage());
            }
        }

        private void succeed() {
            String versionNumber = plan.version().getVersionNumber();
            logLine(label() + " of version " + versionNumber + " succeeded in " + elapsedSeconds() + "s");
            record.markSuccess(clock.instant());
            deploymentRepository.save(record);

            app.setCurrentVersion(versionNumber);
            app.setStatus(AppStatus.ONLINE);
            applicationRepository.updateReleaseState(app.getId(), versionNumber, AppStatus.ONLINE);

            progress.success(STEP_COMPLETE, 100, label() + " of version " + versionNumber + " succeeded");
            log.info("[DEPLOY] {} is online with version {}", app.getName(), versionNumber);
        }

        private void fail(RuntimeException error) {
            String failedStep = currentStep;
            boolean cancelled = error instanceof OperationCancelledException || ctx.getToken().isCancelled();
            log.warn("[DEPLOY] {} of {} failed at {}: {}", label(), app.getName(), failedStep, error.getMessage());
            if (!(error instanceof PbDeployerException)) {
                log.error("[DEPLOY] Unexpected error in deployment {}", record.getId(), error);
            }

            progress.failed(failedStep, currentPercent, "Step " + failedStep + " failed", error.getMessage());
            logLine("Step " + failedStep + " failed: " + error.getMessage());
            if (cancelled) {
                logLine("Deployment cancelled by request");
            }

            boolean restoredHealthy = rollbackArmed && softRollback();

            logLine(label() + " failed after " + elapsedSeconds() + "s");
            if (record.getStatus().isTerminal()) {
                return;
            }
            record.markFailed(clock.instant());
            deploymentRepository.save(record);

            if (rollbackArmed) {
                AppStatus status = restoredHealthy ? AppStatus.ONLINE : AppStatus.OFFLINE;
                app.setStatus(status);
                applicationRepository.updateReleaseState(app.getId(), app.getCurrentVersion(), status);
            }
            progress.failed(STEP_COMPLETE, 100, label() + " failed at step " + failedStep, error.getMessage());
        }

        /**
         * Puts the previous release back in place and restarts it if it was running.
         * Runs under its own deadline so that it also completes after a cancellation.
         *
         * @return true if the restored release answers its health probe
         */
        private boolean softRollback() {
            OperationContext rollbackCtx = OperationContext.withTimeout(ROLLBACK_TIMEOUT, clock);
            progress.running(STEP_SOFT_ROLLBACK, currentPercent, "Restoring previous release");
            logLine("Soft rollback started");
            try {
                if (!installStarted) {
                    logLine("Install directory untouched, nothing to restore");
                } else if (!backupTaken) {
                    if (serviceController.isActive(rollbackCtx, server, paths.serviceName())) {
                        serviceController.stop(rollbackCtx, server, paths.serviceName());
                    }
                    logLine("No previous release to restore, service left stopped");
                    progress.success(STEP_SOFT_ROLLBACK, currentPercent, "Service stopped, nothing to restore");
                    return false;
                } else {
                    String dir = quote(paths.installDir());
                    executor.runChecked(rollbackCtx, server, asPrivileged,
                            RemoteCommand.sudo("systemctl stop " + paths.serviceName()
                                    + "; find " + dir + " -mindepth 1 -maxdepth 1 -exec rm -rf {} +"
                                    + " && cp -a " + quote(paths.backupDir()) + "/. " + dir + "/"),
                            "restore backup " + paths.backupDir());
                    logLine("Previous release restored from " + paths.backupDir());
                }

                boolean restoredHealthy = false;
                if (serviceWasRunning) {
                    serviceController.restart(rollbackCtx, server, paths.serviceName());
                    restoredHealthy = probeHealth(rollbackCtx, ROLLBACK_HEALTH_ATTEMPTS);
                    logLine("Previous release restarted, " + (restoredHealthy ? "healthy" : "not answering"));
                }
                progress.success(STEP_SOFT_ROLLBACK, currentPercent, "Previous release restored");
                return restoredHealthy;
            } catch (RuntimeException e) {
                log.error("[DEPLOY] Soft rollback of {} failed", app.getName(), e);
                logLine("Soft rollback failed: " + e.getMessage());
                progress.failed(STEP_SOFT_ROLLBACK, currentPercent, "Soft rollback failed", e.getMessage());
                return false;
            }
        }

        private void logLine(String message) {
            record.appendLog(clock.instant(), message);
            deploymentRepository.save(record);
        }

        private long elapsedSeconds() {
            return record.elapsed(clock.instant()).toSeconds();
        }

        private String label() {
            return plan.kind() == DeploymentKind.ROLLBACK ? "Rollback" : "Deployment";
        }
    }
}
