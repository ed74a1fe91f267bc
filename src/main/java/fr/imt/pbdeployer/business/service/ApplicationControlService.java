package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.AppStatus;
import fr.imt.pbdeployer.business.model.OperationContext;
import fr.imt.pbdeployer.business.model.ServiceState;
import fr.imt.pbdeployer.business.model.ServiceStatus;
import fr.imt.pbdeployer.business.port.ApplicationRepositoryPort;
import fr.imt.pbdeployer.business.port.ServerRepositoryPort;
import fr.imt.pbdeployer.configuration.PbDeployerProperties;
import fr.imt.pbdeployer.exception.ResourceNotFoundException;
import fr.imt.pbdeployer.exception.ValidationException;
import fr.imt.pbdeployer.infrastructure.persistence.ManagedApplication;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;

/**
 * Controls the systemd service of a deployed application, resolved from its id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationControlService {

    private final ApplicationRepositoryPort applicationRepository;
    private final ServerRepositoryPort serverRepository;
    private final SystemdServiceController serviceController;
    private final PbDeployerProperties properties;
    private final Clock clock;

    /**
     * Runs {@code start}, {@code stop} or {@code restart} and returns the resulting status.
     * The application's recorded status follows what systemd reports afterwards.
     */
    public ServiceStatus control(String appId, String action) {
        ManagedApplication app = findApplication(appId);
        ServerTarget server = findServer(app);
        OperationContext ctx = newContext();
        String serviceName = RemotePaths.serviceName(app);

        switch (action.toLowerCase(Locale.ROOT)) {
            case "start" -> serviceController.start(ctx, server, serviceName);
            case "stop" -> serviceController.stop(ctx, server, serviceName);
            case "restart" -> serviceController.restart(ctx, server, serviceName);
            default -> throw new ValidationException("Unknown service action '" + action
                    + "', expected start, stop or restart");
        }

        ServiceStatus status = serviceController.status(ctx, server, serviceName);
        AppStatus appStatus = status.state() == ServiceState.RUNNING ? AppStatus.ONLINE : AppStatus.OFFLINE;
        if (app.getStatus() != appStatus) {
            applicationRepository.updateReleaseState(app.getId(), app.getCurrentVersion(), appStatus);
        }
        log.info("[SERVICE] {} of {} done, service is {}", action, app.getName(), status.state());
        return status;
    }

    public ServiceStatus status(String appId) {
        ManagedApplication app = findApplication(appId);
        return serviceController.status(newContext(), findServer(app), RemotePaths.serviceName(app));
    }

    public String logs(String appId, int lines) {
        ManagedApplication app = findApplication(appId);
        return serviceController.tailLogs(newContext(), findServer(app), RemotePaths.serviceName(app), lines);
    }

    private OperationContext newContext() {
        return OperationContext.withTimeout(properties.getSsh().getCommandTimeout(), clock);
    }

    private ManagedApplication findApplication(String appId) {
        return applicationRepository.findById(appId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", appId));
    }

    private ServerTarget findServer(ManagedApplication app) {
        return serverRepository.findById(app.getServerId())
                .orElseThrow(() -> new ResourceNotFoundException("Server", app.getServerId()));
    }
}
