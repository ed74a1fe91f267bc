package fr.imt.pbdeployer.business.model;

import java.time.Duration;

/**
 * @param pid    main process id, null when not running
 * @param uptime time since the main process started, null when unknown
 */
public record ServiceStatus(String serviceName, ServiceState state, Integer pid, Duration uptime) {

    public boolean isRunning() {
        return state == ServiceState.RUNNING;
    }
}
