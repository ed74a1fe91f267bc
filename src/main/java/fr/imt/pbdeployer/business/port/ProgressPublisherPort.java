package fr.imt.pbdeployer.business.port;

import fr.imt.pbdeployer.business.model.ProgressEvent;

/**
 * Outbound notification of operation progress. Implementations must not throw.
 */
public interface ProgressPublisherPort {
    void publish(String subscription, ProgressEvent event);
}
