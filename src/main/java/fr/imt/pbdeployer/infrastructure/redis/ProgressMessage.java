package fr.imt.pbdeployer.infrastructure.redis;

import fr.imt.pbdeployer.business.model.ProgressEvent;

/**
 * Payload carried on the progress topic.
 */
public record ProgressMessage(String subscription, ProgressEvent event) {
}
