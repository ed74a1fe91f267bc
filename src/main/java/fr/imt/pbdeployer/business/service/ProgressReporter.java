package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.ProgressEvent;
import fr.imt.pbdeployer.business.model.ProgressStatus;
import fr.imt.pbdeployer.business.port.ProgressPublisherPort;

import java.time.Clock;

/**
 * Emits the progress events of one operation on its subscription.
 */
public class ProgressReporter {

    private final ProgressPublisherPort publisher;
    private final String subscription;
    private final Clock clock;

    public ProgressReporter(ProgressPublisherPort publisher, String subscription, Clock clock) {
        this.publisher = publisher;
        this.subscription = subscription;
        this.clock = clock;
    }

    public void running(String step, int percent, String message) {
        emit(step, ProgressStatus.RUNNING, percent, message, null);
    }

    public void success(String step, int percent, String message) {
        emit(step, ProgressStatus.SUCCESS, percent, message, null);
    }

    public void failed(String step, int percent, String message, String detail) {
        emit(step, ProgressStatus.FAILED, percent, message, detail);
    }

    private void emit(String step, ProgressStatus status, int percent, String message, String detail) {
        publisher.publish(subscription, ProgressEvent.builder()
                .step(step)
                .status(status)
                .message(message)
                .detail(detail)
                .timestampUtc(clock.instant())
                .progressPercent(Math.max(0, Math.min(100, percent)))
                .build());
    }
}
