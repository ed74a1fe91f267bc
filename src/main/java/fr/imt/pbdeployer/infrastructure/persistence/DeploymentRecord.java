package fr.imt.pbdeployer.infrastructure.persistence;

import fr.imt.pbdeployer.business.model.DeploymentKind;
import fr.imt.pbdeployer.business.model.DeploymentStatus;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One attempt to move an application to a version.
 * Status only moves pending, running, then success or failed; a terminal record is frozen.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Document(collection = "deployments")
public class DeploymentRecord {

    @Id
    private String id;

    private String appId;

    private String versionId;

    private String versionNumber;

    private DeploymentKind kind;

    private DeploymentStatus status;

    private String logs;

    private Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    public static DeploymentRecord pending(String appId, AppVersion version, DeploymentKind kind, Instant now) {
        DeploymentRecord record = new DeploymentRecord();
        record.id = UUID.randomUUID().toString();
        record.appId = appId;
        record.versionId = version.getId();
        record.versionNumber = version.getVersionNumber();
        record.kind = kind;
        record.status = DeploymentStatus.PENDING;
        record.logs = "";
        record.createdAt = now;
        return record;
    }

    public void markRunning(Instant now) {
        requireStatus(DeploymentStatus.PENDING, DeploymentStatus.RUNNING);
        status = DeploymentStatus.RUNNING;
        startedAt = now;
    }

    public void markSuccess(Instant now) {
        complete(DeploymentStatus.SUCCESS, now);
    }

    public void markFailed(Instant now) {
        complete(DeploymentStatus.FAILED, now);
    }

    public void appendLog(Instant at, String message) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Deployment " + id + " is " + status.wireName() + " and can no longer change");
        }
        logs = logs + "[" + at + "] " + message + "\n";
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Duration elapsed(Instant now) {
        return startedAt == null ? Duration.ZERO : Duration.between(startedAt, now);
    }

    private void complete(DeploymentStatus terminal, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Deployment " + id + " is already " + status.wireName());
        }
        requireStatus(DeploymentStatus.RUNNING, terminal);
        status = terminal;
        completedAt = now;
    }

    private void requireStatus(DeploymentStatus expected, DeploymentStatus next) {
        if (status != expected) {
            throw new IllegalStateException("Deployment " + id + " cannot move from "
                    + status.wireName() + " to " + next.wireName());
        }
    }
}
