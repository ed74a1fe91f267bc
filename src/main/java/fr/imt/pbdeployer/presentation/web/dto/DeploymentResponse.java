package fr.imt.pbdeployer.presentation.web.dto;

import fr.imt.pbdeployer.business.model.DeploymentKind;
import fr.imt.pbdeployer.business.model.DeploymentStatus;
import lombok.Data;

import java.time.Instant;

@Data
public class DeploymentResponse {
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
    private String subscription;
}
