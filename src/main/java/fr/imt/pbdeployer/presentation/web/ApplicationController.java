package fr.imt.pbdeployer.presentation.web;

import fr.imt.pbdeployer.business.model.BootstrapCredentials;
import fr.imt.pbdeployer.business.model.ServiceStatus;
import fr.imt.pbdeployer.business.service.ApplicationControlService;
import fr.imt.pbdeployer.business.service.DeploymentService;
import fr.imt.pbdeployer.infrastructure.persistence.DeploymentRecord;
import fr.imt.pbdeployer.presentation.web.dto.DeployRequest;
import fr.imt.pbdeployer.presentation.web.dto.DeploymentResponse;
import fr.imt.pbdeployer.presentation.web.dto.LogsResponse;
import fr.imt.pbdeployer.presentation.web.dto.RollbackRequest;
import fr.imt.pbdeployer.presentation.web.dto.mappers.DeploymentMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/apps")
@RequiredArgsConstructor
public class ApplicationController {

    private final ApplicationControlService controlService;
    private final DeploymentService deploymentService;
    private final DeploymentMapper deploymentMapper;

    @PostMapping("/{appId}/service/{action}")
    public ResponseEntity<ServiceStatus> controlService(@PathVariable String appId, @PathVariable String action) {
        return ResponseEntity.ok(controlService.control(appId, action));
    }

    @GetMapping("/{appId}/service/status")
    public ResponseEntity<ServiceStatus> serviceStatus(@PathVariable String appId) {
        return ResponseEntity.ok(controlService.status(appId));
    }

    @GetMapping("/{appId}/service/logs")
    public ResponseEntity<LogsResponse> serviceLogs(@PathVariable String appId,
                                                    @RequestParam(defaultValue = "100") int lines) {
        return ResponseEntity.ok(new LogsResponse(appId, lines, controlService.logs(appId, lines)));
    }

    @PostMapping("/{appId}/deployments")
    public ResponseEntity<DeploymentResponse> deploy(@PathVariable String appId,
                                                     @Valid @RequestBody DeployRequest request) {
        BootstrapCredentials credentials = new BootstrapCredentials(
                request.getSuperuserEmail(), request.getSuperuserPassword());
        DeploymentRecord record = deploymentService.requestDeploy(appId, request.getVersionId(), credentials);
        return ResponseEntity.accepted().body(deploymentMapper.toResponse(record));
    }

    @PostMapping("/{appId}/rollbacks")
    public ResponseEntity<DeploymentResponse> rollback(@PathVariable String appId,
                                                       @Valid @RequestBody RollbackRequest request) {
        DeploymentRecord record = deploymentService.requestRollback(appId, request.getVersionId());
        return ResponseEntity.accepted().body(deploymentMapper.toResponse(record));
    }
}
