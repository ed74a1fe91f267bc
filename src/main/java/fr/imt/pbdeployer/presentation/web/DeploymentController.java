package fr.imt.pbdeployer.presentation.web;

import fr.imt.pbdeployer.business.service.DeploymentService;
import fr.imt.pbdeployer.presentation.web.dto.DeploymentResponse;
import fr.imt.pbdeployer.presentation.web.dto.mappers.DeploymentMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/deployments")
@RequiredArgsConstructor
public class DeploymentController {

    private final DeploymentService deploymentService;
    private final DeploymentMapper deploymentMapper;

    @GetMapping("/{deploymentId}")
    public ResponseEntity<DeploymentResponse> find(@PathVariable String deploymentId) {
        return ResponseEntity.ok(deploymentMapper.toResponse(deploymentService.findDeployment(deploymentId)));
    }

    @PostMapping("/{deploymentId}/cancel")
    public ResponseEntity<DeploymentResponse> cancel(@PathVariable String deploymentId) {
        return ResponseEntity.accepted().body(deploymentMapper.toResponse(deploymentService.cancel(deploymentId)));
    }
}
