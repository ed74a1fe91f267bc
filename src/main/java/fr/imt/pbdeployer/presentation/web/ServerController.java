package fr.imt.pbdeployer.presentation.web;

import fr.imt.pbdeployer.business.model.AutoFixResult;
import fr.imt.pbdeployer.business.model.DiagnosticReport;
import fr.imt.pbdeployer.business.model.OperationHandle;
import fr.imt.pbdeployer.business.service.DiagnosticsService;
import fr.imt.pbdeployer.business.service.SecurityLockdownService;
import fr.imt.pbdeployer.business.service.ServerSetupService;
import fr.imt.pbdeployer.presentation.web.dto.OperationResponse;
import fr.imt.pbdeployer.presentation.web.dto.mappers.OperationMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/servers")
@RequiredArgsConstructor
public class ServerController {

    private final ServerSetupService setupService;
    private final SecurityLockdownService lockdownService;
    private final DiagnosticsService diagnosticsService;
    private final OperationMapper operationMapper;

    @PostMapping("/{serverId}/setup")
    public ResponseEntity<OperationResponse> setup(@PathVariable String serverId) {
        OperationHandle handle = setupService.startSetup(serverId);
        return ResponseEntity.accepted().body(operationMapper.toResponse(handle));
    }

    @PostMapping("/{serverId}/security")
    public ResponseEntity<OperationResponse> lockdown(@PathVariable String serverId) {
        OperationHandle handle = lockdownService.startLockdown(serverId);
        return ResponseEntity.accepted().body(operationMapper.toResponse(handle));
    }

    @GetMapping("/{serverId}/diagnostics")
    public ResponseEntity<DiagnosticReport> diagnose(@PathVariable String serverId) {
        return ResponseEntity.ok(diagnosticsService.diagnose(serverId));
    }

    @PostMapping("/{serverId}/diagnostics/auto-fix")
    public ResponseEntity<AutoFixResult> autoFix(@PathVariable String serverId) {
        return ResponseEntity.ok(diagnosticsService.autoFix(serverId));
    }
}
