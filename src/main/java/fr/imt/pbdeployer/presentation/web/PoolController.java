package fr.imt.pbdeployer.presentation.web;

import fr.imt.pbdeployer.infrastructure.ssh.PoolHealthReport;
import fr.imt.pbdeployer.infrastructure.ssh.SshConnectionPool;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/pool")
@RequiredArgsConstructor
public class PoolController {

    private final SshConnectionPool connectionPool;

    // current state, without probing the connections
    @GetMapping("/health")
    public ResponseEntity<PoolHealthReport> health() {
        return ResponseEntity.ok(connectionPool.snapshot());
    }
}
