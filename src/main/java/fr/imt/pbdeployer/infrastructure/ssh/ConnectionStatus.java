package fr.imt.pbdeployer.infrastructure.ssh;

import java.time.Instant;

public record ConnectionStatus(String key,
                               ConnectionState state,
                               long useCount,
                               int consecutiveFailures,
                               Boolean lastCheckPassed,
                               Instant createdAt,
                               Instant lastUsedAt) {
}
