package fr.imt.pbdeployer.business.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class DiagnosticReport {
    String serverId;
    List<Diagnostic> diagnostics;
    OverallHealth overall;
    List<String> suggestions;
    int errorCount;
    int warningCount;
    boolean canAutoFix;
    Instant startedAt;
    Duration duration;
}
