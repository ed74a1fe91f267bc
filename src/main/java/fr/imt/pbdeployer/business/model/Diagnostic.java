package fr.imt.pbdeployer.business.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

@Value
@Builder
public class Diagnostic {
    String step;
    DiagnosticStatus status;
    String message;
    @Singular("detail")
    Map<String, String> details;
    String suggestion;
    SafeRemediation remediation;
    Duration duration;

    public boolean isAutoFixable() {
        return remediation != null;
    }
}
