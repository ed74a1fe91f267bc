package fr.imt.pbdeployer.business.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One step transition of a long-running operation, as seen by progress subscribers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressEvent {
    private String step;
    private ProgressStatus status;
    private String message;
    private String detail;
    private Instant timestampUtc;
    private int progressPercent;
}
