package fr.imt.pbdeployer.presentation.web.dto;

import lombok.Data;

@Data
public class OperationResponse {
    private String id;
    private String kind;
    private String targetId;
    // STOMP destination suffix: /topic/progress/<subscription>
    private String subscription;
}
