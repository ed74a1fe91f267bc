package fr.imt.pbdeployer.presentation.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogsResponse {
    private String appId;
    private int lines;
    private String content;
}
