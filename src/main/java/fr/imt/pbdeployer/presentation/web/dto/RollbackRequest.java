package fr.imt.pbdeployer.presentation.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RollbackRequest {

    @NotBlank
    private String versionId;
}
