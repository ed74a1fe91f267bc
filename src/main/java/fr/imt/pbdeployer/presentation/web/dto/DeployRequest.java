package fr.imt.pbdeployer.presentation.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * The superuser fields are only read on the first deployment of an application.
 */
@Data
public class DeployRequest {

    @NotBlank
    private String versionId;

    @Email
    private String superuserEmail;

    @Size(min = 10, max = 72)
    private String superuserPassword;
}
