package fr.imt.pbdeployer.presentation.web.dto.mappers;

import fr.imt.pbdeployer.infrastructure.persistence.DeploymentRecord;
import fr.imt.pbdeployer.presentation.web.dto.DeploymentResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface DeploymentMapper {

    @Mapping(target = "subscription",
            expression = "java(fr.imt.pbdeployer.business.model.OperationKind.DEPLOYMENT_PROGRESS.subscription(record.getId()))")
    DeploymentResponse toResponse(DeploymentRecord record);
}
