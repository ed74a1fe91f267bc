package fr.imt.pbdeployer.presentation.web.dto.mappers;

import fr.imt.pbdeployer.business.model.OperationHandle;
import fr.imt.pbdeployer.presentation.web.dto.OperationResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface OperationMapper {

    @Mapping(target = "kind", source = "kind.prefix")
    OperationResponse toResponse(OperationHandle handle);
}
