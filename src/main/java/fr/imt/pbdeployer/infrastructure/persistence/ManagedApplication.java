package fr.imt.pbdeployer.infrastructure.persistence;

import fr.imt.pbdeployer.business.model.AppStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "apps")
public class ManagedApplication {

    @Id
    private String id;

    private String name;

    private String serverId;

    // install path, defaults to <base>/apps/<name> when empty
    private String remotePath;

    private String serviceName;

    private String domain;

    private String currentVersion;

    @Builder.Default
    private AppStatus status = AppStatus.OFFLINE;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    public boolean hasBeenDeployed() {
        return currentVersion != null && !currentVersion.isBlank();
    }
}
