package fr.imt.pbdeployer.infrastructure.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "versions")
public class AppVersion {

    @Id
    private String id;

    private String appId;

    private String versionNumber;

    // GridFS id of the uploaded release zip
    private String artifactId;

    private String notes;

    @CreatedDate
    private LocalDateTime createdAt;
}
