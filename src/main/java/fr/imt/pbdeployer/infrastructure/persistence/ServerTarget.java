package fr.imt.pbdeployer.infrastructure.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * A remote host under management.
 * Once {@code securityLocked} is set the privileged identity can no longer log in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "servers")
public class ServerTarget {

    @Id
    private String id;

    private String name;

    private String host;

    @Builder.Default
    private int port = 22;

    @Builder.Default
    private String privilegedUsername = "root";

    @Builder.Default
    private String unprivilegedUsername = "pocketbase";

    @Builder.Default
    private boolean useSshAgent = true;

    // private key file used when the agent is disabled or rejects us
    private String manualKeyPath;

    private boolean setupComplete;

    private boolean securityLocked;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    public String usernameFor(boolean asPrivileged) {
        return asPrivileged ? privilegedUsername : unprivilegedUsername;
    }

    /**
     * Identity to use for administrative work: the privileged account until lockdown.
     */
    public boolean prefersPrivileged() {
        return !securityLocked;
    }

    public boolean isReadyForDeployment() {
        return setupComplete && securityLocked;
    }
}
