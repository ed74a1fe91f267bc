package fr.imt.pbdeployer.business.model;

import lombok.Getter;

/**
 * Kinds of background operation. The prefix is used to build progress subscription keys.
 */
@Getter
public enum OperationKind {
    SERVER_SETUP("server_setup"),
    SERVER_SECURITY("server_security"),
    DEPLOYMENT_PROGRESS("deployment_progress");

    private final String prefix;

    OperationKind(String prefix) {
        this.prefix = prefix;
    }

    public String subscription(String targetId) {
        return prefix + "_" + targetId;
    }
}
