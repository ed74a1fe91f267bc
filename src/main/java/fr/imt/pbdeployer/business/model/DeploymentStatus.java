package fr.imt.pbdeployer.business.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeploymentStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
