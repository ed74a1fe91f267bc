package fr.imt.pbdeployer.business.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ServiceState {
    RUNNING,
    STOPPED,
    FAILED,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static ServiceState fromActiveState(String activeState) {
        if (activeState == null) {
            return UNKNOWN;
        }
        return switch (activeState.strip()) {
            case "active", "reloading", "activating" -> RUNNING;
            case "inactive", "deactivating" -> STOPPED;
            case "failed" -> FAILED;
            default -> UNKNOWN;
        };
    }
}
