package fr.imt.pbdeployer.business.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AppStatus {
    ONLINE,
    OFFLINE,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
