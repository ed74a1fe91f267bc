package fr.imt.pbdeployer.business.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OverallHealth {
    HEALTHY,
    DEGRADED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
