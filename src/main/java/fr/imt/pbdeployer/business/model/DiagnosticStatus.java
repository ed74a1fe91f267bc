package fr.imt.pbdeployer.business.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiagnosticStatus {
    SUCCESS,
    WARNING,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
