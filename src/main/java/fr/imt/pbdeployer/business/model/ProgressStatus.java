package fr.imt.pbdeployer.business.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum ProgressStatus {
    RUNNING("running"),
    SUCCESS("success"),
    FAILED("failed");

    @JsonValue
    private final String wireName;

    ProgressStatus(String wireName) {
        this.wireName = wireName;
    }
}
