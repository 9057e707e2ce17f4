package io.kubeplane.core.dispatch;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResultStatus {
    SUCCESS("success"),
    ERROR("error");

    private final String wireName;

    ResultStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
