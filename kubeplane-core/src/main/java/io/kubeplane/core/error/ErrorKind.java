package io.kubeplane.core.error;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorKind {
    UNKNOWN_TOOL("UnknownToolError"),
    INVALID_PARAMETER("InvalidParameterError"),
    UNKNOWN_CLUSTER("UnknownClusterError"),
    DUPLICATE_CLUSTER("DuplicateClusterError"),
    DUPLICATE_TOOL("DuplicateToolError"),
    AUTHENTICATION("AuthenticationError"),
    UNSUPPORTED_OPERATION("UnsupportedOperationError"),
    NOT_FOUND("NotFoundError"),
    VALIDATION("ValidationError"),
    TRANSIENT("TransientError"),
    TIMEOUT("TimeoutError"),
    INTERNAL("InternalError");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean retryable() {
        return this == TRANSIENT;
    }
}
