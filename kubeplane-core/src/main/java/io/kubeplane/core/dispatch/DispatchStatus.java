package io.kubeplane.core.dispatch;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

public enum DispatchStatus {
    SUCCESS("success", 0),
    PARTIAL_FAILURE("partial_failure", 3),
    FAILURE("failure", 1);

    private final String wireName;
    private final int exitCode;

    DispatchStatus(String wireName, int exitCode) {
        this.wireName = wireName;
        this.exitCode = exitCode;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int exitCode() {
        return exitCode;
    }

    /** Zero results count as success. */
    public static DispatchStatus of(List<OperationResult> results) {
        long succeeded = results.stream().filter(OperationResult::succeeded).count();
        if (succeeded == results.size()) {
            return SUCCESS;
        }
        return succeeded == 0 ? FAILURE : PARTIAL_FAILURE;
    }
}
