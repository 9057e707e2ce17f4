package io.kubeplane.core.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OperationResult(String cluster, ResultStatus status, Object payload, ErrorDetail error) {
    public OperationResult {
        Objects.requireNonNull(status, "status must not be null");
        if (status == ResultStatus.ERROR && error == null) {
            throw new IllegalArgumentException("an error result needs an error detail");
        }
    }

    public static OperationResult success(String cluster, Object payload) {
        return new OperationResult(cluster, ResultStatus.SUCCESS, payload, null);
    }

    public static OperationResult failure(String cluster, ErrorDetail error) {
        return new OperationResult(cluster, ResultStatus.ERROR, null, error);
    }

    @JsonIgnore
    public boolean succeeded() {
        return status == ResultStatus.SUCCESS;
    }
}
