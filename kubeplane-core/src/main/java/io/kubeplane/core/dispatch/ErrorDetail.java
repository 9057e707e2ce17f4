package io.kubeplane.core.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.kubeplane.core.error.ErrorKind;
import io.kubeplane.core.error.KubeplaneException;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorDetail(ErrorKind kind, String message) {
    public ErrorDetail {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null ? "" : message;
    }

    public static ErrorDetail from(KubeplaneException error) {
        return new ErrorDetail(error.kind(), error.getMessage());
    }

    public static ErrorDetail internal(Throwable error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new ErrorDetail(ErrorKind.INTERNAL, message);
    }

    @JsonProperty("retryable")
    public boolean retryable() {
        return kind.retryable();
    }
}
