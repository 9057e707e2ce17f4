package io.kubeplane.core.error;

import java.util.Objects;

public class KubeplaneException extends RuntimeException {
    private final ErrorKind kind;

    public KubeplaneException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public KubeplaneException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind kind() {
        return kind;
    }
}
