package io.kubeplane.core.error;

public final class TransientException extends KubeplaneException {
    public TransientException(String message) {
        super(ErrorKind.TRANSIENT, message);
    }

    public TransientException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, message, cause);
    }
}
