package io.kubeplane.core.error;

public final class AuthenticationException extends KubeplaneException {
    public AuthenticationException(String message) {
        super(ErrorKind.AUTHENTICATION, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, message, cause);
    }
}
