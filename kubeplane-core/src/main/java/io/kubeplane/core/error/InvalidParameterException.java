package io.kubeplane.core.error;

public final class InvalidParameterException extends KubeplaneException {
    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(ErrorKind.INVALID_PARAMETER, "Invalid parameter '" + parameter + "': " + message);
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }
}
