package io.kubeplane.core.error;

public final class UnsupportedVerbException extends KubeplaneException {
    public UnsupportedVerbException(String kind, String verb) {
        super(ErrorKind.UNSUPPORTED_OPERATION, "Operation " + verb + " is not supported for " + kind);
    }
}
