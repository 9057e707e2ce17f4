package io.kubeplane.core.error;

public final class DuplicateToolException extends KubeplaneException {
    public DuplicateToolException(String toolName) {
        super(ErrorKind.DUPLICATE_TOOL, "Tool already registered: " + toolName);
    }
}
