package io.kubeplane.core.error;

public final class UnknownToolException extends KubeplaneException {
    private final String toolName;

    public UnknownToolException(String toolName) {
        super(ErrorKind.UNKNOWN_TOOL, "Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
