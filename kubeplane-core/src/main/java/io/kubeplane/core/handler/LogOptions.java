package io.kubeplane.core.handler;

public record LogOptions(String container, Integer tailLines) {
    public static LogOptions defaults() {
        return new LogOptions(null, null);
    }
}
