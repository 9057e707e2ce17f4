package io.kubeplane.mcp.server.config;

import io.kubeplane.core.config.ConfigPaths;
import java.nio.file.Path;

public record McpServerConfig(
    String host,
    int port,
    Path configPath
) {
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8080;

    public static McpServerConfig fromEnv() {
        return new McpServerConfig(
            env("HOST", DEFAULT_HOST),
            intEnv("PORT", DEFAULT_PORT),
            ConfigPaths.resolveConfigPath()
        );
    }

    private static String env(String key, String fallback) {
        String value = System.getenv(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int intEnv(String key, int fallback) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
