package io.kubeplane.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    public static final String CONFIG_ENV = "KUBEPLANE_CONFIG";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".kubeplane", "config.json");
    }

    public static Path resolveConfigPath() {
        return resolve(System.getenv(CONFIG_ENV));
    }

    public static Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return defaultConfigPath();
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
