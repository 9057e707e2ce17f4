package io.kubeplane.cli;

import io.kubeplane.core.KubeplaneRuntime;
import io.kubeplane.core.config.ConfigService;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    RuntimeFactory runtimeFactory,
    ServerRunner serverRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, KubeplaneRuntime::create, (host, port) -> {
            throw new UnsupportedOperationException("server runner is not configured");
        });
    }

    public KubeplaneRuntime openRuntime() throws IOException {
        return runtimeFactory.create(configService.load(configPath));
    }
}
