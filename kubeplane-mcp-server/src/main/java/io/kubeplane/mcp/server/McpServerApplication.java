package io.kubeplane.mcp.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.kubeplane.core.KubeplaneRuntime;
import io.kubeplane.core.config.ConfigService;
import io.kubeplane.core.config.model.KubeplaneConfig;
import io.kubeplane.mcp.server.config.McpServerConfig;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpServerApplication {
    private static final Logger log = LoggerFactory.getLogger(McpServerApplication.class);

    private McpServerApplication() {
    }

    public static void main(String[] args) throws IOException {
        McpServerConfig serverConfig = McpServerConfig.fromEnv();
        KubeplaneConfig config = new ConfigService().load(serverConfig.configPath());
        log.info("Loaded {} cluster(s) from {}", config.clusters().size(), serverConfig.configPath());

        KubeplaneRuntime runtime = KubeplaneRuntime.create(config);
        McpHttpServer server = start(serverConfig, runtime);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            runtime.close();
        }, "kubeplane-shutdown"));
    }

    public static McpHttpServer start(McpServerConfig serverConfig, KubeplaneRuntime runtime) {
        McpHttpServer server = new McpHttpServer(
            serverConfig.host(),
            serverConfig.port(),
            new ToolRouter(runtime),
            new ObjectMapper()
        );
        server.start();
        return server;
    }
}
