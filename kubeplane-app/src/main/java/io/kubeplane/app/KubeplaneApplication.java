package io.kubeplane.app;

import io.kubeplane.cli.CallCommand;
import io.kubeplane.cli.CliContext;
import io.kubeplane.cli.ClustersCommand;
import io.kubeplane.cli.KubeplaneCliCommand;
import io.kubeplane.cli.ServeCommand;
import io.kubeplane.cli.ToolsCommand;
import io.kubeplane.core.KubeplaneRuntime;
import io.kubeplane.core.config.ConfigPaths;
import io.kubeplane.core.config.ConfigService;
import io.kubeplane.core.config.model.KubeplaneConfig;
import io.kubeplane.mcp.server.McpHttpServer;
import io.kubeplane.mcp.server.McpServerApplication;
import io.kubeplane.mcp.server.config.McpServerConfig;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class KubeplaneApplication {
    private static final Logger LOG = LoggerFactory.getLogger(KubeplaneApplication.class);

    private KubeplaneApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.resolveConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            KubeplaneRuntime::create,
            (host, port) -> runServer(configService, configPath, host, port)
        );
        CommandLine commandLine = new CommandLine(new KubeplaneCliCommand());
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("tools", new ToolsCommand(context));
        commandLine.addSubcommand("clusters", new ClustersCommand(context));
        commandLine.addSubcommand("call", new CallCommand(context));
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runServer(ConfigService configService, Path configPath, String host, int port) throws Exception {
        KubeplaneConfig config = configService.load(configPath);
        LOG.info("Loaded {} cluster(s) from {}", config.clusters().size(), configPath);

        KubeplaneRuntime runtime = KubeplaneRuntime.create(config);
        McpHttpServer server;
        try {
            server = McpServerApplication.start(new McpServerConfig(host, port, configPath), runtime);
        } catch (RuntimeException e) {
            runtime.close();
            throw e;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdown(stopped, server, runtime), "kubeplane-shutdown"));
        LOG.info("Serving {} tools on port {}", runtime.tools().size(), server.port());
        stopped.await();
        return 0;
    }

    /**
     * Closes {@code resources} in order, then releases {@code stopped}. Runs on the shutdown-hook
     * thread, so the closing happens before the JVM halts rather than after {@code main} resumes.
     */
    static Runnable shutdown(CountDownLatch stopped, AutoCloseable... resources) {
        return () -> {
            LOG.info("Shutting down");
            try {
                for (AutoCloseable resource : resources) {
                    try {
                        resource.close();
                    } catch (Exception e) {
                        LOG.warn("Failed to close {} during shutdown", resource, e);
                    }
                }
            } finally {
                stopped.countDown();
            }
        };
    }
}
