package io.kubeplane.cli;

import io.kubeplane.core.KubeplaneRuntime;
import io.kubeplane.core.cluster.ClusterContext;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "clusters", description = "List the configured clusters")
public final class ClustersCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--server"}, description = "Query a running server instead of the local configuration")
    String server;

    public ClustersCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (server != null && !server.isBlank()) {
                KubeplaneClient.RemoteResponse response = new KubeplaneClient(server, Duration.ofSeconds(30)).listClusters();
                if (!response.ok()) {
                    System.err.println("Server returned HTTP " + response.httpStatus() + ": " + response.body());
                    return 1;
                }
                if (response.body().get("clusters") instanceof List<?> clusters) {
                    for (Object cluster : clusters) {
                        if (cluster instanceof Map<?, ?> entry) {
                            print(String.valueOf(entry.get("name")), entry.get("endpoint"), entry.get("defaultNamespace"));
                        }
                    }
                }
                return 0;
            }

            try (KubeplaneRuntime runtime = context.openRuntime()) {
                String defaultCluster = runtime.config().defaultCluster();
                for (ClusterContext cluster : runtime.clusters().contexts()) {
                    String marker = cluster.name().equals(defaultCluster) ? " (default)" : "";
                    print(cluster.name() + marker, cluster.endpoint(), cluster.defaultNamespace());
                }
                return 0;
            }
        } catch (Exception e) {
            System.err.println("Clusters command failed: " + e.getMessage());
            return 1;
        }
    }

    private static void print(String name, Object endpoint, Object namespace) {
        System.out.printf("%-24s %-40s %s%n", name, endpoint == null ? "<kubeconfig>" : endpoint, namespace);
    }
}
