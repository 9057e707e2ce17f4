package io.kubeplane.core;

import io.kubeplane.core.cluster.ClusterContext;
import io.kubeplane.core.cluster.ClusterRegistry;
import io.kubeplane.core.cluster.ClusterSelector;
import io.kubeplane.core.cluster.CredentialSource;
import io.kubeplane.core.cluster.KubernetesCredentialSource;
import io.kubeplane.core.config.model.ClusterConfig;
import io.kubeplane.core.config.model.KubeplaneConfig;
import io.kubeplane.core.dispatch.DispatchEngine;
import io.kubeplane.core.dispatch.DispatchSettings;
import io.kubeplane.core.handler.HandlerRegistry;
import io.kubeplane.core.tool.ToolCatalog;
import io.kubeplane.core.tool.ToolRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registries and dispatch engine built once from configuration and shared by every transport.
 */
public final class KubeplaneRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(KubeplaneRuntime.class);

    private final KubeplaneConfig config;
    private final ClusterRegistry clusterRegistry;
    private final ToolRegistry toolRegistry;
    private final DispatchEngine engine;

    private KubeplaneRuntime(
        KubeplaneConfig config,
        ClusterRegistry clusterRegistry,
        ToolRegistry toolRegistry,
        DispatchEngine engine
    ) {
        this.config = config;
        this.clusterRegistry = clusterRegistry;
        this.toolRegistry = toolRegistry;
        this.engine = engine;
    }

    public static KubeplaneRuntime create(KubeplaneConfig config) {
        DispatchSettings settings = config.dispatch().toSettings();
        CredentialSource credentials = new KubernetesCredentialSource(settings.timeout(), config.validateCredentials());
        return create(config, credentials, HandlerRegistry.kubernetesDefaults());
    }

    public static KubeplaneRuntime create(KubeplaneConfig config, CredentialSource credentials, HandlerRegistry handlers) {
        Objects.requireNonNull(config, "config must not be null");
        ClusterRegistry clusters = new ClusterRegistry(credentials);
        for (ClusterConfig cluster : config.clusters()) {
            ClusterContext context = cluster.toContext();
            clusters.register(context);
            LOG.info("Registered cluster {} endpoint={} namespace={}", context.name(), context.endpoint(), context.defaultNamespace());
        }
        if (config.defaultCluster() != null && !config.defaultCluster().isBlank()
            && clusters.find(config.defaultCluster()).isEmpty()) {
            throw new IllegalArgumentException("defaultCluster " + config.defaultCluster() + " is not a configured cluster");
        }

        ToolRegistry tools = ToolCatalog.registry(handlers, config.readOnly());
        LOG.info("Registered {} tools (readOnly={})", tools.size(), config.readOnly());
        DispatchEngine engine = new DispatchEngine(tools, clusters, handlers, config.dispatch().toSettings());
        return new KubeplaneRuntime(config, clusters, tools, engine);
    }

    public KubeplaneConfig config() {
        return config;
    }

    public ClusterRegistry clusters() {
        return clusterRegistry;
    }

    public ToolRegistry tools() {
        return toolRegistry;
    }

    public DispatchEngine engine() {
        return engine;
    }

    /** Selector used when a call names no clusters: the configured default cluster, else all. */
    public ClusterSelector defaultSelector() {
        String defaultCluster = config.defaultCluster();
        return defaultCluster == null || defaultCluster.isBlank()
            ? ClusterSelector.allClusters()
            : ClusterSelector.single(defaultCluster);
    }

    @Override
    public void close() {
        engine.close();
        clusterRegistry.close();
    }
}
