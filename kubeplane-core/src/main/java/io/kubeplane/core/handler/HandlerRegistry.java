package io.kubeplane.core.handler;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class HandlerRegistry {
    private final Map<String, ResourceHandler> handlers = new ConcurrentHashMap<>();

    public HandlerRegistry() {
    }

    public HandlerRegistry(List<ResourceHandler> handlers) {
        handlers.forEach(this::register);
    }

    public static HandlerRegistry kubernetesDefaults() {
        return new HandlerRegistry(List.of(
            new PodHandler(),
            new DeploymentHandler(),
            new ServiceHandler(),
            new ReplicaSetHandler(),
            new StatefulSetHandler(),
            new JobHandler(),
            new CronJobHandler(),
            new ConfigMapHandler(),
            new PersistentVolumeClaimHandler(),
            new EndpointsHandler(),
            new EventHandler(),
            new NamespaceHandler(),
            new NodeHandler()
        ));
    }

    public void register(ResourceHandler handler) {
        ResourceHandler previous = handlers.putIfAbsent(handler.kind(), handler);
        if (previous != null) {
            throw new IllegalArgumentException("Handler already registered for kind: " + handler.kind());
        }
    }

    public Optional<ResourceHandler> find(String kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    public Collection<ResourceHandler> all() {
        return handlers.values();
    }
}
