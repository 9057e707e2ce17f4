package io.kubeplane.core.handler;

import io.kubeplane.core.cluster.ClusterCapability;
import io.kubeplane.core.error.UnsupportedVerbException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Uniform verb set for one resource kind, executed against a single cluster.
 *
 * <p>Implementations hold no mutable state; everything lives in the cluster or in the
 * capability. Verbs a kind does not support keep the default body and fail with
 * {@link UnsupportedVerbException}. Transient API failures must surface as
 * {@link io.kubeplane.core.error.TransientException}, distinct from permanent ones.
 */
public interface ResourceHandler {
    String kind();

    Set<Verb> verbs();

    default boolean namespaced() {
        return true;
    }

    default List<Map<String, Object>> list(ClusterCapability capability, String namespace, ListFilters filters) {
        throw new UnsupportedVerbException(kind(), Verb.LIST.label());
    }

    default Map<String, Object> get(ClusterCapability capability, String namespace, String name) {
        throw new UnsupportedVerbException(kind(), Verb.GET.label());
    }

    default Map<String, Object> create(ClusterCapability capability, String namespace, Map<String, Object> manifest) {
        throw new UnsupportedVerbException(kind(), Verb.CREATE.label());
    }

    default Map<String, Object> update(
        ClusterCapability capability,
        String namespace,
        String name,
        Map<String, Object> manifest
    ) {
        throw new UnsupportedVerbException(kind(), Verb.UPDATE.label());
    }

    default Map<String, Object> delete(ClusterCapability capability, String namespace, String name) {
        throw new UnsupportedVerbException(kind(), Verb.DELETE.label());
    }

    default Map<String, Object> scale(ClusterCapability capability, String namespace, String name, int replicas) {
        throw new UnsupportedVerbException(kind(), Verb.SCALE.label());
    }

    default Map<String, Object> logs(ClusterCapability capability, String namespace, String name, LogOptions options) {
        throw new UnsupportedVerbException(kind(), Verb.LOGS.label());
    }

    default List<Map<String, Object>> events(ClusterCapability capability, String namespace, String name) {
        throw new UnsupportedVerbException(kind(), Verb.EVENTS.label());
    }
}
