package io.kubeplane.core.dispatch;

import io.kubeplane.core.cluster.ClusterContext;
import io.kubeplane.core.handler.ListFilters;
import io.kubeplane.core.handler.LogOptions;
import io.kubeplane.core.handler.Verb;
import java.util.Map;

/**
 * Typed view over the parameters of a validated invocation. Types were already checked by the
 * tool registry, so accessors only convert.
 */
final class InvocationArguments {
    private final Map<String, Object> parameters;

    InvocationArguments(Map<String, Object> parameters) {
        this.parameters = parameters;
    }

    /** Explicit parameter, then the manifest's own namespace on create, then the cluster default. */
    String namespace(Verb verb, ClusterContext cluster) {
        String explicit = string("namespace");
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        if (verb == Verb.CREATE) {
            Object metadata = manifest().get("metadata");
            if (metadata instanceof Map<?, ?> meta && meta.get("namespace") instanceof String declared && !declared.isBlank()) {
                return declared;
            }
        }
        return cluster.defaultNamespace();
    }

    String name() {
        return string("name");
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> manifest() {
        Object value = parameters.get("manifest");
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    ListFilters filters() {
        Long limit = parameters.get("limit") instanceof Number number ? number.longValue() : null;
        return new ListFilters(
            string("labelSelector"),
            string("fieldSelector"),
            Boolean.TRUE.equals(parameters.get("allNamespaces")),
            limit
        );
    }

    int replicas() {
        Integer replicas = intValue("replicas");
        return replicas == null ? 0 : replicas;
    }

    LogOptions logOptions() {
        return new LogOptions(string("container"), intValue("tailLines"));
    }

    private Integer intValue(String key) {
        return parameters.get(key) instanceof Number number ? Math.toIntExact(number.longValue()) : null;
    }

    private String string(String key) {
        Object value = parameters.get(key);
        return value == null ? null : value.toString();
    }
}
