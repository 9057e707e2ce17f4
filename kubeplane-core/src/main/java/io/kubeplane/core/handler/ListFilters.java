package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.ListOptions;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;

public record ListFilters(
    String labelSelector,
    String fieldSelector,
    boolean allNamespaces,
    Long limit
) {
    public static ListFilters none() {
        return new ListFilters(null, null, false, null);
    }

    public ListOptions toListOptions() {
        ListOptionsBuilder builder = new ListOptionsBuilder();
        if (labelSelector != null && !labelSelector.isBlank()) {
            builder.withLabelSelector(labelSelector);
        }
        if (fieldSelector != null && !fieldSelector.isBlank()) {
            builder.withFieldSelector(fieldSelector);
        }
        if (limit != null && limit > 0) {
            builder.withLimit(limit);
        }
        return builder.build();
    }
}
