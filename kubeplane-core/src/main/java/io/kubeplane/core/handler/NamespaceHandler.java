package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import java.util.EnumSet;
import java.util.Map;

public final class NamespaceHandler extends KubernetesResourceHandler<Namespace, NamespaceList, Resource<Namespace>> {

    public NamespaceHandler() {
        super(
            "namespaces",
            "Namespace",
            Namespace.class,
            false,
            EnumSet.of(Verb.LIST, Verb.GET, Verb.CREATE, Verb.DELETE)
        );
    }

    @Override
    protected NonNamespaceOperation<Namespace, NamespaceList, Resource<Namespace>> scoped(KubernetesClient client, String namespace) {
        return client.namespaces();
    }

    @Override
    protected Listable<NamespaceList> everywhere(KubernetesClient client) {
        return client.namespaces();
    }

    @Override
    protected void describe(Namespace namespace, Map<String, Object> summary) {
        summary.put("phase", namespace.getStatus() == null ? null : namespace.getStatus().getPhase());
    }
}
