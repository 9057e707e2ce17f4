package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetList;
import io.fabric8.kubernetes.api.model.apps.StatefulSetSpec;
import io.fabric8.kubernetes.api.model.apps.StatefulSetStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.RollableScalableResource;
import java.util.EnumSet;
import java.util.Map;

public final class StatefulSetHandler
    extends KubernetesResourceHandler<StatefulSet, StatefulSetList, RollableScalableResource<StatefulSet>> {

    public StatefulSetHandler() {
        super("statefulsets", "StatefulSet", StatefulSet.class, true, EnumSet.of(Verb.LIST, Verb.GET));
    }

    @Override
    protected NonNamespaceOperation<StatefulSet, StatefulSetList, RollableScalableResource<StatefulSet>> scoped(
        KubernetesClient client,
        String namespace
    ) {
        return client.apps().statefulSets().inNamespace(namespace);
    }

    @Override
    protected Listable<StatefulSetList> everywhere(KubernetesClient client) {
        return client.apps().statefulSets().inAnyNamespace();
    }

    @Override
    protected void describe(StatefulSet statefulSet, Map<String, Object> summary) {
        StatefulSetSpec spec = statefulSet.getSpec();
        StatefulSetStatus status = statefulSet.getStatus();
        summary.put("replicas", spec == null ? 0 : orZero(spec.getReplicas()));
        summary.put("readyReplicas", status == null ? 0 : orZero(status.getReadyReplicas()));
        summary.put("currentRevision", status == null ? null : status.getCurrentRevision());
        summary.put("serviceName", spec == null ? null : spec.getServiceName());
    }
}
