package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.api.model.apps.ReplicaSetList;
import io.fabric8.kubernetes.api.model.apps.ReplicaSetSpec;
import io.fabric8.kubernetes.api.model.apps.ReplicaSetStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.RollableScalableResource;
import io.kubeplane.core.cluster.ClusterCapability;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class ReplicaSetHandler
    extends KubernetesResourceHandler<ReplicaSet, ReplicaSetList, RollableScalableResource<ReplicaSet>> {

    public ReplicaSetHandler() {
        super(
            "replicasets",
            "ReplicaSet",
            ReplicaSet.class,
            true,
            EnumSet.of(Verb.LIST, Verb.GET, Verb.CREATE, Verb.UPDATE, Verb.DELETE, Verb.SCALE, Verb.EVENTS)
        );
    }

    @Override
    protected NonNamespaceOperation<ReplicaSet, ReplicaSetList, RollableScalableResource<ReplicaSet>> scoped(
        KubernetesClient client,
        String namespace
    ) {
        return client.apps().replicaSets().inNamespace(namespace);
    }

    @Override
    protected Listable<ReplicaSetList> everywhere(KubernetesClient client) {
        return client.apps().replicaSets().inAnyNamespace();
    }

    @Override
    public Map<String, Object> scale(ClusterCapability capability, String namespace, String name, int replicas) {
        return scaleReplicas(capability, namespace, name, replicas);
    }

    @Override
    protected void describe(ReplicaSet replicaSet, Map<String, Object> summary) {
        ReplicaSetSpec spec = replicaSet.getSpec();
        ReplicaSetStatus status = replicaSet.getStatus();
        summary.put("replicas", spec == null ? 0 : orZero(spec.getReplicas()));
        summary.put("readyReplicas", status == null ? 0 : orZero(status.getReadyReplicas()));
        summary.put("availableReplicas", status == null ? 0 : orZero(status.getAvailableReplicas()));
        summary.put("owner", owner(replicaSet));
        summary.put("images", images(spec));
    }

    private static String owner(ReplicaSet replicaSet) {
        List<OwnerReference> owners = replicaSet.getMetadata() == null ? null : replicaSet.getMetadata().getOwnerReferences();
        if (owners == null || owners.isEmpty()) {
            return null;
        }
        OwnerReference owner = owners.get(0);
        return owner.getKind() + "/" + owner.getName();
    }

    private static List<String> images(ReplicaSetSpec spec) {
        if (spec == null || spec.getTemplate() == null || spec.getTemplate().getSpec() == null
            || spec.getTemplate().getSpec().getContainers() == null) {
            return List.of();
        }
        return spec.getTemplate().getSpec().getContainers().stream()
            .map(Container::getImage)
            .filter(Objects::nonNull)
            .toList();
    }
}
