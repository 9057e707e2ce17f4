package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentCondition;
import io.fabric8.kubernetes.api.model.apps.DeploymentList;
import io.fabric8.kubernetes.api.model.apps.DeploymentSpec;
import io.fabric8.kubernetes.api.model.apps.DeploymentStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.RollableScalableResource;
import io.kubeplane.core.cluster.ClusterCapability;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class DeploymentHandler
    extends KubernetesResourceHandler<Deployment, DeploymentList, RollableScalableResource<Deployment>> {

    public DeploymentHandler() {
        super(
            "deployments",
            "Deployment",
            Deployment.class,
            true,
            EnumSet.of(Verb.LIST, Verb.GET, Verb.CREATE, Verb.UPDATE, Verb.DELETE, Verb.SCALE, Verb.EVENTS)
        );
    }

    @Override
    protected NonNamespaceOperation<Deployment, DeploymentList, RollableScalableResource<Deployment>> scoped(
        KubernetesClient client,
        String namespace
    ) {
        return client.apps().deployments().inNamespace(namespace);
    }

    @Override
    protected Listable<DeploymentList> everywhere(KubernetesClient client) {
        return client.apps().deployments().inAnyNamespace();
    }

    @Override
    public Map<String, Object> scale(ClusterCapability capability, String namespace, String name, int replicas) {
        return scaleReplicas(capability, namespace, name, replicas);
    }

    @Override
    protected void describe(Deployment deployment, Map<String, Object> summary) {
        DeploymentSpec spec = deployment.getSpec();
        DeploymentStatus status = deployment.getStatus();
        summary.put("replicas", spec == null ? 0 : orZero(spec.getReplicas()));
        summary.put("readyReplicas", status == null ? 0 : orZero(status.getReadyReplicas()));
        summary.put("availableReplicas", status == null ? 0 : orZero(status.getAvailableReplicas()));
        summary.put("updatedReplicas", status == null ? 0 : orZero(status.getUpdatedReplicas()));
        summary.put("strategy", spec == null || spec.getStrategy() == null ? null : spec.getStrategy().getType());
        summary.put("images", images(spec));
        summary.put("conditions", conditions(status));
    }

    private static List<Map<String, Object>> conditions(DeploymentStatus status) {
        if (status == null || status.getConditions() == null) {
            return List.of();
        }
        List<Map<String, Object>> conditions = new ArrayList<>();
        for (DeploymentCondition condition : status.getConditions()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", condition.getType());
            entry.put("status", condition.getStatus());
            entry.put("reason", condition.getReason());
            entry.put("message", condition.getMessage());
            conditions.add(entry);
        }
        return conditions;
    }

    private static List<String> images(DeploymentSpec spec) {
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
