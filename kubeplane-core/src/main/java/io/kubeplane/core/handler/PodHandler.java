package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.api.model.PodStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.ContainerResource;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.kubeplane.core.cluster.ClusterCapability;
import io.kubeplane.core.error.ValidationException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class PodHandler extends KubernetesResourceHandler<Pod, PodList, PodResource> {

    public PodHandler() {
        super(
            "pods",
            "Pod",
            Pod.class,
            true,
            EnumSet.of(Verb.LIST, Verb.GET, Verb.CREATE, Verb.UPDATE, Verb.DELETE, Verb.LOGS, Verb.EVENTS)
        );
    }

    @Override
    protected NonNamespaceOperation<Pod, PodList, PodResource> scoped(KubernetesClient client, String namespace) {
        return client.pods().inNamespace(namespace);
    }

    @Override
    protected Listable<PodList> everywhere(KubernetesClient client) {
        return client.pods().inAnyNamespace();
    }

    @Override
    public Map<String, Object> logs(ClusterCapability capability, String namespace, String name, LogOptions options) {
        LogOptions effective = options == null ? LogOptions.defaults() : options;
        if (effective.tailLines() != null && effective.tailLines() < 0) {
            throw new ValidationException("tailLines must not be negative: " + effective.tailLines());
        }
        String log = KubernetesErrors.translate(kind(), Verb.LOGS, () -> {
            PodResource pod = capability.client().pods().inNamespace(namespace).withName(name);
            if (effective.container() != null && !effective.container().isBlank()) {
                ContainerResource container = pod.inContainer(effective.container());
                return effective.tailLines() == null ? container.getLog() : container.tailingLines(effective.tailLines()).getLog();
            }
            return effective.tailLines() == null ? pod.getLog() : pod.tailingLines(effective.tailLines()).getLog();
        });

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", name);
        result.put("namespace", namespace);
        result.put("container", effective.container());
        result.put("log", log == null ? "" : log);
        return result;
    }

    @Override
    protected void describe(Pod pod, Map<String, Object> summary) {
        PodStatus status = pod.getStatus();
        summary.put("phase", status == null || status.getPhase() == null ? "Unknown" : status.getPhase());
        summary.put("node", pod.getSpec() == null ? null : pod.getSpec().getNodeName());
        summary.put("podIP", status == null ? null : status.getPodIP());
        summary.put("hostIP", status == null ? null : status.getHostIP());
        summary.put("startTime", status == null ? null : status.getStartTime());
        summary.put("containers", containers(pod));
    }

    private static List<Map<String, Object>> containers(Pod pod) {
        List<Map<String, Object>> containers = new ArrayList<>();
        if (pod.getStatus() != null && pod.getStatus().getContainerStatuses() != null
            && !pod.getStatus().getContainerStatuses().isEmpty()) {
            for (ContainerStatus status : pod.getStatus().getContainerStatuses()) {
                Map<String, Object> container = new LinkedHashMap<>();
                container.put("name", status.getName());
                container.put("image", status.getImage());
                container.put("ready", Boolean.TRUE.equals(status.getReady()));
                container.put("restartCount", orZero(status.getRestartCount()));
                containers.add(container);
            }
            return containers;
        }
        if (pod.getSpec() != null && pod.getSpec().getContainers() != null) {
            for (Container spec : pod.getSpec().getContainers()) {
                Map<String, Object> container = new LinkedHashMap<>();
                container.put("name", spec.getName());
                container.put("image", spec.getImage());
                containers.add(container);
            }
        }
        return containers;
    }
}
