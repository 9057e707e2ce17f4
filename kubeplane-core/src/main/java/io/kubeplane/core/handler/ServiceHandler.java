package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceList;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.ServiceSpec;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.ServiceResource;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ServiceHandler extends KubernetesResourceHandler<Service, ServiceList, ServiceResource<Service>> {

    public ServiceHandler() {
        super(
            "services",
            "Service",
            Service.class,
            true,
            EnumSet.of(Verb.LIST, Verb.GET, Verb.CREATE, Verb.UPDATE, Verb.DELETE, Verb.EVENTS)
        );
    }

    @Override
    protected NonNamespaceOperation<Service, ServiceList, ServiceResource<Service>> scoped(KubernetesClient client, String namespace) {
        return client.services().inNamespace(namespace);
    }

    @Override
    protected Listable<ServiceList> everywhere(KubernetesClient client) {
        return client.services().inAnyNamespace();
    }

    @Override
    protected void describe(Service service, Map<String, Object> summary) {
        ServiceSpec spec = service.getSpec();
        summary.put("type", spec == null ? null : spec.getType());
        summary.put("clusterIP", spec == null ? null : spec.getClusterIP());
        summary.put("selector", spec == null ? Map.of() : sorted(spec.getSelector()));
        summary.put("ports", ports(spec));
    }

    private static List<Map<String, Object>> ports(ServiceSpec spec) {
        List<Map<String, Object>> ports = new ArrayList<>();
        if (spec == null || spec.getPorts() == null) {
            return ports;
        }
        for (ServicePort port : spec.getPorts()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", port.getName());
            entry.put("port", port.getPort());
            entry.put("targetPort", port.getTargetPort() == null ? null : port.getTargetPort().toString());
            entry.put("protocol", port.getProtocol());
            entry.put("nodePort", port.getNodePort());
            ports.add(entry);
        }
        return ports;
    }
}
