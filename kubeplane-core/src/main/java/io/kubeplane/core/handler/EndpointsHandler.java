package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.EndpointAddress;
import io.fabric8.kubernetes.api.model.EndpointPort;
import io.fabric8.kubernetes.api.model.EndpointSubset;
import io.fabric8.kubernetes.api.model.Endpoints;
import io.fabric8.kubernetes.api.model.EndpointsList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backends behind a service. An {@code endpoints} object shares its service's name, so
 * {@code get_endpoint} with a service name answers which pods the service routes to.
 */
public final class EndpointsHandler extends KubernetesResourceHandler<Endpoints, EndpointsList, Resource<Endpoints>> {

    public EndpointsHandler() {
        super("endpoints", "Endpoints", Endpoints.class, true, EnumSet.of(Verb.LIST, Verb.GET));
    }

    @Override
    protected NonNamespaceOperation<Endpoints, EndpointsList, Resource<Endpoints>> scoped(KubernetesClient client, String namespace) {
        return client.endpoints().inNamespace(namespace);
    }

    @Override
    protected Listable<EndpointsList> everywhere(KubernetesClient client) {
        return client.endpoints().inAnyNamespace();
    }

    @Override
    protected void describe(Endpoints endpoints, Map<String, Object> summary) {
        List<Map<String, Object>> ready = new ArrayList<>();
        List<Map<String, Object>> notReady = new ArrayList<>();
        List<Integer> ports = new ArrayList<>();
        if (endpoints.getSubsets() != null) {
            for (EndpointSubset subset : endpoints.getSubsets()) {
                addresses(subset.getAddresses(), ready);
                addresses(subset.getNotReadyAddresses(), notReady);
                if (subset.getPorts() != null) {
                    subset.getPorts().stream().map(EndpointPort::getPort).forEach(ports::add);
                }
            }
        }
        summary.put("addresses", ready);
        summary.put("notReadyAddresses", notReady);
        summary.put("ports", ports);
    }

    private static void addresses(List<EndpointAddress> source, List<Map<String, Object>> target) {
        if (source == null) {
            return;
        }
        for (EndpointAddress address : source) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("ip", address.getIp());
            entry.put("node", address.getNodeName());
            entry.put("target", address.getTargetRef() == null ? null : address.getTargetRef().getName());
            target.add(entry);
        }
    }
}
