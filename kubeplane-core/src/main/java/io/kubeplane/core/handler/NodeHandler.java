package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.NodeList;
import io.fabric8.kubernetes.api.model.NodeStatus;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import java.util.EnumSet;
import java.util.Map;
import java.util.TreeMap;

public final class NodeHandler extends KubernetesResourceHandler<Node, NodeList, Resource<Node>> {

    public NodeHandler() {
        super("nodes", "Node", Node.class, false, EnumSet.of(Verb.LIST, Verb.GET));
    }

    @Override
    protected NonNamespaceOperation<Node, NodeList, Resource<Node>> scoped(KubernetesClient client, String namespace) {
        return client.nodes();
    }

    @Override
    protected Listable<NodeList> everywhere(KubernetesClient client) {
        return client.nodes();
    }

    @Override
    protected void describe(Node node, Map<String, Object> summary) {
        NodeStatus status = node.getStatus();
        summary.put("ready", ready(status));
        summary.put("unschedulable", node.getSpec() != null && Boolean.TRUE.equals(node.getSpec().getUnschedulable()));
        summary.put("kubeletVersion", status == null || status.getNodeInfo() == null ? null : status.getNodeInfo().getKubeletVersion());
        summary.put("capacity", quantities(status == null ? null : status.getCapacity()));
        summary.put("allocatable", quantities(status == null ? null : status.getAllocatable()));
    }

    private static boolean ready(NodeStatus status) {
        if (status == null || status.getConditions() == null) {
            return false;
        }
        for (NodeCondition condition : status.getConditions()) {
            if ("Ready".equals(condition.getType())) {
                return "True".equalsIgnoreCase(condition.getStatus());
            }
        }
        return false;
    }

    private static Map<String, String> quantities(Map<String, Quantity> values) {
        Map<String, String> out = new TreeMap<>();
        if (values == null) {
            return out;
        }
        values.forEach((key, value) -> out.put(key, value == null ? null : value.toString()));
        return out;
    }
}
