package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/** Config maps are summarized by key only; values can be large and are never copied out. */
public final class ConfigMapHandler extends KubernetesResourceHandler<ConfigMap, ConfigMapList, Resource<ConfigMap>> {

    public ConfigMapHandler() {
        super("configmaps", "ConfigMap", ConfigMap.class, true, EnumSet.of(Verb.LIST, Verb.GET));
    }

    @Override
    protected NonNamespaceOperation<ConfigMap, ConfigMapList, Resource<ConfigMap>> scoped(KubernetesClient client, String namespace) {
        return client.configMaps().inNamespace(namespace);
    }

    @Override
    protected Listable<ConfigMapList> everywhere(KubernetesClient client) {
        return client.configMaps().inAnyNamespace();
    }

    @Override
    protected void describe(ConfigMap configMap, Map<String, Object> summary) {
        TreeSet<String> keys = new TreeSet<>();
        if (configMap.getData() != null) {
            keys.addAll(configMap.getData().keySet());
        }
        if (configMap.getBinaryData() != null) {
            keys.addAll(configMap.getBinaryData().keySet());
        }
        summary.put("keys", List.copyOf(keys));
    }
}
