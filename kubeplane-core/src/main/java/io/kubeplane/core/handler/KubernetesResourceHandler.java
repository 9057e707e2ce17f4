package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventList;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import io.kubeplane.core.cluster.ClusterCapability;
import io.kubeplane.core.error.NotFoundException;
import io.kubeplane.core.error.ValidationException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * fabric8-backed verb implementations shared by every resource kind. Subclasses supply the
 * client operation for their kind and a flat summary of one object.
 */
public abstract class KubernetesResourceHandler<T extends HasMetadata, L extends KubernetesResourceList<T>, R extends Resource<T>>
    implements ResourceHandler {

    private final String kind;
    private final String resourceKind;
    private final Class<T> type;
    private final boolean namespaced;
    private final Set<Verb> verbs;

    protected KubernetesResourceHandler(String kind, String resourceKind, Class<T> type, boolean namespaced, Set<Verb> verbs) {
        this.kind = kind;
        this.resourceKind = resourceKind;
        this.type = type;
        this.namespaced = namespaced;
        this.verbs = Set.copyOf(verbs);
    }

    protected abstract NonNamespaceOperation<T, L, R> scoped(KubernetesClient client, String namespace);

    protected abstract Listable<L> everywhere(KubernetesClient client);

    protected abstract void describe(T item, Map<String, Object> summary);

    @Override
    public final String kind() {
        return kind;
    }

    @Override
    public final Set<Verb> verbs() {
        return verbs;
    }

    @Override
    public final boolean namespaced() {
        return namespaced;
    }

    @Override
    public List<Map<String, Object>> list(ClusterCapability capability, String namespace, ListFilters filters) {
        ListFilters effective = filters == null ? ListFilters.none() : filters;
        return KubernetesErrors.translate(kind, Verb.LIST, () -> {
            KubernetesClient client = capability.client();
            L items = effective.allNamespaces() || !namespaced
                ? everywhere(client).list(effective.toListOptions())
                : scoped(client, namespace).list(effective.toListOptions());
            return items.getItems().stream().map(this::summarize).toList();
        });
    }

    @Override
    public Map<String, Object> get(ClusterCapability capability, String namespace, String name) {
        T item = KubernetesErrors.translate(kind, Verb.GET, () -> scoped(capability.client(), namespace).withName(name).get());
        if (item == null) {
            throw new NotFoundException(notFoundMessage(namespace, name));
        }
        return summarize(item);
    }

    @Override
    public Map<String, Object> create(ClusterCapability capability, String namespace, Map<String, Object> manifest) {
        KubernetesClient client = capability.client();
        T item = toResource(client, manifest);
        if (namespaced) {
            String declared = item.getMetadata().getNamespace();
            if (declared != null && !declared.isBlank() && !declared.equals(namespace)) {
                throw new ValidationException(
                    "manifest namespace " + declared + " does not match target namespace " + namespace
                );
            }
            item.getMetadata().setNamespace(namespace);
        }
        return KubernetesErrors.translate(kind, Verb.CREATE, () -> summarize(scoped(client, namespace).resource(item).create()));
    }

    @Override
    public Map<String, Object> update(ClusterCapability capability, String namespace, String name, Map<String, Object> manifest) {
        if (manifest == null || manifest.isEmpty()) {
            throw new ValidationException("update manifest must not be empty");
        }
        return mergePatch(capability, namespace, name, manifest, Verb.UPDATE);
    }

    @Override
    public Map<String, Object> delete(ClusterCapability capability, String namespace, String name) {
        List<StatusDetails> details = KubernetesErrors.translate(kind, Verb.DELETE, () -> scoped(capability.client(), namespace)
            .withName(name)
            .withPropagationPolicy(DeletionPropagation.FOREGROUND)
            .delete());
        if (details == null || details.isEmpty()) {
            throw new NotFoundException(notFoundMessage(namespace, name));
        }
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("kind", resourceKind);
        ack.put("name", name);
        if (namespaced) {
            ack.put("namespace", namespace);
        }
        ack.put("deleted", true);
        return ack;
    }

    /**
     * Events whose involved object is this kind and name, oldest first. Cluster-scoped kinds
     * search every namespace.
     */
    @Override
    public List<Map<String, Object>> events(ClusterCapability capability, String namespace, String name) {
        EventList events = KubernetesErrors.translate(kind, Verb.EVENTS, () -> {
            KubernetesClient client = capability.client();
            Map<String, String> involved = new LinkedHashMap<>();
            involved.put("involvedObject.name", name);
            involved.put("involvedObject.kind", resourceKind);
            return namespaced
                ? client.v1().events().inNamespace(namespace).withFields(involved).list()
                : client.v1().events().inAnyNamespace().withFields(involved).list();
        });
        return events.getItems().stream()
            .sorted(Comparator.comparing(KubernetesResourceHandler::lastSeen, Comparator.nullsFirst(Comparator.<String>naturalOrder())))
            .map(KubernetesResourceHandler::summarizeEvent)
            .toList();
    }

    protected Map<String, Object> scaleReplicas(ClusterCapability capability, String namespace, String name, int replicas) {
        if (replicas < 0) {
            throw new ValidationException("replicas must not be negative: " + replicas);
        }
        return mergePatch(capability, namespace, name, Map.of("spec", Map.of("replicas", replicas)), Verb.SCALE);
    }

    protected Map<String, Object> summarize(T item) {
        Map<String, Object> summary = new LinkedHashMap<>();
        ObjectMeta metadata = item.getMetadata();
        summary.put("name", metadata == null ? null : metadata.getName());
        if (namespaced) {
            summary.put("namespace", metadata == null ? null : metadata.getNamespace());
        }
        describe(item, summary);
        if (metadata != null) {
            summary.put("labels", sorted(metadata.getLabels()));
            summary.put("createdAt", metadata.getCreationTimestamp());
        }
        return summary;
    }

    protected static Map<String, String> sorted(Map<String, String> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        return new TreeMap<>(input);
    }

    protected static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    private Map<String, Object> mergePatch(
        ClusterCapability capability,
        String namespace,
        String name,
        Map<String, Object> patch,
        Verb verb
    ) {
        KubernetesClient client = capability.client();
        String body = client.getKubernetesSerialization().asJson(patch);
        return KubernetesErrors.translate(kind, verb, () -> summarize(
            scoped(client, namespace).withName(name).patch(PatchContext.of(PatchType.JSON_MERGE), body)
        ));
    }

    private T toResource(KubernetesClient client, Map<String, Object> manifest) {
        if (manifest == null || manifest.isEmpty()) {
            throw new ValidationException("manifest must not be empty");
        }
        Object declaredKind = manifest.get("kind");
        if (declaredKind != null && !resourceKind.equals(String.valueOf(declaredKind))) {
            throw new ValidationException("manifest kind " + declaredKind + " cannot be created as " + resourceKind);
        }
        T item;
        try {
            item = client.getKubernetesSerialization().convertValue(manifest, type);
        } catch (RuntimeException e) {
            throw new ValidationException("manifest is not a valid " + resourceKind + ": " + e.getMessage(), e);
        }
        ObjectMeta metadata = item.getMetadata();
        if (metadata == null || (isBlank(metadata.getName()) && isBlank(metadata.getGenerateName()))) {
            throw new ValidationException("manifest.metadata.name is required");
        }
        return item;
    }

    private static Map<String, Object> summarizeEvent(Event event) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("type", event.getType());
        summary.put("reason", event.getReason());
        summary.put("message", event.getMessage());
        summary.put("count", orZero(event.getCount()));
        summary.put("firstTimestamp", event.getFirstTimestamp());
        summary.put("lastTimestamp", lastSeen(event));
        summary.put("source", event.getSource() == null ? null : event.getSource().getComponent());
        return summary;
    }

    // Events recorded through events.k8s.io only carry eventTime.
    private static String lastSeen(Event event) {
        if (event.getLastTimestamp() != null) {
            return event.getLastTimestamp();
        }
        return event.getEventTime() == null ? null : event.getEventTime().getTime();
    }

    private String notFoundMessage(String namespace, String name) {
        return namespaced
            ? resourceKind + " " + namespace + "/" + name + " not found"
            : resourceKind + " " + name + " not found";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
