package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventList;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import java.util.EnumSet;
import java.util.Map;

public final class EventHandler extends KubernetesResourceHandler<Event, EventList, Resource<Event>> {

    public EventHandler() {
        super("events", "Event", Event.class, true, EnumSet.of(Verb.LIST, Verb.GET));
    }

    @Override
    protected NonNamespaceOperation<Event, EventList, Resource<Event>> scoped(KubernetesClient client, String namespace) {
        return client.v1().events().inNamespace(namespace);
    }

    @Override
    protected Listable<EventList> everywhere(KubernetesClient client) {
        return client.v1().events().inAnyNamespace();
    }

    @Override
    protected void describe(Event event, Map<String, Object> summary) {
        ObjectReference involved = event.getInvolvedObject();
        summary.put("type", event.getType());
        summary.put("reason", event.getReason());
        summary.put("message", event.getMessage());
        summary.put("count", orZero(event.getCount()));
        summary.put("involvedObject", involved == null ? null : involved.getKind() + "/" + involved.getName());
        summary.put("lastTimestamp", event.getLastTimestamp());
    }
}
