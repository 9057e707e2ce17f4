package io.kubeplane.core.dispatch;

import io.kubeplane.core.cluster.ClusterCapability;
import io.kubeplane.core.error.ErrorKind;
import io.kubeplane.core.error.KubeplaneException;
import io.kubeplane.core.handler.ListFilters;
import io.kubeplane.core.handler.ResourceHandler;
import io.kubeplane.core.handler.Verb;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Pod handler whose per-cluster behaviour is scripted by the test. */
final class ScriptedPodHandler implements ResourceHandler {
    private final Map<String, Behaviour> behaviours = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final List<String> namespaces = new CopyOnWriteArrayList<>();
    private final Set<String> threads = ConcurrentHashMap.newKeySet();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();

    @FunctionalInterface
    interface Behaviour {
        Object apply(String namespace) throws InterruptedException;
    }

    static Behaviour returning(Object payload) {
        return namespace -> payload;
    }

    static Behaviour sleeping(long millis, Object payload) {
        return namespace -> {
            Thread.sleep(millis);
            return payload;
        };
    }

    static Behaviour failing(KubeplaneException error) {
        return namespace -> {
            throw error;
        };
    }

    ScriptedPodHandler on(String cluster, Behaviour behaviour) {
        behaviours.put(cluster, behaviour);
        return this;
    }

    int calls(String cluster) {
        AtomicInteger counter = calls.get(cluster);
        return counter == null ? 0 : counter.get();
    }

    int totalCalls() {
        return calls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    List<String> namespaces() {
        return namespaces;
    }

    int maxActive() {
        return maxActive.get();
    }

    Set<String> threads() {
        return threads;
    }

    @Override
    public String kind() {
        return "pods";
    }

    @Override
    public Set<Verb> verbs() {
        return EnumSet.of(Verb.LIST, Verb.GET, Verb.CREATE, Verb.DELETE, Verb.SCALE, Verb.EVENTS);
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> list(ClusterCapability capability, String namespace, ListFilters filters) {
        return (List<Map<String, Object>>) run(capability, namespace);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> get(ClusterCapability capability, String namespace, String name) {
        return (Map<String, Object>) run(capability, namespace);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> create(ClusterCapability capability, String namespace, Map<String, Object> manifest) {
        return (Map<String, Object>) run(capability, namespace);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> delete(ClusterCapability capability, String namespace, String name) {
        return (Map<String, Object>) run(capability, namespace);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> scale(ClusterCapability capability, String namespace, String name, int replicas) {
        return (Map<String, Object>) run(capability, namespace);
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> events(ClusterCapability capability, String namespace, String name) {
        return (List<Map<String, Object>>) run(capability, namespace);
    }

    private Object run(ClusterCapability capability, String namespace) {
        threads.add(Thread.currentThread().getName());
        calls.computeIfAbsent(capability.clusterName(), name -> new AtomicInteger()).incrementAndGet();
        namespaces.add(namespace);
        maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
        try {
            return behaviours.getOrDefault(capability.clusterName(), returning(List.of())).apply(namespace);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KubeplaneException(ErrorKind.TIMEOUT, "interrupted");
        } finally {
            active.decrementAndGet();
        }
    }
}
