package io.kubeplane.core.cluster;

import io.kubeplane.core.error.AuthenticationException;
import io.kubeplane.core.error.DuplicateClusterException;
import io.kubeplane.core.error.KubeplaneException;
import io.kubeplane.core.error.UnknownClusterException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named cluster contexts plus a lazily built, cached capability per context.
 *
 * <p>Capability construction is single-flight: concurrent first calls for one cluster share a
 * single {@link CredentialSource#connect} invocation. A failed construction is not cached.
 */
public final class ClusterRegistry implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ClusterRegistry.class);

    private final CredentialSource credentialSource;
    private final Map<String, ClusterContext> contexts = new LinkedHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<ClusterCapability>> capabilities = new ConcurrentHashMap<>();

    public ClusterRegistry(CredentialSource credentialSource) {
        this.credentialSource = Objects.requireNonNull(credentialSource, "credentialSource must not be null");
    }

    public synchronized void register(ClusterContext context) {
        Objects.requireNonNull(context, "context must not be null");
        if (contexts.containsKey(context.name())) {
            throw new DuplicateClusterException(context.name());
        }
        contexts.put(context.name(), context);
    }

    public synchronized Optional<ClusterContext> find(String name) {
        return Optional.ofNullable(contexts.get(name));
    }

    public synchronized List<ClusterContext> contexts() {
        return List.copyOf(contexts.values());
    }

    public synchronized List<ClusterContext> resolve(ClusterSelector selector) {
        Objects.requireNonNull(selector, "selector must not be null");
        if (selector.all()) {
            return List.copyOf(contexts.values());
        }
        List<ClusterContext> resolved = new ArrayList<>(selector.names().size());
        for (String name : selector.names()) {
            ClusterContext context = contexts.get(name);
            if (context == null) {
                throw new UnknownClusterException(name);
            }
            resolved.add(context);
        }
        return List.copyOf(resolved);
    }

    public ClusterCapability capability(ClusterContext context) throws InterruptedException {
        CompletableFuture<ClusterCapability> pending = new CompletableFuture<>();
        CompletableFuture<ClusterCapability> existing = capabilities.putIfAbsent(context.name(), pending);
        if (existing == null) {
            construct(context, pending);
            return await(context, pending);
        }
        return await(context, existing);
    }

    /**
     * Drops {@code failed} from the cache and closes it, provided it is still the cached
     * capability for its cluster. A capability that was already replaced is left alone, so a
     * late failure report never evicts the rebuilt one.
     */
    public void invalidate(ClusterCapability failed) {
        Objects.requireNonNull(failed, "failed must not be null");
        CompletableFuture<ClusterCapability> current = capabilities.get(failed.clusterName());
        if (current == null || !current.isDone() || current.isCompletedExceptionally() || current.join() != failed) {
            LOG.debug("Capability for cluster {} was already replaced; nothing to drop", failed.clusterName());
            return;
        }
        if (capabilities.remove(failed.clusterName(), current)) {
            LOG.debug("Dropping cached capability for cluster {}", failed.clusterName());
            failed.close();
        }
    }

    /** Closes every cached capability, including ones still being built when this is called. */
    @Override
    public void close() {
        for (String name : List.copyOf(capabilities.keySet())) {
            CompletableFuture<ClusterCapability> removed = capabilities.remove(name);
            if (removed != null) {
                removed.thenAccept(capability -> {
                    LOG.debug("Closing capability for cluster {}", name);
                    capability.close();
                });
            }
        }
    }

    private void construct(ClusterContext context, CompletableFuture<ClusterCapability> pending) {
        LOG.debug("Building capability for cluster {}", context.name());
        try {
            pending.complete(credentialSource.connect(context));
        } catch (RuntimeException e) {
            capabilities.remove(context.name(), pending);
            pending.completeExceptionally(e);
        }
    }

    private ClusterCapability await(ClusterContext context, CompletableFuture<ClusterCapability> future)
        throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AuthenticationException authentication) {
                throw authentication;
            }
            if (cause instanceof KubeplaneException kubeplane) {
                throw new AuthenticationException(kubeplane.getMessage(), kubeplane);
            }
            throw new AuthenticationException(
                "Cannot connect to cluster " + context.name() + ": " + cause.getMessage(),
                cause
            );
        }
    }
}
