package io.kubeplane.core.dispatch;

import io.kubeplane.core.cluster.ClusterCapability;
import io.kubeplane.core.cluster.ClusterContext;
import io.kubeplane.core.cluster.ClusterRegistry;
import io.kubeplane.core.error.DispatchTimeoutException;
import io.kubeplane.core.error.ErrorKind;
import io.kubeplane.core.error.InvalidParameterException;
import io.kubeplane.core.error.KubeplaneException;
import io.kubeplane.core.error.UnknownToolException;
import io.kubeplane.core.error.UnsupportedVerbException;
import io.kubeplane.core.handler.HandlerRegistry;
import io.kubeplane.core.handler.ResourceHandler;
import io.kubeplane.core.handler.Verb;
import io.kubeplane.core.tool.ToolDescriptor;
import io.kubeplane.core.tool.ToolInvocation;
import io.kubeplane.core.tool.ToolRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates an invocation, resolves its target clusters and runs the matching handler verb on
 * each of them concurrently.
 *
 * <p>Results are collected into slots indexed by resolution order, never by completion order.
 * Validation and resolution failures happen before any cluster is contacted; per-cluster failures,
 * including the overall deadline, are recorded in that cluster's slot and never affect siblings.
 * Only {@link io.kubeplane.core.error.UnknownClusterException} escapes {@link #dispatch}.
 *
 * <p>Workers come from one pool of {@code maxInFlight} threads shared by all dispatches; targets
 * beyond that queue until a worker frees up. Only idempotent verbs are retried.
 */
public final class DispatchEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(DispatchEngine.class);

    private final ToolRegistry toolRegistry;
    private final ClusterRegistry clusterRegistry;
    private final HandlerRegistry handlerRegistry;
    private final DispatchSettings settings;
    private final ThreadPoolExecutor workers;

    public DispatchEngine(
        ToolRegistry toolRegistry,
        ClusterRegistry clusterRegistry,
        HandlerRegistry handlerRegistry,
        DispatchSettings settings
    ) {
        this.toolRegistry = Objects.requireNonNull(toolRegistry, "toolRegistry must not be null");
        this.clusterRegistry = Objects.requireNonNull(clusterRegistry, "clusterRegistry must not be null");
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "handlerRegistry must not be null");
        this.settings = settings == null ? DispatchSettings.defaults() : settings;
        this.workers = new ThreadPoolExecutor(
            this.settings.maxInFlight(),
            this.settings.maxInFlight(),
            30L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            new WorkerThreadFactory()
        );
        this.workers.allowCoreThreadTimeOut(true);
    }

    public AggregatedResponse dispatch(ToolInvocation invocation) {
        return dispatch(invocation, settings.timeout());
    }

    public AggregatedResponse dispatch(ToolInvocation invocation, Duration deadline) {
        Objects.requireNonNull(invocation, "invocation must not be null");
        Duration effectiveDeadline = deadline == null || deadline.isZero() || deadline.isNegative()
            ? settings.timeout()
            : deadline;
        long started = System.nanoTime();

        ToolDescriptor descriptor;
        try {
            descriptor = toolRegistry.validate(invocation);
        } catch (UnknownToolException | InvalidParameterException e) {
            LOG.info("Rejected call to {}: {}", invocation.toolName(), e.getMessage());
            return AggregatedResponse.rejected(invocation.toolName(), ErrorDetail.from(e));
        }

        List<ClusterContext> targets = clusterRegistry.resolve(invocation.selector());
        List<OperationResult> results = fanOut(descriptor, new InvocationArguments(invocation.parameters()), targets, effectiveDeadline);
        AggregatedResponse response = AggregatedResponse.of(descriptor.name(), results);

        LOG.info(
            "Dispatched {} to {} cluster(s): {} in {} ms",
            descriptor.name(),
            targets.size(),
            response.status().wireName(),
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)
        );
        return response;
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private List<OperationResult> fanOut(
        ToolDescriptor descriptor,
        InvocationArguments arguments,
        List<ClusterContext> targets,
        Duration deadline
    ) {
        if (targets.isEmpty()) {
            return List.of();
        }

        List<Future<OperationResult>> futures = new ArrayList<>(targets.size());
        for (ClusterContext target : targets) {
            futures.add(workers.submit(() -> execute(descriptor, arguments, target)));
        }

        OperationResult[] slots = new OperationResult[targets.size()];
        long deadlineNanos = System.nanoTime() + deadline.toNanos();
        for (int i = 0; i < targets.size(); i++) {
            ClusterContext target = targets.get(i);
            Future<OperationResult> future = futures.get(i);
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            try {
                slots[i] = future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                LOG.warn("{} on cluster {} exceeded the {} ms deadline", descriptor.name(), target.name(), deadline.toMillis());
                slots[i] = OperationResult.failure(target.name(), ErrorDetail.from(new DispatchTimeoutException(target.name(), deadline)));
            } catch (ExecutionException e) {
                LOG.warn("{} on cluster {} failed unexpectedly", descriptor.name(), target.name(), e.getCause());
                slots[i] = OperationResult.failure(target.name(), ErrorDetail.internal(e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(descriptor, targets, futures, slots, i);
                break;
            }
        }
        return Arrays.asList(slots);
    }

    private void abandon(
        ToolDescriptor descriptor,
        List<ClusterContext> targets,
        List<Future<OperationResult>> futures,
        OperationResult[] slots,
        int from
    ) {
        LOG.warn("Dispatch of {} interrupted; cancelling {} pending cluster(s)", descriptor.name(), targets.size() - from);
        for (int j = from; j < targets.size(); j++) {
            futures.get(j).cancel(true);
            String cluster = targets.get(j).name();
            slots[j] = OperationResult.failure(cluster, new ErrorDetail(ErrorKind.TIMEOUT, "Dispatch interrupted before cluster " + cluster + " completed"));
        }
    }

    private OperationResult execute(ToolDescriptor descriptor, InvocationArguments arguments, ClusterContext target) {
        ClusterCapability capability;
        try {
            capability = clusterRegistry.capability(target);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure(target.name(), new ErrorDetail(ErrorKind.TIMEOUT, "Cancelled while connecting to cluster " + target.name()));
        } catch (KubeplaneException e) {
            LOG.warn("Cannot connect to cluster {}: {}", target.name(), e.getMessage());
            return OperationResult.failure(target.name(), ErrorDetail.from(e));
        }

        try {
            ResourceHandler handler = handlerRegistry.find(descriptor.kind())
                .filter(candidate -> candidate.verbs().contains(descriptor.verb()))
                .orElseThrow(() -> new UnsupportedVerbException(descriptor.kind(), descriptor.verb().label()));
            RetryPolicy retries = descriptor.verb().idempotent() ? settings.retryPolicy() : RetryPolicy.none();
            Object payload = retries.execute(
                target.name(),
                () -> invoke(handler, capability, descriptor.verb(), arguments, target)
            );
            return OperationResult.success(target.name(), payload);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure(target.name(), new ErrorDetail(ErrorKind.TIMEOUT, "Cancelled while retrying on cluster " + target.name()));
        } catch (KubeplaneException e) {
            if (e.kind() == ErrorKind.AUTHENTICATION) {
                clusterRegistry.invalidate(capability);
            }
            LOG.warn("{} failed on cluster {}: {} {}", descriptor.name(), target.name(), e.kind().wireName(), e.getMessage());
            return OperationResult.failure(target.name(), ErrorDetail.from(e));
        } catch (RuntimeException e) {
            LOG.warn("{} failed on cluster {}", descriptor.name(), target.name(), e);
            return OperationResult.failure(target.name(), ErrorDetail.internal(e));
        }
    }

    private static Object invoke(
        ResourceHandler handler,
        ClusterCapability capability,
        Verb verb,
        InvocationArguments arguments,
        ClusterContext target
    ) {
        String namespace = arguments.namespace(verb, target);
        return switch (verb) {
            case LIST -> handler.list(capability, namespace, arguments.filters());
            case GET -> handler.get(capability, namespace, arguments.name());
            case CREATE -> handler.create(capability, namespace, arguments.manifest());
            case UPDATE -> handler.update(capability, namespace, arguments.name(), arguments.manifest());
            case DELETE -> handler.delete(capability, namespace, arguments.name());
            case SCALE -> handler.scale(capability, namespace, arguments.name(), arguments.replicas());
            case LOGS -> handler.logs(capability, namespace, arguments.name(), arguments.logOptions());
            case EVENTS -> handler.events(capability, namespace, arguments.name());
        };
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "kubeplane-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
