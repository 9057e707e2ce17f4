package io.kubeplane.core.cluster;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kubeplane.core.error.AuthenticationException;
import io.kubeplane.core.error.DuplicateClusterException;
import io.kubeplane.core.error.UnknownClusterException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ClusterRegistryTest {

    @Test
    void duplicateNamesAreRejected() {
        ClusterRegistry registry = new ClusterRegistry(context -> new ClusterCapability(context.name(), null));
        registry.register(new ClusterContext("prod", "https://prod.example"));

        assertThatThrownBy(() -> registry.register(new ClusterContext("prod", "https://other.example")))
            .isInstanceOf(DuplicateClusterException.class);
    }

    @Test
    void resolveAllFollowsRegistrationOrderAndNeverFails() {
        ClusterRegistry empty = new ClusterRegistry(context -> new ClusterCapability(context.name(), null));
        assertThat(empty.resolve(ClusterSelector.allClusters())).isEmpty();

        ClusterRegistry registry = new ClusterRegistry(context -> new ClusterCapability(context.name(), null));
        registry.register(new ClusterContext("b", "https://b"));
        registry.register(new ClusterContext("a", "https://a"));

        assertThat(registry.resolve(ClusterSelector.allClusters()))
            .extracting(ClusterContext::name)
            .containsExactly("b", "a");
    }

    @Test
    void resolveExplicitSetKeepsSelectorOrderAndNamesFirstUnknown() {
        ClusterRegistry registry = new ClusterRegistry(context -> new ClusterCapability(context.name(), null));
        registry.register(new ClusterContext("a", "https://a"));
        registry.register(new ClusterContext("b", "https://b"));

        assertThat(registry.resolve(ClusterSelector.of("b", "a")))
            .extracting(ClusterContext::name)
            .containsExactly("b", "a");

        assertThatThrownBy(() -> registry.resolve(ClusterSelector.of("a", "typo", "missing")))
            .isInstanceOf(UnknownClusterException.class)
            .satisfies(error -> assertThat(((UnknownClusterException) error).clusterName()).isEqualTo("typo"));
    }

    @Test
    void concurrentFirstUseConstructsOneCapability() throws Exception {
        AtomicInteger constructions = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ClusterRegistry registry = new ClusterRegistry(context -> {
            constructions.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ClusterCapability(context.name(), null);
        });
        ClusterContext prod = new ClusterContext("prod", "https://prod");
        registry.register(prod);

        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            CountDownLatch ready = new CountDownLatch(callers);
            List<Future<ClusterCapability>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    return registry.capability(prod);
                }));
            }
            ready.await(5, TimeUnit.SECONDS);
            Thread.sleep(100);
            release.countDown();

            ClusterCapability first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<ClusterCapability> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(constructions).hasValue(1);
    }

    @Test
    void failedConstructionIsNotCached() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        ClusterRegistry registry = new ClusterRegistry(context -> {
            if (attempts.incrementAndGet() == 1) {
                throw new AuthenticationException("token rejected");
            }
            return new ClusterCapability(context.name(), null);
        });
        ClusterContext prod = new ClusterContext("prod", "https://prod");
        registry.register(prod);

        assertThatThrownBy(() -> registry.capability(prod))
            .isInstanceOf(AuthenticationException.class)
            .hasMessageContaining("token rejected");
        assertThat(registry.capability(prod).clusterName()).isEqualTo("prod");
        assertThat(attempts).hasValue(2);
    }

    @Test
    void unexpectedConstructionFailureSurfacesAsAuthenticationError() {
        ClusterRegistry registry = new ClusterRegistry(context -> {
            throw new IllegalStateException("boom");
        });
        ClusterContext prod = new ClusterContext("prod", "https://prod");
        registry.register(prod);

        assertThatThrownBy(() -> registry.capability(prod))
            .isInstanceOf(AuthenticationException.class)
            .hasMessageContaining("boom");
    }

    @Test
    void invalidateForcesReconstruction() throws Exception {
        AtomicInteger constructions = new AtomicInteger();
        ClusterRegistry registry = new ClusterRegistry(context -> {
            constructions.incrementAndGet();
            return new ClusterCapability(context.name(), null);
        });
        ClusterContext prod = new ClusterContext("prod", "https://prod");
        registry.register(prod);

        ClusterCapability first = registry.capability(prod);
        assertThat(registry.capability(prod)).isSameAs(first);

        registry.invalidate(first);

        assertThat(registry.capability(prod)).isNotSameAs(first);
        assertThat(constructions).hasValue(2);
    }

    @Test
    void lateInvalidationOfReplacedCapabilityKeepsTheRebuiltOne() throws Exception {
        AtomicInteger constructions = new AtomicInteger();
        ClusterRegistry registry = new ClusterRegistry(context -> {
            constructions.incrementAndGet();
            return new ClusterCapability(context.name(), null);
        });
        ClusterContext prod = new ClusterContext("prod", "https://prod");
        registry.register(prod);

        ClusterCapability first = registry.capability(prod);
        registry.invalidate(first);
        ClusterCapability rebuilt = registry.capability(prod);

        registry.invalidate(first);

        assertThat(registry.capability(prod)).isSameAs(rebuilt);
        assertThat(constructions).hasValue(2);
    }
}
