package io.kubeplane.core.cluster;

@FunctionalInterface
public interface CredentialSource {
    /**
     * Builds an authenticated handle for the given cluster.
     *
     * @throws io.kubeplane.core.error.AuthenticationException when the credentials cannot be used
     */
    ClusterCapability connect(ClusterContext context);
}
