package io.kubeplane.core.cluster;

public record ClusterContext(
    String name,
    String endpoint,
    CredentialReference credentials,
    String defaultNamespace
) {
    public static final String FALLBACK_NAMESPACE = "default";

    public ClusterContext {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("cluster name must not be blank");
        }
        name = name.trim();
        credentials = credentials == null ? CredentialReference.none() : credentials;
        defaultNamespace = defaultNamespace == null || defaultNamespace.isBlank()
            ? FALLBACK_NAMESPACE
            : defaultNamespace.trim();
    }

    public ClusterContext(String name, String endpoint) {
        this(name, endpoint, CredentialReference.none(), FALLBACK_NAMESPACE);
    }

    public boolean hasEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }
}
