package io.kubeplane.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kubeplane.core.cluster.ClusterContext;
import io.kubeplane.core.cluster.CredentialReference;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClusterConfig(
    String name,
    String endpoint,
    @JsonAlias("default_namespace") String defaultNamespace,
    CredentialReference credentials
) {

    public ClusterContext toContext() {
        return new ClusterContext(name, endpoint, credentials, defaultNamespace);
    }
}
