package io.kubeplane.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KubeplaneConfig(
    String defaultCluster,
    boolean readOnly,
    boolean validateCredentials,
    DispatchConfig dispatch,
    List<ClusterConfig> clusters
) {

    public KubeplaneConfig {
        dispatch = dispatch == null ? DispatchConfig.defaults() : dispatch;
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
    }

    public static KubeplaneConfig defaults() {
        return new KubeplaneConfig(
            null,
            false,
            true,
            DispatchConfig.defaults(),
            List.of()
        );
    }
}
