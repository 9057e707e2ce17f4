package io.kubeplane.core.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One result per targeted cluster, in resolution order, plus the derived overall status.
 *
 * <p>A rejected invocation (unknown tool, bad parameters) carries a single result with no cluster
 * name; {@link #rejection()} exposes its error.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregatedResponse(String tool, DispatchStatus status, List<OperationResult> results) {
    public AggregatedResponse {
        Objects.requireNonNull(status, "status must not be null");
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static AggregatedResponse of(String tool, List<OperationResult> results) {
        return new AggregatedResponse(tool, DispatchStatus.of(results), results);
    }

    public static AggregatedResponse rejected(String tool, ErrorDetail error) {
        return new AggregatedResponse(tool, DispatchStatus.FAILURE, List.of(OperationResult.failure(null, error)));
    }

    @JsonIgnore
    public Optional<ErrorDetail> rejection() {
        if (results.size() == 1 && results.get(0).cluster() == null && !results.get(0).succeeded()) {
            return Optional.of(results.get(0).error());
        }
        return Optional.empty();
    }

    @JsonIgnore
    public List<String> clusters() {
        return results.stream().map(OperationResult::cluster).toList();
    }
}
