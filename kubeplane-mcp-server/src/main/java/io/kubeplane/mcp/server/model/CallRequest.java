package io.kubeplane.mcp.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * Body of {@code POST /mcp/call}. {@code clusters} is {@code "all"}, one name, or an array of
 * names; when absent the server's default selector applies.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallRequest(
    String name,
    Map<String, Object> arguments,
    Object clusters,
    Integer timeoutSeconds
) {
    public CallRequest {
        name = name == null ? "" : name;
        arguments = arguments == null ? Map.of() : arguments;
    }
}
