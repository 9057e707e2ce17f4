package io.kubeplane.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/** HTTP client for a running kubeplane server. */
public final class KubeplaneClient {
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public KubeplaneClient(String baseUrl, Duration callTimeout) {
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.mapper = new ObjectMapper();
        this.client = new OkHttpClient.Builder().callTimeout(callTimeout).build();
    }

    public RemoteResponse listTools() throws IOException {
        return execute(new Request.Builder().url(baseUrl + "/mcp/tools").get().build());
    }

    public RemoteResponse listClusters() throws IOException {
        return execute(new Request.Builder().url(baseUrl + "/mcp/clusters").get().build());
    }

    public RemoteResponse callTool(String toolName, Map<String, Object> arguments, Object clusters, Integer timeoutSeconds)
        throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", toolName);
        payload.put("arguments", arguments == null ? Map.of() : arguments);
        if (clusters != null) {
            payload.put("clusters", clusters);
        }
        if (timeoutSeconds != null) {
            payload.put("timeoutSeconds", timeoutSeconds);
        }

        Request request = new Request.Builder()
            .url(baseUrl + "/mcp/call")
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();
        return execute(request);
    }

    private String normalizeBaseUrl(String value) {
        String raw = (value == null || value.isBlank()) ? "http://127.0.0.1:8080" : value.trim();
        if (raw.endsWith("/")) {
            return raw.substring(0, raw.length() - 1);
        }
        return raw;
    }

    private RemoteResponse execute(Request request) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            Map<String, Object> parsed = body.isBlank()
                ? new LinkedHashMap<>()
                : mapper.readValue(body, new TypeReference<LinkedHashMap<String, Object>>() {});
            return new RemoteResponse(response.code(), parsed);
        }
    }

    public record RemoteResponse(int httpStatus, Map<String, Object> body) {
        public boolean ok() {
            return httpStatus >= 200 && httpStatus < 300;
        }
    }
}
