package io.kubeplane.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kubeplane.core.dispatch.AggregatedResponse;
import io.kubeplane.core.dispatch.DispatchStatus;
import io.kubeplane.core.dispatch.ErrorDetail;
import io.kubeplane.core.error.ErrorKind;
import io.kubeplane.core.error.UnknownClusterException;
import io.kubeplane.mcp.server.model.CallRequest;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpHttpServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(McpHttpServer.class);

    private final String host;
    private final int requestedPort;
    private final ToolRouter router;
    private final ObjectMapper mapper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private Undertow server;
    private volatile int actualPort;

    public McpHttpServer(String host, int port, ToolRouter router, ObjectMapper mapper) {
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.requestedPort = port;
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.actualPort = port;
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        PathHandler routes = Handlers.path(exchange -> sendJson(exchange, 404, Map.of("error", "not_found")))
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/mcp/tools", this::handleTools)
            .addExactPath("/mcp/clusters", this::handleClusters)
            .addExactPath("/mcp/call", this::handleCall);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        actualPort = resolveBoundPort(server, requestedPort);
        log.info("kubeplane MCP server listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (running.getAndSet(false) && server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleTools(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("tools", router.listTools()));
    }

    private void handleClusters(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("clusters", router.listClusters()));
    }

    private void handleCall(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleCall(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        CallRequest request;
        try {
            request = readRequest(exchange);
        } catch (JsonProcessingException e) {
            sendJson(exchange, 400, errorBody(null, new ErrorDetail(ErrorKind.INVALID_PARAMETER, "Malformed request body: " + e.getOriginalMessage())));
            return;
        }

        try {
            AggregatedResponse response = router.callTool(request);
            sendJson(exchange, statusCode(response), response);
        } catch (UnknownClusterException e) {
            sendJson(exchange, 404, errorBody(request.name(), ErrorDetail.from(e)));
        } catch (IllegalArgumentException e) {
            sendJson(exchange, 400, errorBody(request.name(), new ErrorDetail(ErrorKind.INVALID_PARAMETER, e.getMessage())));
        }
    }

    static int statusCode(AggregatedResponse response) {
        if (response.rejection().isPresent()) {
            return 400;
        }
        DispatchStatus status = response.status();
        return switch (status) {
            case SUCCESS -> 200;
            case PARTIAL_FAILURE -> 207;
            case FAILURE -> 502;
        };
    }

    private CallRequest readRequest(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return new CallRequest(null, null, null, null);
        }
        return mapper.readValue(bytes, CallRequest.class);
    }

    private Map<String, Object> errorBody(String tool, ErrorDetail error) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (tool != null) {
            body.put("tool", tool);
        }
        body.put("status", DispatchStatus.FAILURE);
        body.put("error", error);
        return body;
    }

    private void sendJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        log.error("Unhandled error serving {}", exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, errorBody(null, ErrorDetail.internal(error)));
        } catch (IOException e) {
            log.warn("Could not write error response: {}", e.getMessage());
            exchange.endExchange();
        }
    }

    private static boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        if (undertow.getListenerInfo().isEmpty()) {
            return fallbackPort;
        }
        Object address = undertow.getListenerInfo().get(0).getAddress();
        if (address instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
