package io.kubeplane.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CallCommandTest {

    private MockWebServer server;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void localCallOnDefaultClusterExitsZero() throws Exception {
        CommandFixtures.Result result = CommandFixtures.run(
            new CallCommand(CommandFixtures.context(tempDir)),
            "list_pods", "--arg", "limit=5"
        );

        assertThat(result.exitCode()).isZero();
        JsonNode body = CliJson.MAPPER.readTree(result.out());
        assertThat(body.path("status").asText()).isEqualTo("success");
        assertThat(body.path("results")).hasSize(1);
        JsonNode pod = body.path("results").get(0).path("payload").get(0);
        assertThat(pod.path("namespace").asText()).isEqualTo("default");
        assertThat(pod.path("limit").asText()).isEqualTo("5");
    }

    @Test
    void localPartialFailureExitsThree() throws Exception {
        CommandFixtures.Result result = CommandFixtures.run(
            new CallCommand(CommandFixtures.context(tempDir)),
            "list_pods", "--clusters", "all"
        );

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.out()).contains("partial_failure").contains("TransientError");
    }

    @Test
    void localFailureExitsOne() throws Exception {
        CommandFixtures.Result result = CommandFixtures.run(
            new CallCommand(CommandFixtures.context(tempDir)),
            "get_pod", "-a", "name=web", "-c", "a,b"
        );

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.out()).contains("NotFoundError");
    }

    @Test
    void rejectedCallExitsOne() throws Exception {
        CommandFixtures.Result result = CommandFixtures.run(
            new CallCommand(CommandFixtures.context(tempDir)),
            "list_widgets"
        );

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.out()).contains("UnknownToolError");
    }

    @Test
    void unknownClusterIsReportedOnStderr() throws Exception {
        CommandFixtures.Result result = CommandFixtures.run(
            new CallCommand(CommandFixtures.context(tempDir)),
            "list_pods", "--clusters", "a,typo"
        );

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.out()).isEmpty();
        assertThat(result.err()).contains("typo");
    }

    @Test
    void manifestFileBecomesManifestArgument() throws Exception {
        Path manifest = tempDir.resolve("pod.json");
        Files.writeString(manifest, """
            {"kind": "Pod", "metadata": {"name": "web"}}
            """);
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"tool": "create_pod", "status": "success", "results": []}
                """));

        CommandFixtures.Result result = CommandFixtures.run(
            new CallCommand(CommandFixtures.context(tempDir)),
            "create_pod", "-f", manifest.toString(), "--server", server.url("/").toString()
        );

        assertThat(result.exitCode()).isZero();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/mcp/call");
        JsonNode sent = CliJson.MAPPER.readTree(request.getBody().readUtf8());
        assertThat(sent.path("name").asText()).isEqualTo("create_pod");
        assertThat(sent.path("arguments").path("manifest").path("metadata").path("name").asText()).isEqualTo("web");
        assertThat(sent.has("clusters")).isFalse();
    }

    @Test
    void remoteCallCoercesArgumentsAndMapsPartialFailure() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"tools": [{
                  "name": "list_pods",
                  "inputSchema": {"type": "object", "properties": {
                    "limit": {"type": "integer"},
                    "allNamespaces": {"type": "boolean"}
                  }}
                }]}
                """));
        server.enqueue(new MockResponse()
            .setResponseCode(207)
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"tool": "list_pods", "status": "partial_failure", "results": [
                  {"cluster": "a", "status": "success", "payload": []},
                  {"cluster": "b", "status": "error", "error": {"kind": "TransientError", "message": "slow down", "retryable": true}}
                ]}
                """));

        CommandFixtures.Result result = CommandFixtures.run(
            new CallCommand(CommandFixtures.context(tempDir)),
            "list_pods", "-a", "limit=10", "-a", "allNamespaces=true", "-c", "a,b", "--timeout", "7",
            "--server", server.url("/").toString()
        );

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(server.takeRequest().getPath()).isEqualTo("/mcp/tools");
        JsonNode sent = CliJson.MAPPER.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(sent.path("arguments").path("limit").isIntegralNumber()).isTrue();
        assertThat(sent.path("arguments").path("limit").asLong()).isEqualTo(10L);
        assertThat(sent.path("arguments").path("allNamespaces").asBoolean()).isTrue();
        assertThat(sent.path("clusters").asText()).isEqualTo("a,b");
        assertThat(sent.path("timeoutSeconds").asInt()).isEqualTo(7);
        assertThat(result.out()).contains("slow down");
    }

    @Test
    void remoteRejectionExitsOne() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(404)
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"tool": "list_pods", "status": "failure", "error": {"kind": "UnknownClusterError", "message": "typo"}}
                """));

        CommandFixtures.Result result = CommandFixtures.run(
            new CallCommand(CommandFixtures.context(tempDir)),
            "list_pods", "--server", server.url("/").toString()
        );

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.out()).contains("UnknownClusterError");
    }
}
