package io.kubeplane.core.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kubeplane.core.error.AuthenticationException;
import io.kubeplane.core.error.NotFoundException;
import io.kubeplane.core.error.TransientException;
import io.kubeplane.core.error.ValidationException;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PodHandlerTest {
    private static final String POD = """
        {
          "apiVersion": "v1",
          "kind": "Pod",
          "metadata": {
            "name": "web-1",
            "namespace": "team-a",
            "labels": {"tier": "frontend", "app": "web"},
            "creationTimestamp": "2024-05-01T10:00:00Z"
          },
          "spec": {
            "nodeName": "node-a",
            "containers": [{"name": "app", "image": "nginx:1.27"}]
          },
          "status": {
            "phase": "Running",
            "podIP": "10.0.0.12",
            "containerStatuses": [
              {"name": "app", "image": "nginx:1.27", "ready": true, "restartCount": 2, "imageID": "", "started": true}
            ]
          }
        }
        """;

    private MockApiServer api;
    private final PodHandler handler = new PodHandler();

    @BeforeEach
    void setUp() throws Exception {
        api = new MockApiServer();
    }

    @AfterEach
    void tearDown() throws Exception {
        api.close();
    }

    @Test
    void listReturnsSummariesAndPassesFilters() {
        api.route("GET", "/api/v1/namespaces/team-a/pods", MockApiServer.json(200, """
            {"apiVersion": "v1", "kind": "PodList", "metadata": {}, "items": [%s]}
            """.formatted(POD)));

        List<Map<String, Object>> pods = handler.list(
            api.capability(),
            "team-a",
            new ListFilters("app=web", null, false, 5L)
        );

        assertThat(pods).hasSize(1);
        Map<String, Object> pod = pods.get(0);
        assertThat(pod).containsEntry("name", "web-1")
            .containsEntry("namespace", "team-a")
            .containsEntry("phase", "Running")
            .containsEntry("node", "node-a")
            .containsEntry("podIP", "10.0.0.12");
        assertThat(pod.get("labels")).isEqualTo(Map.of("app", "web", "tier", "frontend"));
        assertThat((List<?>) pod.get("containers")).hasSize(1);

        RecordedRequest request = api.requests("GET").get(0);
        assertThat(request.getRequestUrl().queryParameter("labelSelector")).isEqualTo("app=web");
        assertThat(request.getRequestUrl().queryParameter("limit")).isEqualTo("5");
    }

    @Test
    void listAcrossNamespacesUsesClusterWidePath() {
        api.route("GET", "/api/v1/pods", MockApiServer.json(200, """
            {"apiVersion": "v1", "kind": "PodList", "metadata": {}, "items": [%s]}
            """.formatted(POD)));

        List<Map<String, Object>> pods = handler.list(api.capability(), "ignored", new ListFilters(null, null, true, null));

        assertThat(pods).extracting(pod -> pod.get("name")).containsExactly("web-1");
    }

    @Test
    void getOfMissingPodIsNotFound() {
        assertThatThrownBy(() -> handler.get(api.capability(), "team-a", "ghost"))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("team-a/ghost");
    }

    @Test
    void createForcesTargetNamespace() {
        api.route("POST", "/api/v1/namespaces/team-a/pods", MockApiServer.json(201, POD));

        Map<String, Object> created = handler.create(api.capability(), "team-a", Map.of(
            "apiVersion", "v1",
            "kind", "Pod",
            "metadata", Map.of("name", "web-1"),
            "spec", Map.of("containers", List.of(Map.of("name", "app", "image", "nginx:1.27")))
        ));

        assertThat(created).containsEntry("name", "web-1");
        String body = api.requests("POST").get(0).getBody().readUtf8();
        assertThat(body).contains("\"namespace\":\"team-a\"");
    }

    @Test
    void createRejectsConflictingNamespaceAndKindWithoutCallingTheCluster() {
        Map<String, Object> otherNamespace = Map.of(
            "kind", "Pod",
            "metadata", Map.of("name", "web-1", "namespace", "team-b")
        );
        Map<String, Object> wrongKind = Map.of("kind", "Service", "metadata", Map.of("name", "web"));
        Map<String, Object> anonymous = Map.of("kind", "Pod", "metadata", Map.of());

        assertThatThrownBy(() -> handler.create(api.capability(), "team-a", otherNamespace))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> handler.create(api.capability(), "team-a", wrongKind))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> handler.create(api.capability(), "team-a", anonymous))
            .isInstanceOf(ValidationException.class);
        assertThat(api.requests()).isEmpty();
    }

    @Test
    void rejectedManifestIsAValidationError() {
        api.route("POST", "/api/v1/namespaces/team-a/pods",
            MockApiServer.status(422, "Invalid", "spec.containers: Required value"));

        assertThatThrownBy(() -> handler.create(api.capability(), "team-a", Map.of(
            "kind", "Pod",
            "metadata", Map.of("name", "broken")
        )))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("spec.containers");
    }

    @Test
    void deleteUsesForegroundPropagation() {
        api.route("DELETE", "/api/v1/namespaces/team-a/pods/web-1", MockApiServer.json(200, POD));

        Map<String, Object> ack = handler.delete(api.capability(), "team-a", "web-1");

        assertThat(ack).containsEntry("kind", "Pod")
            .containsEntry("name", "web-1")
            .containsEntry("namespace", "team-a")
            .containsEntry("deleted", true);
        assertThat(api.requests("DELETE").get(0).getBody().readUtf8()).contains("Foreground");
    }

    @Test
    void deleteOfMissingPodIsNotFound() {
        assertThatThrownBy(() -> handler.delete(api.capability(), "team-a", "ghost"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void serverErrorsAreTransientAndForbiddenIsAuthentication() {
        api.route("GET", "/api/v1/namespaces/team-a/pods", MockApiServer.status(503, "ServiceUnavailable", "etcd leader changed"));
        api.route("GET", "/api/v1/namespaces/locked/pods", MockApiServer.status(403, "Forbidden", "pods is forbidden"));

        assertThatThrownBy(() -> handler.list(api.capability(), "team-a", ListFilters.none()))
            .isInstanceOf(TransientException.class);
        assertThatThrownBy(() -> handler.list(api.capability(), "locked", ListFilters.none()))
            .isInstanceOf(AuthenticationException.class);
    }

    @Test
    void negativeTailLinesIsRejectedBeforeAnyRequest() {
        assertThatThrownBy(() -> handler.logs(api.capability(), "team-a", "web-1", new LogOptions(null, -1)))
            .isInstanceOf(ValidationException.class);
        assertThat(api.requests()).isEmpty();
    }

    @Test
    void logsPassContainerAndTailLinesToTheLogEndpoint() {
        api.route("GET", "/api/v1/namespaces/team-a/pods/web-1", MockApiServer.json(200, POD));
        api.route("GET", "/api/v1/namespaces/team-a/pods/web-1/log", MockApiServer.text("started\nready\n"));

        Map<String, Object> logs = handler.logs(api.capability(), "team-a", "web-1", new LogOptions("app", 5));

        assertThat(logs).containsEntry("name", "web-1")
            .containsEntry("namespace", "team-a")
            .containsEntry("container", "app")
            .containsEntry("log", "started\nready\n");
        RecordedRequest request = api.requests("GET").stream()
            .filter(recorded -> recorded.getRequestUrl().encodedPath().endsWith("/log"))
            .findFirst()
            .orElseThrow();
        assertThat(request.getRequestUrl().queryParameter("container")).isEqualTo("app");
        assertThat(request.getRequestUrl().queryParameter("tailLines")).isEqualTo("5");
    }

    @Test
    void eventsSelectByInvolvedPodAndComeBackOldestFirst() {
        api.route("GET", "/api/v1/namespaces/team-a/events", MockApiServer.json(200, """
            {"apiVersion": "v1", "kind": "EventList", "metadata": {}, "items": [
              {"metadata": {"name": "web-1.b", "namespace": "team-a"},
               "involvedObject": {"kind": "Pod", "name": "web-1", "namespace": "team-a"},
               "type": "Warning", "reason": "BackOff", "message": "Back-off restarting failed container",
               "count": 4, "firstTimestamp": "2024-05-01T10:02:00Z", "lastTimestamp": "2024-05-01T10:09:00Z",
               "source": {"component": "kubelet"}},
              {"metadata": {"name": "web-1.a", "namespace": "team-a"},
               "involvedObject": {"kind": "Pod", "name": "web-1", "namespace": "team-a"},
               "type": "Normal", "reason": "Scheduled", "message": "Assigned team-a/web-1 to node-a",
               "firstTimestamp": "2024-05-01T10:00:00Z", "lastTimestamp": "2024-05-01T10:00:00Z",
               "source": {"component": "default-scheduler"}}
            ]}
            """));

        List<Map<String, Object>> events = handler.events(api.capability(), "team-a", "web-1");

        assertThat(events).extracting(event -> event.get("reason")).containsExactly("Scheduled", "BackOff");
        assertThat(events.get(1)).containsEntry("type", "Warning")
            .containsEntry("count", 4)
            .containsEntry("source", "kubelet")
            .containsEntry("lastTimestamp", "2024-05-01T10:09:00Z");
        assertThat(events.get(0)).containsEntry("count", 0);
        String selector = api.requests().get(0).getRequestUrl().queryParameter("fieldSelector");
        assertThat(selector).contains("involvedObject.name=web-1").contains("involvedObject.kind=Pod");
    }
}
