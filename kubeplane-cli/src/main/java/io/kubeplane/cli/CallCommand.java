package io.kubeplane.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import io.kubeplane.core.KubeplaneRuntime;
import io.kubeplane.core.cluster.ClusterSelector;
import io.kubeplane.core.dispatch.AggregatedResponse;
import io.kubeplane.core.dispatch.DispatchStatus;
import io.kubeplane.core.error.UnknownClusterException;
import io.kubeplane.core.tool.ParameterSpec;
import io.kubeplane.core.tool.ToolDescriptor;
import io.kubeplane.core.tool.ToolInvocation;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Invokes one tool and prints the aggregated response. The exit code reflects the overall status:
 * 0 for success, 3 for a partial failure, 1 for failure or a rejected call.
 */
@Command(name = "call", description = "Invoke a tool against one or more clusters")
public final class CallCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Tool name, e.g. list_pods")
    String tool;

    @Option(names = {"-a", "--arg"}, description = "Tool argument as key=value (repeatable)")
    Map<String, String> args = new LinkedHashMap<>();

    @Option(names = {"--args-json"}, description = "Tool arguments as a JSON object")
    String argsJson;

    @Option(names = {"-f", "--manifest-file"}, description = "JSON manifest passed as the manifest argument")
    Path manifestFile;

    @Option(names = {"-c", "--clusters"}, description = "\"all\" or a comma separated list of cluster names")
    String clusters;

    @Option(names = {"--timeout"}, description = "Overall deadline in seconds")
    Integer timeoutSeconds;

    @Option(names = {"--server"}, description = "Send the call to a running server instead of dispatching locally")
    String server;

    public CallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (server != null && !server.isBlank()) {
                return remote();
            }
            return local();
        } catch (UnknownClusterException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Call command failed: " + e.getMessage());
            return 1;
        }
    }

    private int local() throws Exception {
        try (KubeplaneRuntime runtime = context.openRuntime()) {
            Map<String, String> declared = new LinkedHashMap<>();
            runtime.tools().find(tool).map(ToolDescriptor::parameters).orElse(List.of())
                .forEach((ParameterSpec parameter) -> declared.put(parameter.name(), parameter.type().schemaName()));

            Map<String, Object> arguments = arguments(declared);
            ClusterSelector selector = ClusterSelector.parse(clusters, runtime.defaultSelector());
            Duration deadline = timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds);
            AggregatedResponse response = runtime.engine().dispatch(new ToolInvocation(tool, arguments, selector), deadline);
            System.out.println(CliJson.pretty(response));
            return response.status().exitCode();
        }
    }

    private int remote() throws Exception {
        KubeplaneClient client = new KubeplaneClient(server, Duration.ofSeconds(timeoutSeconds == null ? 60 : timeoutSeconds + 10L));
        Map<String, String> declared = remoteTypes(client);
        KubeplaneClient.RemoteResponse response = client.callTool(tool, arguments(declared), clusters, timeoutSeconds);
        System.out.println(CliJson.pretty(response.body()));
        Object status = response.body().get("status");
        for (DispatchStatus candidate : DispatchStatus.values()) {
            if (candidate.wireName().equals(status)) {
                return candidate.exitCode();
            }
        }
        return 1;
    }

    private Map<String, Object> arguments(Map<String, String> declaredTypes) throws Exception {
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (argsJson != null && !argsJson.isBlank()) {
            arguments.putAll(CliJson.MAPPER.readValue(argsJson, new TypeReference<LinkedHashMap<String, Object>>() {}));
        }
        arguments.putAll(new ArgumentCoercer(declaredTypes, CliJson.MAPPER).coerce(args));
        if (manifestFile != null) {
            arguments.put("manifest", CliJson.MAPPER.readValue(Files.readString(manifestFile), new TypeReference<LinkedHashMap<String, Object>>() {}));
        }
        return arguments;
    }

    private Map<String, String> remoteTypes(KubeplaneClient client) throws Exception {
        Map<String, String> declared = new LinkedHashMap<>();
        if (args.isEmpty()) {
            return declared;
        }
        KubeplaneClient.RemoteResponse tools = client.listTools();
        if (!(tools.body().get("tools") instanceof List<?> entries)) {
            return declared;
        }
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> descriptor && tool.equals(descriptor.get("name"))
                && descriptor.get("inputSchema") instanceof Map<?, ?> schema
                && schema.get("properties") instanceof Map<?, ?> properties) {
                properties.forEach((name, property) -> {
                    if (property instanceof Map<?, ?> spec && spec.get("type") != null) {
                        declared.put(String.valueOf(name), String.valueOf(spec.get("type")));
                    }
                });
            }
        }
        return declared;
    }
}
