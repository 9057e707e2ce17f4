package io.kubeplane.cli;

import io.kubeplane.core.KubeplaneRuntime;
import io.kubeplane.core.tool.ParameterSpec;
import io.kubeplane.core.tool.ToolDescriptor;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "tools", description = "List the registered tools")
public final class ToolsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--server"}, description = "Query a running server instead of the local configuration")
    String server;

    @Option(names = {"--json"}, description = "Print JSON instead of a table")
    boolean json;

    public ToolsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (server != null && !server.isBlank()) {
                return remote();
            }
            try (KubeplaneRuntime runtime = context.openRuntime()) {
                List<ToolDescriptor> tools = runtime.tools().all();
                if (json) {
                    System.out.println(CliJson.pretty(tools.stream().map(ToolsCommand::toMap).toList()));
                    return 0;
                }
                for (ToolDescriptor tool : tools) {
                    System.out.printf("%-26s %-8s %s%n", tool.name(), tool.verb().label(), parameters(tool));
                }
                return 0;
            }
        } catch (Exception e) {
            System.err.println("Tools command failed: " + e.getMessage());
            return 1;
        }
    }

    private int remote() throws Exception {
        KubeplaneClient.RemoteResponse response = new KubeplaneClient(server, Duration.ofSeconds(30)).listTools();
        if (!response.ok()) {
            System.err.println("Server returned HTTP " + response.httpStatus() + ": " + response.body());
            return 1;
        }
        if (json) {
            System.out.println(CliJson.pretty(response.body().get("tools")));
            return 0;
        }
        if (response.body().get("tools") instanceof List<?> tools) {
            for (Object tool : tools) {
                if (tool instanceof Map<?, ?> entry) {
                    System.out.printf("%-26s %-8s%n", entry.get("name"), entry.get("verb"));
                }
            }
        }
        return 0;
    }

    private static String parameters(ToolDescriptor tool) {
        return tool.parameters().stream()
            .map(ToolsCommand::describe)
            .collect(Collectors.joining(" "));
    }

    private static String describe(ParameterSpec parameter) {
        String rendered = parameter.name() + ":" + parameter.type().schemaName();
        return parameter.required() ? rendered : "[" + rendered + "]";
    }

    private static Map<String, Object> toMap(ToolDescriptor tool) {
        return Map.of(
            "name", tool.name(),
            "description", tool.description(),
            "kind", tool.kind(),
            "verb", tool.verb().label(),
            "mutating", tool.mutating(),
            "inputSchema", tool.inputSchema()
        );
    }
}
