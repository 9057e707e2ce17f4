package io.kubeplane.core.tool;

import io.kubeplane.core.handler.HandlerRegistry;
import io.kubeplane.core.handler.ResourceHandler;
import io.kubeplane.core.handler.Verb;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Derives the static tool table from the registered handlers: one tool per supported
 * (kind, verb) pair.
 */
public final class ToolCatalog {

    private ToolCatalog() {
    }

    public static ToolRegistry registry(HandlerRegistry handlers, boolean readOnly) {
        ToolRegistry registry = new ToolRegistry();
        descriptors(handlers, readOnly).forEach(registry::register);
        return registry;
    }

    public static List<ToolDescriptor> descriptors(HandlerRegistry handlers, boolean readOnly) {
        List<ResourceHandler> ordered = new ArrayList<>(handlers.all());
        ordered.sort(Comparator.comparing(ResourceHandler::kind));

        List<ToolDescriptor> descriptors = new ArrayList<>();
        for (ResourceHandler handler : ordered) {
            for (Verb verb : Verb.values()) {
                if (!handler.verbs().contains(verb) || (readOnly && verb.mutating())) {
                    continue;
                }
                descriptors.add(describe(handler, verb));
            }
        }
        return descriptors;
    }

    static ToolDescriptor describe(ResourceHandler handler, Verb verb) {
        String plural = handler.kind();
        String singular = singular(plural);
        boolean namespaced = handler.namespaced();
        List<ParameterSpec> parameters = new ArrayList<>();
        if (namespaced) {
            parameters.add(ParameterSpec.optional(
                "namespace",
                ParameterType.STRING,
                "Namespace; defaults to the cluster's default namespace"
            ));
        }

        return switch (verb) {
            case LIST -> {
                parameters.add(ParameterSpec.optional("labelSelector", ParameterType.STRING, "Label selector, e.g. app=web"));
                parameters.add(ParameterSpec.optional("fieldSelector", ParameterType.STRING, "Field selector, e.g. status.phase=Running"));
                if (namespaced) {
                    parameters.add(ParameterSpec.optional("allNamespaces", ParameterType.BOOLEAN, "List across every namespace"));
                }
                parameters.add(ParameterSpec.optional("limit", ParameterType.INTEGER, "Maximum number of items per cluster")
                    .between(1, Integer.MAX_VALUE));
                yield new ToolDescriptor("list_" + plural, "List " + plural + (namespaced ? " in a namespace" : ""), plural, verb, parameters);
            }
            case GET -> {
                parameters.add(nameParameter(singular));
                yield new ToolDescriptor("get_" + singular, "Get one " + singular + " by name", plural, verb, parameters);
            }
            case CREATE -> {
                parameters.add(ParameterSpec.required("manifest", ParameterType.OBJECT, "Full " + singular + " manifest"));
                yield new ToolDescriptor("create_" + singular, "Create a " + singular + " from a manifest", plural, verb, parameters);
            }
            case UPDATE -> {
                parameters.add(nameParameter(singular));
                parameters.add(ParameterSpec.required("manifest", ParameterType.OBJECT, "Partial manifest merged onto the live object"));
                yield new ToolDescriptor("update_" + singular, "Merge-patch an existing " + singular, plural, verb, parameters);
            }
            case DELETE -> {
                parameters.add(nameParameter(singular));
                yield new ToolDescriptor("delete_" + singular, "Delete a " + singular + " with foreground propagation", plural, verb, parameters);
            }
            case SCALE -> {
                parameters.add(nameParameter(singular));
                parameters.add(ParameterSpec.required("replicas", ParameterType.INTEGER, "Desired replica count")
                    .between(0, Integer.MAX_VALUE));
                yield new ToolDescriptor("scale_" + singular, "Set the replica count of a " + singular, plural, verb, parameters);
            }
            case LOGS -> {
                parameters.add(nameParameter(singular));
                parameters.add(ParameterSpec.optional("container", ParameterType.STRING, "Container name for multi-container pods"));
                parameters.add(ParameterSpec.optional("tailLines", ParameterType.INTEGER, "Only return the last N lines")
                    .between(0, Integer.MAX_VALUE));
                yield new ToolDescriptor("get_" + singular + "_logs", "Read the logs of a " + singular, plural, verb, parameters);
            }
            case EVENTS -> {
                parameters.add(nameParameter(singular));
                yield new ToolDescriptor("get_" + singular + "_events", "List the events recorded for a " + singular, plural, verb, parameters);
            }
        };
    }

    private static ParameterSpec nameParameter(String singular) {
        return ParameterSpec.required("name", ParameterType.STRING, "Name of the " + singular);
    }

    static String singular(String plural) {
        return plural.endsWith("s") ? plural.substring(0, plural.length() - 1) : plural;
    }
}
