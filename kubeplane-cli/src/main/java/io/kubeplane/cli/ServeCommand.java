package io.kubeplane.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Start the HTTP tool-call server")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--host"}, description = "Bind address", defaultValue = "0.0.0.0")
    String host;

    @Option(names = {"--port"}, description = "Listen port", defaultValue = "8080")
    int port;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.serverRunner().run(host, port);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
