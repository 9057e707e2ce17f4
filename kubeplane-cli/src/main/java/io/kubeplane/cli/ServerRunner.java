package io.kubeplane.cli;

@FunctionalInterface
public interface ServerRunner {
    int run(String host, int port) throws Exception;
}
