package io.kubeplane.cli;

import picocli.CommandLine.Command;

@Command(name = "kubeplane", mixinStandardHelpOptions = true, description = "Multi-cluster Kubernetes tool-call control plane")
public final class KubeplaneCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
