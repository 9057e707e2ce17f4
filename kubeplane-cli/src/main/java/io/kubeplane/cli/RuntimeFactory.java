package io.kubeplane.cli;

import io.kubeplane.core.KubeplaneRuntime;
import io.kubeplane.core.config.model.KubeplaneConfig;

@FunctionalInterface
public interface RuntimeFactory {
    KubeplaneRuntime create(KubeplaneConfig config);
}
