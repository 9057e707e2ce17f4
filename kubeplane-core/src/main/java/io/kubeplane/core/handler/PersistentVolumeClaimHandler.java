package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimList;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimSpec;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimStatus;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

public final class PersistentVolumeClaimHandler
    extends KubernetesResourceHandler<PersistentVolumeClaim, PersistentVolumeClaimList, Resource<PersistentVolumeClaim>> {

    public PersistentVolumeClaimHandler() {
        super(
            "persistentvolumeclaims",
            "PersistentVolumeClaim",
            PersistentVolumeClaim.class,
            true,
            EnumSet.of(Verb.LIST, Verb.GET)
        );
    }

    @Override
    protected NonNamespaceOperation<PersistentVolumeClaim, PersistentVolumeClaimList, Resource<PersistentVolumeClaim>> scoped(
        KubernetesClient client,
        String namespace
    ) {
        return client.persistentVolumeClaims().inNamespace(namespace);
    }

    @Override
    protected Listable<PersistentVolumeClaimList> everywhere(KubernetesClient client) {
        return client.persistentVolumeClaims().inAnyNamespace();
    }

    @Override
    protected void describe(PersistentVolumeClaim claim, Map<String, Object> summary) {
        PersistentVolumeClaimSpec spec = claim.getSpec();
        PersistentVolumeClaimStatus status = claim.getStatus();
        summary.put("phase", status == null ? null : status.getPhase());
        summary.put("storageClass", spec == null ? null : spec.getStorageClassName());
        summary.put("volume", spec == null ? null : spec.getVolumeName());
        summary.put("accessModes", spec == null || spec.getAccessModes() == null ? List.of() : List.copyOf(spec.getAccessModes()));
        summary.put("capacity", capacity(status));
    }

    private static String capacity(PersistentVolumeClaimStatus status) {
        if (status == null || status.getCapacity() == null) {
            return null;
        }
        Quantity storage = status.getCapacity().get("storage");
        return storage == null ? null : storage.toString();
    }
}
