package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobList;
import io.fabric8.kubernetes.api.model.batch.v1.JobSpec;
import io.fabric8.kubernetes.api.model.batch.v1.JobStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.ScalableResource;
import java.util.EnumSet;
import java.util.Map;

public final class JobHandler extends KubernetesResourceHandler<Job, JobList, ScalableResource<Job>> {

    public JobHandler() {
        super("jobs", "Job", Job.class, true, EnumSet.of(Verb.LIST, Verb.GET));
    }

    @Override
    protected NonNamespaceOperation<Job, JobList, ScalableResource<Job>> scoped(KubernetesClient client, String namespace) {
        return client.batch().v1().jobs().inNamespace(namespace);
    }

    @Override
    protected Listable<JobList> everywhere(KubernetesClient client) {
        return client.batch().v1().jobs().inAnyNamespace();
    }

    @Override
    protected void describe(Job job, Map<String, Object> summary) {
        JobSpec spec = job.getSpec();
        JobStatus status = job.getStatus();
        summary.put("completions", spec == null ? null : spec.getCompletions());
        summary.put("active", status == null ? 0 : orZero(status.getActive()));
        summary.put("succeeded", status == null ? 0 : orZero(status.getSucceeded()));
        summary.put("failed", status == null ? 0 : orZero(status.getFailed()));
        summary.put("startTime", status == null ? null : status.getStartTime());
        summary.put("completionTime", status == null ? null : status.getCompletionTime());
    }
}
