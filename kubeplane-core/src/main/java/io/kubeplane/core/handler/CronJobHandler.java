package io.kubeplane.core.handler;

import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.CronJobList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Listable;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import java.util.EnumSet;
import java.util.Map;

public final class CronJobHandler extends KubernetesResourceHandler<CronJob, CronJobList, Resource<CronJob>> {

    public CronJobHandler() {
        super("cronjobs", "CronJob", CronJob.class, true, EnumSet.of(Verb.LIST, Verb.GET));
    }

    @Override
    protected NonNamespaceOperation<CronJob, CronJobList, Resource<CronJob>> scoped(KubernetesClient client, String namespace) {
        return client.batch().v1().cronjobs().inNamespace(namespace);
    }

    @Override
    protected Listable<CronJobList> everywhere(KubernetesClient client) {
        return client.batch().v1().cronjobs().inAnyNamespace();
    }

    @Override
    protected void describe(CronJob cronJob, Map<String, Object> summary) {
        summary.put("schedule", cronJob.getSpec() == null ? null : cronJob.getSpec().getSchedule());
        summary.put("suspended", cronJob.getSpec() != null && Boolean.TRUE.equals(cronJob.getSpec().getSuspend()));
        summary.put("lastScheduleTime", cronJob.getStatus() == null ? null : cronJob.getStatus().getLastScheduleTime());
    }
}
