package ai.iacgraph.normalize.schema;

/**
 * Kubernetes kinds with the API version written for objects created from other dialects.
 */
public enum KubernetesKinds implements TypeMapping {
    NAMESPACE("Namespace", "cluster.namespace", "v1"),
    DEPLOYMENT("Deployment", "workload.deployment", "apps/v1"),
    STATEFUL_SET("StatefulSet", "workload.statefulset", "apps/v1"),
    DAEMON_SET("DaemonSet", "workload.daemonset", "apps/v1"),
    JOB("Job", "workload.job", "batch/v1"),
    CRON_JOB("CronJob", "workload.cronjob", "batch/v1"),
    POD("Pod", "workload.pod", "v1"),
    SERVICE("Service", "network.service", "v1"),
    INGRESS("Ingress", "network.ingress", "networking.k8s.io/v1"),
    CONFIG_MAP("ConfigMap", "config.map", "v1"),
    SECRET("Secret", "config.secret", "v1"),
    PERSISTENT_VOLUME_CLAIM("PersistentVolumeClaim", "storage.claim", "v1"),
    SERVICE_ACCOUNT("ServiceAccount", "identity.serviceaccount", "v1"),
    HORIZONTAL_POD_AUTOSCALER("HorizontalPodAutoscaler", "autoscaling.policy", "autoscaling/v2");

    private final String kind;
    private final String canonicalType;
    private final String apiVersion;

    KubernetesKinds(String kind, String canonicalType, String apiVersion) {
        this.kind = kind;
        this.canonicalType = canonicalType;
        this.apiVersion = apiVersion;
    }

    @Override
    public String nativeType() {
        return kind;
    }

    @Override
    public String canonicalType() {
        return canonicalType;
    }

    @Override
    public boolean primary() {
        return true;
    }

    public String apiVersion() {
        return apiVersion;
    }

    public boolean isWorkload() {
        return canonicalType.startsWith("workload.");
    }
}
