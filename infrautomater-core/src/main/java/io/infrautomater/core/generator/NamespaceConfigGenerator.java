package io.infrautomater.core.generator;

import io.infrautomater.core.engine.ExecutionEngine;
import io.infrautomater.core.execution.ProvisioningContext;
import io.infrautomater.core.hcl.HclBlock;
import io.infrautomater.core.hcl.HclDocument;
import io.infrautomater.core.hcl.HclExpression;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.core.request.ResourceType;
import java.util.LinkedHashMap;
import java.util.Map;

/// Cluster namespace with a resource quota.
///
/// ### Config
/// | Key       | Default    | Values                          |
/// |-----------|------------|---------------------------------|
/// | `cluster` | `default`  | kubeconfig context name         |
/// | `quota`   | `standard` | `small`, `standard`, `large`    |
///
/// An unknown quota falls back to `standard`.
public class NamespaceConfigGenerator extends AbstractConfigGenerator {

    static final String DEFAULT_CLUSTER = "default";
    static final String DEFAULT_QUOTA = "standard";

    record Quota(String cpu, String memory, int pods) {}

    static final Map<String, Quota> QUOTAS =
            Map.of(
                    "small", new Quota("2", "4Gi", 10),
                    "standard", new Quota("4", "8Gi", 20),
                    "large", new Quota("8", "16Gi", 50));

    public NamespaceConfigGenerator(ExecutionEngine engine) {
        super(engine);
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.NAMESPACE;
    }

    @Override
    protected Definitions define(
            ResourceRequest request, ConfigValues config, ProvisioningContext context) {
        String cluster = config.getString("cluster", DEFAULT_CLUSTER);
        String quotaName = config.getLowercase("quota", DEFAULT_QUOTA);
        Quota quota = QUOTAS.get(quotaName);
        if (quota == null) {
            quotaName = DEFAULT_QUOTA;
            quota = QUOTAS.get(DEFAULT_QUOTA);
        }
        String name = resourceName(request);

        HclDocument provider = new HclDocument();
        requireProvider(provider, "kubernetes", "hashicorp/kubernetes", "~> 2.0");
        provider.block("provider", "kubernetes")
                .attribute("config_context", HclExpression.var("cluster"));

        HclDocument resources = new HclDocument();
        declareVariable(resources, "namespace", "string");
        declareVariable(resources, "cluster", "string");
        declareVariable(resources, "quota_name", "string");
        declareVariable(resources, "cpu_limit", "string");
        declareVariable(resources, "memory_limit", "string");
        declareVariable(resources, "pod_limit", "number");
        declareVariable(resources, "labels", "map(string)");

        resources
                .block("resource", "kubernetes_namespace", "this")
                .block("metadata")
                .attribute("name", HclExpression.var("namespace"))
                .attribute("labels", HclExpression.var("labels"));

        HclBlock resourceQuota = resources.block("resource", "kubernetes_resource_quota", "this");
        resourceQuota
                .block("metadata")
                .attribute("name", HclExpression.of("\"${var.namespace}-quota\""))
                .attribute("namespace", HclExpression.of("kubernetes_namespace.this.metadata[0].name"));
        Map<String, Object> hard = new LinkedHashMap<>();
        hard.put("limits.cpu", HclExpression.var("cpu_limit"));
        hard.put("limits.memory", HclExpression.var("memory_limit"));
        hard.put("pods", HclExpression.var("pod_limit"));
        resourceQuota.block("spec").attribute("hard", hard);

        resources
                .block("output", "namespace")
                .attribute("value", HclExpression.of("kubernetes_namespace.this.metadata[0].name"));
        resources
                .block("output", "quota")
                .attribute("value", HclExpression.var("quota_name"));

        HclDocument variables =
                new HclDocument()
                        .attribute("namespace", name)
                        .attribute("cluster", cluster)
                        .attribute("quota_name", quotaName)
                        .attribute("cpu_limit", quota.cpu())
                        .attribute("memory_limit", quota.memory())
                        .attribute("pod_limit", quota.pods())
                        .attribute("labels", labels(request, name));

        return new Definitions(provider, resources, variables);
    }

    /// Kubernetes label keys allow no upper case, so the standard tags are
    /// rewritten in label form.
    private static Map<String, Object> labels(ResourceRequest request, String name) {
        Map<String, Object> labels = new LinkedHashMap<>();
        labels.put("app.kubernetes.io/name", name);
        labels.put("app.kubernetes.io/managed-by", MANAGED_BY);
        labels.put("infrautomater/request-id", String.valueOf(request.id()));
        labels.put(
                "infrautomater/team-id",
                request.teamId() != null ? String.valueOf(request.teamId()) : "none");
        return labels;
    }
}
