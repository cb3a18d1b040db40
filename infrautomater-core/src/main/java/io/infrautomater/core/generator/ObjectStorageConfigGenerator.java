package io.infrautomater.core.generator;

import io.infrautomater.core.engine.ExecutionEngine;
import io.infrautomater.core.execution.ProvisioningContext;
import io.infrautomater.core.hcl.HclDocument;
import io.infrautomater.core.hcl.HclExpression;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.core.request.ResourceType;

/// Object-storage bucket with versioning and public-access controls.
///
/// ### Config
/// | Key          | Default     |
/// |--------------|-------------|
/// | `region`     | `us-east-1` |
/// | `public`     | `false`     |
/// | `versioning` | `false`     |
///
/// A private bucket blocks every form of public access.
public class ObjectStorageConfigGenerator extends AbstractConfigGenerator {

    static final String DEFAULT_REGION = "us-east-1";

    public ObjectStorageConfigGenerator(ExecutionEngine engine) {
        super(engine);
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.OBJECT_STORAGE;
    }

    @Override
    protected Definitions define(
            ResourceRequest request, ConfigValues config, ProvisioningContext context)
            throws InvalidResourceConfigException {
        String region = config.getString("region", DEFAULT_REGION);
        boolean publicAccess = config.getBoolean("public", false);
        boolean versioning = config.getBoolean("versioning", false);
        String name = resourceName(request);

        HclDocument provider = new HclDocument();
        requireProvider(provider, "aws", "hashicorp/aws", "~> 5.0");
        provider.block("provider", "aws").attribute("region", HclExpression.var("region"));

        HclDocument resources = new HclDocument();
        declareVariable(resources, "bucket_name", "string");
        declareVariable(resources, "region", "string");
        declareVariable(resources, "versioning", "bool");
        declareVariable(resources, "public", "bool");
        declareVariable(resources, "tags", "map(string)");
        resources
                .block("resource", "aws_s3_bucket", "this")
                .attribute("bucket", HclExpression.var("bucket_name"))
                .attribute("tags", HclExpression.var("tags"));
        resources
                .block("resource", "aws_s3_bucket_versioning", "this")
                .attribute("bucket", HclExpression.of("aws_s3_bucket.this.id"))
                .block("versioning_configuration")
                .attribute(
                        "status",
                        HclExpression.of("var.versioning ? \"Enabled\" : \"Suspended\""));
        resources
                .block("resource", "aws_s3_bucket_public_access_block", "this")
                .attribute("bucket", HclExpression.of("aws_s3_bucket.this.id"))
                .attribute("block_public_acls", HclExpression.of("!var.public"))
                .attribute("block_public_policy", HclExpression.of("!var.public"))
                .attribute("ignore_public_acls", HclExpression.of("!var.public"))
                .attribute("restrict_public_buckets", HclExpression.of("!var.public"));
        resources
                .block("output", "bucket")
                .attribute("value", HclExpression.of("aws_s3_bucket.this.id"));
        resources
                .block("output", "arn")
                .attribute("value", HclExpression.of("aws_s3_bucket.this.arn"));

        HclDocument variables =
                new HclDocument()
                        .attribute("bucket_name", name)
                        .attribute("region", region)
                        .attribute("versioning", versioning)
                        .attribute("public", publicAccess)
                        .attribute("tags", standardTags(request, name));

        return new Definitions(provider, resources, variables);
    }
}
