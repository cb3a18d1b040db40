package io.infrautomater.core.generator;

import io.infrautomater.core.engine.ExecutionEngine;
import io.infrautomater.core.execution.ProvisioningContext;
import io.infrautomater.core.hcl.HclDocument;
import io.infrautomater.core.hcl.HclExpression;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.core.request.ResourceType;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Managed relational database instance.
///
/// ### Config
/// | Key      | Default     | Values                                   |
/// |----------|-------------|------------------------------------------|
/// | `engine` | `postgres`  | `postgres`, `mysql`, `mariadb`           |
/// | `size`   | `small`     | `small`, `medium`, `large`, `xlarge`     |
/// | `region` | `us-east-1` | any provider region                      |
///
/// An unknown size falls back to `small`; an unknown engine is rejected.
///
/// A fresh master password is generated on every call, written only to
/// `terraform.tfvars` and registered with the attempt's masker. Retried
/// attempts therefore converge the instance onto the latest password.
public class DatabaseConfigGenerator extends AbstractConfigGenerator {

    static final String DEFAULT_ENGINE = "postgres";
    static final String DEFAULT_SIZE = "small";
    static final String DEFAULT_REGION = "us-east-1";
    static final String MASTER_USERNAME = "dbadmin";

    static final Set<String> ENGINES = Set.of("postgres", "mysql", "mariadb");

    /// Capacity tier of a size label.
    record Tier(String instanceClass, int storageGb) {}

    static final Map<String, Tier> TIERS =
            Map.of(
                    "small", new Tier("db.t3.micro", 20),
                    "medium", new Tier("db.t3.small", 50),
                    "large", new Tier("db.t3.medium", 100),
                    "xlarge", new Tier("db.t3.large", 250));

    private final SecretGenerator secrets;

    public DatabaseConfigGenerator(ExecutionEngine engine) {
        this(engine, new SecretGenerator());
    }

    public DatabaseConfigGenerator(ExecutionEngine engine, SecretGenerator secrets) {
        super(engine);
        this.secrets = Objects.requireNonNull(secrets, "secrets must not be null");
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.DATABASE;
    }

    @Override
    protected Definitions define(
            ResourceRequest request, ConfigValues config, ProvisioningContext context)
            throws InvalidResourceConfigException {
        String engine = config.getLowercase("engine", DEFAULT_ENGINE);
        if (!ENGINES.contains(engine)) {
            throw new InvalidResourceConfigException(
                    "Unsupported database engine '" + engine + "', expected one of " + ENGINES);
        }
        Tier tier = TIERS.getOrDefault(config.getLowercase("size", DEFAULT_SIZE), TIERS.get(DEFAULT_SIZE));
        String region = config.getString("region", DEFAULT_REGION);
        String name = resourceName(request);

        String password = secrets.generate();
        context.masker().register(password);

        HclDocument provider = new HclDocument();
        requireProvider(provider, "aws", "hashicorp/aws", "~> 5.0");
        provider.block("provider", "aws").attribute("region", HclExpression.var("region"));

        HclDocument resources = new HclDocument();
        declareVariable(resources, "name", "string");
        declareVariable(resources, "engine", "string");
        declareVariable(resources, "instance_class", "string");
        declareVariable(resources, "allocated_storage", "number");
        declareVariable(resources, "master_username", "string");
        declareVariable(resources, "db_password", "string").attribute("sensitive", true);
        declareVariable(resources, "region", "string");
        declareVariable(resources, "tags", "map(string)");
        resources
                .block("resource", "aws_db_instance", "this")
                .attribute("identifier", HclExpression.var("name"))
                .attribute("engine", HclExpression.var("engine"))
                .attribute("instance_class", HclExpression.var("instance_class"))
                .attribute("allocated_storage", HclExpression.var("allocated_storage"))
                .attribute("username", HclExpression.var("master_username"))
                .attribute("password", HclExpression.var("db_password"))
                .attribute("publicly_accessible", false)
                .attribute("skip_final_snapshot", true)
                .attribute("tags", HclExpression.var("tags"));
        resources
                .block("output", "endpoint")
                .attribute("value", HclExpression.of("aws_db_instance.this.endpoint"));
        resources
                .block("output", "port")
                .attribute("value", HclExpression.of("aws_db_instance.this.port"));
        resources
                .block("output", "master_username")
                .attribute("value", HclExpression.var("master_username"));

        HclDocument variables =
                new HclDocument()
                        .attribute("name", name)
                        .attribute("engine", engine)
                        .attribute("instance_class", tier.instanceClass())
                        .attribute("allocated_storage", tier.storageGb())
                        .attribute("master_username", MASTER_USERNAME)
                        .attribute("db_password", password)
                        .attribute("region", region)
                        .attribute("tags", standardTags(request, name));

        return new Definitions(provider, resources, variables);
    }
}
