package ai.iacgraph.normalize.schema;

import java.util.Optional;

/**
 * Terraform resource and data source types.
 */
public enum TerraformTypes implements TypeMapping {
    INSTANCE("aws_instance", "compute.instance"),
    LAMBDA_FUNCTION("aws_lambda_function", "compute.function"),
    VPC("aws_vpc", "network.vpc"),
    SUBNET("aws_subnet", "network.subnet"),
    SECURITY_GROUP("aws_security_group", "network.securitygroup"),
    LOAD_BALANCER("aws_lb", "network.loadbalancer"),
    ALB("aws_alb", "network.loadbalancer", false, false),
    S3_BUCKET("aws_s3_bucket", "storage.bucket"),
    EBS_VOLUME("aws_ebs_volume", "storage.volume"),
    DB_INSTANCE("aws_db_instance", "database.instance"),
    IAM_ROLE("aws_iam_role", "identity.role"),
    IAM_POLICY("aws_iam_policy", "identity.policy"),
    KUBERNETES_NAMESPACE("kubernetes_namespace", "cluster.namespace"),
    AMI("aws_ami", "compute.image", true, true);

    private final String nativeType;
    private final String canonicalType;
    private final boolean primary;
    private final boolean dataSource;

    TerraformTypes(String nativeType, String canonicalType) {
        this(nativeType, canonicalType, true, false);
    }

    TerraformTypes(String nativeType, String canonicalType, boolean primary, boolean dataSource) {
        this.nativeType = nativeType;
        this.canonicalType = canonicalType;
        this.primary = primary;
        this.dataSource = dataSource;
    }

    @Override
    public String nativeType() {
        return nativeType;
    }

    @Override
    public String canonicalType() {
        return canonicalType;
    }

    @Override
    public boolean primary() {
        return primary;
    }

    public boolean dataSource() {
        return dataSource;
    }

    public static Optional<TerraformTypes> lookup(String nativeType, boolean dataSource) {
        for (TerraformTypes t : values()) {
            if (t.nativeType.equals(nativeType) && t.dataSource == dataSource) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    public static Optional<TerraformTypes> forCanonical(String canonicalType) {
        for (TerraformTypes t : values()) {
            if (t.primary && t.canonicalType.equals(canonicalType)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
