package ai.iacgraph.normalize.schema;

/**
 * CloudFormation resource types.
 */
public enum CloudFormationTypes implements TypeMapping {
    INSTANCE("AWS::EC2::Instance", "compute.instance"),
    LAMBDA_FUNCTION("AWS::Lambda::Function", "compute.function"),
    VPC("AWS::EC2::VPC", "network.vpc"),
    SUBNET("AWS::EC2::Subnet", "network.subnet"),
    SECURITY_GROUP("AWS::EC2::SecurityGroup", "network.securitygroup"),
    LOAD_BALANCER("AWS::ElasticLoadBalancingV2::LoadBalancer", "network.loadbalancer"),
    S3_BUCKET("AWS::S3::Bucket", "storage.bucket"),
    EBS_VOLUME("AWS::EC2::Volume", "storage.volume"),
    DB_INSTANCE("AWS::RDS::DBInstance", "database.instance"),
    IAM_ROLE("AWS::IAM::Role", "identity.role"),
    IAM_POLICY("AWS::IAM::ManagedPolicy", "identity.policy");

    private final String nativeType;
    private final String canonicalType;

    CloudFormationTypes(String nativeType, String canonicalType) {
        this.nativeType = nativeType;
        this.canonicalType = canonicalType;
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
        return true;
    }
}
