package ai.iacgraph.normalize.schema;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static ai.iacgraph.normalize.schema.PropertySpec.of;
import static ai.iacgraph.normalize.schema.ValueKind.ANY;
import static ai.iacgraph.normalize.schema.ValueKind.BOOLEAN;
import static ai.iacgraph.normalize.schema.ValueKind.LIST;
import static ai.iacgraph.normalize.schema.ValueKind.MAP;
import static ai.iacgraph.normalize.schema.ValueKind.NUMBER;
import static ai.iacgraph.normalize.schema.ValueKind.STRING;
import static ai.iacgraph.normalize.schema.ValueKind.TAGS;

/**
 * Property schemas per canonical type.
 */
public final class PropertySchemas {

    private static final Map<String, PropertySchema> SCHEMAS = List.of(
            schema("compute.instance",
                    of("image", STRING).asRequired().tf("ami").cfn("ImageId").ansible("image_id"),
                    of("instanceType", STRING),
                    of("subnetId", STRING).tf("subnet_id").cfn("SubnetId").ansible("vpc_subnet_id"),
                    of("securityGroupIds", LIST).tf("vpc_security_group_ids").cfn("SecurityGroupIds")
                            .ansible("security_groups"),
                    of("keyName", STRING),
                    of("userData", STRING),
                    of("tags", TAGS)),
            schema("compute.function",
                    of("functionName", STRING).ansible("name"),
                    of("runtime", STRING).asRequired(),
                    of("handler", STRING),
                    of("role", STRING).asRequired(),
                    of("memorySize", NUMBER),
                    of("timeout", NUMBER),
                    of("tags", TAGS)),
            schema("network.vpc",
                    of("cidrBlock", STRING).asRequired(),
                    of("enableDnsSupport", BOOLEAN).ansible("dns_support"),
                    of("enableDnsHostnames", BOOLEAN).ansible("dns_hostnames"),
                    of("tags", TAGS)),
            schema("network.subnet",
                    of("vpcId", STRING).asRequired().asOwner().cfn("VpcId"),
                    of("cidrBlock", STRING).asRequired().ansible("cidr"),
                    of("availabilityZone", STRING).ansible("az"),
                    of("mapPublicIpOnLaunch", BOOLEAN).ansible("map_public"),
                    of("tags", TAGS)),
            schema("network.securitygroup",
                    of("name", STRING).cfn("GroupName"),
                    of("description", STRING).cfn("GroupDescription"),
                    of("vpcId", STRING).asOwner().cfn("VpcId"),
                    of("ingress", LIST).cfn("SecurityGroupIngress").ansible("rules"),
                    of("egress", LIST).cfn("SecurityGroupEgress").ansible("rules_egress"),
                    of("tags", TAGS)),
            schema("network.loadbalancer",
                    of("name", STRING),
                    of("loadBalancerType", STRING).cfn("Type").ansible("type"),
                    of("subnets", LIST),
                    of("securityGroups", LIST),
                    of("tags", TAGS)),
            schema("storage.bucket",
                    of("bucketName", STRING).tf("bucket").cfn("BucketName").ansible("name"),
                    of("acl", STRING).cfn("AccessControl"),
                    of("versioning", ANY).cfn("VersioningConfiguration"),
                    of("encryption", ANY).tf("server_side_encryption_configuration").cfn("BucketEncryption"),
                    of("publicAccessBlock", ANY).tf("public_access_block").cfn("PublicAccessBlockConfiguration")
                            .ansible("public_access"),
                    of("tags", TAGS)),
            schema("storage.volume",
                    of("availabilityZone", STRING).asRequired().ansible("zone"),
                    of("size", NUMBER).ansible("volume_size"),
                    of("encrypted", BOOLEAN),
                    of("volumeType", STRING).tf("type"),
                    of("kmsKeyId", STRING),
                    of("tags", TAGS)),
            schema("database.instance",
                    of("engine", STRING).asRequired(),
                    of("instanceClass", STRING).asRequired().cfn("DBInstanceClass").ansible("db_instance_class"),
                    of("allocatedStorage", NUMBER),
                    of("identifier", STRING).cfn("DBInstanceIdentifier").ansible("db_instance_identifier"),
                    of("username", STRING).cfn("MasterUsername"),
                    of("password", STRING).cfn("MasterUserPassword"),
                    of("storageEncrypted", BOOLEAN),
                    of("publiclyAccessible", BOOLEAN),
                    of("vpcSecurityGroupIds", LIST).cfn("VPCSecurityGroups"),
                    of("tags", TAGS)),
            schema("identity.role",
                    of("name", STRING).cfn("RoleName"),
                    of("assumeRolePolicy", ANY).asRequired().cfn("AssumeRolePolicyDocument")
                            .ansible("assume_role_policy_document"),
                    of("managedPolicyArns", LIST).ansible("managed_policies"),
                    of("tags", TAGS)),
            schema("identity.policy",
                    of("name", STRING).cfn("ManagedPolicyName").ansible("policy_name"),
                    of("policy", ANY).asRequired().cfn("PolicyDocument"),
                    of("description", STRING)),
            schema("config.variable",
                    of("type", ANY),
                    of("default", ANY).ansible("value"),
                    of("description", STRING),
                    of("sensitive", BOOLEAN).cfn("NoEcho")),
            schema("config.output",
                    of("value", ANY).asRequired(),
                    of("description", STRING),
                    of("sensitive", BOOLEAN)),
            schema("config.local",
                    of("value", ANY).asRequired()),
            schema("module.call",
                    of("source", STRING).asRequired(),
                    of("version", STRING)),
            schema("workload.deployment", of("namespace", STRING).asOwner(), of("labels", MAP), of("spec", MAP).asRequired()),
            schema("workload.statefulset", of("namespace", STRING).asOwner(), of("labels", MAP), of("spec", MAP).asRequired()),
            schema("workload.daemonset", of("namespace", STRING).asOwner(), of("labels", MAP), of("spec", MAP).asRequired()),
            schema("workload.job", of("namespace", STRING).asOwner(), of("labels", MAP), of("spec", MAP).asRequired()),
            schema("workload.cronjob", of("namespace", STRING).asOwner(), of("labels", MAP), of("spec", MAP).asRequired()),
            schema("workload.pod", of("namespace", STRING).asOwner(), of("labels", MAP), of("spec", MAP).asRequired()),
            schema("network.service", of("namespace", STRING).asOwner(), of("labels", MAP), of("spec", MAP).asRequired()),
            schema("network.ingress", of("namespace", STRING).asOwner(), of("labels", MAP), of("spec", MAP)),
            schema("config.map", of("namespace", STRING).asOwner(), of("labels", MAP), of("data", MAP)),
            schema("config.secret", of("namespace", STRING).asOwner(), of("labels", MAP), of("data", MAP),
                    of("stringData", MAP), of("type", STRING)),
            schema("storage.claim", of("namespace", STRING).asOwner(), of("labels", MAP), of("spec", MAP).asRequired()),
            schema("identity.serviceaccount", of("namespace", STRING).asOwner(), of("labels", MAP)),
            schema("autoscaling.policy", of("namespace", STRING).asOwner(), of("labels", MAP), of("spec", MAP).asRequired()),
            schema("cluster.namespace", of("labels", MAP)),
            schema("host.package",
                    of("name", ANY).asRequired(),
                    of("state", STRING)),
            schema("host.service",
                    of("name", STRING).asRequired(),
                    of("state", STRING),
                    of("enabled", BOOLEAN)),
            schema("host.file",
                    of("dest", STRING),
                    of("src", STRING),
                    of("content", STRING),
                    of("mode", ANY),
                    of("owner", STRING)),
            schema("host.user",
                    of("name", STRING).asRequired(),
                    of("groups", ANY),
                    of("shell", STRING)),
            schema("host.command",
                    of("cmd", STRING),
                    of("creates", STRING),
                    of("removes", STRING),
                    of("chdir", STRING))
    ).stream().collect(Collectors.toUnmodifiableMap(PropertySchema::canonicalType, Function.identity()));

    private PropertySchemas() {
    }

    public static PropertySchema forType(String canonicalType) {
        return SCHEMAS.getOrDefault(canonicalType, PropertySchema.EMPTY);
    }

    private static PropertySchema schema(String canonicalType, PropertySpec... specs) {
        return new PropertySchema(canonicalType, List.of(specs));
    }
}
