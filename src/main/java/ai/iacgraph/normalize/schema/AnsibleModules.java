package ai.iacgraph.normalize.schema;

/**
 * Ansible modules, by fully qualified collection name. Short names ({@code apt},
 * {@code ec2_instance}) resolve to the same rows.
 */
public enum AnsibleModules implements TypeMapping {
    EC2_INSTANCE("amazon.aws.ec2_instance", "compute.instance"),
    LAMBDA("amazon.aws.lambda", "compute.function"),
    EC2_VPC_NET("amazon.aws.ec2_vpc_net", "network.vpc"),
    EC2_VPC_SUBNET("amazon.aws.ec2_vpc_subnet", "network.subnet"),
    EC2_SECURITY_GROUP("amazon.aws.ec2_security_group", "network.securitygroup"),
    ELB_APPLICATION_LB("amazon.aws.elb_application_lb", "network.loadbalancer"),
    S3_BUCKET("amazon.aws.s3_bucket", "storage.bucket"),
    EC2_VOL("amazon.aws.ec2_vol", "storage.volume"),
    RDS_INSTANCE("amazon.aws.rds_instance", "database.instance"),
    IAM_ROLE("amazon.aws.iam_role", "identity.role"),
    IAM_MANAGED_POLICY("amazon.aws.iam_managed_policy", "identity.policy"),
    PACKAGE("ansible.builtin.package", "host.package"),
    APT("ansible.builtin.apt", "host.package", false),
    YUM("ansible.builtin.yum", "host.package", false),
    DNF("ansible.builtin.dnf", "host.package", false),
    SERVICE("ansible.builtin.service", "host.service"),
    SYSTEMD("ansible.builtin.systemd", "host.service", false),
    COPY("ansible.builtin.copy", "host.file"),
    TEMPLATE("ansible.builtin.template", "host.file", false),
    FILE("ansible.builtin.file", "host.file", false),
    USER("ansible.builtin.user", "host.user"),
    COMMAND("ansible.builtin.command", "host.command"),
    SHELL("ansible.builtin.shell", "host.command", false);

    private final String fqcn;
    private final String canonicalType;
    private final boolean primary;

    AnsibleModules(String fqcn, String canonicalType) {
        this(fqcn, canonicalType, true);
    }

    AnsibleModules(String fqcn, String canonicalType, boolean primary) {
        this.fqcn = fqcn;
        this.canonicalType = canonicalType;
        this.primary = primary;
    }

    @Override
    public String nativeType() {
        return fqcn;
    }

    @Override
    public String canonicalType() {
        return canonicalType;
    }

    @Override
    public boolean primary() {
        return primary;
    }

    public String shortName() {
        return fqcn.substring(fqcn.lastIndexOf('.') + 1);
    }

    public boolean matches(String module) {
        return fqcn.equals(module) || shortName().equals(module)
                || ("community.aws." + shortName()).equals(module);
    }

    /**
     * Modules that take a free-form command line instead of arguments.
     */
    public static boolean isCommandModule(String module) {
        final String s = module.substring(module.lastIndexOf('.') + 1);
        return s.equals("command") || s.equals("shell") || s.equals("raw") || s.equals("script");
    }
}
