package ai.iacgraph.normalize.schema;

import org.junit.jupiter.api.Test;

import ai.iacgraph.model.Dialect;

import static org.assertj.core.api.Assertions.assertThat;

class PropertySchemasTest {

    @Test
    void required_subnet_listsVpcAndCidr() {
        assertThat(PropertySchemas.forType("network.subnet").required())
                .extracting(PropertySpec::name)
                .containsExactly("vpcId", "cidrBlock");
    }

    @Test
    void spec_vpcIdOfSubnet_isOwner() {
        final PropertySpec vpcId = PropertySchemas.forType("network.subnet").spec("vpcId").orElseThrow();

        assertThat(vpcId.owner()).isTrue();
        assertThat(vpcId.required()).isTrue();
        assertThat(PropertySchemas.forType("network.subnet").spec("availabilityZone").orElseThrow().owner()).isFalse();
    }

    @Test
    void builders_keepEarlierSettings() {
        final PropertySpec spec = PropertySpec.of("image", ValueKind.STRING).asRequired().asOwner().tf("ami");

        assertThat(spec.required()).isTrue();
        assertThat(spec.owner()).isTrue();
        assertThat(spec.nativeName(Dialect.TERRAFORM)).isEqualTo("ami");
        assertThat(spec.nativeName(Dialect.CLOUDFORMATION)).isEqualTo("Image");
    }

    @Test
    void canonicalName_schemaRenameBeforeConvention() {
        final PropertySchema instance = PropertySchemas.forType("compute.instance");

        assertThat(instance.canonicalName(Dialect.TERRAFORM, "ami")).isEqualTo("image");
        assertThat(instance.canonicalName(Dialect.TERRAFORM, "instance_type")).isEqualTo("instanceType");
        assertThat(instance.nativeName(Dialect.CLOUDFORMATION, "image")).isEqualTo("ImageId");
    }
}
