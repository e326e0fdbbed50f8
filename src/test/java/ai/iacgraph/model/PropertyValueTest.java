package ai.iacgraph.model;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PropertyValueTest {

    @Test
    void scalar_integralNumbers_becomeLong() {
        assertThat(PropertyValue.Scalar.of(8080).value()).isEqualTo(8080L);
        assertThat(PropertyValue.Scalar.of(new BigDecimal("1.5e3")).value()).isEqualTo(1500L);
        assertThat(PropertyValue.Scalar.of(new BigDecimal("0.00")).value()).isEqualTo(0L);
    }

    @Test
    void scalar_beyondLong_keptExact() {
        final PropertyValue.Scalar big = PropertyValue.Scalar.of(new BigInteger("99999999999999999999999"));

        assertThat(big.value()).isEqualTo(new BigDecimal("99999999999999999999999"));
        assertThat(PropertyValue.Scalar.numberText((Number) big.value())).isEqualTo("99999999999999999999999");
    }

    @Test
    void scalar_decimals_sameValueWhateverTheSource() {
        assertThat(PropertyValue.Scalar.of(0.1)).isEqualTo(PropertyValue.Scalar.of(new BigDecimal("0.10")));
        assertThat(PropertyValue.Scalar.numberText((Number) PropertyValue.Scalar.of(new BigDecimal("1e-7")).value()))
                .isEqualTo("0.0000001");
    }

    @Test
    void scalar_hugeExponent_noInfinity() {
        final Object value = PropertyValue.Scalar.of(new BigDecimal("1e400")).value();

        assertThat(value).isInstanceOf(BigDecimal.class);
        assertThat(PropertyValue.Scalar.numberText((Number) value)).startsWith("1000").hasSize(401);
    }
}
