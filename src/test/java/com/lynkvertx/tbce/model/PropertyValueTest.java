package com.lynkvertx.tbce.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PropertyValueTest {

    @Test
    @DisplayName("missing, non-positive and invalid values stay distinguishable")
    void distinguishesStates() {
        assertThat(PropertyValue.parse(null).getState()).isEqualTo(PropertyValue.State.MISSING);
        assertThat(PropertyValue.parse("  ").getState()).isEqualTo(PropertyValue.State.MISSING);
        assertThat(PropertyValue.parse(0).getState()).isEqualTo(PropertyValue.State.NON_POSITIVE);
        assertThat(PropertyValue.parse(-4.5).getState()).isEqualTo(PropertyValue.State.NON_POSITIVE);
        assertThat(PropertyValue.parse("abc").getState()).isEqualTo(PropertyValue.State.INVALID);
        assertThat(PropertyValue.parse(Double.NaN).getState()).isEqualTo(PropertyValue.State.INVALID);
        assertThat(PropertyValue.parse("1.2e6").getState()).isEqualTo(PropertyValue.State.PRESENT);
    }

    @Test
    @DisplayName("every non-present state substitutes the default")
    void substitutesDefault() {
        assertThat(PropertyValue.parse(250000L).orDefault(1)).isEqualTo(250000.0);
        assertThat(PropertyValue.parse(null).orDefault(1)).isEqualTo(1.0);
        assertThat(PropertyValue.parse(0).orDefault(1)).isEqualTo(1.0);
        assertThat(PropertyValue.parse("n/a").orDefault(1)).isEqualTo(1.0);
        assertThat(PropertyValue.parse("n/a").toOptional()).isEmpty();
    }

    @Test
    @DisplayName("material properties read the profile record, accepting either grade field")
    void readsProfile() {
        MaterialProperties material = MaterialProperties.fromProfile(
            Map.of("E_N_per_mm2", 210000, "Ixx_mm4", "88000", "grade_label", "S275"));

        assertThat(material.getElasticModulus().orDefault(0)).isEqualTo(210000.0);
        assertThat(material.getIxx().orDefault(0)).isEqualTo(88000.0);
        assertThat(material.getZxx().getState()).isEqualTo(PropertyValue.State.MISSING);
        assertThat(material.getGradeLabel()).isEqualTo("S275");
        assertThat(MaterialProperties.fromProfile(null).getGradeLabel()).isEmpty();
    }
}
