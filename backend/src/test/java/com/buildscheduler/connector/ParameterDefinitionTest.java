package com.buildscheduler.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.buildscheduler.model.enums.ParameterKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParameterDefinitionTest {

    @Test
    void booleanParameterCollectsBoolean() {
        ParameterDefinition def = new ParameterDefinition("DRY_RUN", ParameterKind.BOOLEAN, null, true, null);

        assertThat(def.collect(null)).isEqualTo(true);
        assertThat(def.collect("false")).isEqualTo(false);
        assertThat(def.collect(Boolean.TRUE)).isEqualTo(true);
    }

    @Test
    void choiceParameterDefaultsToFirstChoice() {
        ParameterDefinition def = new ParameterDefinition("ENV", ParameterKind.CHOICE, null, null,
                List.of("staging", "production"));

        assertThat(def.collect(null)).isEqualTo("staging");
        assertThat(def.collect("production")).isEqualTo("production");
    }

    @Test
    void choiceParameterRejectsUnknownValue() {
        ParameterDefinition def = new ParameterDefinition("ENV", ParameterKind.CHOICE, null, null,
                List.of("staging", "production"));

        assertThatThrownBy(() -> def.collect("qa"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("qa");
    }

    @Test
    void stringParameterKeepsNullWithoutDefault() {
        ParameterDefinition def = new ParameterDefinition("BRANCH", ParameterKind.STRING, null, null, null);

        assertThat(def.collect(null)).isNull();
        assertThat(def.collect(42)).isEqualTo("42");
    }

    @Test
    void classTagsMapToKinds() {
        assertThat(ParameterKind.fromClassTag("hudson.model.StringParameterDefinition")).isEqualTo(ParameterKind.STRING);
        assertThat(ParameterKind.fromClassTag("hudson.model.BooleanParameterDefinition")).isEqualTo(ParameterKind.BOOLEAN);
        assertThat(ParameterKind.fromClassTag("net.uaznia.lukanus.hudson.plugins.gitparameter.GitParameterDefinition"))
                .isEqualTo(ParameterKind.GIT_REF);
        assertThat(ParameterKind.fromClassTag("hudson.model.PasswordParameterDefinition")).isEqualTo(ParameterKind.OTHER);
        assertThat(ParameterKind.fromClassTag(null)).isEqualTo(ParameterKind.OTHER);
    }
}
