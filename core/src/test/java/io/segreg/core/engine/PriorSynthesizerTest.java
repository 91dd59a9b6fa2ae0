package io.segreg.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.segreg.core.error.PriorSpecException;
import io.segreg.core.model.FamilyLink;
import io.segreg.core.model.ParameterTable;
import io.segreg.core.model.Prior;
import io.segreg.core.model.PriorTable;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PriorSynthesizer}: default priors per parameter kind and family, and
 * user overrides.
 */
class PriorSynthesizerTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        void changePointsLevelsSigmaAndAr() {
            Map<String, String> priors = texts(FamilyLink.GAUSSIAN, Map.of(), "y ~ 1 + ar(1)", "~ 1", "1 + (1 | id) ~ 1");

            assertThat(priors).containsExactly(
                    Map.entry("cp_1", "dunif(MINX, MAXX)"),
                    Map.entry("cp_2", "dunif(cp_1, MAXX)"),
                    Map.entry("int_1", "dnorm(0, 3 * SDY)"),
                    Map.entry("sigma_1", "dnorm(0, SDY) T(0, )"),
                    Map.entry("ar1_1", "dunif(-1, 1)"),
                    Map.entry("int_2", "dnorm(0, 3 * SDY)"),
                    Map.entry("int_3", "dnorm(0, 3 * SDY)"),
                    Map.entry("cp_2_sd", "dnorm(0, (MAXX - MINX) / 2) T(0, )"),
                    Map.entry("cp_2_id", "dnorm(0, cp_2_sd) T(cp_1 - cp_2, MAXX - cp_2)"));
        }

        @Test
        void slopesScaleWithThePredictorRange() {
            Map<String, String> priors = texts(
                    FamilyLink.GAUSSIAN, Map.of(), "y ~ 1 + x + sigma(1 + x) + ar(1, 1 + x)");

            assertThat(priors)
                    .containsEntry("x_1", "dnorm(0, 3 * SDY / (MAXX - MINX))")
                    .containsEntry("sigma_x_1", "dnorm(0, SDY / (MAXX - MINX))")
                    .containsEntry("ar1_x_1", "dnorm(0, 1 / (MAXX - MINX))");
        }

        @Test
        void relativeSigmaIsNotTruncated() {
            Map<String, String> priors = texts(FamilyLink.GAUSSIAN, Map.of(), "y ~ 1", "~ sigma(rel(1))");

            assertThat(priors).containsEntry("sigma_2", "dnorm(0, SDY)");
        }

        @Test
        void familyScales() {
            assertThat(texts(FamilyLink.of("gaussian", "log", "m"), Map.of(), "y ~ 1"))
                    .containsEntry("int_1", "dnorm(0, 3)");
            assertThat(texts(FamilyLink.of("bernoulli", null, "m"), Map.of(), "y ~ 1"))
                    .containsEntry("int_1", "dnorm(0, 3)");
            assertThat(texts(FamilyLink.of("poisson", null, "m"), Map.of(), "y ~ 1 + x"))
                    .containsEntry("int_1", "dnorm(0, 10)")
                    .containsEntry("x_1", "dnorm(0, 10 / (MAXX - MINX))");
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        void overrideReplacesTheDefault() {
            Map<String, String> overrides = new LinkedHashMap<>();
            overrides.put("cp_1", "dunif(20, 80)");
            overrides.put("int_2", "0");

            PriorTable table = synthesize(FamilyLink.GAUSSIAN, overrides, "y ~ 1", "~ 1");

            assertThat(table.get("cp_1").text()).isEqualTo("dunif(20, 80)");
            assertThat(table.get("int_2")).isEqualTo(new Prior.Fixed(0));
            assertThat(table.isOverridden("cp_1")).isTrue();
            assertThat(table.isOverridden("int_1")).isFalse();
            assertThat(table.isFixed("int_2")).isTrue();
            assertThat(table.size()).isEqualTo(4);
        }

        @Test
        void unknownParameterIsRejected() {
            assertThatThrownBy(() -> synthesize(FamilyLink.GAUSSIAN, Map.of("int_9", "dnorm(0, 1)"), "y ~ 1"))
                    .isInstanceOf(PriorSpecException.class)
                    .hasMessageContaining("unknown parameter 'int_9'")
                    .satisfies(ex -> assertThat(((PriorSpecException) ex).parameter()).isEqualTo("int_9"));
        }

        @Test
        void malformedOverrideIsRejected() {
            assertThatThrownBy(() -> synthesize(FamilyLink.GAUSSIAN, Map.of("int_1", "dnorm(0,"), "y ~ 1"))
                    .isInstanceOf(PriorSpecException.class);
        }
    }

    private static PriorTable synthesize(FamilyLink familyLink, Map<String, String> overrides, String... formulas) {
        ParameterTable table = ParameterTableBuilderTest.build(familyLink, formulas);
        return new PriorSynthesizer("test-model")
                .synthesize(table, ConstraintDeriver.derive(table), familyLink, overrides);
    }

    private static Map<String, String> texts(FamilyLink familyLink, Map<String, String> overrides, String... formulas) {
        Map<String, String> texts = new LinkedHashMap<>();
        synthesize(familyLink, overrides, formulas).asMap().forEach((name, prior) -> texts.put(name, prior.text()));
        return texts;
    }
}
