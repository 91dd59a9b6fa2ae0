package io.segreg.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.segreg.core.error.ModelDefinitionException;
import io.segreg.core.model.ModelDefinition;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ModelDefinitionParser}: YAML fixtures under
 * {@code src/test/resources/definitions} and schema rejections.
 */
class ModelDefinitionParserTest {

    private ModelDefinitionParser parser;

    @BeforeEach
    void setUp() {
        parser = new ModelDefinitionParser();
    }

    @Nested
    @DisplayName("Valid definitions")
    class Valid {

        @Test
        void arOnset() {
            ModelDefinition definition = parser.parse(fixturePath("ar-onset.yaml"));

            assertThat(definition.id()).isEqualTo("ar-onset");
            assertThat(definition.description()).isEqualTo("Flat AR(1) level followed by a joined slope");
            assertThat(definition.family()).isEqualTo("gaussian");
            assertThat(definition.link()).isNull();
            assertThat(definition.predictor()).isNull();
            assertThat(definition.segments()).containsExactly("y ~ 1 + ar(1)", "~ 0 + x");
            assertThat(definition.priors()).isEmpty();
        }

        @Test
        void familyDefaultsToGaussianAndPriorsKeepOrder() {
            ModelDefinition definition = parser.parse(fixturePath("varying-change.yaml"));

            assertThat(definition.family()).isEqualTo("gaussian");
            assertThat(definition.priors()).containsExactly(
                    Map.entry("int_1", "dnorm(10, 5)"), Map.entry("cp_1", "dunif(20, 80)"), Map.entry("time_2", "0.5"));
        }

        @Test
        void familyLinkAndPredictor() {
            ModelDefinition definition = parser.parse(fixturePath("binomial-trials.yaml"));

            assertThat(definition.family()).isEqualTo("binomial");
            assertThat(definition.link()).isEqualTo("logit");
            assertThat(definition.predictor()).isEqualTo("day");
        }

        @Test
        void inlineYaml() {
            ModelDefinition definition = parser.parse("""
                    id: inline
                    segments:
                      - "y ~ 1"
                      - "~ 1"
                    """, "inline");

            assertThat(definition).isEqualTo(ModelDefinition.of("inline", List.of("y ~ 1", "~ 1")));
        }
    }

    @Nested
    @DisplayName("Invalid definitions")
    class Invalid {

        @Test
        void unknownKey() {
            Path path = invalidFixturePath("unknown-key.yaml");

            assertThatThrownBy(() -> parser.parse(path))
                    .isInstanceOf(ModelDefinitionException.class)
                    .hasMessageContaining("does not match schema")
                    .hasMessageContaining("sampler")
                    .satisfies(ex -> {
                        ModelDefinitionException mde = (ModelDefinitionException) ex;
                        assertThat(mde.modelId()).isEqualTo("unknown-key");
                        assertThat(mde.source()).isEqualTo(path.toString());
                    });
        }

        @Test
        void missingSegments() {
            assertThatThrownBy(() -> parser.parse(invalidFixturePath("missing-segments.yaml")))
                    .isInstanceOf(ModelDefinitionException.class)
                    .hasMessageContaining("segments");
        }

        @Test
        void unknownFamily() {
            assertThatThrownBy(() -> parser.parse(invalidFixturePath("bad-family.yaml")))
                    .isInstanceOf(ModelDefinitionException.class)
                    .hasMessageContaining("family");
        }

        @Test
        void sequenceInsteadOfMapping() {
            assertThatThrownBy(() -> parser.parse(invalidFixturePath("not-a-mapping.yaml")))
                    .isInstanceOf(ModelDefinitionException.class)
                    .hasMessageContaining("must be a YAML mapping");
        }

        @Test
        void emptySegmentList() {
            assertThatThrownBy(() -> parser.parse("id: empty\nsegments: []\n", "inline"))
                    .isInstanceOf(ModelDefinitionException.class)
                    .hasMessageContaining("segments");
        }

        @Test
        void brokenYaml() {
            assertThatThrownBy(() -> parser.parse("id: [unclosed\n", "inline"))
                    .isInstanceOf(ModelDefinitionException.class)
                    .hasMessageContaining("Failed to parse YAML")
                    .satisfies(ex -> assertThat(((ModelDefinitionException) ex).source()).isEqualTo("inline"));
        }

        @Test
        void missingFile() {
            assertThatThrownBy(() -> parser.parse(fixturePath("does-not-exist.yaml")))
                    .isInstanceOf(ModelDefinitionException.class)
                    .hasMessageContaining("Failed to read");
        }
    }

    private static Path fixturePath(String filename) {
        return Path.of("src/test/resources/definitions/" + filename);
    }

    private static Path invalidFixturePath(String filename) {
        return Path.of("src/test/resources/definitions/invalid/" + filename);
    }
}
