package io.segreg.core.engine.jags;

import static org.assertj.core.api.Assertions.assertThat;

import io.segreg.core.config.CompilerOptions;
import io.segreg.core.engine.CompiledModel;
import io.segreg.core.engine.ModelCompiler;
import io.segreg.core.model.Expr;
import io.segreg.core.model.ModelDefinition;
import io.segreg.core.model.Prior;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link JagsDialect}: prior rendering with precisions and the layout of complete
 * model texts.
 */
class JagsDialectTest {

    private JagsDialect dialect;
    private ModelCompiler compiler;

    @BeforeEach
    void setUp() {
        dialect = new JagsDialect();
        compiler = new ModelCompiler();
    }

    @Nested
    @DisplayName("renderPrior")
    class RenderPrior {

        @Test
        void normalUsesPrecision() {
            Prior prior = Prior.Normal.of(Expr.num(0), Expr.times(Expr.num(3), Expr.var("SDY")));

            assertThat(dialect.renderPrior(prior)).isEqualTo("dnorm(0, 1 / (3 * SDY)^2)");
        }

        @Test
        void truncatedNormal() {
            Prior prior = new Prior.Normal(Expr.num(0), Expr.var("SDY"), Expr.num(0), null);

            assertThat(dialect.renderPrior(prior)).isEqualTo("dnorm(0, 1 / SDY^2) T(0, )");
        }

        @Test
        void hierarchicalUsesSpreadParameter() {
            Prior prior = new Prior.Hierarchical(Expr.num(0), "cp_1_sd", null, Expr.var("MAXX"));

            assertThat(dialect.renderPrior(prior)).isEqualTo("dnorm(0, 1 / cp_1_sd^2) T(, MAXX)");
        }

        @Test
        void uniformFixedAndCustom() {
            assertThat(dialect.renderPrior(new Prior.Uniform(Expr.num(-1), Expr.num(1)))).isEqualTo("dunif(-1, 1)");
            assertThat(dialect.renderPrior(new Prior.Fixed(2.5))).isEqualTo("2.5");
            assertThat(dialect.renderPrior(new Prior.Custom("dgamma(1, 1)"))).isEqualTo("dgamma(1, 1)");
        }
    }

    @Nested
    @DisplayName("renderModel")
    class RenderModel {

        @Test
        void twoSegmentGaussian() {
            CompiledModel model = compiler.compile(List.of("y ~ 1 + x", "~ 1"));

            assertThat(model.modelCode()).isEqualTo("""
                    model {
                      # Priors for population-level effects
                      cp_0 <- MINX
                      cp_1 ~ dunif(MINX, MAXX)
                      int_1 ~ dnorm(0, 1 / (3 * SDY)^2)
                      x_1 ~ dnorm(0, 1 / (3 * SDY / (MAXX - MINX))^2)
                      sigma_1 ~ dnorm(0, 1 / SDY^2) T(0, )
                      int_2 ~ dnorm(0, 1 / (3 * SDY)^2)

                      # Model and likelihood
                      for (i_ in 1:length(x)) {
                        X_1_[i_] <- min(x[i_], cp_1)
                        X_2_[i_] <- x[i_] - cp_1

                        # Segment 1: y ~ 1 + x
                        # Segment 2: ~ 1
                        y_[i_] <- (x[i_] < cp_1) * (int_1 + x_1 * X_1_[i_]) +
                          (x[i_] >= cp_1) * (int_2 + x_1 * X_2_[i_])
                        sigma_[i_] <- (x[i_] < cp_1) * (sigma_1) +
                          (x[i_] >= cp_1) * (sigma_1)
                        y[i_] ~ dnorm(y_[i_], 1 / sigma_[i_]^2)
                      }
                    }
                    """);
        }

        @Test
        void autoregressiveResidualsArePaddedAndLagged() {
            CompiledModel model = compiler.compile(List.of("y ~ 1 + ar(2)"));

            assertThat(model.modelCode()).endsWith("""
                        y_[i_] <- int_1
                        sigma_[i_] <- sigma_1
                        ar1_[i_] <- ar1_1
                        ar2_[i_] <- ar2_1
                        resid_[i_] <- y[i_] - y_[i_]
                        resid_pad_[i_ + 2] <- resid_[i_]
                      }
                      for (n_ in 1:2) {
                        resid_pad_[n_] <- 0
                      }
                      for (i_ in 1:length(x)) {
                        y_ar_[i_] <- y_[i_] + ar1_[i_] * resid_pad_[i_ + 1] + ar2_[i_] * resid_pad_[i_]
                        y[i_] ~ dnorm(y_ar_[i_], 1 / sigma_[i_]^2)
                      }
                    }
                    """);
        }

        @Test
        void logLinkResidualsUseLogResponse() {
            CompiledModel model = compiler.compile(ModelDefinition.builder()
                    .segments("y ~ 1 + ar(1)")
                    .link("log")
                    .build());

            assertThat(model.modelCode())
                    .contains("    resid_[i_] <- log(y[i_]) - y_[i_]\n")
                    .contains("    y[i_] ~ dnorm(exp(y_ar_[i_]), 1 / sigma_[i_]^2)\n");
        }

        @Test
        void varyingChangePoint() {
            CompiledModel model = compiler.compile(List.of("y ~ 1", "1 + (1 | id) ~ 0 + x"));

            assertThat(model.modelCode())
                    .contains("""
                              cp_1_sd ~ dnorm(0, 1 / ((MAXX - MINX) / 2)^2) T(0, )

                              # Priors for varying effects
                              for (l_ in 1:n_unique_id) {
                                cp_1_id_uni_[l_] ~ dnorm(0, 1 / cp_1_sd^2) T(MINX - cp_1, MAXX - cp_1)
                              }
                              for (l_ in 1:n_unique_id) {
                                cp_1_id[l_] <- cp_1_id_uni_[l_] - mean(cp_1_id_uni_[1:n_unique_id])
                              }
                            """)
                    .contains("    cp_1_[i_] <- min(max(MINX, cp_1 + cp_1_id[id[i_]]), MAXX)\n")
                    .contains("    X_2_[i_] <- x[i_] - cp_1_[i_]\n")
                    .contains("    y_[i_] <- (x[i_] < cp_1_[i_]) * (int_1) +\n")
                    .contains("      (x[i_] >= cp_1_[i_]) * (int_1 + x_2 * X_2_[i_])\n")
                    .doesNotContain("  cp_1_id ~");
        }

        @Test
        void binomialWithTrials() {
            CompiledModel model = new ModelCompiler(CompilerOptions.DEFAULT.withSegmentComments(false))
                    .compile(ModelDefinition.builder()
                            .family("binomial")
                            .segments("hits | trials(attempts) ~ 1 + day")
                            .build());

            assertThat(model.modelCode())
                    .contains("  for (i_ in 1:length(day)) {\n")
                    .contains("    X_1_[i_] <- day[i_]\n")
                    .contains("    y_[i_] <- int_1 + day_1 * X_1_[i_]\n")
                    .contains("    hits[i_] ~ dbin(ilogit(y_[i_]), attempts[i_])\n")
                    .doesNotContain("# Segment")
                    .doesNotContain("sigma");
        }

        @Test
        void otherFamiliesAndLinks() {
            assertThat(compiler.compile(ModelDefinition.builder().family("poisson").segments("y ~ 1").build())
                            .modelCode())
                    .contains("y[i_] ~ dpois(exp(y_[i_]))");
            assertThat(compiler.compile(ModelDefinition.builder()
                                    .family("bernoulli")
                                    .link("probit")
                                    .segments("y ~ 1")
                                    .build())
                            .modelCode())
                    .contains("y[i_] ~ dbern(phi(y_[i_]))");
        }

        @Test
        void fixedParametersAreDeterministicNodes() {
            CompiledModel model = compiler.compile(ModelDefinition.builder()
                    .segments("y ~ 1", "~ 1")
                    .prior("cp_1", "40")
                    .build());

            assertThat(model.modelCode()).contains("  cp_1 <- 40\n");
        }

        @Test
        void transformedSlopesUseLocalCoordinates() {
            CompiledModel model = compiler.compile(List.of("y ~ 1 + x^2", "~ 0 + exp(x)"));

            assertThat(model.modelCode())
                    .contains("(x[i_] < cp_1) * (int_1 + x_E2_1 * X_1_[i_]^2) +")
                    .contains("(x[i_] >= cp_1) * (int_1 + x_E2_1 * X_1_[i_]^2 + x_E2_1 * X_2_[i_]^2 + x_exp_2 * exp(X_2_[i_]))");
        }

        @Test
        void renderingIsDeterministic() {
            List<String> formulas = List.of("y ~ 1 + x + sigma(1)", "1 + (1 | id) ~ rel(1) + ar(1)", "~ 0 + x");

            assertThat(compiler.compile(formulas).modelCode()).isEqualTo(compiler.compile(formulas).modelCode());
        }
    }
}
