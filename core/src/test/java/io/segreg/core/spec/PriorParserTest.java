package io.segreg.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.segreg.core.error.PriorSpecException;
import io.segreg.core.model.Expr;
import io.segreg.core.model.Prior;
import org.junit.jupiter.api.Test;

class PriorParserTest {

    @Test
    void numberPinsTheParameter() {
        assertThat(PriorParser.parse("40", "cp_1", "m")).isEqualTo(new Prior.Fixed(40));
        assertThat(PriorParser.parse(" -0.5 ", "x_2", "m")).isEqualTo(new Prior.Fixed(-0.5));
    }

    @Test
    void normalWithSymbolicScale() {
        Prior prior = PriorParser.parse("dnorm(0, 3 * SDY)", "int_1", "m");

        assertThat(prior).isInstanceOf(Prior.Normal.class);
        Prior.Normal normal = (Prior.Normal) prior;
        assertThat(normal.mean()).isEqualTo(Expr.num(0));
        assertThat(normal.sd().render()).isEqualTo("3 * SDY");
        assertThat(normal.isTruncated()).isFalse();
    }

    @Test
    void normalWithOpenEndedTruncation() {
        Prior.Normal normal = (Prior.Normal) PriorParser.parse("dnorm(0, 10) T(0, )", "sigma_1", "m");

        assertThat(normal.lower()).isEqualTo(Expr.num(0));
        assertThat(normal.upper()).isNull();
        assertThat(normal.text()).isEqualTo("dnorm(0, 10) T(0, )");
    }

    @Test
    void normalTruncatedAtAnotherParameter() {
        Prior.Normal normal = (Prior.Normal) PriorParser.parse("dnorm(50, 10) T(cp_1, MAXX)", "cp_2", "m");

        assertThat(normal.lower()).isEqualTo(Expr.var("cp_1"));
        assertThat(normal.upper()).isEqualTo(Expr.var("MAXX"));
    }

    @Test
    void uniform() {
        Prior prior = PriorParser.parse("dunif(MINX, 80)", "cp_1", "m");

        assertThat(prior).isEqualTo(new Prior.Uniform(Expr.var("MINX"), Expr.num(80)));
    }

    @Test
    void otherDistributionsAreKeptVerbatim() {
        Prior prior = PriorParser.parse("  dgamma(1, 0.1)  ", "sigma_1", "m");

        assertThat(prior).isEqualTo(new Prior.Custom("dgamma(1, 0.1)"));
    }

    @Test
    void wrongArity() {
        assertThatThrownBy(() -> PriorParser.parse("dnorm(0)", "int_1", "m"))
                .isInstanceOf(PriorSpecException.class)
                .hasMessageContaining("takes 2 arguments, got 1")
                .satisfies(ex -> assertThat(((PriorSpecException) ex).parameter()).isEqualTo("int_1"));
    }

    @Test
    void truncatedUniformIsRejected() {
        assertThatThrownBy(() -> PriorParser.parse("dunif(0, 1) T(0, )", "ar1_1", "m"))
                .isInstanceOf(PriorSpecException.class)
                .hasMessageContaining("already bounded");
    }

    @Test
    void notADistribution() {
        assertThatThrownBy(() -> PriorParser.parse("normal(0, 1)", "int_1", "m"))
                .isInstanceOf(PriorSpecException.class)
                .hasMessageContaining("must be a number or a distribution");
    }

    @Test
    void syntaxErrorReportsPosition() {
        assertThatThrownBy(() -> PriorParser.parse("dnorm(0, 1", "int_1", "m"))
                .isInstanceOf(PriorSpecException.class)
                .hasMessageContaining("at position 10");
    }

    @Test
    void emptyText() {
        assertThatThrownBy(() -> PriorParser.parse(" ", "int_1", "m"))
                .isInstanceOf(PriorSpecException.class)
                .hasMessageContaining("is empty");
    }
}
