package io.segreg.core.engine.jags;

import io.segreg.core.model.Channel;
import io.segreg.core.model.Expr;
import io.segreg.core.model.Family;
import io.segreg.core.model.Link;
import io.segreg.core.model.ModelPlan;
import io.segreg.core.model.Prior;
import io.segreg.core.model.PriorTable;
import io.segreg.core.spi.SamplerDialect;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders models for JAGS.
 *
 * <p>
 * Normal distributions are written with precisions ({@code dnorm(m, 1 / sd^2)}); fixed
 * parameters become deterministic nodes. Observation-level nodes carry a trailing underscore
 * ({@code y_}, {@code sigma_}, {@code ar1_}, {@code X_1_}) and loop indices are {@code i_},
 * {@code l_} and {@code n_}, so they cannot clash with parameter or data names.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class JagsDialect implements SamplerDialect {

    /** Dialect id used in options and the registry. */
    public static final String ID = "jags";

    private static final String INDENT = "  ";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String renderPrior(Prior prior) {
        if (prior instanceof Prior.Uniform uniform) {
            return "dunif(" + uniform.lower().render() + ", " + uniform.upper().render() + ")";
        }
        if (prior instanceof Prior.Normal normal) {
            return "dnorm(" + normal.mean().render() + ", " + precision(normal.sd()) + ")"
                    + truncation(normal.lower(), normal.upper());
        }
        if (prior instanceof Prior.Hierarchical hierarchical) {
            return "dnorm(" + hierarchical.mean().render() + ", " + precision(Expr.var(hierarchical.spread())) + ")"
                    + truncation(hierarchical.lower(), hierarchical.upper());
        }
        if (prior instanceof Prior.Fixed fixed) {
            return fixed.text();
        }
        return ((Prior.Custom) prior).text();
    }

    @Override
    public String renderModel(ModelPlan plan, PriorTable priors, boolean segmentComments) {
        List<String> lines = new ArrayList<>();
        lines.add("model {");
        renderPopulationPriors(plan, priors, lines);
        if (!plan.varying().isEmpty()) {
            lines.add("");
            renderVaryingPriors(plan, priors, lines);
        }
        lines.add("");
        renderLikelihood(plan, segmentComments, lines);
        lines.add("}");
        return String.join("\n", lines) + "\n";
    }

    // ── Priors ──

    private void renderPopulationPriors(ModelPlan plan, PriorTable priors, List<String> lines) {
        lines.add(INDENT + "# Priors for population-level effects");
        lines.add(INDENT + "cp_0 <- MINX");
        for (Map.Entry<String, Prior> entry : priors.asMap().entrySet()) {
            if (isVaryingOffset(plan, entry.getKey())) {
                continue;
            }
            lines.add(INDENT + node(entry.getKey(), entry.getValue()));
        }
    }

    private void renderVaryingPriors(ModelPlan plan, PriorTable priors, List<String> lines) {
        lines.add(INDENT + "# Priors for varying effects");
        for (ModelPlan.VaryingChangePoint varying : plan.varying()) {
            String levels = "1:" + varying.levelCount();
            String raw = varying.offset() + "_uni_";
            lines.add(INDENT + "for (l_ in " + levels + ") {");
            lines.add(INDENT + INDENT + node(raw + "[l_]", priors.get(varying.offset())));
            lines.add(INDENT + "}");
            lines.add(INDENT + "for (l_ in " + levels + ") {");
            lines.add(INDENT + INDENT + varying.offset() + "[l_] <- " + raw + "[l_] - mean(" + raw + "[" + levels
                    + "])");
            lines.add(INDENT + "}");
        }
    }

    private String node(String target, Prior prior) {
        if (prior instanceof Prior.Fixed) {
            return target + " <- " + renderPrior(prior);
        }
        return target + " ~ " + renderPrior(prior);
    }

    private static boolean isVaryingOffset(ModelPlan plan, String name) {
        for (ModelPlan.VaryingChangePoint varying : plan.varying()) {
            if (varying.offset().equals(name)) {
                return true;
            }
        }
        return false;
    }

    private static String precision(Expr sd) {
        return Expr.div(Expr.num(1), Expr.pow(sd, Expr.num(2))).render();
    }

    private static String truncation(Expr lower, Expr upper) {
        if (lower == null && upper == null) {
            return "";
        }
        return " T(" + (lower == null ? "" : lower.render()) + ", " + (upper == null ? "" : upper.render()) + ")";
    }

    // ── Likelihood ──

    private void renderLikelihood(ModelPlan plan, boolean segmentComments, List<String> lines) {
        String x = plan.predictor() + "[i_]";
        String loop = "for (i_ in 1:length(" + plan.predictor() + ")) {";
        String body = INDENT + INDENT;
        int segments = plan.segmentCount();

        lines.add(INDENT + "# Model and likelihood");
        lines.add(INDENT + loop);

        for (ModelPlan.VaryingChangePoint varying : plan.varying()) {
            int k = varying.changePoint();
            lines.add(body + "cp_" + k + "_[i_] <- min(max(" + varying.lower().render() + ", cp_" + k + " + "
                    + varying.offset() + "[" + varying.group() + "[i_]]), " + varying.upper().render() + ")");
        }
        for (int j : plan.coordinates()) {
            lines.add(body + "X_" + j + "_[i_] <- " + coordinate(plan, j, x));
        }

        if (segmentComments) {
            lines.add("");
            for (int k = 1; k <= segments; k++) {
                lines.add(body + "# Segment " + k + ": " + plan.formulas().get(k - 1));
            }
        }
        for (Map.Entry<Channel, List<ModelPlan.SegmentExpression>> entry : plan.channels().entrySet()) {
            lines.addAll(gated(plan, nodeName(entry.getKey()), entry.getValue(), x, body));
        }

        int order = plan.arOrder();
        if (order == 0) {
            lines.add(body + likelihood(plan, "y_[i_]"));
            lines.add(INDENT + "}");
            return;
        }

        String observed = plan.response() + "[i_]";
        String linkScale = plan.familyLink().link() == Link.LOG ? "log(" + observed + ")" : observed;
        lines.add(body + "resid_[i_] <- " + linkScale + " - y_[i_]");
        lines.add(body + "resid_pad_[i_ + " + order + "] <- resid_[i_]");
        lines.add(INDENT + "}");
        lines.add(INDENT + "for (n_ in 1:" + order + ") {");
        lines.add(body + "resid_pad_[n_] <- 0");
        lines.add(INDENT + "}");
        lines.add(INDENT + loop);
        StringBuilder corrected = new StringBuilder("y_ar_[i_] <- y_[i_]");
        for (int n = 1; n <= order; n++) {
            int offset = order - n;
            corrected.append(" + ar").append(n).append("_[i_] * resid_pad_[i_");
            if (offset > 0) {
                corrected.append(" + ").append(offset);
            }
            corrected.append("]");
        }
        lines.add(body + corrected);
        lines.add(body + likelihood(plan, "y_ar_[i_]"));
        lines.add(INDENT + "}");
    }

    private static String coordinate(ModelPlan plan, int j, String x) {
        int segments = plan.segmentCount();
        if (segments == 1) {
            return x;
        }
        if (j == 1) {
            return "min(" + x + ", " + changePoint(plan, 1) + ")";
        }
        if (j == segments) {
            return x + " - " + changePoint(plan, segments - 1);
        }
        return "min(" + x + ", " + changePoint(plan, j) + ") - " + changePoint(plan, j - 1);
    }

    private static String changePoint(ModelPlan plan, int k) {
        return plan.varyingOn(k) != null ? "cp_" + k + "_[i_]" : "cp_" + k;
    }

    private static String nodeName(Channel channel) {
        switch (channel.type()) {
            case MEAN:
                return "y_";
            case SIGMA:
                return "sigma_";
            default:
                return channel.prefix() + "_";
        }
    }

    private static List<String> gated(
            ModelPlan plan, String node, List<ModelPlan.SegmentExpression> expressions, String x, String indent) {
        int segments = plan.segmentCount();
        List<String> lines = new ArrayList<>();
        if (segments == 1) {
            lines.add(indent + node + "[i_] <- " + sum(expressions.get(0)));
            return lines;
        }
        for (int k = 1; k <= segments; k++) {
            StringBuilder line = new StringBuilder(indent);
            line.append(k == 1 ? node + "[i_] <- " : INDENT);
            if (k > 1) {
                line.append("(").append(x).append(" >= ").append(changePoint(plan, k - 1)).append(") * ");
            }
            if (k < segments) {
                line.append("(").append(x).append(" < ").append(changePoint(plan, k)).append(") * ");
            }
            line.append("(").append(sum(expressions.get(k - 1))).append(")");
            if (k < segments) {
                line.append(" +");
            }
            lines.add(line.toString());
        }
        return lines;
    }

    private static String sum(ModelPlan.SegmentExpression expression) {
        if (expression.contributions().isEmpty()) {
            return "0";
        }
        List<String> parts = new ArrayList<>();
        for (ModelPlan.Contribution contribution : expression.contributions()) {
            String coefficient = contribution.coefficients().size() == 1
                    ? contribution.coefficients().get(0)
                    : "(" + String.join(" + ", contribution.coefficients()) + ")";
            if (contribution.isIntercept()) {
                parts.add(coefficient);
                continue;
            }
            String local = "X_" + contribution.coordinate() + "_[i_]";
            Expr transform = contribution.transform();
            String term = transform.render(name -> local);
            if (transform.precedence() < 2) {
                term = "(" + term + ")";
            }
            parts.add(coefficient + " * " + term);
        }
        return String.join(" + ", parts);
    }

    private static String likelihood(ModelPlan plan, String eta) {
        String y = plan.response() + "[i_]";
        String mean = inverseLink(plan, eta);
        Family family = plan.familyLink().family();
        switch (family) {
            case GAUSSIAN:
                return y + " ~ dnorm(" + mean + ", 1 / sigma_[i_]^2)";
            case BINOMIAL:
                return y + " ~ dbin(" + mean + ", " + plan.trials() + "[i_])";
            case BERNOULLI:
                return y + " ~ dbern(" + mean + ")";
            default:
                return y + " ~ dpois(" + mean + ")";
        }
    }

    private static String inverseLink(ModelPlan plan, String eta) {
        switch (plan.familyLink().link()) {
            case LOG:
                return "exp(" + eta + ")";
            case LOGIT:
                return "ilogit(" + eta + ")";
            case PROBIT:
                return "phi(" + eta + ")";
            default:
                return eta;
        }
    }
}
