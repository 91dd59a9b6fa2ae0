package io.segreg.core.engine;

import io.segreg.core.model.Expr;

/**
 * Term codes used in parameter names: {@code x} for the bare predictor, {@code x_E2} for
 * {@code x^2}, {@code x_exp} for {@code exp(x)}, and a sanitized rendering for anything else
 * (e.g. {@code x_x_t_2} for {@code x * 2}). In the sanitized form operators become letter codes
 * and parentheses become {@code L}/{@code R}, so distinct groupings get distinct codes:
 * {@code x * (x + 1)} is {@code x_x_t_L_x_p_1_R} while {@code x * x + 1} is {@code x_x_t_x_p_1}.
 *
 * <p>
 * Thread-safe and stateless; all methods are static.
 */
public final class TermNames {

    private static final String OPERATORS = "+-*/^()";
    private static final String OPERATOR_CODES = "pmtdELR";

    private TermNames() {}

    /**
     * Returns the term code of a slope expression.
     *
     * @param expression slope expression over the predictor
     * @param predictor  predictor name
     */
    public static String code(Expr expression, String predictor) {
        if (expression instanceof Expr.Var var) {
            return var.name();
        }
        if (expression instanceof Expr.Binary binary
                && binary.op() == '^'
                && binary.right() instanceof Expr.Num exponent
                && simple(binary.left())) {
            return code(binary.left(), predictor) + "_E" + sanitizeNumber(exponent.value());
        }
        if (expression instanceof Expr.Call call && simple(call.args().get(0))) {
            return code(call.args().get(0), predictor) + "_" + call.function();
        }
        return predictor + "_" + sanitize(expression.render());
    }

    private static boolean simple(Expr expr) {
        return expr instanceof Expr.Var || expr instanceof Expr.Call || isPower(expr);
    }

    private static boolean isPower(Expr expr) {
        return expr instanceof Expr.Binary b && b.op() == '^' && b.right() instanceof Expr.Num;
    }

    private static String sanitizeNumber(double value) {
        return Expr.formatNumber(value).replace('.', '_').replace('-', 'm');
    }

    private static String sanitize(String text) {
        StringBuilder out = new StringBuilder();
        for (char c : text.toCharArray()) {
            int operator = OPERATORS.indexOf(c);
            if (Character.isLetterOrDigit(c)) {
                out.append(c);
            } else if (operator >= 0) {
                separate(out);
                out.append(OPERATOR_CODES.charAt(operator));
                out.append('_');
            } else {
                separate(out);
            }
        }
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '_') {
            end--;
        }
        return out.substring(0, end);
    }

    private static void separate(StringBuilder out) {
        if (out.length() > 0 && out.charAt(out.length() - 1) != '_') {
            out.append('_');
        }
    }
}
