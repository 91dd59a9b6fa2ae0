package io.segreg.core.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Small arithmetic expression tree. Used for transformed slope terms (e.g. {@code x^2},
 * {@code exp(x)}) and for the symbolic arguments of priors (e.g. {@code MAXX - MINX},
 * {@code 3 * SDY}).
 *
 * <p>
 * Rendering is canonical: the same tree always produces the same text, with the minimal
 * parentheses required by operator precedence. Evaluation takes an environment of variable
 * values.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Expr {

    /** Functions accepted in transforms; all of them exist in the sampler language too. */
    Set<String> FUNCTIONS = Set.of("exp", "log", "sqrt", "abs", "sin", "cos", "tan");

    /**
     * Evaluates this expression.
     *
     * @param env variable values
     * @return the numeric value
     * @throws IllegalStateException if a referenced variable has no value in {@code env}
     */
    double evaluate(Map<String, Double> env);

    /**
     * Renders this expression, mapping every variable name through {@code variables}.
     *
     * @param variables maps a variable name to the text that replaces it
     */
    String render(Function<String, String> variables);

    /** Binding strength used for parenthesization (higher binds tighter). */
    int precedence();

    /** Renders this expression with variables as-is. */
    default String render() {
        return render(Function.identity());
    }

    /** Returns the sorted set of variable names referenced by this expression. */
    default Set<String> variables() {
        Set<String> names = new TreeSet<>();
        collectVariables(this, names);
        return names;
    }

    // ── Factories ──

    static Expr num(double value) {
        return new Num(value);
    }

    static Expr var(String name) {
        return new Var(name);
    }

    static Expr plus(Expr left, Expr right) {
        return new Binary('+', left, right);
    }

    static Expr minus(Expr left, Expr right) {
        return new Binary('-', left, right);
    }

    static Expr times(Expr left, Expr right) {
        return new Binary('*', left, right);
    }

    static Expr div(Expr left, Expr right) {
        return new Binary('/', left, right);
    }

    static Expr pow(Expr left, Expr right) {
        return new Binary('^', left, right);
    }

    /** Formats a number without exponent notation or trailing zeros ({@code 3}, {@code 0.5}). */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static void collectVariables(Expr expr, Set<String> names) {
        if (expr instanceof Var v) {
            names.add(v.name());
        } else if (expr instanceof Neg n) {
            collectVariables(n.operand(), names);
        } else if (expr instanceof Binary b) {
            collectVariables(b.left(), names);
            collectVariables(b.right(), names);
        } else if (expr instanceof Call c) {
            c.args().forEach(arg -> collectVariables(arg, names));
        }
    }

    // ── Implementations ──

    /** A numeric literal. */
    record Num(double value) implements Expr {

        @Override
        public double evaluate(Map<String, Double> env) {
            return value;
        }

        @Override
        public String render(Function<String, String> variables) {
            return formatNumber(value);
        }

        @Override
        public int precedence() {
            return value < 0 ? 3 : 5;
        }
    }

    /** A variable reference: the predictor, a parameter, or a data constant. */
    record Var(String name) implements Expr {
        public Var {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public double evaluate(Map<String, Double> env) {
            Double value = env.get(name);
            if (value == null) {
                throw new IllegalStateException("No value bound for variable '" + name + "'");
            }
            return value;
        }

        @Override
        public String render(Function<String, String> variables) {
            return variables.apply(name);
        }

        @Override
        public int precedence() {
            return 5;
        }
    }

    /** Unary minus. */
    record Neg(Expr operand) implements Expr {
        public Neg {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public double evaluate(Map<String, Double> env) {
            return -operand.evaluate(env);
        }

        @Override
        public String render(Function<String, String> variables) {
            String inner = operand.render(variables);
            return operand.precedence() < precedence() ? "-(" + inner + ")" : "-" + inner;
        }

        @Override
        public int precedence() {
            return 3;
        }
    }

    /**
     * Binary arithmetic: {@code + - * / ^}.
     *
     * @param op    operator character
     * @param left  left operand
     * @param right right operand
     */
    record Binary(char op, Expr left, Expr right) implements Expr {
        public Binary {
            if ("+-*/^".indexOf(op) < 0) {
                throw new IllegalArgumentException("Unsupported operator: " + op);
            }
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public double evaluate(Map<String, Double> env) {
            double l = left.evaluate(env);
            double r = right.evaluate(env);
            return switch (op) {
                case '+' -> l + r;
                case '-' -> l - r;
                case '*' -> l * r;
                case '/' -> l / r;
                default -> Math.pow(l, r);
            };
        }

        @Override
        public String render(Function<String, String> variables) {
            int p = precedence();
            String l = left.render(variables);
            String r = right.render(variables);
            // ^ is right-associative; - and / are left-associative
            boolean wrapLeft = op == '^' ? left.precedence() <= p : left.precedence() < p;
            boolean wrapRight = op == '^'
                    ? right.precedence() < p
                    : right.precedence() < p || (right.precedence() == p && (op == '-' || op == '/'));
            if (wrapLeft) l = "(" + l + ")";
            if (wrapRight) r = "(" + r + ")";
            return op == '^' ? l + "^" + r : l + " " + op + " " + r;
        }

        @Override
        public int precedence() {
            return switch (op) {
                case '+', '-' -> 1;
                case '*', '/' -> 2;
                default -> 4;
            };
        }
    }

    /**
     * Function call, one argument per function in {@link #FUNCTIONS}.
     *
     * @param function function name
     * @param args     arguments
     */
    record Call(String function, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(function, "function must not be null");
            if (!FUNCTIONS.contains(function)) {
                throw new IllegalArgumentException("Unknown function: " + function);
            }
            args = List.copyOf(args);
            if (args.size() != 1) {
                throw new IllegalArgumentException(function + "() takes exactly one argument, got " + args.size());
            }
        }

        @Override
        public double evaluate(Map<String, Double> env) {
            double a = args.get(0).evaluate(env);
            return switch (function) {
                case "exp" -> Math.exp(a);
                case "log" -> Math.log(a);
                case "sqrt" -> Math.sqrt(a);
                case "abs" -> Math.abs(a);
                case "sin" -> Math.sin(a);
                case "cos" -> Math.cos(a);
                default -> Math.tan(a);
            };
        }

        @Override
        public String render(Function<String, String> variables) {
            return function + "(" + args.get(0).render(variables) + ")";
        }

        @Override
        public int precedence() {
            return 5;
        }
    }
}
