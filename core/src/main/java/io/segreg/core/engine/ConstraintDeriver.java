package io.segreg.core.engine;

import io.segreg.core.model.Constraint;
import io.segreg.core.model.DataSummary;
import io.segreg.core.model.Expr;
import io.segreg.core.model.Parameter;
import io.segreg.core.model.ParameterKind;
import io.segreg.core.model.ParameterTable;
import io.segreg.core.model.VaryingEffect;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives the constraints implied by a parameter table: change-point ordering, truncation
 * and zero-sum of varying offsets, and the stationarity range of AR coefficients.
 *
 * <p>
 * Thread-safe and stateless; all methods are static.
 */
public final class ConstraintDeriver {

    private ConstraintDeriver() {}

    /**
     * Derives all constraints, change points first, then varying effects, then AR
     * coefficients.
     */
    public static List<Constraint> derive(ParameterTable table) {
        List<Constraint> constraints = new ArrayList<>();
        int changePoints = table.changePointCount();
        for (int k = 1; k <= changePoints; k++) {
            constraints.add(new Constraint.Ordering(
                    ParameterTable.changePoint(k), lowerNeighbour(k), upperNeighbour(k, changePoints)));
        }
        for (VaryingEffect effect : table.varyingEffects()) {
            int k = effect.changePoint();
            constraints.add(new Constraint.ZeroSum(effect.offset(), effect.group()));
            constraints.add(new Constraint.Truncation(
                    effect.offset(), ParameterTable.changePoint(k), lowerNeighbour(k), upperNeighbour(k, changePoints)));
        }
        for (Parameter parameter : table.ofKind(ParameterKind.AR_COEFFICIENT)) {
            constraints.add(new Constraint.Stationarity(parameter.name(), -1, 1));
        }
        return List.copyOf(constraints);
    }

    /** {@code cp_(k-1)}, or {@code MINX} for the first change point. */
    static Expr lowerNeighbour(int k) {
        return k == 1 ? Expr.var(DataSummary.MINX) : Expr.var(ParameterTable.changePoint(k - 1));
    }

    /** {@code cp_(k+1)}, or {@code MAXX} for the last change point. */
    static Expr upperNeighbour(int k, int changePoints) {
        return k == changePoints ? Expr.var(DataSummary.MAXX) : Expr.var(ParameterTable.changePoint(k + 1));
    }
}
