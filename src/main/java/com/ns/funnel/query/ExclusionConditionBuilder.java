package com.ns.funnel.query;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.context.ResolvedExclusion;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Flags rows whose conversion path contains an excluded event and caps their steps at
 * the step the exclusion range starts from.
 */
public class ExclusionConditionBuilder {
    private final QueryContext context;

    public ExclusionConditionBuilder(QueryContext context) {
        this.context = context;
    }

    public boolean hasExclusions() {
        return !context.getExclusions().isEmpty();
    }

    /**
     * {@code exclusion_k = if(excluded > latest_f AND excluded < if(isNull(end), latest_f + window, end), 1, 0)}
     *
     * @param rangeEnd the time the range closes at, given its end step
     */
    public List<Expr> flagColumns(Function<ResolvedExclusion, Expr> rangeEnd) {
        List<Expr> flags = new ArrayList<>();
        for (ResolvedExclusion exclusion : context.getExclusions()) {
            Expr excludedAt = FunnelExprs.col(Columns.exclusionLatest(exclusion.getIndex(), exclusion.getFromStep()));
            Expr from = FunnelExprs.col(Columns.latest(exclusion.getFromStep()));
            Expr end = rangeEnd.apply(exclusion);
            Expr upper = Exprs.ifElse(Exprs.isNull(end), FunnelExprs.windowEnd(from, context.getWindow()), end);
            Expr hit = Exprs.and(Exprs.gt(excludedAt, from), Exprs.lt(excludedAt, upper));
            flags.add(Exprs.alias(Columns.exclusionFlag(exclusion.getIndex()),
                Exprs.ifElse(hit, Exprs.constant(1), Exprs.constant(0))));
        }
        return flags;
    }

    /** {@code arraySum([exclusion_0, ...]) AS exclusion}. */
    public Expr totalColumn() {
        List<Expr> flags = new ArrayList<>();
        for (ResolvedExclusion exclusion : context.getExclusions()) {
            flags.add(FunnelExprs.col(Columns.exclusionFlag(exclusion.getIndex())));
        }
        return Exprs.alias(Columns.EXCLUSION, Exprs.call("arraySum", Exprs.array(flags)));
    }

    /**
     * {@code least(steps, arrayMin([if(exclusion_k = 1, f_k + 1, maxSteps), ...]))}: an
     * actor keeps the steps up to the start of the range it was excluded in.
     */
    public Expr capSteps(Expr steps) {
        if (!hasExclusions()) {
            return steps;
        }
        List<Expr> caps = new ArrayList<>();
        for (ResolvedExclusion exclusion : context.getExclusions()) {
            Expr flagged = Exprs.eq(FunnelExprs.col(Columns.exclusionFlag(exclusion.getIndex())), Exprs.constant(1));
            caps.add(Exprs.ifElse(flagged, Exprs.constant(exclusion.getFromStep() + 1), Exprs.constant(context.getMaxSteps())));
        }
        return Exprs.call("least", steps, Exprs.call("arrayMin", Exprs.array(caps)));
    }
}
