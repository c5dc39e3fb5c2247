package com.ns.funnel.query;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.OrderExpr;
import com.ns.funnel.ast.WindowFrame;
import com.ns.funnel.ast.WindowFunction;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.model.ConversionWindow;

import java.util.ArrayList;
import java.util.List;

/**
 * Expression fragments shared by the funnel query builders.
 */
public final class FunnelExprs {

    private FunnelExprs() {
    }

    public static Expr col(String name) {
        return Exprs.field(name);
    }

    /** {@code start + toIntervalDay(14)} for a 14 day window. */
    public static Expr windowEnd(Expr start, ConversionWindow window) {
        return Exprs.plus(start, Exprs.call(window.getUnit().getIntervalFunction(), Exprs.constant(window.getAmount())));
    }

    /** Actor partition, plus the breakdown value when the funnel is broken down. */
    public static List<Expr> actorPartition(QueryContext context) {
        List<Expr> partition = new ArrayList<>();
        partition.add(col(Columns.AGGREGATION_TARGET));
        if (context.getBreakdown().isPresent()) {
            partition.add(col(Columns.PROP));
        }
        return partition;
    }

    /**
     * {@code fn(column) OVER (PARTITION BY actor ORDER BY timestamp DESC ROWS BETWEEN ...)}.
     * Rows are ordered latest first, so preceding rows are the later events.
     */
    public static WindowFunction overLaterRows(String function, Expr argument, QueryContext context, WindowFrame frame) {
        List<OrderExpr> order = List.of(Exprs.desc(col(Columns.TIMESTAMP)));
        return new WindowFunction(function, List.of(argument), actorPartition(context), order, frame);
    }

    public static Expr stepMatched(int index) {
        return Exprs.eq(col(Columns.step(index)), Exprs.constant(1));
    }

    public static Expr dateDiffSeconds(Expr from, Expr to) {
        return Exprs.call("dateDiff", Exprs.constant("second"), from, to);
    }
}
