package com.ns.funnel.aggregation;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.JoinExpr;
import com.ns.funnel.ast.SelectQuery;
import com.ns.funnel.context.QueryContext;
import com.ns.funnel.query.Columns;
import com.ns.funnel.query.FunnelExprs;
import com.ns.funnel.results.TimeToConvertBinning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Histogram of the time actors took from the from-step to the to-step. Bins are
 * {@code from_seconds + k * bin_width_seconds} for every {@code k} in {@code [0, bin_count]},
 * including empty ones.
 */
public class TimeToConvertQueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TimeToConvertQueryBuilder.class);

    static final String STEP_RUNS = "step_runs";
    static final String HISTOGRAM_PARAMS = "histogram_params";
    static final String TIMINGS = "timings";
    static final String FROM_SECONDS = "from_seconds";
    static final String TO_SECONDS = "to_seconds";
    static final String AVERAGE_CONVERSION_TIME = "average_conversion_time";
    static final String BIN_COUNT = "bin_count";
    static final String BIN_WIDTH_SECONDS = "bin_width_seconds";
    static final String BIN_FROM_SECONDS = "bin_from_seconds";
    static final String PERSON_COUNT = "person_count";

    private final QueryContext context;

    public TimeToConvertQueryBuilder(QueryContext context) {
        this.context = context;
    }

    /** {@code bin_from_seconds, person_count, average_conversion_time} ordered by bin. */
    public SelectQuery build() {
        Expr fromSeconds = param(FROM_SECONDS);
        Expr binWidth = param(BIN_WIDTH_SECONDS);

        Expr binOf = Exprs.plus(fromSeconds, Exprs.multiply(
            Exprs.call("floor", Exprs.divide(Exprs.minus(FunnelExprs.col(TIMINGS), fromSeconds), binWidth)), binWidth));
        SelectQuery results = SelectQuery.builder()
            .select(Exprs.alias(BIN_FROM_SECONDS, binOf), Exprs.alias(PERSON_COUNT, Exprs.call("count")))
            .from(Exprs.field(STEP_RUNS))
            .groupBy(FunnelExprs.col(BIN_FROM_SECONDS))
            .build();

        SelectQuery fill = SelectQuery.builder()
            .select(Exprs.alias(BIN_FROM_SECONDS, Exprs.plus(fromSeconds, Exprs.multiply(FunnelExprs.col("number"), binWidth))))
            .from(Exprs.call("numbers", Exprs.plus(Exprs.call("ifNull", param(BIN_COUNT), Exprs.constant(0)), Exprs.constant(1))))
            .build();

        Expr constraint = Exprs.eq(Exprs.field("results", BIN_FROM_SECONDS), Exprs.field("fill", BIN_FROM_SECONDS));
        JoinExpr from = JoinExpr.from(results, "results")
            .then(JoinExpr.join("RIGHT OUTER JOIN", fill, "fill", constraint));

        logger.debug("Time to convert from step {} to step {}", context.getFromStep(), context.getToStep());
        return SelectQuery.builder()
            .with(STEP_RUNS, stepRuns())
            .with(HISTOGRAM_PARAMS, histogramParams())
            .select(
                Exprs.alias(BIN_FROM_SECONDS, Exprs.field("fill", BIN_FROM_SECONDS)),
                Exprs.alias(PERSON_COUNT, Exprs.call("ifNull", Exprs.field("results", PERSON_COUNT), Exprs.constant(0))),
                Exprs.alias(AVERAGE_CONVERSION_TIME, param(AVERAGE_CONVERSION_TIME)))
            .from(from)
            .orderBy(Exprs.asc(FunnelExprs.col(BIN_FROM_SECONDS)))
            .build();
    }

    /** Actors that reached the to-step, with the sum of their hop times in between. */
    SelectQuery stepRuns() {
        List<Expr> hops = new ArrayList<>();
        for (int i = context.getFromStep() + 1; i <= context.getToStep(); i++) {
            hops.add(FunnelExprs.col(Columns.inner(Columns.averageConversionTime(i))));
        }
        Expr timings = hops.get(0);
        for (int i = 1; i < hops.size(); i++) {
            timings = Exprs.plus(timings, hops.get(i));
        }
        return SelectQuery.builder()
            .select(FunnelExprs.col(Columns.AGGREGATION_TARGET), Exprs.alias(TIMINGS, timings))
            .from(new StepCountsQueryBuilder(context).actorStepsQuery(false, false))
            .where(Exprs.gtEq(FunnelExprs.col(Columns.STEPS), Exprs.constant(context.getToStep() + 1)))
            .build();
    }

    SelectQuery histogramParams() {
        Expr from = FunnelExprs.col(FROM_SECONDS);
        Expr to = FunnelExprs.col(TO_SECONDS);
        Expr binCount = FunnelExprs.col(BIN_COUNT);
        Expr width = Exprs.call("ceil", Exprs.divide(Exprs.minus(to, from), binCount));
        Expr defaultWidth = Exprs.constant(context.getConfig().getDefaultBinWidthSeconds());
        return SelectQuery.builder()
            .select(
                Exprs.alias(FROM_SECONDS, Exprs.call("ifNull", Exprs.call("floor", Exprs.call("min", FunnelExprs.col(TIMINGS))), Exprs.constant(0))),
                Exprs.alias(TO_SECONDS, Exprs.call("ifNull", Exprs.call("ceil", Exprs.call("max", FunnelExprs.col(TIMINGS))), Exprs.constant(0))),
                Exprs.alias(AVERAGE_CONVERSION_TIME, Exprs.call("round", Exprs.call("avg", FunnelExprs.col(TIMINGS)), Exprs.constant(2))),
                Exprs.alias(BIN_COUNT, binCountExpr()),
                Exprs.alias(BIN_WIDTH_SECONDS, Exprs.ifElse(Exprs.gt(width, Exprs.constant(0)), width, defaultWidth)))
            .from(Exprs.field(STEP_RUNS))
            .build();
    }

    /** A custom bin count is clamped here; otherwise the cube root of the sample size, capped. */
    private Expr binCountExpr() {
        TimeToConvertBinning binning = TimeToConvertBinning.forConfig(context.getConfig());
        if (context.getBinCount().isPresent()) {
            return Exprs.constant(binning.clampCustom(context.getBinCount().get()));
        }
        Expr count = Exprs.call("count");
        Expr auto = Exprs.call("least", Exprs.constant(binning.getAutoMaxBinCount()), Exprs.call("ceil", Exprs.call("cbrt", count)));
        return Exprs.ifElse(Exprs.gtEq(count, Exprs.constant(2)), auto, Exprs.constant(1));
    }

    private static Expr param(String name) {
        return SelectQuery.builder()
            .select(FunnelExprs.col(name))
            .from(Exprs.field(HISTOGRAM_PARAMS))
            .build();
    }
}
