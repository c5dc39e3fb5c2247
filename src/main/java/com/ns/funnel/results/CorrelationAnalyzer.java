package com.ns.funnel.results;

import com.ns.funnel.aggregation.CorrelationQueryBuilder;
import com.ns.funnel.config.FunnelCompilerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores correlation rows by odds ratio against the funnel-wide totals.
 *
 * <p>Each row's odds of converting are compared with everyone else's, with a prior count
 * added to every cell so that empty cells don't produce zero or infinite ratios. Rows
 * touching too few actors are discarded.
 */
public class CorrelationAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(CorrelationAnalyzer.class);

    private static final double SKEW_RATIO = 0.1;

    private final int minPersonCount;
    private final double minPersonPercentage;
    private final int resultLimit;
    private final int priorCount;

    public CorrelationAnalyzer(int minPersonCount, double minPersonPercentage, int resultLimit, int priorCount) {
        this.minPersonCount = minPersonCount;
        this.minPersonPercentage = minPersonPercentage;
        this.resultLimit = resultLimit;
        this.priorCount = priorCount;
    }

    public static CorrelationAnalyzer forConfig(FunnelCompilerConfig config) {
        return new CorrelationAnalyzer(config.getCorrelationMinPersonCount(), config.getCorrelationMinPersonPercentage(),
            config.getCorrelationResultLimit(), config.getCorrelationPriorCount());
    }

    /**
     * @param rows query rows, including the totals row named
     *             {@link CorrelationQueryBuilder#TOTAL_VALUES_ROW}
     */
    public CorrelationResult analyze(List<CorrelationRow> rows) {
        long totalSuccess = 0;
        long totalFailure = 0;
        List<CorrelationRow> candidates = new ArrayList<>();
        for (CorrelationRow row : rows) {
            if (CorrelationQueryBuilder.TOTAL_VALUES_ROW.equals(row.getName())) {
                totalSuccess = row.getSuccessCount();
                totalFailure = row.getFailureCount();
            } else {
                candidates.add(row);
            }
        }

        double threshold = Math.min(minPersonCount, minPersonPercentage * (totalSuccess + totalFailure));
        List<CorrelationEvent> successes = new ArrayList<>();
        List<CorrelationEvent> failures = new ArrayList<>();
        for (CorrelationRow row : candidates) {
            if (row.getSuccessCount() + row.getFailureCount() < threshold) {
                continue;
            }
            double odds = oddsRatio(row.getSuccessCount(), row.getFailureCount(), totalSuccess, totalFailure);
            if (odds > 1) {
                successes.add(new CorrelationEvent(row.getName(), row.getSuccessCount(), row.getFailureCount(), odds,
                    CorrelationEvent.Outcome.SUCCESS));
            } else {
                failures.add(new CorrelationEvent(row.getName(), row.getSuccessCount(), row.getFailureCount(), odds,
                    CorrelationEvent.Outcome.FAILURE));
            }
        }
        successes.sort(Comparator.comparingDouble(CorrelationEvent::getOddsRatio).reversed());
        failures.sort(Comparator.comparingDouble(CorrelationEvent::getOddsRatio));

        List<CorrelationEvent> events = new ArrayList<>(successes.subList(0, Math.min(resultLimit, successes.size())));
        events.addAll(failures.subList(0, Math.min(resultLimit, failures.size())));
        logger.debug("Kept {} of {} correlation rows (threshold {})", events.size(), candidates.size(), threshold);
        return new CorrelationResult(events, isSkewed(totalSuccess, totalFailure));
    }

    public double oddsRatio(long success, long failure, long totalSuccess, long totalFailure) {
        double p = priorCount;
        return ((success + p) * (totalFailure - failure + p)) / ((totalSuccess - success + p) * (failure + p));
    }

    static boolean isSkewed(long totalSuccess, long totalFailure) {
        long larger = Math.max(totalSuccess, totalFailure);
        if (larger == 0) {
            return false;
        }
        return (double) Math.min(totalSuccess, totalFailure) / larger < SKEW_RATIO;
    }
}
