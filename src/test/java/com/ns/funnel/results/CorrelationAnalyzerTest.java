package com.ns.funnel.results;

import com.ns.funnel.aggregation.CorrelationQueryBuilder;
import com.ns.funnel.config.FunnelCompilerConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CorrelationAnalyzerTest {

    private final CorrelationAnalyzer analyzer = CorrelationAnalyzer.forConfig(FunnelCompilerConfig.defaults());

    @Test
    void oddsRatioUsesPriorCount() {
        double odds = analyzer.oddsRatio(5, 1, 50, 100);
        assertEquals(600.0 / 92.0, odds, 1e-9);
        assertEquals(6.52, odds, 0.01);
    }

    @Test
    void rowsAreClassifiedAndOrdered() {
        List<CorrelationRow> rows = List.of(
            new CorrelationRow(CorrelationQueryBuilder.TOTAL_VALUES_ROW, 50, 100),
            new CorrelationRow("signed up", 5, 1),
            new CorrelationRow("watched video", 20, 2),
            new CorrelationRow("saw error", 1, 30));

        CorrelationResult result = analyzer.analyze(rows);

        assertEquals(3, result.getEvents().size());
        assertEquals("watched video", result.getEvents().get(0).getName());
        assertEquals(CorrelationEvent.Outcome.SUCCESS, result.getEvents().get(0).getOutcome());
        assertEquals("signed up", result.getEvents().get(1).getName());
        assertEquals(CorrelationEvent.Outcome.SUCCESS, result.getEvents().get(1).getOutcome());
        assertEquals("saw error", result.getEvents().get(2).getName());
        assertEquals(CorrelationEvent.Outcome.FAILURE, result.getEvents().get(2).getOutcome());
        assertFalse(result.isSkewed());
    }

    @Test
    void smallRowsAreDiscarded() {
        // threshold is min(25, 2% of 1000) = 20
        List<CorrelationRow> rows = List.of(
            new CorrelationRow(CorrelationQueryBuilder.TOTAL_VALUES_ROW, 500, 500),
            new CorrelationRow("rare", 15, 4),
            new CorrelationRow("common", 15, 5));

        CorrelationResult result = analyzer.analyze(rows);

        assertEquals(1, result.getEvents().size());
        assertEquals("common", result.getEvents().get(0).getName());
    }

    @Test
    void resultsAreLimitedPerSide() {
        CorrelationAnalyzer limited = new CorrelationAnalyzer(0, 0, 2, 1);
        List<CorrelationRow> rows = List.of(
            new CorrelationRow(CorrelationQueryBuilder.TOTAL_VALUES_ROW, 100, 100),
            new CorrelationRow("s1", 10, 1),
            new CorrelationRow("s2", 20, 1),
            new CorrelationRow("s3", 30, 1),
            new CorrelationRow("f1", 1, 10));

        CorrelationResult result = limited.analyze(rows);

        assertEquals(List.of("s3", "s2", "f1"),
            result.getEvents().stream().map(CorrelationEvent::getName).collect(Collectors.toList()));
    }

    @Test
    void skewedWhenOneSideDominates() {
        assertTrue(CorrelationAnalyzer.isSkewed(5, 100));
        assertFalse(CorrelationAnalyzer.isSkewed(10, 100));
        assertFalse(CorrelationAnalyzer.isSkewed(0, 0));
    }
}
