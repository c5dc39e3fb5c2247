package com.ns.funnel.udf;

import com.ns.funnel.model.BreakdownAttribution;
import com.ns.funnel.model.OrderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The single-pass step classification: given all events of one actor, finds the furthest
 * step any step-0 event leads to within the conversion window. This is the routine the
 * {@code aggregate_funnel} aggregate runs, and follows the same chain, window, exclusion
 * and attribution rules as the cascading plan.
 *
 * <p>Events sharing a timestamp are taken in step order. A step can only be satisfied by
 * an event that does not also match the step before it, unless that event is strictly
 * later than the previous step.
 */
public class FunnelAggregator {
    private static final Logger logger = LoggerFactory.getLogger(FunnelAggregator.class);

    private static final Comparator<AggregatorEvent> EVENT_ORDER =
        Comparator.comparingLong(AggregatorEvent::getTimestamp).thenComparingInt(AggregatorEvent::firstStep);

    /** An exclusion range over 0-indexed steps. */
    public static final class ExclusionRange {
        private final int fromStep;
        private final int toStep;

        public ExclusionRange(int fromStep, int toStep) {
            if (fromStep >= toStep) {
                throw new IllegalArgumentException("Exclusion range [" + fromStep + ", " + toStep + "] is empty");
            }
            this.fromStep = fromStep;
            this.toStep = toStep;
        }

        public int getFromStep() { return fromStep; }
        public int getToStep() { return toStep; }
    }

    private final int numSteps;
    private final long windowSeconds;
    private final BreakdownAttribution attribution;
    private final OrderType orderType;
    private final List<ExclusionRange> exclusions;
    private final boolean[] optional;

    public FunnelAggregator(int numSteps, long windowSeconds, BreakdownAttribution attribution, OrderType orderType,
                            List<ExclusionRange> exclusions, List<Boolean> optionalSteps) {
        if (numSteps < 1) {
            throw new IllegalArgumentException("A funnel needs at least one step");
        }
        this.numSteps = numSteps;
        this.windowSeconds = windowSeconds;
        this.attribution = Objects.requireNonNull(attribution, "attribution is null");
        this.orderType = Objects.requireNonNull(orderType, "orderType is null");
        this.exclusions = List.copyOf(exclusions);
        this.optional = new boolean[numSteps];
        for (int i = 0; i < optionalSteps.size() && i < numSteps; i++) {
            optional[i] = Boolean.TRUE.equals(optionalSteps.get(i));
        }
        if (optional[0]) {
            throw new IllegalArgumentException("The first step cannot be optional");
        }
    }

    /** Builds the routine from the arguments of the SQL aggregate. */
    public static FunnelAggregator fromArguments(int numSteps, long windowSeconds, String attribution, String order,
                                                 List<ExclusionRange> exclusions, List<Boolean> optionalSteps) {
        return new FunnelAggregator(numSteps, windowSeconds, parseAttribution(attribution), parseOrder(order), exclusions, optionalSteps);
    }

    /** {@code first_touch}, {@code last_touch}, {@code all_events} or {@code step_N}. */
    public static String attributionArgument(BreakdownAttribution attribution) {
        if (attribution.isStep()) {
            return "step_" + attribution.getStepIndex();
        }
        return attribution.getType().name().toLowerCase(Locale.ROOT);
    }

    public static BreakdownAttribution parseAttribution(String argument) {
        String value = argument.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("step_")) {
            return BreakdownAttribution.step(Integer.parseInt(value.substring("step_".length())));
        }
        return BreakdownAttribution.of(value, null);
    }

    /** {@code ordered}, {@code strict} or {@code unordered}. */
    public static String orderArgument(OrderType orderType) {
        return orderType == OrderType.SEQUENTIAL ? "ordered" : orderType.name().toLowerCase(Locale.ROOT);
    }

    public static OrderType parseOrder(String argument) {
        String value = argument.trim().toLowerCase(Locale.ROOT);
        return "ordered".equals(value) ? OrderType.SEQUENTIAL : OrderType.valueOf(value.toUpperCase(Locale.ROOT));
    }

    /**
     * Classifies one actor. Returns one result per breakdown value the actor is counted
     * under, or nothing when it never did step 0.
     */
    public List<AggregatorResult> aggregate(List<AggregatorEvent> actorEvents) {
        List<AggregatorEvent> events = new ArrayList<>(actorEvents);
        events.sort(EVENT_ORDER);
        List<AggregatorResult> results = new ArrayList<>();
        switch (attribution.getType()) {
            case ALL_EVENTS:
                for (Object value : distinctValues(events, -1)) {
                    List<AggregatorEvent> partition = new ArrayList<>();
                    for (AggregatorEvent event : events) {
                        if (Objects.equals(event.getBreakdown(), value)) {
                            partition.add(event);
                        }
                    }
                    best(partition, value, -1).ifPresent(results::add);
                }
                break;
            case STEP:
                int step = attribution.getStepIndex();
                for (Object value : distinctValues(events, step)) {
                    best(events, value, step).ifPresent(results::add);
                }
                break;
            case LAST_TOUCH:
                best(events, touchValue(events, true), -1).ifPresent(results::add);
                break;
            default:
                best(events, touchValue(events, false), -1).ifPresent(results::add);
                break;
        }
        logger.trace("Actor with {} events classified into {} results", events.size(), results.size());
        return results;
    }

    private static Set<Object> distinctValues(List<AggregatorEvent> events, int step) {
        Set<Object> values = new LinkedHashSet<>();
        for (AggregatorEvent event : events) {
            if (step < 0) {
                values.add(event.getBreakdown());
            } else if (event.matchesStep(step) && hasValue(event.getBreakdown())) {
                values.add(event.getBreakdown());
            }
        }
        return values;
    }

    private static Object touchValue(List<AggregatorEvent> events, boolean last) {
        Object value = null;
        for (AggregatorEvent event : events) {
            if (hasValue(event.getBreakdown())) {
                value = event.getBreakdown();
                if (!last) {
                    break;
                }
            }
        }
        return value;
    }

    private static boolean hasValue(Object value) {
        if (value instanceof List) {
            return ((List<?>) value).stream().anyMatch(part -> part != null && !part.toString().isEmpty());
        }
        return value != null;
    }

    /**
     * The furthest chain over all step-0 candidates; the earliest candidate wins ties.
     *
     * @param attributedStep step whose event must carry {@code value}, or -1
     */
    private Optional<AggregatorResult> best(List<AggregatorEvent> events, Object value, int attributedStep) {
        Chain best = null;
        for (int start = 0; start < events.size(); start++) {
            List<Chain> candidates = new ArrayList<>();
            if (orderType == OrderType.UNORDERED) {
                for (int code : events.get(start).getCodes()) {
                    if (code > 0) {
                        candidates.add(unorderedChain(events, start, code - 1));
                    }
                }
            } else if (events.get(start).matchesStep(0)
                && (attributedStep != 0 || Objects.equals(events.get(start).getBreakdown(), value))) {
                candidates.add(orderType == OrderType.STRICT
                    ? strictChain(events, start, value, attributedStep)
                    : orderedChain(events, start, value, attributedStep));
            }
            for (Chain chain : candidates) {
                if (best == null || chain.reached > best.reached) {
                    best = chain;
                }
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(best.toResult(value));
    }

    private Chain orderedChain(List<AggregatorEvent> events, int start, Object value, int attributedStep) {
        Chain chain = new Chain(events.get(start));
        long deadline = chain.startTime() + windowSeconds;
        for (int j = start + 1; j < events.size() && chain.next < numSteps; j++) {
            AggregatorEvent event = events.get(j);
            if (event.getTimestamp() > deadline) {
                break;
            }
            int step = matchingCandidate(chain, event, value, attributedStep);
            if (step >= 0) {
                chain.take(step, event);
            }
        }
        return applyExclusions(chain, events);
    }

    /** Every event after the start must be the next step; anything else ends the chain. */
    private Chain strictChain(List<AggregatorEvent> events, int start, Object value, int attributedStep) {
        Chain chain = new Chain(events.get(start));
        long deadline = chain.startTime() + windowSeconds;
        for (int j = start + 1; j < events.size() && chain.next < numSteps; j++) {
            AggregatorEvent event = events.get(j);
            if (event.getTimestamp() > deadline) {
                break;
            }
            int step = matchingCandidate(chain, event, value, attributedStep);
            if (step < 0) {
                break;
            }
            chain.take(step, event);
        }
        return applyExclusions(chain, events);
    }

    /**
     * The step this event fills: the first of the pending steps up to and including the
     * next required one that it matches, or -1.
     */
    private int matchingCandidate(Chain chain, AggregatorEvent event, Object value, int attributedStep) {
        for (int step = chain.next; step < numSteps; step++) {
            boolean sameTime = event.getTimestamp() == chain.times[chain.last];
            boolean eligible = event.matchesStep(step)
                && !(sameTime && event.matchesStep(chain.last))
                && (step != attributedStep || Objects.equals(event.getBreakdown(), value));
            if (eligible) {
                return step;
            }
            if (!optional[step]) {
                break;
            }
        }
        return -1;
    }

    /**
     * Unordered: the chain starting at {@code startStep} counts every other step whose
     * first occurrence from the start event on is strictly later and within the window.
     */
    private Chain unorderedChain(List<AggregatorEvent> events, int start, int startStep) {
        AggregatorEvent first = events.get(start);
        long deadline = first.getTimestamp() + windowSeconds;
        Long[] firstSeen = new Long[numSteps];
        String[] uuids = new String[numSteps];
        for (int j = start; j < events.size(); j++) {
            AggregatorEvent event = events.get(j);
            if (event.getTimestamp() > deadline) {
                break;
            }
            for (int step = 0; step < numSteps; step++) {
                if (step != startStep && firstSeen[step] == null && event.matchesStep(step)) {
                    firstSeen[step] = event.getTimestamp();
                    uuids[step] = event.getUuid();
                }
            }
        }
        List<Integer> counted = new ArrayList<>();
        for (int step = 0; step < numSteps; step++) {
            if (firstSeen[step] != null && firstSeen[step] > first.getTimestamp()) {
                counted.add(step);
            }
        }
        counted.sort(Comparator.comparingLong(step -> firstSeen[step]));
        Chain chain = new Chain(first);
        for (int step : counted) {
            chain.take(chain.next, new AggregatorEvent(firstSeen[step], uuids[step], null, List.of()));
        }
        return applyExclusions(chain, events);
    }

    /** Caps the chain at the start of the first exclusion range an excluded event falls into. */
    private Chain applyExclusions(Chain chain, List<AggregatorEvent> events) {
        for (int k = 0; k < exclusions.size(); k++) {
            ExclusionRange range = exclusions.get(k);
            Long from = chain.times[range.getFromStep()];
            if (from == null || chain.reached < range.getFromStep()) {
                continue;
            }
            Long to = range.getToStep() <= chain.reached ? chain.times[range.getToStep()] : null;
            long end = to != null ? to : from + windowSeconds;
            for (AggregatorEvent event : events) {
                if (event.matchesExclusion(k) && event.getTimestamp() > from && event.getTimestamp() < end) {
                    chain.reached = Math.min(chain.reached, range.getFromStep());
                    break;
                }
            }
        }
        return chain;
    }

    private final class Chain {
        final Long[] times = new Long[numSteps];
        final String[] uuids = new String[numSteps];
        int last = 0;
        int next = 1;
        int reached = 0;

        Chain(AggregatorEvent start) {
            times[0] = start.getTimestamp();
            uuids[0] = start.getUuid();
        }

        long startTime() {
            return times[0];
        }

        void take(int step, AggregatorEvent event) {
            times[step] = event.getTimestamp();
            uuids[step] = event.getUuid();
            last = step;
            next = step + 1;
            reached = step;
        }

        AggregatorResult toResult(Object breakdown) {
            List<Long> stepTimes = new ArrayList<>(Arrays.asList(times).subList(0, reached + 1));
            List<String> stepUuids = new ArrayList<>(Arrays.asList(uuids).subList(0, reached + 1));
            List<Long> conversionTimes = new ArrayList<>();
            Long previous = times[0];
            for (int i = 1; i <= reached; i++) {
                if (times[i] == null) {
                    conversionTimes.add(null);
                    continue;
                }
                conversionTimes.add(times[i] - previous);
                previous = times[i];
            }
            return new AggregatorResult(reached, breakdown, stepTimes, conversionTimes, stepUuids);
        }
    }
}
