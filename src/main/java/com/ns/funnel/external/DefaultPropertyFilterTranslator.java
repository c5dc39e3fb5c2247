package com.ns.funnel.external;

import com.ns.funnel.ast.CompareOperation;
import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.Exprs;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.config.EventStoreDefinition;
import com.ns.funnel.context.FunnelResolutionException;
import com.ns.funnel.hogql.HogQLExpressionParser;
import com.ns.funnel.model.PropertyFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Translates property filters into predicates over an events row: event properties
 * live under the properties column, person properties under the person join, group
 * properties under {@code group_N}, and cohort filters become a membership subquery.
 */
public class DefaultPropertyFilterTranslator implements PropertyFilterTranslator {
    private static final Logger logger = LoggerFactory.getLogger(DefaultPropertyFilterTranslator.class);

    private final EventStoreDefinition eventStore;
    private final CohortRepository cohortRepository;
    private final HogQLExpressionParser hogqlParser;

    public DefaultPropertyFilterTranslator(EventStoreDefinition eventStore, CohortRepository cohortRepository, HogQLExpressionParser hogqlParser) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore is null");
        this.cohortRepository = Objects.requireNonNull(cohortRepository, "cohortRepository is null");
        this.hogqlParser = Objects.requireNonNull(hogqlParser, "hogqlParser is null");
    }

    @Override
    public Optional<Expr> translate(List<PropertyFilter> filters) {
        if (filters == null || filters.isEmpty()) {
            return Optional.empty();
        }
        List<Expr> predicates = new ArrayList<>();
        for (PropertyFilter filter : filters) {
            predicates.add(translate(filter));
        }
        logger.debug("Translated {} property filters", filters.size());
        return Optional.of(Exprs.and(predicates));
    }

    private Expr translate(PropertyFilter filter) {
        switch (filter.getType()) {
            case HOGQL:
                return hogqlParser.parse(filter.getKey());
            case COHORT:
                long cohortId = ((Number) filter.getValue()).longValue();
                QueryExpr members = cohortRepository.membershipPlan(cohortId)
                    .orElseThrow(() -> new FunnelResolutionException(FunnelResolutionException.ResolutionCode.UNKNOWN_COHORT, cohortId));
                return Exprs.compare(CompareOperation.Operator.IN, Exprs.field(eventStore.getPersonIdColumn()), members);
            default:
                return compare(propertyField(filter), filter);
        }
    }

    Expr propertyField(PropertyFilter filter) {
        List<String> chain = new ArrayList<>();
        switch (filter.getType()) {
            case PERSON:
                chain.addAll(eventStore.getPersonPropertiesChain());
                break;
            case GROUP:
                chain.add("group_" + filter.getGroupTypeIndex().orElse(0));
                chain.add(eventStore.getPropertiesColumn());
                break;
            default:
                chain.add(eventStore.getPropertiesColumn());
                break;
        }
        chain.add(filter.getKey());
        return Exprs.field(chain);
    }

    private static Expr compare(Expr property, PropertyFilter filter) {
        Object value = filter.getValue();
        switch (filter.getOperator()) {
            case EXACT:
                return Exprs.in(property, constants(value));
            case IS_NOT:
                List<Expr> excluded = constants(value);
                return excluded.size() == 1
                    ? Exprs.notEq(property, excluded.get(0))
                    : Exprs.compare(CompareOperation.Operator.NOT_IN, property, Exprs.tuple(excluded.toArray(new Expr[0])));
            case ICONTAINS:
                return Exprs.compare(CompareOperation.Operator.ILIKE, Exprs.call("toString", property), Exprs.constant("%" + value + "%"));
            case NOT_ICONTAINS:
                return Exprs.compare(CompareOperation.Operator.NOT_ILIKE, Exprs.call("toString", property), Exprs.constant("%" + value + "%"));
            case REGEX:
                return Exprs.call("match", Exprs.call("toString", property), Exprs.constant(String.valueOf(value)));
            case NOT_REGEX:
                return Exprs.not(Exprs.call("match", Exprs.call("toString", property), Exprs.constant(String.valueOf(value))));
            case GT:
                return Exprs.gt(Exprs.call("toFloat", property), numeric(value));
            case GTE:
                return Exprs.gtEq(Exprs.call("toFloat", property), numeric(value));
            case LT:
                return Exprs.lt(Exprs.call("toFloat", property), numeric(value));
            case LTE:
                return Exprs.ltEq(Exprs.call("toFloat", property), numeric(value));
            case IS_SET:
                return Exprs.isNotNull(property);
            case IS_NOT_SET:
                return Exprs.isNull(property);
            default:
                throw new IllegalArgumentException("Unknown property operator " + filter.getOperator());
        }
    }

    private static List<Expr> constants(Object value) {
        if (value instanceof List) {
            return ((List<?>) value).stream().map(DefaultPropertyFilterTranslator::scalar).collect(Collectors.toList());
        }
        return List.of(scalar(value));
    }

    private static Expr scalar(Object value) {
        if (value == null || value instanceof Boolean) {
            return Exprs.constant(value);
        }
        // property values are stored as strings
        return Exprs.constant(value.toString());
    }

    private static Expr numeric(Object value) {
        if (value instanceof Number) {
            return Exprs.constant(((Number) value).doubleValue());
        }
        try {
            return Exprs.constant(Double.parseDouble(String.valueOf(value)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Numeric comparison needs a number, got '" + value + "'", e);
        }
    }
}
