package com.ns.funnel.context;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.ast.QueryExpr;
import com.ns.funnel.model.BreakdownAttribution;
import com.ns.funnel.model.BreakdownType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A breakdown with its cohorts resolved, its HogQL expression parsed and its
 * attribution adjusted to what the order type supports.
 */
public final class ResolvedBreakdown {
    /** Cohort id used for the synthetic "all users" cohort. */
    public static final long ALL_USERS_COHORT_ID = 0L;

    public static final class CohortBranch {
        private final long cohortId;
        private final QueryExpr membership;

        public CohortBranch(long cohortId, QueryExpr membership) {
            this.cohortId = cohortId;
            this.membership = membership;
        }

        public long getCohortId() { return cohortId; }

        /** Empty for the all-users cohort. */
        public Optional<QueryExpr> getMembership() { return Optional.ofNullable(membership); }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CohortBranch)) return false;
            CohortBranch other = (CohortBranch) o;
            return cohortId == other.cohortId && Objects.equals(membership, other.membership);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cohortId, membership);
        }
    }

    private final BreakdownType type;
    private final BreakdownAttribution attribution;
    private final List<String> properties;
    private final boolean normalizeUrl;
    private final Integer groupTypeIndex;
    private final int limit;
    private final List<List<String>> values;
    private final Expr hogqlExpression;
    private final List<CohortBranch> cohortBranches;

    public ResolvedBreakdown(BreakdownType type, BreakdownAttribution attribution, List<String> properties,
                             boolean normalizeUrl, Integer groupTypeIndex, int limit, List<List<String>> values,
                             Expr hogqlExpression, List<CohortBranch> cohortBranches) {
        this.type = Objects.requireNonNull(type, "type is null");
        this.attribution = Objects.requireNonNull(attribution, "attribution is null");
        this.properties = List.copyOf(properties);
        this.normalizeUrl = normalizeUrl;
        this.groupTypeIndex = groupTypeIndex;
        this.limit = limit;
        this.values = values;
        this.hogqlExpression = hogqlExpression;
        this.cohortBranches = List.copyOf(cohortBranches);
    }

    public BreakdownType getType() { return type; }
    public BreakdownAttribution getAttribution() { return attribution; }
    public List<String> getProperties() { return properties; }
    public boolean isNormalizeUrl() { return normalizeUrl; }
    public Optional<Integer> getGroupTypeIndex() { return Optional.ofNullable(groupTypeIndex); }
    public int getLimit() { return limit; }
    public Optional<List<List<String>>> getValues() { return Optional.ofNullable(values); }
    public Optional<Expr> getHogqlExpression() { return Optional.ofNullable(hogqlExpression); }
    public List<CohortBranch> getCohortBranches() { return cohortBranches; }

    /** Multi-property breakdowns produce array values. */
    public boolean isArrayValued() {
        return properties.size() > 1;
    }

    public boolean isCohort() {
        return type == BreakdownType.COHORT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedBreakdown)) return false;
        ResolvedBreakdown other = (ResolvedBreakdown) o;
        return type == other.type && normalizeUrl == other.normalizeUrl && limit == other.limit
            && attribution.equals(other.attribution) && properties.equals(other.properties)
            && Objects.equals(groupTypeIndex, other.groupTypeIndex) && Objects.equals(values, other.values)
            && Objects.equals(hogqlExpression, other.hogqlExpression) && cohortBranches.equals(other.cohortBranches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, attribution, properties, normalizeUrl, groupTypeIndex, limit, values, hogqlExpression, cohortBranches);
    }
}
