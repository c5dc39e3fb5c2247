package com.ns.funnel.external;

import com.ns.funnel.ast.QueryExpr;

import java.util.Optional;

public interface CohortRepository {

    /**
     * A query returning one {@code person_id} column with the members of the cohort,
     * or empty when the cohort does not exist.
     */
    Optional<QueryExpr> membershipPlan(long cohortId);
}
