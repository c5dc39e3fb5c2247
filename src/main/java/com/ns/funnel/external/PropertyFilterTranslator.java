package com.ns.funnel.external;

import com.ns.funnel.ast.Expr;
import com.ns.funnel.model.PropertyFilter;

import java.util.List;
import java.util.Optional;

public interface PropertyFilterTranslator {

    /**
     * The AND of all filters as a predicate over an events row, or empty when there is
     * nothing to filter on.
     */
    Optional<Expr> translate(List<PropertyFilter> filters);
}
