package com.ns.funnel.context;

import com.ns.funnel.config.FunnelCompilerConfig;
import com.ns.funnel.external.ActionRepository;
import com.ns.funnel.external.CohortRepository;
import com.ns.funnel.external.DateRangeResolver;
import com.ns.funnel.external.DefaultDateRangeResolver;
import com.ns.funnel.external.DefaultPropertyFilterTranslator;
import com.ns.funnel.external.PropertyFilterTranslator;
import com.ns.funnel.hogql.HogQLExpressionParser;
import com.ns.funnel.model.PropertyFilter;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The collaborators and team settings a funnel is compiled against. Only consulted while
 * a {@link QueryContext} is being built.
 */
public final class FunnelEnvironment {
    private final ActionRepository actionRepository;
    private final CohortRepository cohortRepository;
    private final DateRangeResolver dateRangeResolver;
    private final PropertyFilterTranslator propertyFilterTranslator;
    private final HogQLExpressionParser hogqlParser;
    private final ZoneId timezone;
    private final List<PropertyFilter> testAccountFilters;
    private final FunnelCompilerConfig config;

    private FunnelEnvironment(Builder builder) {
        this.config = builder.config == null ? FunnelCompilerConfig.defaults() : builder.config;
        this.actionRepository = Objects.requireNonNull(builder.actionRepository, "actionRepository is null");
        this.cohortRepository = Objects.requireNonNull(builder.cohortRepository, "cohortRepository is null");
        this.dateRangeResolver = builder.dateRangeResolver == null ? new DefaultDateRangeResolver() : builder.dateRangeResolver;
        this.hogqlParser = builder.hogqlParser == null ? new HogQLExpressionParser() : builder.hogqlParser;
        this.propertyFilterTranslator = builder.propertyFilterTranslator == null
            ? new DefaultPropertyFilterTranslator(config.getEventStore(), cohortRepository, hogqlParser)
            : builder.propertyFilterTranslator;
        this.timezone = builder.timezone == null ? ZoneId.of("UTC") : builder.timezone;
        this.testAccountFilters = List.copyOf(builder.testAccountFilters);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ActionRepository getActionRepository() { return actionRepository; }
    public CohortRepository getCohortRepository() { return cohortRepository; }
    public DateRangeResolver getDateRangeResolver() { return dateRangeResolver; }
    public PropertyFilterTranslator getPropertyFilterTranslator() { return propertyFilterTranslator; }
    public HogQLExpressionParser getHogqlParser() { return hogqlParser; }
    public ZoneId getTimezone() { return timezone; }
    public List<PropertyFilter> getTestAccountFilters() { return testAccountFilters; }
    public FunnelCompilerConfig getConfig() { return config; }

    public static final class Builder {
        private ActionRepository actionRepository;
        private CohortRepository cohortRepository;
        private DateRangeResolver dateRangeResolver;
        private PropertyFilterTranslator propertyFilterTranslator;
        private HogQLExpressionParser hogqlParser;
        private ZoneId timezone;
        private final List<PropertyFilter> testAccountFilters = new ArrayList<>();
        private FunnelCompilerConfig config;

        private Builder() {
        }

        public Builder actionRepository(ActionRepository value) {
            this.actionRepository = value;
            return this;
        }

        public Builder cohortRepository(CohortRepository value) {
            this.cohortRepository = value;
            return this;
        }

        public Builder dateRangeResolver(DateRangeResolver value) {
            this.dateRangeResolver = value;
            return this;
        }

        public Builder propertyFilterTranslator(PropertyFilterTranslator value) {
            this.propertyFilterTranslator = value;
            return this;
        }

        public Builder hogqlParser(HogQLExpressionParser value) {
            this.hogqlParser = value;
            return this;
        }

        public Builder timezone(ZoneId value) {
            this.timezone = value;
            return this;
        }

        public Builder testAccountFilters(List<PropertyFilter> values) {
            testAccountFilters.addAll(values);
            return this;
        }

        public Builder config(FunnelCompilerConfig value) {
            this.config = value;
            return this;
        }

        public FunnelEnvironment build() {
            return new FunnelEnvironment(this);
        }
    }
}
