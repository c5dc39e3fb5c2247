package com.ns.funnel.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class SelectQuery extends QueryExpr {
    private final Map<String, QueryExpr> ctes;
    private final boolean distinct;
    private final List<Expr> select;
    private final JoinExpr from;
    private final List<Expr> arrayJoin;
    private final Expr where;
    private final List<Expr> groupBy;
    private final Expr having;
    private final List<OrderExpr> orderBy;
    private final Integer limit;
    private final Integer offset;

    private SelectQuery(Builder builder) {
        if (builder.select.isEmpty()) {
            throw new IllegalArgumentException("SELECT list cannot be empty");
        }
        this.ctes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.ctes));
        this.distinct = builder.distinct;
        this.select = List.copyOf(builder.select);
        this.from = builder.from;
        this.arrayJoin = List.copyOf(builder.arrayJoin);
        this.where = builder.where;
        this.groupBy = List.copyOf(builder.groupBy);
        this.having = builder.having;
        this.orderBy = List.copyOf(builder.orderBy);
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.ctes.putAll(ctes);
        builder.distinct = distinct;
        builder.select.addAll(select);
        builder.from = from;
        builder.arrayJoin.addAll(arrayJoin);
        builder.where = where;
        builder.groupBy.addAll(groupBy);
        builder.having = having;
        builder.orderBy.addAll(orderBy);
        builder.limit = limit;
        builder.offset = offset;
        return builder;
    }

    public Map<String, QueryExpr> getCtes() { return ctes; }
    public boolean isDistinct() { return distinct; }
    public List<Expr> getSelect() { return select; }
    public Optional<JoinExpr> getFrom() { return Optional.ofNullable(from); }
    public List<Expr> getArrayJoin() { return arrayJoin; }
    public Optional<Expr> getWhere() { return Optional.ofNullable(where); }
    public List<Expr> getGroupBy() { return groupBy; }
    public Optional<Expr> getHaving() { return Optional.ofNullable(having); }
    public List<OrderExpr> getOrderBy() { return orderBy; }
    public Optional<Integer> getLimit() { return Optional.ofNullable(limit); }
    public Optional<Integer> getOffset() { return Optional.ofNullable(offset); }

    /** Names exposed by the select list: aliases, or the last part of plain fields. */
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>();
        for (Expr expr : select) {
            if (expr instanceof Alias) {
                names.add(((Alias) expr).getAlias());
            } else if (expr instanceof Field) {
                List<String> chain = ((Field) expr).getChain();
                names.add(chain.get(chain.size() - 1));
            }
        }
        return names;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSelectQuery(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectQuery)) return false;
        SelectQuery other = (SelectQuery) o;
        return distinct == other.distinct && ctes.equals(other.ctes) && select.equals(other.select)
            && Objects.equals(from, other.from) && arrayJoin.equals(other.arrayJoin)
            && Objects.equals(where, other.where) && groupBy.equals(other.groupBy)
            && Objects.equals(having, other.having) && orderBy.equals(other.orderBy)
            && Objects.equals(limit, other.limit) && Objects.equals(offset, other.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ctes, distinct, select, from, arrayJoin, where, groupBy, having, orderBy, limit, offset);
    }

    public static final class Builder {
        private final Map<String, QueryExpr> ctes = new LinkedHashMap<>();
        private boolean distinct;
        private final List<Expr> select = new ArrayList<>();
        private JoinExpr from;
        private final List<Expr> arrayJoin = new ArrayList<>();
        private Expr where;
        private final List<Expr> groupBy = new ArrayList<>();
        private Expr having;
        private final List<OrderExpr> orderBy = new ArrayList<>();
        private Integer limit;
        private Integer offset;

        private Builder() {
        }

        public Builder with(String name, QueryExpr query) {
            ctes.put(Objects.requireNonNull(name, "cte name is null"), Objects.requireNonNull(query, "cte query is null"));
            return this;
        }

        public Builder distinct(boolean value) {
            this.distinct = value;
            return this;
        }

        public Builder select(Expr... exprs) {
            select.addAll(Arrays.asList(exprs));
            return this;
        }

        public Builder select(List<? extends Expr> exprs) {
            select.addAll(exprs);
            return this;
        }

        public Builder replaceSelect(List<? extends Expr> exprs) {
            select.clear();
            select.addAll(exprs);
            return this;
        }

        public Builder from(JoinExpr value) {
            this.from = value;
            return this;
        }

        public Builder from(Expr table) {
            this.from = JoinExpr.from(table);
            return this;
        }

        public Builder from(Expr table, String alias) {
            this.from = JoinExpr.from(table, alias);
            return this;
        }

        public Builder join(JoinExpr link) {
            if (from == null) {
                throw new IllegalStateException("Cannot join before FROM is set");
            }
            this.from = from.then(link);
            return this;
        }

        public Builder arrayJoin(Expr expr) {
            arrayJoin.add(expr);
            return this;
        }

        public Builder where(Expr value) {
            this.where = value;
            return this;
        }

        /** ANDs the predicate onto any existing WHERE. */
        public Builder andWhere(Expr predicate) {
            this.where = where == null ? predicate : Exprs.and(where, predicate);
            return this;
        }

        public Builder groupBy(Expr... exprs) {
            groupBy.addAll(Arrays.asList(exprs));
            return this;
        }

        public Builder groupBy(List<? extends Expr> exprs) {
            groupBy.addAll(exprs);
            return this;
        }

        public Builder having(Expr value) {
            this.having = value;
            return this;
        }

        public Builder orderBy(OrderExpr... exprs) {
            orderBy.addAll(Arrays.asList(exprs));
            return this;
        }

        public Builder orderBy(List<OrderExpr> exprs) {
            orderBy.addAll(exprs);
            return this;
        }

        public Builder limit(Integer value) {
            this.limit = value;
            return this;
        }

        public Builder offset(Integer value) {
            this.offset = value;
            return this;
        }

        public SelectQuery build() {
            return new SelectQuery(this);
        }
    }
}
