package com.hogql.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single {@code SELECT} statement.
 *
 * <p>Clauses map onto fields as follows:
 * <pre>
 *   WITH name AS (...)      -- ctes
 *   SELECT [DISTINCT] ...   -- select, distinct
 *   FROM ...                -- selectFrom
 *   WHERE ...               -- where
 *   GROUP BY ...            -- groupBy
 *   HAVING ...              -- having
 *   ORDER BY ...            -- orderBy
 *   LIMIT ... OFFSET ...    -- limit, offset
 * </pre>
 *
 * <p>Every clause except {@code select} is optional: list clauses are empty when
 * absent, single-expression clauses are null. Instances are immutable; use
 * {@link #toBuilder()} to derive a modified copy.
 */
public final class SelectQuery implements Expr {

    private final Map<String, Cte> ctes;
    private final List<Expr> select;
    private final boolean distinct;
    private final JoinExpr selectFrom;
    private final Expr where;
    private final List<Expr> groupBy;
    private final Expr having;
    private final List<OrderExpr> orderBy;
    private final Expr limit;
    private final Expr offset;

    private SelectQuery(Builder builder) {
        this.ctes = new LinkedHashMap<>(builder.ctes);
        this.select = new ArrayList<>(builder.select);
        this.distinct = builder.distinct;
        this.selectFrom = builder.selectFrom;
        this.where = builder.where;
        this.groupBy = new ArrayList<>(builder.groupBy);
        this.having = builder.having;
        this.orderBy = new ArrayList<>(builder.orderBy);
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    /**
     * Returns the common table expressions, in declaration order.
     *
     * @return an unmodifiable map from CTE name to CTE
     */
    public Map<String, Cte> ctes() {
        return Collections.unmodifiableMap(ctes);
    }

    /**
     * Returns the projections.
     *
     * @return an unmodifiable list of projected expressions
     */
    public List<Expr> select() {
        return Collections.unmodifiableList(select);
    }

    public boolean distinct() {
        return distinct;
    }

    /**
     * Returns the {@code FROM} clause.
     *
     * @return the first join expression, or null when the query has no {@code FROM}
     */
    public JoinExpr selectFrom() {
        return selectFrom;
    }

    /**
     * Returns the {@code WHERE} condition.
     *
     * @return the condition, or null when absent
     */
    public Expr where() {
        return where;
    }

    public List<Expr> groupBy() {
        return Collections.unmodifiableList(groupBy);
    }

    public Expr having() {
        return having;
    }

    public List<OrderExpr> orderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    public Expr limit() {
        return limit;
    }

    public Expr offset() {
        return offset;
    }

    @Override
    public String toHogQL() {
        StringBuilder sb = new StringBuilder();
        if (!ctes.isEmpty()) {
            sb.append("WITH ")
              .append(ctes.values().stream().map(Cte::toHogQL).collect(Collectors.joining(", ")))
              .append(' ');
        }
        sb.append("SELECT ");
        if (distinct) {
            sb.append("DISTINCT ");
        }
        sb.append(joined(select));
        if (selectFrom != null) {
            sb.append(" FROM ").append(selectFrom.toHogQL());
        }
        if (where != null) {
            sb.append(" WHERE ").append(where.toHogQL());
        }
        if (!groupBy.isEmpty()) {
            sb.append(" GROUP BY ").append(joined(groupBy));
        }
        if (having != null) {
            sb.append(" HAVING ").append(having.toHogQL());
        }
        if (!orderBy.isEmpty()) {
            sb.append(" ORDER BY ").append(joined(orderBy));
        }
        if (limit != null) {
            sb.append(" LIMIT ").append(limit.toHogQL());
        }
        if (offset != null) {
            sb.append(" OFFSET ").append(offset.toHogQL());
        }
        return sb.toString();
    }

    private static String joined(List<? extends Expr> exprs) {
        return exprs.stream().map(SelectQuery::renderItem).collect(Collectors.joining(", "));
    }

    private static String renderItem(Expr expr) {
        if (expr instanceof SelectQuery || expr instanceof SelectSetQuery) {
            return "(" + expr.toHogQL() + ")";
        }
        return expr.toHogQL();
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SelectQuery)) return false;
        SelectQuery that = (SelectQuery) obj;
        return distinct == that.distinct &&
               Objects.equals(ctes, that.ctes) &&
               Objects.equals(select, that.select) &&
               Objects.equals(selectFrom, that.selectFrom) &&
               Objects.equals(where, that.where) &&
               Objects.equals(groupBy, that.groupBy) &&
               Objects.equals(having, that.having) &&
               Objects.equals(orderBy, that.orderBy) &&
               Objects.equals(limit, that.limit) &&
               Objects.equals(offset, that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ctes, select, distinct, selectFrom, where, groupBy,
                            having, orderBy, limit, offset);
    }

    // ==================== Builder ====================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialised with every clause of this query.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder()
            .ctes(ctes.values())
            .select(select)
            .distinct(distinct)
            .selectFrom(selectFrom)
            .where(where)
            .groupBy(groupBy)
            .having(having)
            .orderBy(orderBy)
            .limit(limit)
            .offset(offset);
    }

    /**
     * Builder for {@link SelectQuery}.
     */
    public static final class Builder {

        private final Map<String, Cte> ctes = new LinkedHashMap<>();
        private final List<Expr> select = new ArrayList<>();
        private boolean distinct;
        private JoinExpr selectFrom;
        private Expr where;
        private final List<Expr> groupBy = new ArrayList<>();
        private Expr having;
        private final List<OrderExpr> orderBy = new ArrayList<>();
        private Expr limit;
        private Expr offset;

        private Builder() {}

        public Builder ctes(Iterable<Cte> values) {
            ctes.clear();
            for (Cte cte : values) {
                ctes.put(cte.name(), cte);
            }
            return this;
        }

        public Builder cte(String name, Expr expr) {
            ctes.put(name, new Cte(name, expr));
            return this;
        }

        public Builder select(List<? extends Expr> exprs) {
            select.clear();
            select.addAll(exprs);
            return this;
        }

        public Builder select(Expr... exprs) {
            return select(List.of(exprs));
        }

        public Builder distinct(boolean value) {
            this.distinct = value;
            return this;
        }

        public Builder selectFrom(JoinExpr value) {
            this.selectFrom = value;
            return this;
        }

        /**
         * Sets {@code FROM} to a single named table.
         *
         * @param tableName the table name
         * @return this builder
         */
        public Builder from(String tableName) {
            this.selectFrom = JoinExpr.table(tableName);
            return this;
        }

        public Builder where(Expr value) {
            this.where = value;
            return this;
        }

        public Builder groupBy(List<? extends Expr> exprs) {
            groupBy.clear();
            groupBy.addAll(exprs);
            return this;
        }

        public Builder groupBy(Expr... exprs) {
            return groupBy(List.of(exprs));
        }

        public Builder having(Expr value) {
            this.having = value;
            return this;
        }

        public Builder orderBy(List<OrderExpr> exprs) {
            orderBy.clear();
            orderBy.addAll(exprs);
            return this;
        }

        public Builder orderBy(OrderExpr... exprs) {
            return orderBy(List.of(exprs));
        }

        public Builder limit(Expr value) {
            this.limit = value;
            return this;
        }

        public Builder offset(Expr value) {
            this.offset = value;
            return this;
        }

        public SelectQuery build() {
            return new SelectQuery(this);
        }
    }
}
