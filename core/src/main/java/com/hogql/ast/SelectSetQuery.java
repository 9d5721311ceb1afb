package com.hogql.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Several queries combined with set operators:
 * <pre>
 *   SELECT ... UNION ALL SELECT ... UNION ALL SELECT ...
 * </pre>
 *
 * <p>Members are {@link SelectQuery} or nested {@link SelectSetQuery} nodes.
 */
public final class SelectSetQuery implements Expr {

    /**
     * One query attached to the previous ones by a set operator.
     *
     * @param setOperator the operator, e.g. {@code UNION ALL}
     * @param selectQuery the attached query
     */
    public record SetNode(String setOperator, Expr selectQuery) {
        public SetNode {
            Objects.requireNonNull(setOperator, "setOperator must not be null");
            Objects.requireNonNull(selectQuery, "selectQuery must not be null");
        }
    }

    private final Expr initialSelectQuery;
    private final List<SetNode> subsequentSelectQueries;

    public SelectSetQuery(Expr initialSelectQuery, List<SetNode> subsequentSelectQueries) {
        this.initialSelectQuery = Objects.requireNonNull(initialSelectQuery,
            "initialSelectQuery must not be null");
        this.subsequentSelectQueries = new ArrayList<>(Objects.requireNonNull(subsequentSelectQueries,
            "subsequentSelectQueries must not be null"));
    }

    public Expr initialSelectQuery() {
        return initialSelectQuery;
    }

    public List<SetNode> subsequentSelectQueries() {
        return Collections.unmodifiableList(subsequentSelectQueries);
    }

    /**
     * Returns every member query, initial query first.
     *
     * @return the member queries
     */
    public List<Expr> selectQueries() {
        List<Expr> queries = new ArrayList<>();
        queries.add(initialSelectQuery);
        for (SetNode node : subsequentSelectQueries) {
            queries.add(node.selectQuery());
        }
        return queries;
    }

    @Override
    public String toHogQL() {
        StringBuilder sb = new StringBuilder(initialSelectQuery.toHogQL());
        for (SetNode node : subsequentSelectQueries) {
            sb.append(' ').append(node.setOperator()).append(' ').append(node.selectQuery().toHogQL());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SelectSetQuery)) return false;
        SelectSetQuery that = (SelectSetQuery) obj;
        return Objects.equals(initialSelectQuery, that.initialSelectQuery) &&
               Objects.equals(subsequentSelectQueries, that.subsequentSelectQueries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(initialSelectQuery, subsequentSelectQueries);
    }

    // ==================== Factory Methods ====================

    /**
     * Combines queries with {@code UNION ALL}.
     *
     * @param first the first query
     * @param rest the remaining queries
     * @return the set query
     */
    public static SelectSetQuery unionAll(Expr first, Expr... rest) {
        List<SetNode> nodes = new ArrayList<>();
        for (Expr query : rest) {
            nodes.add(new SetNode("UNION ALL", query));
        }
        return new SelectSetQuery(first, nodes);
    }
}
