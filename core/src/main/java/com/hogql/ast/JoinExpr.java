package com.hogql.ast;

import com.hogql.generator.HogQLQuoting;
import java.util.Objects;

/**
 * One table source of a {@code FROM} clause, optionally followed by further joins.
 *
 * <p>A {@code FROM} clause is a linked list of join expressions: the first entry holds
 * the leftmost table, and each {@link #nextJoin()} carries its join type and
 * constraint:
 * <pre>
 *   FROM events AS e SAMPLE 1
 *   FROM events LEFT JOIN persons AS p ON e.person_id = p.id
 *   FROM (SELECT ...) AS sub
 * </pre>
 *
 * <p>{@link #table()} is usually a {@link Field} naming a table, but may be a nested
 * {@link SelectQuery} or {@link SelectSetQuery}.
 */
public final class JoinExpr implements Expr {

    private final Expr table;
    private final String alias;
    private final String joinType;
    private final Expr constraint;
    private final JoinExpr nextJoin;
    private final SampleExpr sample;

    /**
     * Creates a join expression.
     *
     * @param table the table or subquery
     * @param alias the table alias (may be null)
     * @param joinType the join type used to attach this entry to the previous one, e.g.
     *                 {@code LEFT JOIN} (null for the first entry)
     * @param constraint the {@code ON} condition (may be null)
     * @param nextJoin the next joined table (may be null)
     * @param sample the sample clause (may be null)
     */
    public JoinExpr(Expr table, String alias, String joinType, Expr constraint,
                    JoinExpr nextJoin, SampleExpr sample) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.alias = alias;
        this.joinType = joinType;
        this.constraint = constraint;
        this.nextJoin = nextJoin;
        this.sample = sample;
    }

    /**
     * Creates a plain single-table source.
     *
     * @param table the table or subquery
     */
    public JoinExpr(Expr table) {
        this(table, null, null, null, null, null);
    }

    public Expr table() {
        return table;
    }

    public String alias() {
        return alias;
    }

    public String joinType() {
        return joinType;
    }

    public Expr constraint() {
        return constraint;
    }

    public JoinExpr nextJoin() {
        return nextJoin;
    }

    public SampleExpr sample() {
        return sample;
    }

    public JoinExpr withTable(Expr newTable) {
        return new JoinExpr(newTable, alias, joinType, constraint, nextJoin, sample);
    }

    public JoinExpr withSample(SampleExpr newSample) {
        return new JoinExpr(table, alias, joinType, constraint, nextJoin, newSample);
    }

    public JoinExpr withNextJoin(JoinExpr newNextJoin) {
        return new JoinExpr(table, alias, joinType, constraint, newNextJoin, sample);
    }

    @Override
    public String toHogQL() {
        StringBuilder sb = new StringBuilder();
        if (joinType != null) {
            sb.append(joinType).append(' ');
        }
        if (table instanceof SelectQuery || table instanceof SelectSetQuery) {
            sb.append('(').append(table.toHogQL()).append(')');
        } else {
            sb.append(table.toHogQL());
        }
        if (alias != null) {
            sb.append(" AS ").append(HogQLQuoting.quoteIdentifierIfNeeded(alias));
        }
        if (sample != null) {
            sb.append(' ').append(sample.toHogQL());
        }
        if (constraint != null) {
            sb.append(" ON ").append(constraint.toHogQL());
        }
        if (nextJoin != null) {
            sb.append(' ').append(nextJoin.toHogQL());
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
        if (!(obj instanceof JoinExpr)) return false;
        JoinExpr that = (JoinExpr) obj;
        return Objects.equals(table, that.table) &&
               Objects.equals(alias, that.alias) &&
               Objects.equals(joinType, that.joinType) &&
               Objects.equals(constraint, that.constraint) &&
               Objects.equals(nextJoin, that.nextJoin) &&
               Objects.equals(sample, that.sample);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, alias, joinType, constraint, nextJoin, sample);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a source reading a single named table.
     *
     * @param tableName the table name
     * @return the join expression
     */
    public static JoinExpr table(String tableName) {
        return new JoinExpr(Field.of(tableName));
    }

    /**
     * Creates a source reading a single named table under an alias.
     *
     * @param tableName the table name
     * @param alias the alias
     * @return the join expression
     */
    public static JoinExpr table(String tableName, String alias) {
        return new JoinExpr(Field.of(tableName), alias, null, null, null, null);
    }
}
