package com.hogql.optimizer;

import com.hogql.ast.Alias;
import com.hogql.ast.And;
import com.hogql.ast.Call;
import com.hogql.ast.CompareOperation;
import com.hogql.ast.CompareOperationOp;
import com.hogql.ast.Expr;
import com.hogql.ast.Field;
import com.hogql.ast.JoinExpr;
import com.hogql.ast.SelectQuery;
import com.hogql.optimizer.PreaggregatedTableCapabilities.AggregationMerge;
import com.hogql.visitor.ExprTransformer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a matched events query to read the pre-aggregated table.
 *
 * <p>Given a query accepted by {@link PageviewQueryMatcher}:
 * <pre>
 *   SELECT count(), uniq(person_id) FROM events
 *   WHERE event = '$pageview' AND timestamp >= '2024-01-01'
 * </pre>
 * the rewriter produces:
 * <pre>
 *   SELECT sumMerge(pageviews_count_state), uniqMerge(persons_uniq_state)
 *   FROM web_stats_combined
 *   WHERE timestamp >= '2024-01-01'
 * </pre>
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>Deep-copy the query, so the result shares no node with the input</li>
 *   <li>Point {@code FROM} at the pre-aggregated table, keeping alias and joins, and
 *       dropping a {@code SAMPLE 1} clause</li>
 *   <li>Replace each top-level aggregate with its state merge</li>
 *   <li>Remove the event equality conditions from {@code WHERE}</li>
 *   <li>Apply the period bucket filter hook</li>
 * </ol>
 *
 * <p>Conditional aggregates ({@code countIf}, {@code uniqIf}) drop their condition:
 * the matcher has already proven every row is a pageview or screen event.
 */
public class PreaggregatedQueryRewriter {

    private static final Logger logger = LoggerFactory.getLogger(PreaggregatedQueryRewriter.class);

    private static final ExprTransformer COPIER = new ExprTransformer();

    private static final String UNIQ = "uniq";

    private final PreaggregatedTableCapabilities capabilities;

    public PreaggregatedQueryRewriter(PreaggregatedTableCapabilities capabilities) {
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities must not be null");
    }

    public PreaggregatedQueryRewriter() {
        this(PreaggregatedTableCapabilities.defaults());
    }

    /**
     * Rewrites a matched query.
     *
     * @param query a query accepted by {@link PageviewQueryMatcher#isOptimizable(SelectQuery)}
     * @return a new query reading the pre-aggregated table
     * @throws IllegalArgumentException if the query has no {@code FROM} clause
     */
    public SelectQuery rewrite(SelectQuery query) {
        if (query.selectFrom() == null) {
            throw new IllegalArgumentException("Cannot rewrite a query without a FROM clause");
        }
        SelectQuery copy = (SelectQuery) COPIER.visit(query);

        List<Expr> select = new ArrayList<>(copy.select().size());
        for (Expr projection : copy.select()) {
            select.add(rewriteProjection(projection));
        }

        SelectQuery rewritten = copy.toBuilder()
            .selectFrom(replaceTable(copy.selectFrom()))
            .select(select)
            .where(stripEventConditions(copy.where()))
            .build();

        logger.debug("Rewrote query to {}: {}", capabilities.targetTable(), rewritten);
        return addPeriodBucketFilter(rewritten);
    }

    private JoinExpr replaceTable(JoinExpr from) {
        return from.withTable(Field.of(capabilities.targetTable())).withSample(null);
    }

    /**
     * Replaces a supported aggregate with its state merge. Aliases are kept;
     * everything else is returned as is.
     */
    Expr rewriteProjection(Expr projection) {
        if (projection instanceof Alias alias) {
            return new Alias(alias.alias(), rewriteProjection(alias.expr()));
        }
        if (projection instanceof Call call) {
            AggregationMerge merge = mergeFor(call);
            if (merge != null) {
                return Call.of(merge.mergeFunction(), Field.of(merge.stateColumn()));
            }
        }
        return projection;
    }

    private AggregationMerge mergeFor(Call call) {
        if (call.distinct()) {
            // count(DISTINCT person_id) is uniq(person_id)
            return PageviewQueryMatcher.isDistinctPersonCount(call) ? capabilities.mergeFor(UNIQ) : null;
        }
        return capabilities.mergeFor(call.name());
    }

    /**
     * Removes event equality conditions, descending into AND only.
     *
     * <p>An AND left with no operands disappears, and one left with a single operand
     * collapses to that operand. OR and every other kind pass through unchanged.
     *
     * @param where the condition (may be null)
     * @return the remaining condition, or null if nothing remains
     */
    Expr stripEventConditions(Expr where) {
        if (where == null || isEventEquality(where)) {
            return null;
        }
        if (where instanceof And and) {
            List<Expr> remaining = new ArrayList<>();
            for (Expr operand : and.exprs()) {
                Expr stripped = stripEventConditions(operand);
                if (stripped != null) {
                    remaining.add(stripped);
                }
            }
            if (remaining.isEmpty()) {
                return null;
            }
            if (remaining.size() == 1) {
                return remaining.get(0);
            }
            return new And(remaining);
        }
        return where;
    }

    private static boolean isEventEquality(Expr expr) {
        if (expr instanceof CompareOperation compare) {
            return compare.op() == CompareOperationOp.EQ && PageviewQueryMatcher.isEventField(compare.left());
        }
        if (expr instanceof Call call) {
            return PageviewQueryMatcher.isEqualsCall(call) && PageviewQueryMatcher.isEventField(call.args().get(0));
        }
        return false;
    }

    /**
     * Hook for restricting the query to whole period buckets of the pre-aggregated
     * table. The time window is currently carried by the surviving timestamp
     * conditions, so the query is returned unchanged.
     *
     * @param query the rewritten query
     * @return the query
     */
    SelectQuery addPeriodBucketFilter(SelectQuery query) {
        return query;
    }
}
