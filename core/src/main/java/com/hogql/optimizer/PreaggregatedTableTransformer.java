package com.hogql.optimizer;

import com.hogql.ast.Expr;
import com.hogql.ast.SelectQuery;
import com.hogql.visitor.ExprTransformer;
import java.util.Objects;

/**
 * Walks a tree and rewrites every matching {@code SELECT} to the pre-aggregated table.
 *
 * <p>Substitution is pre-order: a matching query is replaced first, then the
 * traversal continues into the replacement's children, so subqueries in
 * {@code FROM}, CTEs, set queries and scalar subqueries are all considered. A
 * rewritten query no longer reads the events table, so it is never matched again.
 */
class PreaggregatedTableTransformer extends ExprTransformer {

    private final PageviewQueryMatcher matcher;
    private final PreaggregatedQueryRewriter rewriter;

    PreaggregatedTableTransformer(PageviewQueryMatcher matcher, PreaggregatedQueryRewriter rewriter) {
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter must not be null");
    }

    @Override
    protected Expr visitSelectQuery(SelectQuery query) {
        SelectQuery current = matcher.isOptimizable(query) ? rewriter.rewrite(query) : query;
        return super.visitSelectQuery(current);
    }
}
