package com.hogql.optimizer;

import com.hogql.ast.Expr;
import com.hogql.ast.SelectQuery;
import com.hogql.config.Dialect;
import com.hogql.config.QueryModifiers;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redirects simple pageview/screen aggregate queries from the raw events table to the
 * pre-aggregated {@code web_stats_combined} table.
 *
 * <p>The rule is gated by {@link QueryModifiers#useWebAnalyticsPreAggregatedTables()}.
 * When the flag is not set, or no modifiers are given, the input tree is returned
 * as is without being traversed.
 *
 * <p>Example usage:
 * <pre>
 *   PreaggregatedTableRule rule = new PreaggregatedTableRule();
 *   Expr optimized = rule.optimize(query, Dialect.CLICKHOUSE, List.of(), modifiers);
 * </pre>
 *
 * <p>The rule never fails on an unsupported or malformed query: it leaves such
 * queries unchanged, which costs performance but never correctness.
 * Instances are stateless and safe to share between threads.
 */
public class PreaggregatedTableRule implements OptimizationRule {

    private static final Logger logger = LoggerFactory.getLogger(PreaggregatedTableRule.class);

    private final PreaggregatedTableTransformer transformer;

    /**
     * Creates the rule for the production pre-aggregated tables.
     */
    public PreaggregatedTableRule() {
        this(PreaggregatedTableCapabilities.defaults());
    }

    /**
     * Creates the rule for the given table capabilities.
     *
     * @param capabilities the capabilities of the pre-aggregated tables
     */
    public PreaggregatedTableRule(PreaggregatedTableCapabilities capabilities) {
        Objects.requireNonNull(capabilities, "capabilities must not be null");
        this.transformer = new PreaggregatedTableTransformer(
            new PageviewQueryMatcher(capabilities),
            new PreaggregatedQueryRewriter(capabilities));
    }

    @Override
    public Expr apply(Expr node, OptimizationContext context) {
        return optimize(node, context.dialect(), context.callStack(), context.modifiers());
    }

    /**
     * Rewrites every eligible query in the tree.
     *
     * @param root the root of the tree (may be null)
     * @param dialect the target dialect (not used by this rule)
     * @param callStack the enclosing queries (not used by this rule, may be null)
     * @param modifiers the caller's modifiers (may be null)
     * @return {@code root} itself when disabled, otherwise the rewritten tree
     */
    public Expr optimize(Expr root, Dialect dialect, List<SelectQuery> callStack, QueryModifiers modifiers) {
        if (root == null) {
            return null;
        }
        if (modifiers == null || !QueryModifiers.isEnabled(modifiers.useWebAnalyticsPreAggregatedTables())) {
            return root;
        }
        logger.debug("Applying pre-aggregated table transforms for dialect {}", dialect);
        return transformer.visit(root);
    }
}
