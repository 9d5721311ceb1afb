package com.hogql.optimizer;

import com.hogql.ast.Expr;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a list of {@link OptimizationRule}s over a query tree until it settles.
 *
 * <p>A pass applies every rule once, in list order. Passes repeat while the tree
 * keeps changing, up to {@code maxIterations}.
 *
 * <p>Example usage:
 * <pre>
 *   QueryOptimizer optimizer = new QueryOptimizer();
 *   Expr optimized = optimizer.optimize(query, OptimizationContext.of(Dialect.HOGQL, modifiers));
 * </pre>
 *
 * <p>The default rule set contains {@link PreaggregatedTableRule}.
 */
public class QueryOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(QueryOptimizer.class);

    private static final int DEFAULT_MAX_ITERATIONS = 10;

    private final List<OptimizationRule> rules;
    private final int maxIterations;

    /**
     * Uses the pre-aggregated table rule and at most ten passes.
     */
    public QueryOptimizer() {
        this(createDefaultRules(), DEFAULT_MAX_ITERATIONS);
    }

    /**
     * @param rules rules to run in each pass, in order (copied)
     * @param maxIterations upper bound on the number of passes
     * @throws IllegalArgumentException if maxIterations is zero or negative
     */
    public QueryOptimizer(List<OptimizationRule> rules, int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.rules = new ArrayList<>(rules);
        this.maxIterations = maxIterations;
    }

    /**
     * Optimizes a tree by applying the rules.
     *
     * <p>Each iteration applies all rules in order. Iteration stops as soon as a
     * full pass leaves the tree unchanged.
     *
     * @param node the input tree
     * @param context the compilation context
     * @return the optimized tree
     */
    public Expr optimize(Expr node, OptimizationContext context) {
        if (node == null) {
            return null;
        }

        Expr current = node;

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            Expr previous = current;

            for (OptimizationRule rule : rules) {
                Expr result = rule.apply(current, context);
                if (result == null) {
                    logger.warn("Rule {} returned no tree, keeping its input", rule.name());
                    continue;
                }
                current = result;
            }

            if (current == previous || current.equals(previous)) {
                logger.debug("Optimization converged after {} iteration(s)", iteration + 1);
                return current;
            }
        }

        logger.debug("Optimization stopped at the iteration limit of {}", maxIterations);
        return current;
    }

    private static List<OptimizationRule> createDefaultRules() {
        return List.of(new PreaggregatedTableRule());
    }

    /** Copy of the rules, in the order each pass applies them. */
    public List<OptimizationRule> rules() {
        return new ArrayList<>(rules);
    }

    public int maxIterations() {
        return maxIterations;
    }
}
