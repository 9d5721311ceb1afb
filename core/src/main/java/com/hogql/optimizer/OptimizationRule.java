package com.hogql.optimizer;

import com.hogql.ast.Expr;

/**
 * Interface for AST optimization rules.
 *
 * <p>A rule rewrites an expression tree into an equivalent tree that should execute
 * more efficiently, e.g. by reading a pre-aggregated table instead of raw events.
 *
 * <p>Rules must preserve query semantics. A rule that cannot prove a rewrite is
 * safe leaves the tree unchanged rather than failing.
 */
public interface OptimizationRule {

    /**
     * Applies this rule to a tree.
     *
     * <p>Rules should be idempotent: applying the same rule to its own output
     * must not cause further changes.
     *
     * @param node the root of the tree
     * @param context the compilation context
     * @return the rewritten tree, or an equal tree if the rule did not apply
     */
    Expr apply(Expr node, OptimizationContext context);

    /**
     * Returns the name of this rule, used for logging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
