package com.hogql.optimizer;

import com.hogql.ast.SelectQuery;
import com.hogql.config.Dialect;
import com.hogql.config.QueryModifiers;
import java.util.List;
import java.util.Objects;

/**
 * Per-compilation inputs shared by every optimization rule.
 *
 * @param dialect the target dialect
 * @param callStack the enclosing queries of the node being optimized, outermost first
 *                  (never null, possibly empty)
 * @param modifiers the caller's modifiers (may be null)
 */
public record OptimizationContext(Dialect dialect, List<SelectQuery> callStack, QueryModifiers modifiers) {

    public OptimizationContext {
        Objects.requireNonNull(dialect, "dialect must not be null");
        callStack = callStack == null ? List.of() : List.copyOf(callStack);
    }

    public static OptimizationContext of(Dialect dialect, QueryModifiers modifiers) {
        return new OptimizationContext(dialect, List.of(), modifiers);
    }
}
