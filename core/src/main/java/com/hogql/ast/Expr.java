package com.hogql.ast;

/**
 * Sealed interface for all nodes of a HogQL abstract syntax tree.
 *
 * <p>Nodes fall into a few groups:
 * <ul>
 *   <li>Scalar expressions: {@link Constant}, {@link Field}, {@link Call}, {@link Alias}</li>
 *   <li>Predicates: {@link CompareOperation}, {@link And}, {@link Or}, {@link Not}</li>
 *   <li>Collections: {@link ArrayLiteral}, {@link Tuple}</li>
 *   <li>Query structure: {@link SelectQuery}, {@link SelectSetQuery}, {@link JoinExpr},
 *       {@link SampleExpr}, {@link OrderExpr}, {@link Cte}</li>
 * </ul>
 *
 * <p>Every implementation is a {@code final}, immutable class with structural
 * {@code equals}/{@code hashCode}. A tree can therefore be shared freely between
 * callers, and a rewrite always builds new nodes instead of changing existing ones.
 * Immutable construction also guarantees every tree is finite.
 */
public sealed interface Expr
    permits Constant, Field, Call, Alias, CompareOperation, And, Or, Not,
            ArrayLiteral, Tuple, SelectQuery, SelectSetQuery, JoinExpr, SampleExpr,
            OrderExpr, Cte {

    /**
     * Renders this node as HogQL text.
     *
     * <p>The output is meant for logging, debugging and test assertions. It is not
     * the printer used to produce executable SQL.
     *
     * @return the HogQL string
     */
    String toHogQL();
}
