package com.hogql.optimizer;

import com.hogql.ast.Alias;
import com.hogql.ast.Call;
import com.hogql.ast.Constant;
import com.hogql.ast.Expr;
import com.hogql.ast.Field;
import com.hogql.ast.JoinExpr;
import com.hogql.ast.SelectQuery;
import com.hogql.ast.SelectSetQuery;
import com.hogql.ast.Tuple;
import com.hogql.visitor.ExprTransformer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits aggregate queries into a state stage and a merge stage.
 *
 * <p>A state query keeps partial aggregate states instead of final values, so the
 * results of several state queries (e.g. historical pre-aggregated data and
 * today's raw events) can be combined before finalising:
 * <pre>
 *   SELECT uniq(person_id) AS users, properties.$host AS host FROM events GROUP BY host
 *
 *   -- toStateAggregations
 *   SELECT uniqState(person_id) AS users, properties.$host AS host FROM events GROUP BY host
 *
 *   -- wrapInMergeQuery
 *   SELECT uniqMerge(users) AS users, host FROM (...) GROUP BY host
 * </pre>
 *
 * <p>Only top-level projections, and the elements of a top-level tuple, are
 * converted; subqueries keep their aggregates. {@link #combineQueriesWithStateAndMerge}
 * runs both stages over several queries joined with {@code UNION ALL}.
 */
public final class StateAggregations {

    private static final String STATE_SUFFIX = "State";
    private static final String STATE_IF_SUFFIX = "StateIf";
    private static final String MERGE_SUFFIX = "Merge";

    static final Set<String> STATE_AGGREGATIONS = Set.of(
        "count", "countIf", "uniq", "uniqIf", "sum", "sumIf", "avg", "avgIf", "min", "max"
    );

    private static final ExprTransformer COPIER = new ExprTransformer();

    private StateAggregations() {}

    /**
     * Converts the top-level aggregates of a query to their {@code State} variants.
     * Calls already in state form are left alone, so the conversion is idempotent.
     *
     * @param query a {@link SelectQuery} or {@link SelectSetQuery}
     * @return a new query producing aggregate states
     * @throws IllegalArgumentException for any other node kind
     */
    public static Expr toStateAggregations(Expr query) {
        if (query instanceof SelectQuery select) {
            SelectQuery copy = (SelectQuery) COPIER.visit(select);
            List<Expr> projections = new ArrayList<>();
            for (Expr projection : copy.select()) {
                projections.add(toStateProjection(projection));
            }
            return copy.toBuilder().select(projections).build();
        }
        if (query instanceof SelectSetQuery setQuery) {
            List<SelectSetQuery.SetNode> nodes = new ArrayList<>();
            for (SelectSetQuery.SetNode node : setQuery.subsequentSelectQueries()) {
                nodes.add(new SelectSetQuery.SetNode(node.setOperator(), toStateAggregations(node.selectQuery())));
            }
            return new SelectSetQuery(toStateAggregations(setQuery.initialSelectQuery()), nodes);
        }
        throw new IllegalArgumentException("Expected a select query, got: " + describe(query));
    }

    private static Expr toStateProjection(Expr projection) {
        if (projection instanceof Alias alias) {
            return new Alias(alias.alias(), toStateProjection(alias.expr()));
        }
        if (projection instanceof Tuple tuple) {
            List<Expr> elements = new ArrayList<>();
            for (Expr element : tuple.exprs()) {
                elements.add(toStateCall(element));
            }
            return new Tuple(elements);
        }
        return toStateCall(projection);
    }

    private static Expr toStateCall(Expr expr) {
        if (expr instanceof Call call && STATE_AGGREGATIONS.contains(call.name())) {
            return new Call(call.name() + STATE_SUFFIX, call.args(), call.distinct());
        }
        return expr;
    }

    /**
     * Wraps a state query in a query that merges its states into final values.
     *
     * <p>Each {@code ...State} projection named {@code a} becomes
     * {@code ...Merge(a) AS a}. A tuple named {@code a} holding states is rebuilt
     * element by element: the state at position {@code i} becomes
     * {@code ...Merge(tupleElement(a, i))}, constants are copied and anything else
     * becomes {@code any(tupleElement(a, i))}. Every other projection is carried
     * through by name and grouped by. For a set query, the first member query
     * supplies the names.
     *
     * @param stateQuery a {@link SelectQuery} or {@link SelectSetQuery} of states
     * @return the merge query
     * @throws IllegalArgumentException if a projection has no usable name, or the
     *                                  node is not a select query
     */
    public static SelectQuery wrapInMergeQuery(Expr stateQuery) {
        SelectQuery template = firstSelectQuery(stateQuery);

        List<Expr> select = new ArrayList<>();
        List<Expr> groupBy = new ArrayList<>();
        List<Expr> projections = template.select();
        for (int i = 0; i < projections.size(); i++) {
            Expr projection = projections.get(i);
            String name = outputName(projection);
            if (name == null) {
                throw new IllegalArgumentException(
                    "Projection %d (%s) must be aliased to be merged".formatted(i, projection));
            }
            Expr expr = Alias.unwrap(projection);
            if (expr instanceof Call call && isStateFunction(call.name())) {
                select.add(new Alias(name, Call.of(mergeFunctionFor(call.name()), Field.of(name))));
            } else if (expr instanceof Tuple tuple && containsState(tuple)) {
                select.add(new Alias(name, mergeTuple(name, tuple)));
            } else {
                select.add(Field.of(name));
                groupBy.add(Field.of(name));
            }
        }

        return SelectQuery.builder()
            .select(select)
            .selectFrom(new JoinExpr(COPIER.visit(stateQuery)))
            .groupBy(groupBy)
            .build();
    }

    /**
     * Converts every query to state aggregations, joins them with {@code UNION ALL}
     * and merges the result. Queries may already be in state form. Names come from
     * the first query, so every query must project the same columns in the same order.
     *
     * @param first the first query
     * @param rest further queries
     * @return the merge query over the combined states
     * @throws IllegalArgumentException if a query is not a select query, or a
     *                                  projection of the first query has no name
     */
    public static SelectQuery combineQueriesWithStateAndMerge(Expr first, Expr... rest) {
        Expr initial = toStateAggregations(first);
        if (rest.length == 0) {
            return wrapInMergeQuery(initial);
        }
        Expr[] states = new Expr[rest.length];
        for (int i = 0; i < rest.length; i++) {
            states[i] = toStateAggregations(rest[i]);
        }
        return wrapInMergeQuery(SelectSetQuery.unionAll(initial, states));
    }

    private static boolean containsState(Tuple tuple) {
        for (Expr element : tuple.exprs()) {
            if (element instanceof Call call && isStateFunction(call.name())) {
                return true;
            }
        }
        return false;
    }

    private static Tuple mergeTuple(String name, Tuple tuple) {
        List<Expr> elements = new ArrayList<>();
        List<Expr> exprs = tuple.exprs();
        for (int i = 0; i < exprs.size(); i++) {
            Expr element = exprs.get(i);
            // tupleElement is 1-based
            Expr extracted = Call.of("tupleElement", Field.of(name), Constant.of(i + 1));
            if (element instanceof Call call && isStateFunction(call.name())) {
                elements.add(Call.of(mergeFunctionFor(call.name()), extracted));
            } else if (element instanceof Constant constant) {
                elements.add(Constant.of(constant.value()));
            } else {
                elements.add(Call.of("any", extracted));
            }
        }
        return new Tuple(elements);
    }

    /**
     * Returns the merge function finalising a state function. The {@code If}
     * combinator stays when it was applied before {@code State}
     * ({@code uniqIfState} to {@code uniqIfMerge}) and goes when it was applied
     * after ({@code uniqStateIf} to {@code uniqMerge}).
     *
     * @param stateFunction the state function name
     * @return the merge function name
     */
    static String mergeFunctionFor(String stateFunction) {
        String suffix = stateFunction.endsWith(STATE_IF_SUFFIX) ? STATE_IF_SUFFIX : STATE_SUFFIX;
        return stateFunction.substring(0, stateFunction.length() - suffix.length()) + MERGE_SUFFIX;
    }

    static boolean isStateFunction(String name) {
        return (name.length() > STATE_SUFFIX.length() && name.endsWith(STATE_SUFFIX))
            || (name.length() > STATE_IF_SUFFIX.length() && name.endsWith(STATE_IF_SUFFIX));
    }

    private static String outputName(Expr projection) {
        if (projection instanceof Alias alias) {
            return alias.alias();
        }
        if (projection instanceof Field field) {
            return field.lastSegment();
        }
        return null;
    }

    private static SelectQuery firstSelectQuery(Expr query) {
        Expr current = query;
        while (current instanceof SelectSetQuery setQuery) {
            current = setQuery.initialSelectQuery();
        }
        if (current instanceof SelectQuery select) {
            return select;
        }
        throw new IllegalArgumentException("Expected a select query, got: " + describe(query));
    }

    private static String describe(Expr expr) {
        return expr == null ? "null" : expr.getClass().getSimpleName();
    }
}
