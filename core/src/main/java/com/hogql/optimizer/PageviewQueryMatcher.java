package com.hogql.optimizer;

import com.hogql.ast.Alias;
import com.hogql.ast.And;
import com.hogql.ast.ArrayLiteral;
import com.hogql.ast.Call;
import com.hogql.ast.CompareOperation;
import com.hogql.ast.CompareOperationOp;
import com.hogql.ast.Constant;
import com.hogql.ast.Expr;
import com.hogql.ast.Field;
import com.hogql.ast.JoinExpr;
import com.hogql.ast.Or;
import com.hogql.ast.SelectQuery;
import com.hogql.ast.Tuple;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a {@code SELECT} can be answered from the pre-aggregated tables.
 *
 * <p>A query matches only when all four checks pass:
 * <ol>
 *   <li><b>Source</b> - {@code FROM} names the raw events table (as the only or the
 *       leftmost table), without a partial {@code SAMPLE}</li>
 *   <li><b>Event filter</b> - {@code WHERE} restricts the query to pageview/screen
 *       events</li>
 *   <li><b>Aggregations</b> - every projected function call is a supported aggregate</li>
 *   <li><b>Dimensions</b> - every projected or grouped field is a pre-aggregated column</li>
 * </ol>
 *
 * <p>Every check short-circuits to {@code false} on shapes it does not recognise,
 * including malformed trees. The matcher never throws for a non-null query.
 */
public class PageviewQueryMatcher {

    private static final Logger logger = LoggerFactory.getLogger(PageviewQueryMatcher.class);

    static final String EVENT_FIELD = "event";
    private static final String COUNT = "count";
    private static final String PERSON_ID = "person_id";
    private static final String PROPERTIES = "properties";

    private final PreaggregatedTableCapabilities capabilities;

    public PageviewQueryMatcher(PreaggregatedTableCapabilities capabilities) {
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities must not be null");
    }

    public PageviewQueryMatcher() {
        this(PreaggregatedTableCapabilities.defaults());
    }

    /**
     * Returns whether the query matches the pre-aggregatable shape.
     *
     * @param query the query to check
     * @return true if every check passes
     */
    public boolean isOptimizable(SelectQuery query) {
        if (!queriesSourceTable(query)) {
            logger.debug("Not optimizable, source is not {}: {}", capabilities.sourceTable(), query);
            return false;
        }
        if (!isPageviewFilter(query.where())) {
            logger.debug("Not optimizable, no pageview/screen event filter: {}", query);
            return false;
        }
        if (!hasSupportedAggregations(query)) {
            logger.debug("Not optimizable, unsupported aggregation: {}", query);
            return false;
        }
        if (!hasSupportedDimensions(query)) {
            logger.debug("Not optimizable, unsupported dimension: {}", query);
            return false;
        }
        return true;
    }

    // ========== Source ==========

    boolean queriesSourceTable(SelectQuery query) {
        JoinExpr from = query.selectFrom();
        if (from == null) {
            return false;
        }
        if (!(from.table() instanceof Field table) || !table.isNamed(capabilities.sourceTable())) {
            return false;
        }
        return from.sample() == null || from.sample().isFullSample();
    }

    // ========== Event filter ==========

    /**
     * Returns whether a WHERE condition limits rows to the allowed events.
     *
     * <p>Accepted shapes:
     * <ul>
     *   <li>{@code event = '$pageview'} and {@code equals(event, '$pageview')}</li>
     *   <li>{@code event IN ['$pageview', '$screen']}</li>
     *   <li>an AND with at least one of the above, all other operands compatible</li>
     *   <li>an OR with at least one operand that is itself accepted</li>
     * </ul>
     *
     * <p>The OR case accepts a disjunction as soon as one branch is a pageview
     * filter, whatever the other branches compare.
     *
     * @param where the condition (may be null)
     * @return true if the condition is accepted
     */
    boolean isPageviewFilter(Expr where) {
        if (where == null) {
            return false;
        }
        if (isEventCondition(where)) {
            return true;
        }
        if (where instanceof And and) {
            return isPageviewConjunction(and.exprs());
        }
        if (where instanceof Or or) {
            for (Expr branch : or.exprs()) {
                if (isPageviewFilter(branch)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isPageviewConjunction(List<Expr> operands) {
        boolean hasEventCondition = false;
        for (Expr operand : operands) {
            if (isEventCondition(operand)) {
                hasEventCondition = true;
            } else if (!isCompatibleCondition(operand)) {
                return false;
            }
        }
        return hasEventCondition;
    }

    /**
     * Returns whether an expression is a direct event filter: an equality or IN test
     * of the event column against allowed event names only.
     */
    boolean isEventCondition(Expr expr) {
        if (expr instanceof CompareOperation compare && isEventField(compare.left())) {
            if (compare.op() == CompareOperationOp.EQ) {
                return isAllowedEventConstant(compare.right());
            }
            if (compare.op() == CompareOperationOp.IN) {
                return isAllowedEventArray(compare.right());
            }
            return false;
        }
        if (expr instanceof Call call && isEqualsCall(call)) {
            return isEventField(call.args().get(0)) && isAllowedEventConstant(call.args().get(1));
        }
        return false;
    }

    private boolean isAllowedEventConstant(Expr expr) {
        return expr instanceof Constant constant && capabilities.isAllowedEvent(constant.value());
    }

    private boolean isAllowedEventArray(Expr expr) {
        if (!(expr instanceof ArrayLiteral array) || array.exprs().isEmpty()) {
            return false;
        }
        for (Expr element : array.exprs()) {
            if (!isAllowedEventConstant(element)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns whether a non-event conjunct can stay in the WHERE clause of the
     * pre-aggregated query. Comparisons must test an allowed field; anything else is
     * accepted.
     */
    boolean isCompatibleCondition(Expr expr) {
        if (expr instanceof CompareOperation compare) {
            return isCompatibleFilterField(compare.left());
        }
        if (expr instanceof Call call && isEqualsCall(call)) {
            return isCompatibleFilterField(call.args().get(0));
        }
        return true;
    }

    private boolean isCompatibleFilterField(Expr expr) {
        return expr instanceof Field field && capabilities.isCompatibleFilterField(field.lastSegment());
    }

    // ========== Projections ==========

    boolean hasSupportedAggregations(SelectQuery query) {
        for (Expr projection : query.select()) {
            Expr expr = Alias.unwrap(projection);
            if (expr instanceof Call call && !isSupportedAggregation(call)) {
                return false;
            }
            // tuple elements would stay unrewritten against the pre-aggregated table
            if (expr instanceof Tuple) {
                return false;
            }
        }
        return true;
    }

    /**
     * A DISTINCT aggregate is only supported as {@code count(DISTINCT person_id)},
     * which the persons state answers. Any other DISTINCT call is not a pageview count.
     */
    private boolean isSupportedAggregation(Call call) {
        if (call.distinct()) {
            return isDistinctPersonCount(call);
        }
        return capabilities.isSupportedAggregation(call.name());
    }

    boolean hasSupportedDimensions(SelectQuery query) {
        Set<String> projectionAliases = new HashSet<>();
        for (Expr projection : query.select()) {
            if (projection instanceof Alias alias) {
                projectionAliases.add(alias.alias());
            }
            if (!isSupportedDimension(Alias.unwrap(projection))) {
                return false;
            }
        }
        for (Expr grouping : query.groupBy()) {
            Expr expr = Alias.unwrap(grouping);
            // GROUP BY of a projection alias; the aliased expression was checked above
            if (expr instanceof Field field && field.chain().size() == 1
                    && projectionAliases.contains(field.lastSegment())) {
                continue;
            }
            if (!isSupportedDimension(expr)) {
                return false;
            }
        }
        return true;
    }

    private boolean isSupportedDimension(Expr expr) {
        return !(expr instanceof Field field) || capabilities.isSupportedDimension(field.lastSegment());
    }

    // ========== Helpers ==========

    /**
     * Returns whether a field is the event name column, bare or qualified by a table
     * or alias ({@code event}, {@code events.event}, {@code e.event}).
     */
    static boolean isEventField(Expr expr) {
        if (!(expr instanceof Field field) || !EVENT_FIELD.equals(field.lastSegment())) {
            return false;
        }
        List<String> chain = field.chain();
        return chain.size() == 1 || (chain.size() == 2 && !PROPERTIES.equals(chain.get(0)));
    }

    /**
     * Returns whether a call counts distinct persons: {@code count(DISTINCT person_id)},
     * with the id written as {@code person_id}, {@code events.person_id},
     * {@code person.id} or {@code events.person.id}.
     */
    static boolean isDistinctPersonCount(Call call) {
        if (!call.distinct() || !COUNT.equals(call.name()) || call.args().size() != 1
                || !(call.args().get(0) instanceof Field field)) {
            return false;
        }
        List<String> chain = field.chain();
        if (PROPERTIES.equals(chain.get(0))) {
            return false;
        }
        int size = chain.size();
        if (PERSON_ID.equals(chain.get(size - 1))) {
            return size <= 2;
        }
        return size >= 2 && size <= 3
            && "id".equals(chain.get(size - 1)) && "person".equals(chain.get(size - 2));
    }

    static boolean isEqualsCall(Call call) {
        return CompareOperationOp.EQ.functionName().equals(call.name()) && call.args().size() == 2;
    }
}
