package com.hogql.visitor;

import com.hogql.ast.Alias;
import com.hogql.ast.And;
import com.hogql.ast.ArrayLiteral;
import com.hogql.ast.Call;
import com.hogql.ast.CompareOperation;
import com.hogql.ast.Constant;
import com.hogql.ast.Cte;
import com.hogql.ast.Expr;
import com.hogql.ast.Field;
import com.hogql.ast.JoinExpr;
import com.hogql.ast.Not;
import com.hogql.ast.Or;
import com.hogql.ast.OrderExpr;
import com.hogql.ast.SampleExpr;
import com.hogql.ast.SelectQuery;
import com.hogql.ast.SelectSetQuery;
import com.hogql.ast.Tuple;
import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first transformation of an expression tree.
 *
 * <p>{@link #visit(Expr)} dispatches on the node kind to one {@code visitX} method per
 * node class. The default implementation of every method visits the node's children
 * and builds a new node from the results, so a plain {@code ExprTransformer} returns a
 * deep copy that shares no node with its input.
 *
 * <p>Subclasses override only the node kinds they rewrite and call {@code super} to
 * keep descending:
 * <pre>
 *   class RenameTable extends ExprTransformer {
 *       protected Expr visitSelectQuery(SelectQuery query) {
 *           SelectQuery replaced = ...;
 *           return super.visitSelectQuery(replaced);
 *       }
 *   }
 * </pre>
 *
 * <p>Instances hold no state of their own and can be reused.
 */
public class ExprTransformer {

    /**
     * Transforms a node and everything below it.
     *
     * @param node the node to transform (may be null)
     * @return the transformed node, or null if {@code node} is null
     */
    public Expr visit(Expr node) {
        if (node == null) {
            return null;
        }
        if (node instanceof SelectQuery query) return visitSelectQuery(query);
        if (node instanceof SelectSetQuery setQuery) return visitSelectSetQuery(setQuery);
        if (node instanceof JoinExpr join) return visitJoinExpr(join);
        if (node instanceof Field field) return visitField(field);
        if (node instanceof Constant constant) return visitConstant(constant);
        if (node instanceof Call call) return visitCall(call);
        if (node instanceof Alias alias) return visitAlias(alias);
        if (node instanceof CompareOperation compare) return visitCompareOperation(compare);
        if (node instanceof And and) return visitAnd(and);
        if (node instanceof Or or) return visitOr(or);
        if (node instanceof Not not) return visitNot(not);
        if (node instanceof ArrayLiteral array) return visitArrayLiteral(array);
        if (node instanceof Tuple tuple) return visitTuple(tuple);
        if (node instanceof OrderExpr order) return visitOrderExpr(order);
        if (node instanceof SampleExpr sample) return visitSampleExpr(sample);
        if (node instanceof Cte cte) return visitCte(cte);
        throw new IllegalStateException("Unhandled node type: " + node.getClass().getName());
    }

    protected Expr visitSelectQuery(SelectQuery query) {
        SelectQuery.Builder builder = SelectQuery.builder()
            .distinct(query.distinct())
            .select(visitAll(query.select()))
            .selectFrom((JoinExpr) visit(query.selectFrom()))
            .where(visit(query.where()))
            .groupBy(visitAll(query.groupBy()))
            .having(visit(query.having()))
            .limit(visit(query.limit()))
            .offset(visit(query.offset()));

        List<Cte> ctes = new ArrayList<>();
        for (Cte cte : query.ctes().values()) {
            ctes.add((Cte) visit(cte));
        }
        builder.ctes(ctes);

        List<OrderExpr> orderBy = new ArrayList<>();
        for (OrderExpr order : query.orderBy()) {
            orderBy.add((OrderExpr) visit(order));
        }
        builder.orderBy(orderBy);

        return builder.build();
    }

    protected Expr visitSelectSetQuery(SelectSetQuery setQuery) {
        List<SelectSetQuery.SetNode> nodes = new ArrayList<>();
        for (SelectSetQuery.SetNode node : setQuery.subsequentSelectQueries()) {
            nodes.add(new SelectSetQuery.SetNode(node.setOperator(), visit(node.selectQuery())));
        }
        return new SelectSetQuery(visit(setQuery.initialSelectQuery()), nodes);
    }

    protected Expr visitJoinExpr(JoinExpr join) {
        return new JoinExpr(
            visit(join.table()),
            join.alias(),
            join.joinType(),
            visit(join.constraint()),
            (JoinExpr) visit(join.nextJoin()),
            (SampleExpr) visit(join.sample()));
    }

    protected Expr visitField(Field field) {
        return new Field(field.chain());
    }

    protected Expr visitConstant(Constant constant) {
        return new Constant(constant.value());
    }

    protected Expr visitCall(Call call) {
        return new Call(call.name(), visitAll(call.args()), call.distinct());
    }

    protected Expr visitAlias(Alias alias) {
        return new Alias(alias.alias(), visit(alias.expr()));
    }

    protected Expr visitCompareOperation(CompareOperation compare) {
        return new CompareOperation(visit(compare.left()), compare.op(), visit(compare.right()));
    }

    protected Expr visitAnd(And and) {
        return new And(visitAll(and.exprs()));
    }

    protected Expr visitOr(Or or) {
        return new Or(visitAll(or.exprs()));
    }

    protected Expr visitNot(Not not) {
        return new Not(visit(not.expr()));
    }

    protected Expr visitArrayLiteral(ArrayLiteral array) {
        return new ArrayLiteral(visitAll(array.exprs()));
    }

    protected Expr visitTuple(Tuple tuple) {
        return new Tuple(visitAll(tuple.exprs()));
    }

    protected Expr visitOrderExpr(OrderExpr order) {
        return new OrderExpr(visit(order.expr()), order.direction());
    }

    protected Expr visitSampleExpr(SampleExpr sample) {
        return new SampleExpr((Constant) visit(sample.ratio()));
    }

    protected Expr visitCte(Cte cte) {
        return new Cte(cte.name(), visit(cte.expr()));
    }

    /**
     * Visits every expression of a list, preserving order.
     *
     * @param exprs the expressions
     * @return the transformed expressions
     */
    protected final List<Expr> visitAll(List<? extends Expr> exprs) {
        List<Expr> result = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            result.add(visit(expr));
        }
        return result;
    }
}
