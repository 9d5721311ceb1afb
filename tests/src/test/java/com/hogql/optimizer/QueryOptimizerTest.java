package com.hogql.optimizer;

import com.hogql.ast.Expr;
import com.hogql.ast.Field;
import com.hogql.ast.SelectQuery;
import com.hogql.config.Dialect;
import com.hogql.config.QueryModifiers;
import com.hogql.test.TestQueries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@Tag("optimizer")
@Tag("tier1")
@DisplayName("QueryOptimizer Tests")
public class QueryOptimizerTest {

    private static final OptimizationContext ENABLED = OptimizationContext.of(Dialect.CLICKHOUSE,
        QueryModifiers.builder().useWebAnalyticsPreAggregatedTables(true).build());

    @Test
    @DisplayName("Default optimizer carries the pre-aggregated table rule")
    void testDefaults() {
        QueryOptimizer optimizer = new QueryOptimizer();

        assertThat(optimizer.maxIterations()).isEqualTo(10);
        assertThat(optimizer.rules()).hasSize(1);
        assertThat(optimizer.rules().get(0)).isInstanceOf(PreaggregatedTableRule.class);
    }

    @Test
    @DisplayName("Default optimizer rewrites an eligible query")
    void testDefaultRewrite() {
        Expr result = new QueryOptimizer().optimize(TestQueries.pageviewCount(), ENABLED);

        assertThat(result.toHogQL()).isEqualTo("SELECT sumMerge(pageviews_count_state) FROM web_stats_combined");
    }

    @Test
    @DisplayName("Disabled context leaves the tree alone")
    void testDisabled() {
        SelectQuery query = TestQueries.pageviewCount();

        Expr result = new QueryOptimizer().optimize(query, OptimizationContext.of(Dialect.HOGQL, null));

        assertThat(result).isSameAs(query);
    }

    @Test
    @DisplayName("Rules run to a fixpoint")
    void testFixpoint() {
        AtomicInteger calls = new AtomicInteger();
        // Appends a segment until the chain has three
        OptimizationRule grow = (node, context) -> {
            calls.incrementAndGet();
            Field field = (Field) node;
            if (field.chain().size() >= 3) {
                return field;
            }
            String[] chain = field.chain().toArray(new String[0]);
            String[] longer = Arrays.copyOf(chain, chain.length + 1);
            longer[chain.length] = "x";
            return Field.of(longer);
        };

        Expr result = new QueryOptimizer(List.of(grow), 10).optimize(Field.of("a"), ENABLED);

        assertThat(result).isEqualTo(Field.of("a", "x", "x"));
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Iteration limit stops a rule that never converges")
    void testIterationLimit() {
        AtomicInteger calls = new AtomicInteger();
        OptimizationRule counter = (node, context) -> TestQueries.constant(calls.incrementAndGet());

        Expr result = new QueryOptimizer(List.of(counter), 4).optimize(TestQueries.constant(0), ENABLED);

        assertThat(result).isEqualTo(TestQueries.constant(4));
    }

    @Test
    @DisplayName("A rule returning null is skipped")
    void testNullRuleResult() {
        Expr input = Field.of("a");

        Expr result = new QueryOptimizer(List.of((node, context) -> null), 3).optimize(input, ENABLED);

        assertThat(result).isSameAs(input);
    }

    @Test
    @DisplayName("Null tree optimizes to null")
    void testNullTree() {
        assertThat(new QueryOptimizer().optimize(null, ENABLED)).isNull();
    }

    @Test
    @DisplayName("Non-positive iteration limit is rejected")
    void testInvalidLimit() {
        assertThatThrownBy(() -> new QueryOptimizer(List.of(), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxIterations");
    }

    @Test
    @DisplayName("Context requires a dialect and defaults the call stack")
    void testContext() {
        assertThatThrownBy(() -> new OptimizationContext(null, List.of(), null))
            .isInstanceOf(NullPointerException.class);
        assertThat(new OptimizationContext(Dialect.HOGQL, null, null).callStack()).isEmpty();
    }
}
