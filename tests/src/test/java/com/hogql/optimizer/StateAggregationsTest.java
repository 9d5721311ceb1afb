package com.hogql.optimizer;

import com.hogql.ast.Alias;
import com.hogql.ast.CompareOperation;
import com.hogql.ast.CompareOperationOp;
import com.hogql.ast.Expr;
import com.hogql.ast.SelectQuery;
import com.hogql.ast.SelectSetQuery;
import com.hogql.ast.Tuple;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.hogql.test.TestQueries.*;
import static org.assertj.core.api.Assertions.*;

@Tag("optimizer")
@DisplayName("StateAggregations Tests")
public class StateAggregationsTest {

    private static SelectQuery webOverview() {
        return SelectQuery.builder()
            .select(
                Alias.of("pageviews", call("count")),
                Alias.of("visitors", call("uniq", field("person_id"))),
                Alias.of("host", field("properties", "$host")))
            .from("events")
            .where(eventIs("$pageview"))
            .groupBy(field("host"))
            .build();
    }

    @Nested
    @DisplayName("toStateAggregations")
    class ToState {

        @Test
        @DisplayName("Top-level aggregates become State functions")
        void testSelect() {
            Expr result = StateAggregations.toStateAggregations(webOverview());

            assertThat(result.toHogQL()).isEqualTo(
                "SELECT countState() AS pageviews, uniqState(person_id) AS visitors, properties.$host AS host "
                    + "FROM events WHERE event = '$pageview' GROUP BY host");
        }

        @Test
        @DisplayName("Conditional and distinct calls keep their arguments")
        void testConditional() {
            SelectQuery query = select("events", null,
                call("countIf", eq("team_id", 1)), call("max", field("timestamp")));

            Expr result = StateAggregations.toStateAggregations(query);

            assertThat(result.toHogQL()).isEqualTo("SELECT countIfState(team_id = 1), maxState(timestamp) FROM events");
        }

        @Test
        @DisplayName("Other functions are untouched")
        void testOtherFunctions() {
            SelectQuery query = select("events", null, call("median", field("x")), call("toDate", field("timestamp")));

            assertThat(StateAggregations.toStateAggregations(query)).isEqualTo(query);
        }

        @Test
        @DisplayName("Each member of a union is converted")
        void testUnion() {
            SelectSetQuery union = SelectSetQuery.unionAll(
                select("events", null, call("count")),
                select("events", null, call("uniq", field("person_id"))));

            Expr result = StateAggregations.toStateAggregations(union);

            assertThat(result.toHogQL()).isEqualTo(
                "SELECT countState() FROM events UNION ALL SELECT uniqState(person_id) FROM events");
        }

        @Test
        @DisplayName("Aggregates inside a top-level tuple become State functions")
        void testTuple() {
            SelectQuery query = SelectQuery.builder()
                .select(
                    Alias.of("user_stats", Tuple.of(call("uniq", field("person_id")), call("count"), constant("x"))),
                    Alias.of("host", field("properties", "$host")))
                .from("events")
                .groupBy(field("host"))
                .build();

            Expr result = StateAggregations.toStateAggregations(query);

            assertThat(result.toHogQL()).isEqualTo(
                "SELECT (uniqState(person_id), countState(), 'x') AS user_stats, properties.$host AS host "
                    + "FROM events GROUP BY host");
        }

        @Test
        @DisplayName("Queries already in state form are unchanged")
        void testIdempotent() {
            Expr once = StateAggregations.toStateAggregations(webOverview());

            assertThat(StateAggregations.toStateAggregations(once)).isEqualTo(once);
        }

        @Test
        @DisplayName("Input query is not modified")
        void testInputUntouched() {
            SelectQuery query = webOverview();

            StateAggregations.toStateAggregations(query);

            assertThat(query).isEqualTo(webOverview());
        }

        @Test
        @DisplayName("Non-query input is rejected")
        void testNonQuery() {
            assertThatThrownBy(() -> StateAggregations.toStateAggregations(field("x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Field");
        }
    }

    @Nested
    @DisplayName("wrapInMergeQuery")
    class WrapInMerge {

        @Test
        @DisplayName("States are merged and dimensions grouped")
        void testWrap() {
            Expr states = StateAggregations.toStateAggregations(webOverview());

            SelectQuery merged = StateAggregations.wrapInMergeQuery(states);

            assertThat(merged.toHogQL()).isEqualTo(
                "SELECT countMerge(pageviews) AS pageviews, uniqMerge(visitors) AS visitors, host "
                    + "FROM (" + states.toHogQL() + ") GROUP BY host");
        }

        @Test
        @DisplayName("Union input takes names from its first member")
        void testWrapUnion() {
            Expr states = StateAggregations.toStateAggregations(SelectSetQuery.unionAll(
                select("events", null, Alias.of("c", call("count"))),
                select("events", null, Alias.of("c", call("count")))));

            SelectQuery merged = StateAggregations.wrapInMergeQuery(states);

            assertThat(merged.select()).containsExactly(Alias.of("c", call("countMerge", field("c"))));
            assertThat(merged.groupBy()).isEmpty();
        }

        @Test
        @DisplayName("Tuple of states is merged element by element")
        void testWrapTuple() {
            SelectQuery states = select("events", null,
                Alias.of("mixed_stats", Tuple.of(
                    call("uniqState", field("distinct_id")), constant("constant_value"), call("countState"))),
                Alias.of("total_sum", call("sumState", constant(1))));

            SelectQuery merged = StateAggregations.wrapInMergeQuery(states);

            assertThat(merged.select()).containsExactly(
                Alias.of("mixed_stats", Tuple.of(
                    call("uniqMerge", call("tupleElement", field("mixed_stats"), constant(1))),
                    constant("constant_value"),
                    call("countMerge", call("tupleElement", field("mixed_stats"), constant(3))))),
                Alias.of("total_sum", call("sumMerge", field("total_sum"))));
            assertThat(merged.groupBy()).isEmpty();
        }

        @Test
        @DisplayName("StateIf tuple elements merge without the If combinator")
        void testWrapTupleStateIf() {
            SelectQuery states = select("events", null,
                Alias.of("conditional_stats", Tuple.of(
                    call("uniqStateIf", field("distinct_id"), constant(1)),
                    call("countStateIf", constant(1)),
                    call("toDate", field("timestamp")))));

            SelectQuery merged = StateAggregations.wrapInMergeQuery(states);

            assertThat(merged.select().get(0).toHogQL()).isEqualTo(
                "(uniqMerge(tupleElement(conditional_stats, 1)), "
                    + "countMerge(tupleElement(conditional_stats, 2)), "
                    + "any(tupleElement(conditional_stats, 3))) AS conditional_stats");
        }

        @Test
        @DisplayName("Tuple without states is grouped by")
        void testWrapPlainTuple() {
            SelectQuery states = select("events", null,
                Alias.of("key", Tuple.of(field("a"), field("b"))), Alias.of("c", call("countState")));

            SelectQuery merged = StateAggregations.wrapInMergeQuery(states);

            assertThat(merged.select()).containsExactly(field("key"), Alias.of("c", call("countMerge", field("c"))));
            assertThat(merged.groupBy()).containsExactly(field("key"));
        }

        @Test
        @DisplayName("Unnamed projection is rejected")
        void testUnnamed() {
            SelectQuery states = select("events", null, call("countState"));

            assertThatThrownBy(() -> StateAggregations.wrapInMergeQuery(states))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be aliased");
        }

        @ParameterizedTest
        @CsvSource({
            "countState, countMerge",
            "uniqIfState, uniqIfMerge",
            "sumState, sumMerge",
            "uniqStateIf, uniqMerge",
            "countStateIf, countMerge"
        })
        @DisplayName("Merge function names")
        void testMergeFunctionFor(String state, String merge) {
            assertThat(StateAggregations.isStateFunction(state)).isTrue();
            assertThat(StateAggregations.mergeFunctionFor(state)).isEqualTo(merge);
        }

        @Test
        @DisplayName("Bare State is not a state function")
        void testBareState() {
            assertThat(StateAggregations.isStateFunction("State")).isFalse();
            assertThat(StateAggregations.isStateFunction("StateIf")).isFalse();
            assertThat(StateAggregations.isStateFunction("count")).isFalse();
        }
    }

    @Nested
    @DisplayName("combineQueriesWithStateAndMerge")
    class Combine {

        private SelectQuery dailyMetrics(String dateOp, String date) {
            return SelectQuery.builder()
                .select(
                    Alias.of("daily_metrics", Tuple.of(
                        call("uniq", field("distinct_id")),
                        call("count"),
                        call("sumIf", constant(1), eventIs("$pageview")))),
                    Alias.of("date", call("toDate", field("timestamp"))))
                .from("events")
                .where(CompareOperation.of(call("toDate", field("timestamp")),
                    CompareOperationOp.valueOf(dateOp), constant(date)))
                .groupBy(field("date"))
                .build();
        }

        @Test
        @DisplayName("Historical and realtime queries are unioned as states and merged")
        void testHistoricalAndRealtime() {
            SelectQuery historical = dailyMetrics("LT", "2023-01-01");
            SelectQuery realtime = dailyMetrics("EQ", "2023-01-01");

            SelectQuery combined = StateAggregations.combineQueriesWithStateAndMerge(historical, realtime);

            Expr union = SelectSetQuery.unionAll(
                StateAggregations.toStateAggregations(historical),
                StateAggregations.toStateAggregations(realtime));
            assertThat(combined.toHogQL()).isEqualTo(
                "SELECT (uniqMerge(tupleElement(daily_metrics, 1)), "
                    + "countMerge(tupleElement(daily_metrics, 2)), "
                    + "sumIfMerge(tupleElement(daily_metrics, 3))) AS daily_metrics, date "
                    + "FROM (" + union.toHogQL() + ") GROUP BY date");
        }

        @Test
        @DisplayName("Three sources at different stages are combined in order")
        void testThreeSourcesMixedStages() {
            SelectQuery preaggregated = select("web_stats_combined", null,
                Alias.of("views", call("countState")), Alias.of("source", constant("preaggregated")));
            SelectQuery yesterday = select("events", eq("timestamp", "2023-01-01"),
                Alias.of("views", call("count")), Alias.of("source", constant("yesterday")));
            SelectQuery today = select("events", eq("timestamp", "2023-01-02"),
                Alias.of("views", call("count")), Alias.of("source", constant("today")));

            SelectQuery combined = StateAggregations.combineQueriesWithStateAndMerge(preaggregated, yesterday, today);

            SelectSetQuery union = (SelectSetQuery) combined.selectFrom().table();
            assertThat(union.selectQueries()).containsExactly(
                preaggregated,
                StateAggregations.toStateAggregations(yesterday),
                StateAggregations.toStateAggregations(today));
            assertThat(combined.select()).containsExactly(
                Alias.of("views", call("countMerge", field("views"))), field("source"));
            assertThat(combined.groupBy()).containsExactly(field("source"));
        }

        @Test
        @DisplayName("A single query is converted and wrapped")
        void testSingleQuery() {
            assertThat(StateAggregations.combineQueriesWithStateAndMerge(webOverview()))
                .isEqualTo(StateAggregations.wrapInMergeQuery(StateAggregations.toStateAggregations(webOverview())));
        }

        @Test
        @DisplayName("Inputs are not modified")
        void testInputsUntouched() {
            SelectQuery first = webOverview();
            SelectQuery second = webOverview();

            StateAggregations.combineQueriesWithStateAndMerge(first, second);

            assertThat(first).isEqualTo(webOverview());
            assertThat(second).isEqualTo(webOverview());
        }

        @Test
        @DisplayName("Non-query input is rejected")
        void testNonQuery() {
            assertThatThrownBy(() -> StateAggregations.combineQueriesWithStateAndMerge(webOverview(), constant(1)))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
