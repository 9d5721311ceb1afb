package com.hogql.optimizer;

import com.hogql.optimizer.PreaggregatedTableCapabilities.AggregationMerge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@Tag("optimizer")
@Tag("tier1")
@DisplayName("PreaggregatedTableCapabilities Tests")
public class PreaggregatedTableCapabilitiesTest {

    private final PreaggregatedTableCapabilities defaults = PreaggregatedTableCapabilities.defaults();

    @Test
    @DisplayName("Defaults map events to web_stats_combined")
    void testTables() {
        assertThat(defaults.sourceTable()).isEqualTo("events");
        assertThat(defaults.targetTable()).isEqualTo("web_stats_combined");
    }

    @Test
    @DisplayName("Default merges")
    void testMerges() {
        assertThat(defaults.mergeFor("count")).isEqualTo(new AggregationMerge("sumMerge", "pageviews_count_state"));
        assertThat(defaults.mergeFor("countIf")).isEqualTo(new AggregationMerge("sumMerge", "pageviews_count_state"));
        assertThat(defaults.mergeFor("uniq")).isEqualTo(new AggregationMerge("uniqMerge", "persons_uniq_state"));
        assertThat(defaults.mergeFor("uniqIf")).isEqualTo(new AggregationMerge("uniqMerge", "persons_uniq_state"));
        assertThat(defaults.mergeFor("sum")).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"count", "countIf", "uniq", "uniqIf", "sum", "sumIf", "avg", "avgIf"})
    @DisplayName("Supported aggregations")
    void testSupportedAggregations(String function) {
        assertThat(defaults.isSupportedAggregation(function)).isTrue();
    }

    @Test
    @DisplayName("Allowed events are strings only")
    void testAllowedEvents() {
        assertThat(defaults.isAllowedEvent("$pageview")).isTrue();
        assertThat(defaults.isAllowedEvent("$screen")).isTrue();
        assertThat(defaults.isAllowedEvent("$autocapture")).isFalse();
        assertThat(defaults.isAllowedEvent(null)).isFalse();
        assertThat(defaults.isAllowedEvent(1)).isFalse();
    }

    @Test
    @DisplayName("with* methods return extended copies")
    void testWithMethods() {
        PreaggregatedTableCapabilities extended = defaults
            .withDimension("$custom")
            .withCompatibleFilterField("distinct_id")
            .withAggregationMerge("sum", new AggregationMerge("sumMerge", "revenue_state"));

        assertThat(extended.isSupportedDimension("$custom")).isTrue();
        assertThat(extended.isCompatibleFilterField("distinct_id")).isTrue();
        assertThat(extended.mergeFor("sum").stateColumn()).isEqualTo("revenue_state");
        assertThat(defaults.isSupportedDimension("$custom")).isFalse();
        assertThat(defaults.mergeFor("sum")).isNull();
    }

    @Test
    @DisplayName("Collections are immutable")
    void testImmutable() {
        assertThatThrownBy(() -> defaults.supportedDimensions().add("x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
