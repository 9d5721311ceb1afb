package com.hogql.optimizer;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Describes what the pre-aggregated web analytics tables can answer.
 *
 * <p>Holds the allow-lists consulted by {@link PageviewQueryMatcher} and the
 * substitutions applied by {@link PreaggregatedQueryRewriter}:
 * <ul>
 *   <li>{@code compatibleFilterFields} - fields a surviving WHERE condition may compare</li>
 *   <li>{@code supportedDimensions} - fields that may be selected or grouped by</li>
 *   <li>{@code supportedAggregations} - aggregate functions a matching query may use</li>
 *   <li>{@code aggregationMerges} - raw aggregate to merge function and state column</li>
 *   <li>{@code allowedEvents} - event names the tables are populated from</li>
 * </ul>
 *
 * <p>Instances are immutable. {@link #defaults()} describes the production tables;
 * the {@code with*} methods derive variants, e.g. to test a newly added column.
 */
public final class PreaggregatedTableCapabilities {

    public static final String EVENTS_TABLE = "events";
    public static final String WEB_STATS_COMBINED_TABLE = "web_stats_combined";

    public static final String PAGEVIEWS_COUNT_STATE = "pageviews_count_state";
    public static final String PERSONS_UNIQ_STATE = "persons_uniq_state";

    /**
     * A pre-aggregated replacement for a raw aggregate function.
     *
     * @param mergeFunction the function that finalises the state, e.g. {@code sumMerge}
     * @param stateColumn the column holding the partial state
     */
    public record AggregationMerge(String mergeFunction, String stateColumn) {
        public AggregationMerge {
            Objects.requireNonNull(mergeFunction, "mergeFunction must not be null");
            Objects.requireNonNull(stateColumn, "stateColumn must not be null");
        }
    }

    private static final Set<String> DEFAULT_COMPATIBLE_FILTER_FIELDS = Set.of(
        "timestamp", "team_id", "properties",
        "$host", "$browser", "$os",
        "$country_code", "$city", "$region",
        "$utm_source", "$utm_medium", "$utm_campaign",
        "$referring_domain", "$current_url", "$pathname"
    );

    private static final Set<String> DEFAULT_SUPPORTED_DIMENSIONS = Set.of(
        // event and session properties, as referenced through properties.* / session.*
        "$host", "$device_type", "$browser", "$os",
        "$viewport_width", "$viewport_height",
        "$geoip_country_code", "$geoip_city_name", "$geoip_subdivision_1_code",
        "$country_code", "$city", "$region",
        "$utm_source", "$utm_medium", "$utm_campaign", "$utm_term", "$utm_content",
        "$referring_domain", "$current_url", "$pathname",
        "$entry_pathname", "$end_pathname", "$channel_type",
        // columns of web_stats_combined
        "timestamp", "period_bucket",
        "host", "device_type", "browser", "os",
        "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
        "referring_domain", "pathname", "entry_pathname", "end_pathname",
        "country_code", "city_name", "region_code", "channel_type"
    );

    private static final Set<String> DEFAULT_SUPPORTED_AGGREGATIONS = Set.of(
        "count", "countIf", "uniq", "uniqIf", "sum", "sumIf", "avg", "avgIf"
    );

    private static final Map<String, AggregationMerge> DEFAULT_AGGREGATION_MERGES = Map.of(
        "count", new AggregationMerge("sumMerge", PAGEVIEWS_COUNT_STATE),
        "countIf", new AggregationMerge("sumMerge", PAGEVIEWS_COUNT_STATE),
        "uniq", new AggregationMerge("uniqMerge", PERSONS_UNIQ_STATE),
        "uniqIf", new AggregationMerge("uniqMerge", PERSONS_UNIQ_STATE)
    );

    private static final Set<String> DEFAULT_ALLOWED_EVENTS = Set.of("$pageview", "$screen");

    private static final PreaggregatedTableCapabilities DEFAULTS = new PreaggregatedTableCapabilities(
        DEFAULT_COMPATIBLE_FILTER_FIELDS,
        DEFAULT_SUPPORTED_DIMENSIONS,
        DEFAULT_SUPPORTED_AGGREGATIONS,
        DEFAULT_AGGREGATION_MERGES,
        DEFAULT_ALLOWED_EVENTS,
        EVENTS_TABLE,
        WEB_STATS_COMBINED_TABLE);

    private final Set<String> compatibleFilterFields;
    private final Set<String> supportedDimensions;
    private final Set<String> supportedAggregations;
    private final Map<String, AggregationMerge> aggregationMerges;
    private final Set<String> allowedEvents;
    private final String sourceTable;
    private final String targetTable;

    /**
     * Creates a capability description. Collections are copied.
     */
    public PreaggregatedTableCapabilities(Set<String> compatibleFilterFields,
                                          Set<String> supportedDimensions,
                                          Set<String> supportedAggregations,
                                          Map<String, AggregationMerge> aggregationMerges,
                                          Set<String> allowedEvents,
                                          String sourceTable,
                                          String targetTable) {
        this.compatibleFilterFields = Set.copyOf(compatibleFilterFields);
        this.supportedDimensions = Set.copyOf(supportedDimensions);
        this.supportedAggregations = Set.copyOf(supportedAggregations);
        this.aggregationMerges = Map.copyOf(aggregationMerges);
        this.allowedEvents = Set.copyOf(allowedEvents);
        this.sourceTable = Objects.requireNonNull(sourceTable, "sourceTable must not be null");
        this.targetTable = Objects.requireNonNull(targetTable, "targetTable must not be null");
    }

    /**
     * Returns the capabilities of the production {@code web_stats_combined} table.
     *
     * @return the shared default instance
     */
    public static PreaggregatedTableCapabilities defaults() {
        return DEFAULTS;
    }

    public Set<String> compatibleFilterFields() {
        return compatibleFilterFields;
    }

    public Set<String> supportedDimensions() {
        return supportedDimensions;
    }

    public Set<String> supportedAggregations() {
        return supportedAggregations;
    }

    public Map<String, AggregationMerge> aggregationMerges() {
        return aggregationMerges;
    }

    public Set<String> allowedEvents() {
        return allowedEvents;
    }

    public String sourceTable() {
        return sourceTable;
    }

    public String targetTable() {
        return targetTable;
    }

    public boolean isCompatibleFilterField(String name) {
        return compatibleFilterFields.contains(name);
    }

    public boolean isSupportedDimension(String name) {
        return supportedDimensions.contains(name);
    }

    public boolean isSupportedAggregation(String functionName) {
        return supportedAggregations.contains(functionName);
    }

    public boolean isAllowedEvent(Object eventName) {
        return eventName instanceof String name && allowedEvents.contains(name);
    }

    /**
     * Returns the merge replacing a raw aggregate function.
     *
     * @param functionName the raw function name, e.g. {@code uniq}
     * @return the merge, or null if the function has no pre-aggregated state
     */
    public AggregationMerge mergeFor(String functionName) {
        return aggregationMerges.get(functionName);
    }

    // ==================== Derived Variants ====================

    public PreaggregatedTableCapabilities withDimension(String dimension) {
        Set<String> dimensions = new HashSet<>(supportedDimensions);
        dimensions.add(dimension);
        return new PreaggregatedTableCapabilities(compatibleFilterFields, dimensions,
            supportedAggregations, aggregationMerges, allowedEvents, sourceTable, targetTable);
    }

    public PreaggregatedTableCapabilities withCompatibleFilterField(String field) {
        Set<String> fields = new HashSet<>(compatibleFilterFields);
        fields.add(field);
        return new PreaggregatedTableCapabilities(fields, supportedDimensions,
            supportedAggregations, aggregationMerges, allowedEvents, sourceTable, targetTable);
    }

    /**
     * Returns a copy that also supports the given aggregate and replaces it with a
     * merge of the given state column.
     */
    public PreaggregatedTableCapabilities withAggregationMerge(String functionName, AggregationMerge merge) {
        Set<String> aggregations = new HashSet<>(supportedAggregations);
        aggregations.add(functionName);
        Map<String, AggregationMerge> merges = new HashMap<>(aggregationMerges);
        merges.put(functionName, merge);
        return new PreaggregatedTableCapabilities(compatibleFilterFields, supportedDimensions,
            aggregations, merges, allowedEvents, sourceTable, targetTable);
    }

    @Override
    public String toString() {
        return "PreaggregatedTableCapabilities{" + sourceTable + " -> " + targetTable +
               ", dimensions=" + supportedDimensions.size() +
               ", aggregations=" + supportedAggregations + '}';
    }
}
