package com.hogql.config;

import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caller-supplied flags controlling optional compiler behaviour.
 *
 * <p>Each flag is a nullable {@link Boolean}: {@code null} means "not set", and
 * every consumer treats it the same as {@code false}. Instances are immutable and
 * owned by the caller for the duration of one query compilation.
 *
 * <p>Flags can also be read from properties named {@code hogql.modifiers.<flag>},
 * e.g. {@code -Dhogql.modifiers.useWebAnalyticsPreAggregatedTables=true}.
 */
public final class QueryModifiers {

    private static final Logger logger = LoggerFactory.getLogger(QueryModifiers.class);

    public static final String PROPERTY_PREFIX = "hogql.modifiers.";

    private static final QueryModifiers EMPTY = builder().build();

    private final Boolean useWebAnalyticsPreAggregatedTables;
    private final Boolean usePreaggregatedTableTransforms;
    private final Boolean debug;
    private final Boolean timings;

    private QueryModifiers(Builder builder) {
        this.useWebAnalyticsPreAggregatedTables = builder.useWebAnalyticsPreAggregatedTables;
        this.usePreaggregatedTableTransforms = builder.usePreaggregatedTableTransforms;
        this.debug = builder.debug;
        this.timings = builder.timings;
    }

    /**
     * Whether eligible web analytics queries should read the pre-aggregated tables.
     *
     * @return the flag, or null when unset
     */
    public Boolean useWebAnalyticsPreAggregatedTables() {
        return useWebAnalyticsPreAggregatedTables;
    }

    public Boolean usePreaggregatedTableTransforms() {
        return usePreaggregatedTableTransforms;
    }

    public Boolean debug() {
        return debug;
    }

    public Boolean timings() {
        return timings;
    }

    /**
     * Returns whether a flag is explicitly enabled.
     *
     * @param flag the flag value
     * @return true only for {@code Boolean.TRUE}
     */
    public static boolean isEnabled(Boolean flag) {
        return Boolean.TRUE.equals(flag);
    }

    @Override
    public String toString() {
        return "QueryModifiers{" +
               "useWebAnalyticsPreAggregatedTables=" + useWebAnalyticsPreAggregatedTables +
               ", usePreaggregatedTableTransforms=" + usePreaggregatedTableTransforms +
               ", debug=" + debug +
               ", timings=" + timings +
               '}';
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof QueryModifiers)) return false;
        QueryModifiers that = (QueryModifiers) obj;
        return Objects.equals(useWebAnalyticsPreAggregatedTables, that.useWebAnalyticsPreAggregatedTables) &&
               Objects.equals(usePreaggregatedTableTransforms, that.usePreaggregatedTableTransforms) &&
               Objects.equals(debug, that.debug) &&
               Objects.equals(timings, that.timings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(useWebAnalyticsPreAggregatedTables, usePreaggregatedTableTransforms, debug, timings);
    }

    // ========== Factories ==========

    public static QueryModifiers empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads modifiers from JVM system properties.
     *
     * @return the modifiers
     */
    public static QueryModifiers fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads modifiers from properties named {@code hogql.modifiers.<flag>}.
     *
     * <p>Missing properties leave the flag unset. Values other than
     * {@code true}/{@code false} are ignored and logged.
     *
     * @param properties the properties to read
     * @return the modifiers
     */
    public static QueryModifiers fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        return builder()
            .useWebAnalyticsPreAggregatedTables(readFlag(properties, "useWebAnalyticsPreAggregatedTables"))
            .usePreaggregatedTableTransforms(readFlag(properties, "usePreaggregatedTableTransforms"))
            .debug(readFlag(properties, "debug"))
            .timings(readFlag(properties, "timings"))
            .build();
    }

    private static Boolean readFlag(Properties properties, String name) {
        String value = properties.getProperty(PROPERTY_PREFIX + name);
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        if (normalized.equals("true")) {
            return Boolean.TRUE;
        }
        if (normalized.equals("false")) {
            return Boolean.FALSE;
        }
        logger.warn("Ignoring modifier {}{} with non-boolean value '{}'", PROPERTY_PREFIX, name, value);
        return null;
    }

    /**
     * Builder for {@link QueryModifiers}.
     */
    public static final class Builder {
        private Boolean useWebAnalyticsPreAggregatedTables;
        private Boolean usePreaggregatedTableTransforms;
        private Boolean debug;
        private Boolean timings;

        private Builder() {}

        public Builder useWebAnalyticsPreAggregatedTables(Boolean value) {
            this.useWebAnalyticsPreAggregatedTables = value;
            return this;
        }

        public Builder usePreaggregatedTableTransforms(Boolean value) {
            this.usePreaggregatedTableTransforms = value;
            return this;
        }

        public Builder debug(Boolean value) {
            this.debug = value;
            return this;
        }

        public Builder timings(Boolean value) {
            this.timings = value;
            return this;
        }

        public QueryModifiers build() {
            return new QueryModifiers(this);
        }
    }
}
