package com.hogql.ast;

import com.hogql.generator.HogQLQuoting;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A reference to a column, table or nested property.
 *
 * <p>The reference is held as a chain of segments:
 * <pre>
 *   event                  -- ["event"]
 *   properties.$host       -- ["properties", "$host"]
 *   events.session.id      -- ["events", "session", "id"]
 *   events                 -- ["events"] (as a table in FROM)
 * </pre>
 */
public final class Field implements Expr {

    private final List<String> chain;

    /**
     * Creates a field reference.
     *
     * @param chain the name segments, outermost first
     * @throws IllegalArgumentException if the chain is empty
     */
    public Field(List<String> chain) {
        Objects.requireNonNull(chain, "chain must not be null");
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("chain must not be empty");
        }
        for (String segment : chain) {
            Objects.requireNonNull(segment, "chain segments must not be null");
        }
        this.chain = new ArrayList<>(chain);
    }

    /**
     * Returns the chain of name segments.
     *
     * @return an unmodifiable list of segments
     */
    public List<String> chain() {
        return Collections.unmodifiableList(chain);
    }

    /**
     * Returns the last segment of the chain, which names the column or property
     * this field ultimately resolves to.
     *
     * @return the last chain segment
     */
    public String lastSegment() {
        return chain.get(chain.size() - 1);
    }

    /**
     * Returns whether this field is exactly the given single-segment name.
     *
     * @param name the name to compare with
     * @return true if the chain is {@code [name]}
     */
    public boolean isNamed(String name) {
        return chain.size() == 1 && chain.get(0).equals(name);
    }

    @Override
    public String toHogQL() {
        return chain.stream()
            .map(segment -> "*".equals(segment) ? segment : HogQLQuoting.quoteIdentifierIfNeeded(segment))
            .collect(Collectors.joining("."));
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Field)) return false;
        Field that = (Field) obj;
        return Objects.equals(chain, that.chain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chain);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a field from its segments.
     *
     * @param chain the name segments, outermost first
     * @return the field
     */
    public static Field of(String... chain) {
        return new Field(List.of(chain));
    }
}
