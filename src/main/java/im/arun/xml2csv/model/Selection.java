package im.arun.xml2csv.model;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Chosen child index per resolved repeating group. A group absent from the selection is
 * unresolved and skipped during leaf collection. Instances are immutable; {@link #with}
 * returns a copy so the expander can branch without aliasing.
 */
@EqualsAndHashCode
public final class Selection {

    private static final Selection EMPTY = new Selection(Map.of());

    private final Map<PathKey, Integer> indices;

    private Selection(Map<PathKey, Integer> indices) {
        this.indices = indices;
    }

    public static Selection empty() {
        return EMPTY;
    }

    public Selection with(PathKey groupKey, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Selection index must not be negative: " + index);
        }
        if (indices.containsKey(groupKey)) {
            throw new IllegalArgumentException("Group already resolved: " + groupKey);
        }
        Map<PathKey, Integer> copy = new LinkedHashMap<>(indices);
        copy.put(groupKey, index);
        return new Selection(Collections.unmodifiableMap(copy));
    }

    public boolean isResolved(PathKey groupKey) {
        return indices.containsKey(groupKey);
    }

    public OptionalInt indexOf(PathKey groupKey) {
        Integer index = indices.get(groupKey);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public int size() {
        return indices.size();
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }

    /**
     * Resolved groups in resolution order.
     */
    public Map<PathKey, Integer> asMap() {
        return indices;
    }

    @Override
    public String toString() {
        return indices.toString();
    }
}
