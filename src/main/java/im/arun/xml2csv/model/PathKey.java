package im.arun.xml2csv.model;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Sequence of tags from a traversal root down to a node. Identifies a position in the
 * hierarchy, not a particular instance, so sibling rows share their path keys.
 * Also used as the key of a repeating group (parent path plus the repeated tag).
 */
@EqualsAndHashCode
public final class PathKey {

    private final List<String> tags;

    private PathKey(List<String> tags) {
        this.tags = tags;
    }

    public static PathKey of(String... tags) {
        if (tags.length == 0) {
            throw new IllegalArgumentException("A path needs at least one tag");
        }
        return new PathKey(List.copyOf(Arrays.asList(tags)));
    }

    public static PathKey of(List<String> tags) {
        if (tags.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least one tag");
        }
        return new PathKey(List.copyOf(tags));
    }

    public PathKey append(String tag) {
        List<String> extended = new ArrayList<>(tags.size() + 1);
        extended.addAll(tags);
        extended.add(tag);
        return new PathKey(List.copyOf(extended));
    }

    public List<String> getTags() {
        return tags;
    }

    public int size() {
        return tags.size();
    }

    /**
     * Last tag of the path, the default column name of a leaf.
     */
    public String leafTag() {
        return tags.get(tags.size() - 1);
    }

    /**
     * Dotted form, e.g. {@code parent.child.leaf}.
     */
    public String dotted() {
        return String.join(".", tags);
    }

    @Override
    public String toString() {
        return dotted();
    }
}
