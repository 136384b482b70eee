package im.arun.xml2csv.tree;

import im.arun.xml2csv.model.LeafValue;
import im.arun.xml2csv.model.PathKey;
import im.arun.xml2csv.model.Selection;
import im.arun.xml2csv.model.TreeNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static im.arun.xml2csv.model.TreeNode.element;
import static im.arun.xml2csv.model.TreeNode.leaf;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for leaf projection under a selection.
 */
public class LeafCollectorTest {

    private static final PathKey ROW = PathKey.of("b");

    private final LeafCollector collector = new LeafCollector();

    @Test
    void testLeafEmitsTrimmedText() {
        List<LeafValue> leaves = collect(leaf("b", "  spaced \n"), Selection.empty());

        assertThat(leaves).containsExactly(new LeafValue(ROW, "spaced"));
    }

    @Test
    void testEmptyLeafIsEmittedBlank() {
        List<LeafValue> leaves = collect(element("b", leaf("x", "   ")), Selection.empty());

        assertThat(leaves).hasSize(1);
        assertThat(leaves.get(0).isBlank()).isTrue();
    }

    @Test
    void testSingletonsAreFollowedAndGroupsSkippedWhenUnresolved() {
        TreeNode row = element("b",
            leaf("id", "7"),
            leaf("c", "c0"), leaf("c", "c1"),
            element("info", leaf("note", "n")));

        List<LeafValue> leaves = collect(row, Selection.empty());

        assertThat(leaves)
            .extracting(leaf -> leaf.getPath().dotted())
            .containsExactly("b.id", "b.info.note");
    }

    @Test
    void testSelectedMemberIsFollowed() {
        TreeNode row = element("b",
            element("c", leaf("v", "first")),
            element("c", leaf("v", "second")));

        List<LeafValue> leaves = collect(row, Selection.empty().with(PathKey.of("b", "c"), 1));

        assertThat(leaves).containsExactly(new LeafValue(PathKey.of("b", "c", "v"), "second"));
    }

    @Test
    void testOutOfRangeIndexEmitsNothing() {
        TreeNode row = element("b", leaf("c", "0"), leaf("c", "1"));

        assertThat(collect(row, Selection.empty().with(PathKey.of("b", "c"), 5))).isEmpty();
    }

    @Test
    void testTagsFollowFirstAppearanceOrder() {
        TreeNode row = element("b",
            leaf("y", "1"),
            leaf("x", "2"),
            leaf("y", "3"),
            leaf("z", "4"));

        List<String> texts = collect(row, Selection.empty().with(PathKey.of("b", "y"), 1)).stream()
            .map(LeafValue::getText)
            .collect(Collectors.toList());

        assertThat(texts).containsExactly("3", "2", "4");
    }

    @Test
    void testMixedContentTextIsDropped() {
        TreeNode row = new TreeNode("b", "loose text", List.of(leaf("x", "kept")));

        assertThat(collect(row, Selection.empty()))
            .extracting(LeafValue::getText)
            .containsExactly("kept");
    }

    @Test
    void testDescendFilterExcludesSubtree() {
        TreeNode parent = element("a",
            leaf("fa1", "X"),
            element("meta", leaf("src", "S")),
            element("b", leaf("fb1", "1")));

        List<LeafValue> leaves = collector.collectLeaves(parent, Selection.empty(), PathKey.of("a"),
                path -> !path.equals(PathKey.of("a", "b")))
            .collect(Collectors.toList());

        assertThat(leaves)
            .extracting(leaf -> leaf.getPath().dotted())
            .containsExactly("a.fa1", "a.meta.src");
    }

    @Test
    void testStreamCanBeCollectedAgainWithSameResult() {
        TreeNode row = element("b", leaf("c", "0"), leaf("c", "1"), leaf("id", "9"));
        Selection selection = Selection.empty().with(PathKey.of("b", "c"), 0);

        assertThat(collect(row, selection)).isEqualTo(collect(row, selection));
    }

    private List<LeafValue> collect(TreeNode node, Selection selection) {
        return collector.collectLeaves(node, selection, ROW).collect(Collectors.toList());
    }
}
