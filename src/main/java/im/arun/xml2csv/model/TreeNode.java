package im.arun.xml2csv.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * A node of a parsed document: a tag, its text and its ordered element children.
 * Nodes are never mutated once built.
 */
@Getter
@EqualsAndHashCode
public class TreeNode {

    private final String tag;

    private final String text;

    private final List<TreeNode> children;

    public TreeNode(String tag, String text, List<TreeNode> children) {
        if (tag == null || tag.isEmpty()) {
            throw new IllegalArgumentException("Node tag must not be empty");
        }
        this.tag = tag;
        this.text = text == null ? "" : text;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Create a node without children.
     */
    public static TreeNode leaf(String tag, String text) {
        return new TreeNode(tag, text, List.of());
    }

    /**
     * Create a node holding only element children.
     */
    public static TreeNode element(String tag, TreeNode... children) {
        return new TreeNode(tag, "", Arrays.asList(children));
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return "<" + tag + ">" + text + "</" + tag + ">";
        }
        StringBuilder sb = new StringBuilder("<").append(tag).append('>');
        children.forEach(sb::append);
        return sb.append("</").append(tag).append('>').toString();
    }
}
