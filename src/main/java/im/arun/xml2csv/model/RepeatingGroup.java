package im.arun.xml2csv.model;

import lombok.Value;

import java.util.List;

/**
 * Two or more sibling nodes sharing a tag, keyed by parent path plus that tag.
 */
@Value
public class RepeatingGroup {
    PathKey key;
    List<TreeNode> members;

    public int size() {
        return members.size();
    }
}
