package db.lint.validate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Set of string tuples stored as a prefix tree: each level maps one tuple element to
 * the subtree of the remaining elements. Elements are never concatenated, so values
 * containing separators cannot collide. All tuples stored in one set are expected to
 * have the same arity; a stored tuple also makes its own prefixes present.
 */
public class CompositeKeySet {
    private static final class Node {
        final Map<String, Node> children = new HashMap<>();
    }

    private final Node root = new Node();
    private int size;

    public boolean exists(List<String> tuple) {
        if (tuple.isEmpty()) return false;
        Node node = root;
        for (String element : tuple) {
            node = node.children.get(element);
            if (node == null) return false;
        }
        return true;
    }

    public void insert(List<String> tuple) {
        if (tuple.isEmpty()) return;
        Node node = root;
        boolean created = false;
        for (String element : tuple) {
            Node child = node.children.get(element);
            if (child == null) {
                child = new Node();
                node.children.put(element, child);
                created = true;
            }
            node = child;
        }
        if (created) size++;
    }

    /** Number of distinct tuples inserted so far. */
    public int size() { return size; }
}
