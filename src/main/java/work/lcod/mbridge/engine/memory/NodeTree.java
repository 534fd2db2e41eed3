package work.lcod.mbridge.engine.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * One sparse array: an optional value at the root and subscripted children, kept in collation
 * order at every level.
 */
public final class NodeTree {
    private String value;
    private final TreeMap<String, NodeTree> children = new TreeMap<>(Collation.INSTANCE);

    public boolean isEmpty() {
        return value == null && children.isEmpty();
    }

    public NodeTree find(List<String> path) {
        NodeTree node = this;
        for (String subscript : path) {
            node = node.children.get(subscript);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    /**
     * {@code 0} nothing, {@code 1} value only, {@code 10} children only, {@code 11} both.
     */
    public int data(List<String> path) {
        NodeTree node = find(path);
        if (node == null) {
            return 0;
        }
        return (node.value != null ? 1 : 0) + (node.children.isEmpty() ? 0 : 10);
    }

    public String get(List<String> path) {
        NodeTree node = find(path);
        return node == null ? null : node.value;
    }

    public void set(List<String> path, String newValue) {
        NodeTree node = this;
        for (String subscript : path) {
            node = node.children.computeIfAbsent(subscript, key -> new NodeTree());
        }
        node.value = newValue;
    }

    /**
     * Removes the node and everything below it.
     */
    public void kill(List<String> path) {
        if (path.isEmpty()) {
            value = null;
            children.clear();
            return;
        }
        NodeTree parent = find(path.subList(0, path.size() - 1));
        if (parent != null) {
            parent.children.remove(path.get(path.size() - 1));
        }
        prune(path.subList(0, path.size() - 1));
    }

    /**
     * Removes only the value of the node; its children stay.
     */
    public void killValue(List<String> path) {
        NodeTree node = find(path);
        if (node != null) {
            node.value = null;
            prune(path);
        }
    }

    /**
     * Next (or previous) sibling of the last subscript of {@code path}, or {@code ""} when there
     * is none. An empty last subscript starts from the first (or last) sibling.
     */
    public String order(List<String> path, boolean forward) {
        NodeTree parent = find(path.subList(0, path.size() - 1));
        if (parent == null || parent.children.isEmpty()) {
            return "";
        }
        String key = path.get(path.size() - 1);
        String next;
        if (key.isEmpty()) {
            next = forward ? parent.children.firstKey() : parent.children.lastKey();
        } else {
            next = forward ? parent.children.higherKey(key) : parent.children.lowerKey(key);
        }
        return next == null ? "" : next;
    }

    /**
     * Subscripts of the next (or previous) node holding a value in depth-first order, or
     * {@code null} at the end of the array.
     */
    public List<String> query(List<String> start, boolean forward) {
        var prefix = new ArrayList<String>();
        return forward ? following(this, prefix, start, true) : preceding(this, prefix, start, true);
    }

    public NodeTree copy() {
        var copy = new NodeTree();
        copy.value = value;
        for (Map.Entry<String, NodeTree> entry : children.entrySet()) {
            copy.children.put(entry.getKey(), entry.getValue().copy());
        }
        return copy;
    }

    /**
     * Overlays every value of {@code source} onto the node at {@code path}.
     */
    public void merge(List<String> path, NodeTree source) {
        NodeTree target = this;
        for (String subscript : path) {
            target = target.children.computeIfAbsent(subscript, key -> new NodeTree());
        }
        target.overlay(source);
    }

    private void overlay(NodeTree source) {
        if (source.value != null) {
            value = source.value;
        }
        for (Map.Entry<String, NodeTree> entry : source.children.entrySet()) {
            children.computeIfAbsent(entry.getKey(), key -> new NodeTree()).overlay(entry.getValue());
        }
    }

    private void prune(List<String> path) {
        for (int depth = path.size(); depth > 0; depth--) {
            NodeTree parent = find(path.subList(0, depth - 1));
            if (parent == null) {
                continue;
            }
            String key = path.get(depth - 1);
            NodeTree node = parent.children.get(key);
            if (node != null && node.isEmpty()) {
                parent.children.remove(key);
            } else {
                return;
            }
        }
    }

    private static List<String> following(NodeTree node, List<String> prefix, List<String> start, boolean bounded) {
        int depth = prefix.size();
        boolean onStart = bounded && depth < start.size() && !start.get(depth).isEmpty();
        NavigableMap<String, NodeTree> candidates = onStart
            ? node.children.tailMap(start.get(depth), true)
            : node.children;
        for (Map.Entry<String, NodeTree> entry : candidates.entrySet()) {
            prefix.add(entry.getKey());
            boolean onPath = onStart && entry.getKey().equals(start.get(depth));
            NodeTree child = entry.getValue();
            if (!onPath && child.value != null) {
                return new ArrayList<>(prefix);
            }
            List<String> found = following(child, prefix, start, onPath);
            if (found != null) {
                return found;
            }
            prefix.remove(prefix.size() - 1);
        }
        return null;
    }

    private static List<String> preceding(NodeTree node, List<String> prefix, List<String> start, boolean bounded) {
        int depth = prefix.size();
        boolean onStart = bounded && depth < start.size() && !start.get(depth).isEmpty();
        NavigableMap<String, NodeTree> candidates = onStart
            ? node.children.headMap(start.get(depth), true).descendingMap()
            : node.children.descendingMap();
        for (Map.Entry<String, NodeTree> entry : candidates.entrySet()) {
            boolean onPath = onStart && entry.getKey().equals(start.get(depth));
            if (onPath && depth + 1 == start.size()) {
                continue;
            }
            prefix.add(entry.getKey());
            NodeTree child = entry.getValue();
            List<String> found = preceding(child, prefix, start, onPath);
            if (found != null) {
                return found;
            }
            if (child.value != null) {
                return new ArrayList<>(prefix);
            }
            prefix.remove(prefix.size() - 1);
        }
        return null;
    }
}
