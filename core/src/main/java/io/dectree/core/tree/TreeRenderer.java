// file: core/src/main/java/io/dectree/core/tree/TreeRenderer.java
package io.dectree.core.tree;

import io.dectree.core.NaturalSortKey;
import io.dectree.core.Node;
import io.dectree.core.NodeIndex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Flattens a subtree into pre-order {@link TreeEntry} lines.
 * <p>
 * Traversal uses an explicit stack, so deep trees do not grow the call stack.
 * The set of ids on the current root-to-node path guards against corrupt
 * parent links: a child that is already on the path is skipped. Ids leave the
 * set again on backtrack, so a node reachable from two siblings is rendered
 * under both.
 */
public final class TreeRenderer {
    public static final int UNLIMITED = 0;

    private final NodeIndex index;

    public TreeRenderer(NodeIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    public List<TreeEntry> render(Node root) {
        return render(root, UNLIMITED);
    }

    /**
     * @param maxDepth deepest depth to descend into; nodes at this depth are
     *                 emitted but their children are not. 0 means unlimited.
     */
    public List<TreeEntry> render(Node root, int maxDepth) {
        Objects.requireNonNull(root, "root");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");

        List<TreeEntry> out = new ArrayList<>();
        Set<Integer> onPath = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        out.add(new TreeEntry(0, root));
        onPath.add(root.id());
        stack.push(new Frame(root, 0, childrenOf(root, 0, maxDepth)));

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.children.hasNext()) {
                stack.pop();
                onPath.remove(top.node.id());
                continue;
            }
            Node child = top.children.next();
            if (onPath.contains(child.id())) {
                continue;
            }
            int depth = top.depth + 1;
            out.add(new TreeEntry(depth, child));
            onPath.add(child.id());
            stack.push(new Frame(child, depth, childrenOf(child, depth, maxDepth)));
        }
        return out;
    }

    private Iterator<Node> childrenOf(Node node, int depth, int maxDepth) {
        if (maxDepth != UNLIMITED && depth >= maxDepth) {
            return List.<Node>of().iterator();
        }
        List<Node> children = new ArrayList<>(index.children(node));
        children.sort(NaturalSortKey.NODE_ORDER);
        return children.iterator();
    }

    private record Frame(Node node, int depth, Iterator<Node> children) {}
}
