// file: core/src/main/java/io/dectree/core/NodeIndex.java
package io.dectree.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Table of nodes with reverse lookups by name and by surrogate id.
 * <p>
 * Layout (arena + index):
 *  - nodes:    all nodes in id order.
 *  - byName:   name -> node (names are unique).
 *  - byId:     id -> node.
 *  - children: parent id -> child ids ordered by sortOrder (ingestion order).
 * <p>
 * The child order at rest is ingestion order. Anything shown to a user should
 * be re-sorted with {@link NaturalSortKey#NODE_ORDER}.
 * <p>
 * Apart from appending translations, an index is read-only once built and may
 * be shared by many navigation sessions.
 */
public final class NodeIndex {

    private static final Comparator<Node> AT_REST_ORDER =
            Comparator.comparingInt(Node::sortOrder).thenComparingInt(Node::id);

    private final List<Node> nodes;
    private final Map<String, Node> byName;
    private final Map<Integer, Node> byId;
    private final Map<Integer, List<Integer>> children;
    private final AtomicInteger nextTranslationId = new AtomicInteger(1);

    private NodeIndex(List<Node> nodes,
                      Map<String, Node> byName,
                      Map<Integer, Node> byId,
                      Map<Integer, List<Integer>> children) {
        this.nodes = nodes;
        this.byName = byName;
        this.byId = byId;
        this.children = children;
    }

    /**
     * Build an index over existing nodes, e.g. rows loaded from a snapshot.
     * Child lists are derived from each node's parentId, so persisted
     * self-references are kept as they are.
     *
     * @throws IllegalArgumentException on duplicate names or ids
     */
    public static NodeIndex restore(Collection<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        Map<String, Node> byName = new HashMap<>(nodes.size() * 2);
        Map<Integer, Node> byId = new HashMap<>(nodes.size() * 2);
        for (Node n : nodes) {
            if (byName.putIfAbsent(n.name(), n) != null) {
                throw new IllegalArgumentException("duplicate node name: " + n.name());
            }
            if (byId.putIfAbsent(n.id(), n) != null) {
                throw new IllegalArgumentException("duplicate node id: " + n.id());
            }
        }

        List<Node> ordered = new ArrayList<>(nodes);
        ordered.sort(Comparator.comparingInt(Node::id));

        Map<Integer, List<Node>> grouped = new HashMap<>();
        for (Node n : ordered) {
            if (n.parentId() != null) {
                grouped.computeIfAbsent(n.parentId(), k -> new ArrayList<>()).add(n);
            }
        }
        Map<Integer, List<Integer>> children = new HashMap<>(grouped.size() * 2);
        for (var e : grouped.entrySet()) {
            List<Node> list = e.getValue();
            list.sort(AT_REST_ORDER);
            children.put(e.getKey(), list.stream().map(Node::id).toList());
        }

        NodeIndex index = new NodeIndex(List.copyOf(ordered), Map.copyOf(byName), Map.copyOf(byId), Map.copyOf(children));
        for (Node n : ordered) {
            for (Translation t : n.translations()) {
                index.bumpTranslationId(t.id());
            }
        }
        return index;
    }

    public int size() {
        return nodes.size();
    }

    /** All nodes in surrogate id order. */
    public List<Node> nodes() {
        return nodes;
    }

    public Optional<Node> findByName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<Node> findById(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean containsName(String name) {
        return byName.containsKey(name);
    }

    /** Parent of {@code node}, empty for roots or when the parent row is missing. */
    public Optional<Node> parent(Node node) {
        Integer pid = node.parentId();
        return pid == null ? Optional.empty() : findById(pid);
    }

    /** Children of {@code node} in ingestion order. */
    public List<Node> children(Node node) {
        List<Integer> ids = children.getOrDefault(node.id(), List.of());
        List<Node> out = new ArrayList<>(ids.size());
        for (int id : ids) {
            Node child = byId.get(id);
            if (child != null) out.add(child);
        }
        return out;
    }

    /** Nodes without a parent, or whose parent row does not exist. */
    public List<Node> roots() {
        return nodes.stream()
                .filter(n -> n.parentId() == null || !byId.containsKey(n.parentId()))
                .sorted(NaturalSortKey.NODE_ORDER)
                .toList();
    }

    /**
     * Case-insensitive substring search over node text. Results come back in id
     * order; callers that display them sort by natural order.
     */
    public List<Node> search(String term) {
        Objects.requireNonNull(term, "term");
        String needle = term.toLowerCase(Locale.ROOT);
        return nodes.stream()
                .filter(n -> n.text().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    /**
     * All nodes whose names lie between {@code from} and {@code to} (inclusive)
     * in natural order. Endpoints may be given in either order.
     *
     * @throws IllegalArgumentException if an endpoint is not a known name
     */
    public List<Node> rangeBetween(String from, String to) {
        if (!byName.containsKey(from)) throw new IllegalArgumentException("unknown range start: " + from);
        if (!byName.containsKey(to)) throw new IllegalArgumentException("unknown range end: " + to);
        NaturalSortKey a = NaturalSortKey.of(from);
        NaturalSortKey b = NaturalSortKey.of(to);
        NaturalSortKey lo = a.compareTo(b) <= 0 ? a : b;
        NaturalSortKey hi = lo == a ? b : a;
        return nodes.stream()
                .filter(n -> {
                    NaturalSortKey k = NaturalSortKey.of(n.name());
                    return k.compareTo(lo) >= 0 && k.compareTo(hi) <= 0;
                })
                .sorted(NaturalSortKey.NODE_ORDER)
                .toList();
    }

    /**
     * Create and attach a new translation or alternative, assigning the next
     * free translation id.
     */
    public Translation addTranslation(Node node,
                                      String lang,
                                      String text,
                                      String source,
                                      VariantType variantType,
                                      String editor,
                                      List<String> tags,
                                      Instant now) {
        requireOwned(node);
        var t = new Translation(nextTranslationId.getAndIncrement(), lang, text, source,
                variantType, editor, tags, now, now);
        node.attach(t);
        return t;
    }

    /**
     * Re-attach a persisted translation, keeping its id. Used when loading a
     * snapshot; later {@link #addTranslation} calls continue after the highest id.
     */
    public void restoreTranslation(Node node, Translation translation) {
        requireOwned(node);
        node.attach(translation);
        bumpTranslationId(translation.id());
    }

    private void requireOwned(Node node) {
        Objects.requireNonNull(node, "node");
        if (byId.get(node.id()) != node) {
            throw new IllegalArgumentException("node " + node.name() + " does not belong to this index");
        }
    }

    private void bumpTranslationId(int used) {
        nextTranslationId.accumulateAndGet(used + 1, Math::max);
    }
}
