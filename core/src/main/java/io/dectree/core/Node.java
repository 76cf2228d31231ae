// file: core/src/main/java/io/dectree/core/Node.java
package io.dectree.core;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One addressable entry of the corpus, e.g. "2.0121".
 * <p>
 * Nodes are owned by a {@link NodeIndex}. Hierarchy is expressed only through
 * {@code parentId}; children are kept by the index as id lists, so a corrupt
 * parent relation (a node pointing at itself) is representable and must be
 * handled by traversal code.
 * <p>
 * All scalar fields are immutable. The translation list only grows, and is
 * copy-on-write so concurrent readers never observe a partial append.
 */
public final class Node {
    private final int id;
    private final String name;
    private final String text;
    private final int level;
    private final int sortOrder;
    private final Integer parentId;
    private final List<Translation> translations = new CopyOnWriteArrayList<>();

    public Node(int id, String name, String text, int level, int sortOrder, Integer parentId) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        if (level < 1) throw new IllegalArgumentException("level must be >= 1");
        this.id = id;
        this.name = name;
        this.text = Objects.requireNonNull(text, "text");
        this.level = level;
        this.sortOrder = sortOrder;
        this.parentId = parentId;
    }

    public int id() { return id; }

    public String name() { return name; }

    /** Body in the corpus' original language. */
    public String text() { return text; }

    public int level() { return level; }

    public int sortOrder() { return sortOrder; }

    /** Surrogate id of the parent, or null for a root. */
    public Integer parentId() { return parentId; }

    public boolean isRoot() { return parentId == null; }

    /** Translations and alternatives in insertion order (read-only view). */
    public List<Translation> translations() {
        return Collections.unmodifiableList(translations);
    }

    void attach(Translation translation) {
        translations.add(Objects.requireNonNull(translation, "translation"));
    }

    @Override
    public String toString() {
        return name + ": " + text;
    }
}
