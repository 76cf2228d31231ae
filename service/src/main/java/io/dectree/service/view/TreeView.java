// file: service/src/main/java/io/dectree/service/view/TreeView.java
package io.dectree.service.view;

import java.util.List;

/** Flattened subtree below {@code current}; the first line is {@code current} at depth 0. */
public record TreeView(NodeView current, List<TreeLine> lines) {
    public TreeView {
        lines = List.copyOf(lines);
    }
}
