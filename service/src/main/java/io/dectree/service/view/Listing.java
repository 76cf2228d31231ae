// file: service/src/main/java/io/dectree/service/view/Listing.java
package io.dectree.service.view;

import java.util.List;

/** A node and its children in natural order. */
public record Listing(NodeView current, List<NodeView> children) {
    public Listing {
        children = List.copyOf(children);
    }
}
