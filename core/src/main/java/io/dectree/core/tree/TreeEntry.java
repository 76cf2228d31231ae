// file: core/src/main/java/io/dectree/core/tree/TreeEntry.java
package io.dectree.core.tree;

import io.dectree.core.Node;

/** One line of a flattened subtree; the root of the rendered subtree has depth 0. */
public record TreeEntry(int depth, Node node) {}
