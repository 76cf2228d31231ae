// file: storage/src/main/java/io/dectree/storage/IndexSnapshotter.java
package io.dectree.storage;

import io.dectree.core.NodeIndex;

/**
 * Persistence for a built {@link NodeIndex}.
 * <p>
 * A snapshot is a full copy of the node table and the translation table.
 * Ingestion runs once; afterwards the index is loaded from the latest snapshot
 * and written again whenever translations or alternatives have been added.
 */
public interface IndexSnapshotter {

    /**
     * Persist a full copy of the index.
     *
     * @return snapshot identifier (file name)
     */
    String write(NodeIndex index);

    /** Load the latest snapshot, or null if none has been written. */
    NodeIndex loadLatest();
}
