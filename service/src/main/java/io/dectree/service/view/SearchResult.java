// file: service/src/main/java/io/dectree/service/view/SearchResult.java
package io.dectree.service.view;

import java.util.List;

public record SearchResult(String query, List<NodeView> results) {
    public SearchResult {
        results = List.copyOf(results);
    }

    public int count() {
        return results.size();
    }
}
