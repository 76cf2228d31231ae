// file: service/src/main/java/io/dectree/service/view/NodeTranslations.java
package io.dectree.service.view;

import java.util.List;

/** Translations (or alternatives) of one node. */
public record NodeTranslations(NodeView node, List<TranslationView> entries) {
    public NodeTranslations {
        entries = List.copyOf(entries);
    }
}
