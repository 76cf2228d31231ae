// file: service/src/main/java/io/dectree/service/view/NodeView.java
package io.dectree.service.view;

import io.dectree.core.Node;
import io.dectree.core.TextResolver;

/**
 * Read-only projection of a node as shown to callers.
 *
 * @param text      body resolved for {@code language}
 * @param textShort {@code text} cut to the display length (code points)
 * @param language  2-letter code the text was resolved for
 */
public record NodeView(
        int id,
        String name,
        String text,
        String textShort,
        Integer parentId,
        int level,
        String language
) {
    public static NodeView of(Node node, String text, int displayLength, String language) {
        return new NodeView(
                node.id(),
                node.name(),
                text,
                shorten(text, displayLength),
                node.parentId(),
                node.level(),
                TextResolver.shortCode(language)
        );
    }

    static String shorten(String text, int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }
}
