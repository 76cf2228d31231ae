// file: service/src/main/java/io/dectree/service/NavigationSession.java
package io.dectree.service;

import io.dectree.core.NaturalSortKey;
import io.dectree.core.Node;
import io.dectree.core.NodeIndex;
import io.dectree.core.Tags;
import io.dectree.core.TextResolver;
import io.dectree.core.Translation;
import io.dectree.core.VariantType;
import io.dectree.core.tree.TreeEntry;
import io.dectree.core.tree.TreeRenderer;
import io.dectree.service.prefs.Preference;
import io.dectree.service.prefs.Preferences;
import io.dectree.service.view.Listing;
import io.dectree.service.view.NodeTranslations;
import io.dectree.service.view.NodeView;
import io.dectree.service.view.SearchResult;
import io.dectree.service.view.TranslationView;
import io.dectree.service.view.TreeLine;
import io.dectree.service.view.TreeView;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Cursor over a shared {@link NodeIndex}.
 * <p>
 * The only mutable state is the current node. Every operation returns a
 * {@link NavResult}; a failure never moves the cursor. A session is meant for
 * one caller at a time, while the index behind it may be shared.
 * <p>
 * Views carry text resolved for the "lang" preference and cut to the
 * "display_length" preference.
 */
public final class NavigationSession {

    private final NodeIndex index;
    private final TextResolver resolver;
    private final TreeRenderer renderer;
    private final Preferences prefs;
    private final Clock clock;

    private Node current;

    public NavigationSession(NodeIndex index, TextResolver resolver, Preferences prefs) {
        this(index, resolver, prefs, Clock.systemUTC());
    }

    public NavigationSession(NodeIndex index, TextResolver resolver, Preferences prefs, Clock clock) {
        this.index = Objects.requireNonNull(index, "index");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.prefs = Objects.requireNonNull(prefs, "prefs");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.renderer = new TreeRenderer(index);
    }

    public Optional<Node> current() {
        return Optional.ofNullable(current);
    }

    /**
     * Resolve {@code key} and make it current.
     * <ol>
     *   <li>"id:&lt;n&gt;" looks up surrogate id n;</li>
     *   <li>otherwise an exact name match;</li>
     *   <li>otherwise, if the key is all digits, a surrogate id lookup.</li>
     * </ol>
     * Example: "100" is the node named "100" if there is one, else id 100.
     */
    public NavResult<NodeView> get(String key) {
        if (key == null || key.isBlank()) {
            return NavResult.failure(ErrorKind.NOT_FOUND, "No node found for ''.");
        }
        String k = key.trim();
        if (k.startsWith("id:")) {
            int id;
            try {
                id = Integer.parseInt(k.substring(3).trim());
            } catch (NumberFormatException e) {
                return NavResult.failure(ErrorKind.NOT_FOUND, "Invalid id syntax. Use: get id:<integer>");
            }
            return moveTo(index.findById(id), "No record found for id " + id);
        }

        Optional<Node> byName = index.findByName(k);
        if (byName.isPresent()) {
            return moveTo(byName, null);
        }
        if (isAllDigits(k)) {
            Optional<Node> byId = parseId(k).flatMap(index::findById);
            if (byId.isPresent()) return moveTo(byId, null);
        }
        return NavResult.failure(ErrorKind.NOT_FOUND, "No node found for '" + k + "'.");
    }

    public NavResult<NodeView> parent() {
        if (current == null) return noCurrent();
        if (current.parentId() == null) {
            return NavResult.failure(ErrorKind.NO_PARENT, "No parent.");
        }
        return moveTo(index.findById(current.parentId()), "Parent not found.");
    }

    /** Node with the next surrogate id (ingestion order), not the next sibling. */
    public NavResult<NodeView> next() {
        return adjacent(1);
    }

    /** Node with the previous surrogate id. */
    public NavResult<NodeView> previous() {
        return adjacent(-1);
    }

    public NavResult<List<NodeView>> children() {
        if (current == null) return noCurrent();
        return NavResult.ok(sortedChildren(current).stream().map(this::view).toList());
    }

    /** Optionally jump to {@code target} (exact name), then list current and its children. */
    public NavResult<Listing> list(String target) {
        NavResult<Node> at = focus(target);
        if (!at.isOk()) return propagate(at);
        Node node = at.value();
        return NavResult.ok(new Listing(view(node), sortedChildren(node).stream().map(this::view).toList()));
    }

    public NavResult<Listing> list() {
        return list(null);
    }

    /**
     * Optionally jump to {@code target}, then flatten the subtree below the
     * current node, bounded by the "tree_max_depth" preference (0 = unlimited).
     */
    public NavResult<TreeView> tree(String target) {
        NavResult<Node> at = focus(target);
        if (!at.isOk()) return propagate(at);
        Node node = at.value();
        int maxDepth = prefs.getInt(Preference.TREE_MAX_DEPTH);
        List<TreeLine> lines = renderer.render(node, maxDepth).stream()
                .map((TreeEntry e) -> new TreeLine(e.depth(), view(e.node())))
                .toList();
        return NavResult.ok(new TreeView(view(node), lines));
    }

    public NavResult<TreeView> tree() {
        return tree(null);
    }

    /** Case-insensitive substring search over node text. Does not move the cursor. */
    public NavResult<SearchResult> search(String term) {
        if (term == null || term.isBlank()) {
            return NavResult.failure(ErrorKind.VALIDATION_ERROR, "Search term required.");
        }
        String q = term.trim();
        List<NodeView> hits = index.search(q).stream()
                .sorted(NaturalSortKey.NODE_ORDER)
                .map(this::view)
                .toList();
        return NavResult.ok(new SearchResult(q, hits));
    }

    /** Ingested translations of the current node (alternatives excluded). */
    public NavResult<NodeTranslations> translations() {
        if (current == null) return noCurrent();
        List<TranslationView> entries = current.translations().stream()
                .filter(t -> !t.isAlternative())
                .map(TranslationView::of)
                .toList();
        return NavResult.ok(new NodeTranslations(view(current), entries));
    }

    /** First translation or alternative of the current node whose lang equals {@code lang}. */
    public NavResult<TranslationView> translate(String lang) {
        if (current == null) return noCurrent();
        if (lang == null || lang.isBlank()) {
            return NavResult.failure(ErrorKind.VALIDATION_ERROR, "Language code required.");
        }
        String wanted = lang.trim();
        for (Translation t : current.translations()) {
            if (t.lang().equalsIgnoreCase(wanted)) {
                return NavResult.ok(TranslationView.of(t));
            }
        }
        return NavResult.failure(ErrorKind.NOT_FOUND, "No translation found for language: " + wanted);
    }

    /** User-proposed alternatives of the current node, oldest first. */
    public NavResult<NodeTranslations> alternatives() {
        if (current == null) return noCurrent();
        List<TranslationView> entries = current.translations().stream()
                .filter(Translation::isAlternative)
                .sorted(Comparator.comparing(Translation::createdAt).thenComparingInt(Translation::id))
                .map(TranslationView::of)
                .toList();
        return NavResult.ok(new NodeTranslations(view(current), entries));
    }

    /**
     * Attach a user alternative to the current node.
     *
     * @param lang   defaults to the "lang" preference; stored lowercased
     * @param editor optional
     * @param tags   comma-separated, trimmed and de-duplicated
     */
    public NavResult<TranslationView> proposeAlternative(String text, String lang, String editor, String tags) {
        return proposeAlternative(text, lang, editor, Tags.normalize(tags));
    }

    public NavResult<TranslationView> proposeAlternative(String text, String lang, String editor, List<String> tags) {
        if (current == null) return noCurrent();
        if (text == null || text.isBlank()) {
            return NavResult.failure(ErrorKind.VALIDATION_ERROR, "Alternative text is required.");
        }
        String language = lang != null && !lang.isBlank() ? lang.trim() : language();
        String ed = editor == null || editor.isBlank() ? null : editor.trim();
        Translation t = index.addTranslation(current, language.toLowerCase(Locale.ROOT), text.trim(), "user",
                VariantType.ALTERNATIVE, ed, tags, clock.instant());
        return NavResult.ok(TranslationView.of(t));
    }

    /** View of {@code node} in the preferred language. */
    public NodeView view(Node node) {
        return view(node, language());
    }

    /** View of {@code node} with text resolved for {@code languageCode}. */
    public NodeView view(Node node, String languageCode) {
        String lang = languageCode == null || languageCode.isBlank() ? language() : languageCode;
        return NodeView.of(node, resolver.resolve(node, lang), prefs.getInt(Preference.DISPLAY_LENGTH), lang);
    }

    /** The "lang" preference, or "en" when unset. */
    public String language() {
        String lang = prefs.getString(Preference.LANG);
        return lang == null || lang.isBlank() ? "en" : lang.trim();
    }

    // ----------------- helpers -----------------

    private NavResult<NodeView> adjacent(int offset) {
        if (current == null) return noCurrent();
        String direction = offset > 0 ? "next" : "previous";
        return moveTo(index.findById(current.id() + offset), "No " + direction + " node.");
    }

    private NavResult<Node> focus(String target) {
        if (target != null && !target.isBlank()) {
            Optional<Node> node = index.findByName(target.trim());
            if (node.isEmpty()) {
                return NavResult.failure(ErrorKind.NOT_FOUND, "No node found for '" + target.trim() + "'.");
            }
            current = node.get();
        } else if (current == null) {
            return noCurrent();
        }
        return NavResult.ok(current);
    }

    private NavResult<NodeView> moveTo(Optional<Node> target, String notFoundMessage) {
        if (target.isEmpty()) {
            return NavResult.failure(ErrorKind.NOT_FOUND, notFoundMessage);
        }
        current = target.get();
        return NavResult.ok(view(current));
    }

    private List<Node> sortedChildren(Node node) {
        return index.children(node).stream().sorted(NaturalSortKey.NODE_ORDER).toList();
    }

    private static <T> NavResult<T> noCurrent() {
        return NavResult.failure(ErrorKind.NO_CURRENT_NODE, "No current node.");
    }

    private static <T> NavResult<T> propagate(NavResult<?> failure) {
        NavResult.Failure<?> f = (NavResult.Failure<?>) failure;
        return NavResult.failure(f.kind(), f.message());
    }

    /** Digit strings beyond int range cannot be ids. */
    private static Optional<Integer> parseId(String digits) {
        try {
            return Optional.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean isAllDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return !s.isEmpty();
    }
}
