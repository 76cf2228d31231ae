// file: core/src/main/java/io/dectree/core/Ingestor.java
package io.dectree.core;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a {@link NodeIndex} from a flat, ordered list of addresses.
 * <p>
 * Phases:
 *  1) create every node (level 1, sortOrder = input position, ids from 1);
 *     a duplicate address aborts here.
 *  2) resolve parents against the complete name set (longest existing prefix).
 *  3) recompute levels along the parent chain.
 *  4) (multilingual input) attach translations.
 * <p>
 * Parents are only resolved once every name is known, so input order does not
 * matter: "1.1" listed before "1" still ends up under "1". Nothing is visible
 * to callers until all phases have completed.
 */
public final class Ingestor {
    private static final Logger log = Logger.getLogger(Ingestor.class.getName());

    private final String originalLanguage;
    private final Clock clock;

    public Ingestor() {
        this(TextResolver.DEFAULT_ORIGINAL_LANGUAGE, Clock.systemUTC());
    }

    public Ingestor(String originalLanguage, Clock clock) {
        this.originalLanguage = Objects.requireNonNull(originalLanguage, "originalLanguage").toLowerCase(Locale.ROOT);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Ingest {@code (name, text)} rows.
     *
     * @throws DuplicateNameException   if two rows share a name
     * @throws IllegalArgumentException if a name is blank
     */
    public NodeIndex ingest(List<SourceEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        List<Draft> drafts = new ArrayList<>(entries.size());
        for (SourceEntry e : entries) {
            if (e.name() == null || e.name().isBlank()) {
                throw new IllegalArgumentException("entry name must not be blank");
            }
            drafts.add(new Draft(e.name().trim(), e.text(), List.of()));
        }
        NodeIndex index = build(drafts);
        log.log(Level.INFO, "ingested " + index.size() + " nodes");
        return index;
    }

    /**
     * Ingest multilingual records. The primary text of each node is its text in
     * the original language, or the first available text when that is missing.
     * Every non-blank text becomes a translation of the node.
     */
    public NodeIndex ingestMultilingual(List<MultilingualRecord> records) {
        Objects.requireNonNull(records, "records");
        List<Draft> drafts = new ArrayList<>(records.size());
        int skipped = 0;
        for (MultilingualRecord r : records) {
            if (r.name() == null || r.name().isBlank()) {
                skipped++;
                continue;
            }
            List<MultilingualRecord.LanguageText> texts = new ArrayList<>();
            for (MultilingualRecord.LanguageText t : r.texts()) {
                if (t.lang() != null && t.text() != null && !t.text().isBlank()) {
                    texts.add(t);
                }
            }
            drafts.add(new Draft(r.name().trim(), primaryText(texts), texts));
        }

        NodeIndex index = build(drafts);

        // phase 4
        Instant now = clock.instant();
        int translations = 0;
        for (Draft d : drafts) {
            Node node = index.findById(d.id).orElseThrow();
            for (MultilingualRecord.LanguageText t : d.texts) {
                index.addTranslation(node, t.lang().trim().toLowerCase(Locale.ROOT), t.text().trim(),
                        t.source(), VariantType.TRANSLATION, null, List.of(), now);
                translations++;
            }
        }
        log.log(Level.INFO, "ingested " + index.size() + " nodes, " + translations
                + " translations (" + skipped + " records without a name skipped)");
        return index;
    }

    private String primaryText(List<MultilingualRecord.LanguageText> texts) {
        for (MultilingualRecord.LanguageText t : texts) {
            if (t.lang().trim().toLowerCase(Locale.ROOT).equals(originalLanguage)) {
                return t.text().trim();
            }
        }
        return texts.isEmpty() ? "" : texts.get(0).text().trim();
    }

    private static NodeIndex build(List<Draft> drafts) {
        // phase 1
        Map<String, Draft> byName = new HashMap<>(drafts.size() * 2);
        int nextId = 1;
        for (int i = 0; i < drafts.size(); i++) {
            Draft d = drafts.get(i);
            if (byName.putIfAbsent(d.name, d) != null) {
                throw new DuplicateNameException(d.name);
            }
            d.id = nextId++;
            d.sortOrder = i;
        }

        // phase 2
        Set<String> known = new HashSet<>(byName.keySet());
        for (Draft d : drafts) {
            d.parentName = HierarchyResolver.parentOf(d.name, known).orElse(null);
        }

        // phase 3
        for (Draft d : drafts) {
            d.level = HierarchyResolver.depthOf(d.name, n -> byName.get(n).parentName);
        }

        List<Node> nodes = new ArrayList<>(drafts.size());
        for (Draft d : drafts) {
            Integer parentId = d.parentName == null ? null : byName.get(d.parentName).id;
            nodes.add(new Node(d.id, d.name, d.text, d.level, d.sortOrder, parentId));
        }
        return NodeIndex.restore(nodes);
    }

    private static final class Draft {
        final String name;
        final String text;
        final List<MultilingualRecord.LanguageText> texts;
        int id;
        int sortOrder;
        int level = 1;
        String parentName;

        Draft(String name, String text, List<MultilingualRecord.LanguageText> texts) {
            this.name = name;
            this.text = text;
            this.texts = texts;
        }
    }
}
