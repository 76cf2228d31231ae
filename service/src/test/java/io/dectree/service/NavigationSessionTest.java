// file: service/src/test/java/io/dectree/service/NavigationSessionTest.java
package io.dectree.service;

import io.dectree.core.NodeIndex;
import io.dectree.core.TextResolver;
import io.dectree.service.prefs.MemoryPreferenceStore;
import io.dectree.service.prefs.Preference;
import io.dectree.service.view.Listing;
import io.dectree.service.view.NodeView;
import io.dectree.service.view.TranslationView;
import io.dectree.service.view.TreeLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NavigationSessionTest {

    private NodeIndex index;
    private MemoryPreferenceStore prefs;
    private NavigationSession session;

    @BeforeEach
    void setUp() {
        index = Fixtures.index();
        prefs = new MemoryPreferenceStore();
        session = new NavigationSession(index, new TextResolver(), prefs, Fixtures.CLOCK);
    }

    private static List<String> names(List<NodeView> views) {
        return views.stream().map(NodeView::name).toList();
    }

    @Test
    void get_by_name_sets_current_and_resolves_preferred_language() {
        NodeView v = session.get("1.1").value();
        assertEquals("1.1", v.name());
        assertEquals("The world is the totality of facts, not of things.", v.text());
        assertEquals("en", v.language());
        assertEquals(2, v.level());
        assertEquals(1, v.parentId());
        assertEquals("1.1", session.current().orElseThrow().name());
    }

    @Test
    void get_by_explicit_id_and_numeric_fallback() {
        assertEquals("2.0121", session.get("id:8").value().name());
        assertEquals("1.11", session.get("3").value().name(), "no node named 3, so id 3");
        assertEquals("2", session.get("2").value().name(), "a name match beats the id fallback");
    }

    @Test
    void malformed_or_unknown_keys_leave_current_unchanged() {
        session.get("1.2");
        NavResult<NodeView> bad = session.get("id:abc");
        assertEquals(ErrorKind.NOT_FOUND, bad.errorKind());
        assertEquals(ErrorKind.NOT_FOUND, session.get("id:99").errorKind());
        assertEquals(ErrorKind.NOT_FOUND, session.get("9.9").errorKind());
        assertEquals(ErrorKind.NOT_FOUND, session.get("99999999999999").errorKind());
        assertEquals("1.2", session.current().orElseThrow().name());
    }

    @Test
    void parent_walks_up_and_fails_at_roots() {
        assertEquals(ErrorKind.NO_CURRENT_NODE, session.parent().errorKind());
        session.get("2.0121");
        assertEquals("2.01", session.parent().value().name());
        assertEquals("2", session.parent().value().name());
        NavResult<NodeView> r = session.parent();
        assertEquals(ErrorKind.NO_PARENT, r.errorKind());
        assertEquals("2", session.current().orElseThrow().name());
    }

    @Test
    void next_then_previous_round_trips_by_id() {
        session.get("1.12");
        assertEquals("1.2", session.next().value().name());
        assertEquals("1.12", session.previous().value().name());
    }

    @Test
    void next_at_the_last_id_fails_without_moving() {
        session.get("2.0121");
        NavResult<NodeView> r = session.next();
        assertFalse(r.isOk());
        assertEquals(ErrorKind.NOT_FOUND, r.errorKind());
        assertEquals("2.0121", session.current().orElseThrow().name());

        session.get("1");
        assertEquals(ErrorKind.NOT_FOUND, session.previous().errorKind());
        assertEquals("1", session.current().orElseThrow().name());
    }

    @Test
    void children_are_naturally_sorted_and_may_be_empty() {
        assertEquals(ErrorKind.NO_CURRENT_NODE, session.children().errorKind());
        session.get("1");
        assertEquals(List.of("1.1", "1.2"), names(session.children().value()));
        session.get("1.2");
        assertTrue(session.children().value().isEmpty());
    }

    @Test
    void list_with_target_moves_first() {
        Listing l = session.list("1.1").value();
        assertEquals("1.1", l.current().name());
        assertEquals(List.of("1.11", "1.12"), names(l.children()));
        assertEquals("1.1", session.current().orElseThrow().name());

        assertEquals(ErrorKind.NOT_FOUND, session.list("nope").errorKind());
        assertEquals("1.1", session.current().orElseThrow().name());
    }

    @Test
    void list_without_current_fails() {
        assertEquals(ErrorKind.NO_CURRENT_NODE, session.list().errorKind());
    }

    @Test
    void tree_honours_max_depth_preference() {
        List<TreeLine> all = session.tree("1").value().lines();
        assertEquals(List.of("1", "1.1", "1.11", "1.12", "1.2"),
                all.stream().map(l -> l.node().name()).toList());
        assertEquals(List.of(0, 1, 2, 2, 1), all.stream().map(TreeLine::depth).toList());

        prefs.set(Preference.TREE_MAX_DEPTH, 1);
        List<TreeLine> shallow = session.tree().value().lines();
        assertEquals(List.of("1", "1.1", "1.2"), shallow.stream().map(l -> l.node().name()).toList());
    }

    @Test
    void search_is_trimmed_case_insensitive_and_natural_ordered() {
        var r = session.search("  tatsachen ").value();
        assertEquals("tatsachen", r.query());
        assertEquals(List.of("1.1", "1.11", "1.12", "1.2"), names(r.results()));
        assertEquals(4, r.count());
        assertTrue(session.current().isEmpty(), "search does not move the cursor");
    }

    @Test
    void blank_search_is_a_validation_error() {
        assertEquals(ErrorKind.VALIDATION_ERROR, session.search("   ").errorKind());
        assertEquals(ErrorKind.VALIDATION_ERROR, session.search(null).errorKind());
    }

    @Test
    void short_text_follows_display_length() {
        prefs.set(Preference.DISPLAY_LENGTH, 9);
        prefs.set(Preference.LANG, "de");
        NodeView v = session.get("1").value();
        assertEquals("Die Welt ist alles, was der Fall ist.", v.text());
        assertEquals("Die Welt ", v.textShort());
        assertEquals("de", v.language());
    }

    @Test
    void translations_exclude_alternatives() {
        session.get("1");
        session.proposeAlternative("The world is all that is the case.", null, "ed", "style");
        var t = session.translations().value();
        assertEquals(List.of("de", "en-ogden"), t.entries().stream().map(TranslationView::lang).toList());
        assertEquals("German original", t.entries().get(0).source());
    }

    @Test
    void translate_returns_exact_language_or_not_found() {
        session.get("1");
        assertEquals("The world is everything that is the case.", session.translate("en-ogden").value().text());
        assertEquals(ErrorKind.NOT_FOUND, session.translate("fr").errorKind());
        assertEquals(ErrorKind.VALIDATION_ERROR, session.translate(" ").errorKind());
    }

    @Test
    void propose_alternative_defaults_and_normalises() {
        session.get("1.2");
        TranslationView alt = session.proposeAlternative("  The world falls apart into facts.  ", null, "  ", " a, b ,a,, ").value();
        assertEquals("en", alt.lang());
        assertEquals("The world falls apart into facts.", alt.text());
        assertEquals("user", alt.source());
        assertEquals("", alt.editor());
        assertEquals(List.of("a", "b"), alt.tags());
        assertEquals(Instant.parse("2024-03-01T09:00:00Z"), alt.createdAt());

        TranslationView fr = session.proposeAlternative("Le monde", "FR", "Marie", (String) null).value();
        assertEquals("fr", fr.lang());
        assertEquals("Marie", fr.editor());
    }

    @Test
    void propose_alternative_requires_text_and_current() {
        assertEquals(ErrorKind.NO_CURRENT_NODE, session.proposeAlternative("x", null, null, (String) null).errorKind());
        session.get("1");
        assertEquals(ErrorKind.VALIDATION_ERROR, session.proposeAlternative("  ", null, null, (String) null).errorKind());
    }

    @Test
    void alternatives_are_ordered_by_creation_time() {
        session.get("1");
        var late = new NavigationSession(index, new TextResolver(), prefs,
                Clock.fixed(Instant.parse("2024-03-02T00:00:00Z"), ZoneOffset.UTC));
        late.get("1");
        late.proposeAlternative("second", "en", null, (String) null);
        session.proposeAlternative("first", "en", null, (String) null);

        var alts = session.alternatives().value().entries();
        assertEquals(List.of("first", "second"), alts.stream().map(TranslationView::text).toList());
    }

    @Test
    void alternatives_are_not_used_for_display_text() {
        session.get("1.12");
        session.proposeAlternative("For the totality of facts determines...", "en", null, (String) null);
        assertEquals("Denn, die Gesamtheit der Tatsachen bestimmt, was der Fall ist.", session.get("1.12").value().text());
    }

    @Test
    void failures_map_through_unchanged() {
        NavResult<Integer> mapped = session.parent().map(NodeView::level);
        assertEquals(ErrorKind.NO_CURRENT_NODE, mapped.errorKind());
        assertThrows(IllegalStateException.class, mapped::value);

        session.get("2.01");
        assertEquals(6, session.parent().map(NodeView::id).value());
    }
}
