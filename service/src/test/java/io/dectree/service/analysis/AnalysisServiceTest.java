// file: service/src/test/java/io/dectree/service/analysis/AnalysisServiceTest.java
package io.dectree.service.analysis;

import io.dectree.core.NodeIndex;
import io.dectree.core.TextResolver;
import io.dectree.service.ErrorKind;
import io.dectree.service.Fixtures;
import io.dectree.service.NavResult;
import io.dectree.service.NavigationSession;
import io.dectree.service.prefs.MemoryPreferenceStore;
import io.dectree.service.prefs.Preference;
import io.dectree.service.view.NodeView;
import io.dectree.storage.DurableResponseCache;
import io.dectree.storage.FileWal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisServiceTest {

    @TempDir Path cacheDir;

    /** Records every call and answers with a counter so repeated calls are distinguishable. */
    private static final class RecordingClient implements CompletionClient {
        final List<String> users = new ArrayList<>();
        final List<Integer> maxTokens = new ArrayList<>();
        boolean fail;

        @Override
        public String complete(String systemPrompt, String userPrompt, int max) {
            if (fail) throw new UpstreamFailureException("backend down");
            users.add(userPrompt);
            maxTokens.add(max);
            return "answer #" + users.size();
        }
    }

    private NodeIndex index;
    private MemoryPreferenceStore prefs;
    private DurableResponseCache cache;
    private RecordingClient client;
    private AnalysisService service;
    private NavigationSession session;

    @BeforeEach
    void setUp() {
        index = Fixtures.index();
        prefs = new MemoryPreferenceStore();
        cache = new DurableResponseCache(new FileWal(cacheDir, 1L << 20), Fixtures.CLOCK);
        client = new RecordingClient();
        TextResolver resolver = new TextResolver();
        service = new AnalysisService(index, resolver, cache, client, prefs, new PromptBuilder());
        session = new NavigationSession(index, resolver, prefs, Fixtures.CLOCK);
    }

    @AfterEach
    void tearDown() throws Exception {
        cache.close();
    }

    @Test
    void second_identical_request_is_served_from_cache() {
        AnalysisResult first = service.analyze(session, "comment", List.of("1.1"), "en", null, false).value();
        AnalysisResult second = service.analyze(session, "comment", List.of("1.1"), "en", null, false).value();

        assertFalse(first.cached());
        assertTrue(second.cached());
        assertEquals("answer #1", second.content());
        assertEquals(1, client.users.size());
        assertEquals(1, cache.size());
    }

    @Test
    void refresh_bypasses_lookup_and_overwrites() {
        service.analyze(session, "comment", List.of("1.1"), "en", null, false);
        AnalysisResult refreshed = service.analyze(session, "comment", List.of("1.1"), "en", null, true).value();
        assertFalse(refreshed.cached());
        assertEquals("answer #2", refreshed.content());

        AnalysisResult again = service.analyze(session, "comment", List.of("1.1"), "en", null, false).value();
        assertTrue(again.cached());
        assertEquals("answer #2", again.content());
        assertEquals(1, cache.size());
    }

    @Test
    void payload_uses_requested_language_and_max_tokens_preference() {
        prefs.set(Preference.LLM_MAX_TOKENS, 800);
        service.analyze(session, "comparison", List.of("1", "2"), "en", "focus", false);

        String user = client.users.get(0);
        assertTrue(user.startsWith(AgentAction.COMPARISON.instruction()));
        assertTrue(user.contains("1: The world is everything that is the case.\n\n2: What is the case"), user);
        assertTrue(user.endsWith("Additional request:\nfocus"));
        assertEquals(List.of(800), client.maxTokens);
    }

    @Test
    void parents_outside_the_targets_become_context() {
        service.analyze(session, "comment", List.of("1.1"), "en", null, false);
        assertTrue(client.users.get(0).endsWith("\n\nContext:\n1: The world is everything that is the case."),
                client.users.get(0));

        service.analyze(session, "comment", List.of("1", "1.1"), "en", null, false);
        assertFalse(client.users.get(1).contains("Context:"));
    }

    @Test
    void german_requests_add_the_response_hint() {
        AnalysisResult r = service.analyze(session, "", List.of("1"), "de", null, false).value();
        assertEquals(AgentAction.COMMENT, r.action());
        assertTrue(client.users.get(0).contains("1: Die Welt ist alles, was der Fall ist."));
        assertTrue(client.users.get(0).contains("(Please respond in German.)"));
        assertEquals("de", r.nodes().get(0).language());
    }

    @Test
    void different_languages_do_not_share_cache_entries() {
        service.analyze(session, "comment", List.of("1"), "en", null, false);
        AnalysisResult de = service.analyze(session, "comment", List.of("1"), "de", null, false).value();
        assertFalse(de.cached());
        assertEquals(2, cache.size());
    }

    @Test
    void falls_back_to_current_node() {
        assertEquals(ErrorKind.NO_CURRENT_NODE, service.analyze(session, "comment", List.of(), null, null, false).errorKind());

        session.get("2.01");
        AnalysisResult r = service.analyze(session, "comment", null, null, null, false).value();
        assertEquals(List.of("2.01"), r.nodes().stream().map(NodeView::name).toList());
    }

    @Test
    void ranges_expand_and_duplicates_collapse() {
        AnalysisResult r = service.analyze(session, "reference", List.of("1.1:1.12", "1.11", "nope"), "en", null, false).value();
        assertEquals(List.of("1.1", "1.11", "1.12"), r.nodes().stream().map(NodeView::name).toList());
    }

    @Test
    void target_errors_are_reported_as_values() {
        assertEquals(ErrorKind.NOT_FOUND,
                service.analyze(session, "comment", List.of("9.9"), null, null, false).errorKind());
        assertEquals(ErrorKind.INVALID_RANGE,
                service.analyze(session, "comment", List.of("1-9"), null, null, false).errorKind());
        assertEquals(ErrorKind.VALIDATION_ERROR,
                service.analyze(session, "summarize", List.of("1"), null, null, false).errorKind());
        assertTrue(client.users.isEmpty());
    }

    @Test
    void upstream_failure_is_not_cached() {
        client.fail = true;
        NavResult<AnalysisResult> r = service.analyze(session, "comment", List.of("1"), "en", null, false);
        assertEquals(ErrorKind.UPSTREAM_FAILURE, r.errorKind());
        assertEquals(0, cache.size());

        client.fail = false;
        assertFalse(service.analyze(session, "comment", List.of("1"), "en", null, false).value().cached());
    }

    @Test
    void echo_client_returns_the_prompt() {
        var echo = new AnalysisService(index, new TextResolver(), cache, new EchoCompletionClient(), prefs, new PromptBuilder());
        String content = echo.analyze(session, "websearch", List.of("2"), "en", null, false).value().content();
        assertTrue(content.startsWith("[Placeholder completion]"));
        assertTrue(content.contains("2: What is the case"));
    }
}
