// file: service/src/main/java/io/dectree/service/analysis/AnalysisService.java
package io.dectree.service.analysis;

import io.dectree.core.Node;
import io.dectree.core.NodeIndex;
import io.dectree.core.TextResolver;
import io.dectree.service.ErrorKind;
import io.dectree.service.NavResult;
import io.dectree.service.NavigationSession;
import io.dectree.service.prefs.Preference;
import io.dectree.service.prefs.Preferences;
import io.dectree.service.view.NodeView;
import io.dectree.storage.ResponseCache;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generated analyses of nodes, deduplicated through a {@link ResponseCache}.
 * <p>
 * Steps for {@link #analyze}:
 *  1) resolve the action token;
 *  2) resolve targets (names and ranges), or fall back to the session's
 *     current node;
 *  3) build the payload from node texts in the requested language, and the
 *     context from the parents of those nodes that are not targets themselves;
 *  4) build the prompt pair;
 *  5) unless refresh is set, return a cached response for (action, prompt);
 *  6) otherwise call the backend with the "llm_max_tokens" preference and
 *     store the result.
 * Backend failures are reported as UPSTREAM_FAILURE and nothing is cached.
 */
public final class AnalysisService {
    private static final Logger log = Logger.getLogger(AnalysisService.class.getName());

    private final NodeIndex index;
    private final TextResolver resolver;
    private final ResponseCache cache;
    private final CompletionClient client;
    private final Preferences prefs;
    private final PromptBuilder prompts;

    public AnalysisService(NodeIndex index,
                           TextResolver resolver,
                           ResponseCache cache,
                           CompletionClient client,
                           Preferences prefs,
                           PromptBuilder prompts) {
        this.index = Objects.requireNonNull(index, "index");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.client = Objects.requireNonNull(client, "client");
        this.prefs = Objects.requireNonNull(prefs, "prefs");
        this.prompts = Objects.requireNonNull(prompts, "prompts");
    }

    /**
     * @param actionToken loose action name, blank means comment
     * @param targets     names or ranges; null or empty means the current node
     * @param language    response/payload language, blank means the "lang" preference
     * @param userInput   optional extra request
     * @param refresh     bypass the cache lookup (the new result is still stored)
     */
    public NavResult<AnalysisResult> analyze(NavigationSession session,
                                             String actionToken,
                                             List<String> targets,
                                             String language,
                                             String userInput,
                                             boolean refresh) {
        Objects.requireNonNull(session, "session");

        Optional<AgentAction> maybeAction = AgentAction.fromToken(actionToken);
        if (maybeAction.isEmpty()) {
            return NavResult.failure(ErrorKind.VALIDATION_ERROR,
                    "Unknown action: " + actionToken + ". Expected one of: " + AgentAction.expected());
        }
        AgentAction action = maybeAction.get();

        List<Node> nodes;
        if (hasTargets(targets)) {
            try {
                nodes = resolveTargets(targets);
            } catch (InvalidRangeException e) {
                return NavResult.failure(ErrorKind.INVALID_RANGE, e.getMessage());
            }
            if (nodes.isEmpty()) {
                return NavResult.failure(ErrorKind.NOT_FOUND, "No nodes found for targets: " + targets);
            }
        } else if (session.current().isPresent()) {
            nodes = List.of(session.current().get());
        } else {
            return NavResult.failure(ErrorKind.NO_CURRENT_NODE, "No target nodes specified and no current node.");
        }

        String lang = language == null || language.isBlank() ? session.language() : language.trim();
        PromptPair pair = prompts.build(action, payload(nodes, lang), context(nodes, lang), lang, userInput);
        String cacheKeyPrompt = pair.combined();

        List<NodeView> views = nodes.stream().map(n -> session.view(n, lang)).toList();
        String extra = userInput == null ? "" : userInput;

        if (!refresh) {
            Optional<String> hit = cache.lookup(action.token(), cacheKeyPrompt);
            if (hit.isPresent()) {
                log.log(Level.FINE, "analysis cache hit for " + action.token());
                return NavResult.ok(new AnalysisResult(action, views, hit.get(), extra, true));
            }
        }

        String content;
        try {
            content = client.complete(pair.system(), pair.user(), prefs.getInt(Preference.LLM_MAX_TOKENS));
        } catch (UpstreamFailureException e) {
            log.log(Level.WARNING, "completion backend failed for " + action.token(), e);
            return NavResult.failure(ErrorKind.UPSTREAM_FAILURE, e.getMessage() == null ? "Upstream failure." : e.getMessage());
        }
        if (content == null) {
            return NavResult.failure(ErrorKind.UPSTREAM_FAILURE, "Backend returned no content.");
        }
        cache.store(action.token(), cacheKeyPrompt, content);
        return NavResult.ok(new AnalysisResult(action, views, content, extra, false));
    }

    /**
     * Names and ranges in order, without duplicates. Unknown plain names are
     * skipped; a bad range fails the whole request.
     *
     * @throws InvalidRangeException on a malformed range or unknown range endpoint
     */
    public List<Node> resolveTargets(List<String> targets) {
        Map<Integer, Node> out = new LinkedHashMap<>();
        for (String raw : targets) {
            if (raw == null || raw.isBlank()) continue;
            String target = raw.trim();
            Optional<TargetRange> range = index.containsName(target) ? Optional.empty() : TargetRange.parse(target);
            if (range.isPresent()) {
                for (Node n : range.get().resolve(index)) {
                    out.putIfAbsent(n.id(), n);
                }
            } else {
                index.findByName(target).ifPresent(n -> out.putIfAbsent(n.id(), n));
            }
        }
        return new ArrayList<>(out.values());
    }

    /** "name: text" blocks joined by blank lines, text resolved for {@code lang}. */
    String payload(List<Node> nodes, String lang) {
        List<String> blocks = new ArrayList<>(nodes.size());
        for (Node n : nodes) {
            blocks.add(n.name() + ": " + resolver.resolve(n, lang));
        }
        return String.join("\n\n", blocks);
    }

    /** Parents of the targets, in target order, minus any parent that is itself a target. */
    String context(List<Node> nodes, String lang) {
        Map<Integer, Node> parents = new LinkedHashMap<>();
        for (Node n : nodes) {
            index.parent(n).ifPresent(p -> parents.putIfAbsent(p.id(), p));
        }
        for (Node n : nodes) {
            parents.remove(n.id());
        }
        return parents.isEmpty() ? null : payload(new ArrayList<>(parents.values()), lang);
    }

    private static boolean hasTargets(List<String> targets) {
        return targets != null && targets.stream().anyMatch(t -> t != null && !t.isBlank());
    }
}
