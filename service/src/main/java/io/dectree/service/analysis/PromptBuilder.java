// file: service/src/main/java/io/dectree/service/analysis/PromptBuilder.java
package io.dectree.service.analysis;

import java.util.Locale;
import java.util.Objects;

/**
 * Builds the (system, user) prompt pair for an analysis.
 * <p>
 * User prompt layout:
 * <pre>
 *   &lt;action instruction&gt;
 *
 *   &lt;payload&gt;
 *
 *   Context:                       (only with context)
 *   &lt;context&gt;
 *
 *   (Please respond in German.)    (only for language "de")
 *
 *   Additional request:            (only with user input)
 *   &lt;user input&gt;
 * </pre>
 */
public final class PromptBuilder {

    public static final String DEFAULT_SYSTEM_PROMPT =
            "You are a philosophical commentary assistant for a corpus of numbered propositions. "
                    + "Treat propositions below 7 as belonging to Ludwig Wittgenstein's original "
                    + "*Tractatus Logico-Philosophicus*. Propositions numbered 7 or above are "
                    + "part of the continuation titled *Tractatus Logico-Humanus*. "
                    + "You analyze propositions with close attention to their logical structure, "
                    + "meaning, and tone within this evolving conceptual framework. "
                    + "Write clearly and precisely, in a philosophical style. "
                    + "Engage deeply with the text's internal logic and implications.";

    private final String systemPrompt;

    public PromptBuilder() {
        this(DEFAULT_SYSTEM_PROMPT);
    }

    public PromptBuilder(String systemPrompt) {
        this.systemPrompt = Objects.requireNonNull(systemPrompt, "systemPrompt");
    }

    /**
     * @param payload   "name: text" blocks separated by blank lines
     * @param context   optional, e.g. parent and sibling texts
     * @param language  requested response language; "de" adds a German-response hint
     * @param userInput optional free-form request appended last
     */
    public PromptPair build(AgentAction action, String payload, String context, String language, String userInput) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(payload, "payload");

        StringBuilder user = new StringBuilder()
                .append(action.instruction())
                .append("\n\n")
                .append(payload.strip());
        if (context != null && !context.isBlank()) {
            user.append("\n\nContext:\n").append(context.strip());
        }
        if (language != null && language.trim().toLowerCase(Locale.ROOT).equals("de")) {
            user.append("\n\n(Please respond in German.)");
        }
        if (userInput != null && !userInput.isBlank()) {
            user.append("\n\nAdditional request:\n").append(userInput.strip());
        }
        return new PromptPair(systemPrompt, user.toString());
    }
}
