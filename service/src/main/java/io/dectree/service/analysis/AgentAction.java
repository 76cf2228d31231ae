// file: service/src/main/java/io/dectree/service/analysis/AgentAction.java
package io.dectree.service.analysis;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Analyses that can be requested for one or more nodes.
 * <p>
 * User tokens are matched against {@link #CANDIDATES} in that order: the
 * first action whose name the lowercased token starts with wins, so
 * "comments" and "Comment!" both mean COMMENT. A blank token means COMMENT.
 */
public enum AgentAction {
    COMMENT("comment",
            "Interpret the following proposition as a self-contained statement. "
                    + "Explain its internal logic, sense, and philosophical implication "
                    + "within the appropriate context described above:"),
    COMPARISON("comparison",
            "Compare the following propositions with close attention to their "
                    + "logical forms and philosophical emphases. How do their structures "
                    + "and implications differ or align within the combined framework:"),
    WEBSEARCH("websearch",
            "Suggest web-search queries and summarize potential online resources "
                    + "that provide historical, biographical, or interpretive context for "
                    + "understanding these propositions:"),
    REFERENCE("reference",
            "List relevant philosophical references, academic sources, and "
                    + "scholarly interpretations that expand on or challenge the meaning "
                    + "of these propositions:");

    /** Matching order for {@link #fromToken(String)}. */
    public static final List<AgentAction> CANDIDATES = List.of(COMMENT, COMPARISON, WEBSEARCH, REFERENCE);

    private final String token;
    private final String instruction;

    AgentAction(String token, String instruction) {
        this.token = token;
        this.instruction = instruction;
    }

    /** Lowercase name, also used as the cache action. */
    public String token() {
        return token;
    }

    /** User-prompt instruction placed before the payload. */
    public String instruction() {
        return instruction;
    }

    public static Optional<AgentAction> fromToken(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(COMMENT);
        }
        String lowered = raw.trim().toLowerCase(Locale.ROOT);
        for (AgentAction a : CANDIDATES) {
            if (lowered.startsWith(a.token)) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }

    /** "comment, comparison, websearch, reference" */
    public static String expected() {
        return CANDIDATES.stream().map(AgentAction::token).collect(Collectors.joining(", "));
    }
}
