// file: service/src/test/java/io/dectree/service/analysis/PromptBuilderTest.java
package io.dectree.service.analysis;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();

    @Test
    void minimal_prompt_is_instruction_and_payload() {
        PromptPair p = builder.build(AgentAction.COMMENT, "1: text\n", null, "en", null);
        assertEquals(PromptBuilder.DEFAULT_SYSTEM_PROMPT, p.system());
        assertEquals(AgentAction.COMMENT.instruction() + "\n\n1: text", p.user());
    }

    @Test
    void optional_sections_appear_in_order() {
        PromptPair p = builder.build(AgentAction.COMPARISON, "1: a\n\n2: b", " parent ", "DE", " focus on logic ");
        String expected = AgentAction.COMPARISON.instruction()
                + "\n\n1: a\n\n2: b"
                + "\n\nContext:\nparent"
                + "\n\n(Please respond in German.)"
                + "\n\nAdditional request:\nfocus on logic";
        assertEquals(expected, p.user());
    }

    @Test
    void combined_joins_system_and_user() {
        PromptPair p = new PromptBuilder("SYS").build(AgentAction.REFERENCE, "x", null, null, null);
        assertEquals("SYS\n\n" + p.user(), p.combined());
    }
}
