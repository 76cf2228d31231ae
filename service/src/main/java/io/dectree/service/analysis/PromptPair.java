// file: service/src/main/java/io/dectree/service/analysis/PromptPair.java
package io.dectree.service.analysis;

/** System and user prompt sent to a {@link CompletionClient}. */
public record PromptPair(String system, String user) {

    /** Both prompts as one string; this is what the response cache is keyed on. */
    public String combined() {
        return system + "\n\n" + user;
    }
}
