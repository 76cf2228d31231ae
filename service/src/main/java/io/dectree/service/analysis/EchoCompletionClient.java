// file: service/src/main/java/io/dectree/service/analysis/EchoCompletionClient.java
package io.dectree.service.analysis;

/** Placeholder backend: echoes the prompt back so the pipeline stays usable without a provider. */
public final class EchoCompletionClient implements CompletionClient {

    @Override
    public String complete(String systemPrompt, String userPrompt, int maxTokens) {
        return "[Placeholder completion]\n"
                + "No completion backend is configured. Inject a CompletionClient to get real analyses.\n\n"
                + "Prompt received:\n"
                + systemPrompt + "\n\n" + userPrompt;
    }
}
