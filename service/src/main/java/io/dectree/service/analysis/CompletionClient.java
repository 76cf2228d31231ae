// file: service/src/main/java/io/dectree/service/analysis/CompletionClient.java
package io.dectree.service.analysis;

/**
 * Text generation backend. Concrete providers live outside this project.
 */
@FunctionalInterface
public interface CompletionClient {

    /**
     * @return generated text
     * @throws UpstreamFailureException when the backend cannot produce a response
     */
    String complete(String systemPrompt, String userPrompt, int maxTokens);
}
