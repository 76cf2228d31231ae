// file: service/src/main/java/io/dectree/service/analysis/AnalysisResult.java
package io.dectree.service.analysis;

import io.dectree.service.view.NodeView;

import java.util.List;

/**
 * @param nodes     analysed nodes with text in the requested language
 * @param userInput the extra request, "" when none
 * @param cached    true if the content came from the response cache
 */
public record AnalysisResult(AgentAction action, List<NodeView> nodes, String content, String userInput, boolean cached) {
    public AnalysisResult {
        nodes = List.copyOf(nodes);
    }
}
