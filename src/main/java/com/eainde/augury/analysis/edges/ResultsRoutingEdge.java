package com.eainde.augury.analysis.edges;

import com.eainde.augury.analysis.AnalysisState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Skips resolution when every selected theory was dropped.
 */
@Component
public class ResultsRoutingEdge implements AsyncEdgeAction<AnalysisState> {

    public static final String RESOLVE = "resolve";
    public static final String INSUFFICIENT = "insufficient";

    @Override
    public CompletableFuture<String> apply(AnalysisState state) {
        return CompletableFuture.completedFuture(state.getResults().isEmpty() ? INSUFFICIENT : RESOLVE);
    }
}
