package com.eainde.augury.analysis.edges;

import com.eainde.augury.analysis.AnalysisState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
public class SelectionRoutingEdge implements AsyncEdgeAction<AnalysisState> {

    public static final String EXECUTE = "execute";
    public static final String INSUFFICIENT = "insufficient";

    @Override
    public CompletableFuture<String> apply(AnalysisState state) {
        boolean empty = state.getSelection().map(s -> s.selected().isEmpty()).orElse(true);
        return CompletableFuture.completedFuture(empty ? INSUFFICIENT : EXECUTE);
    }
}
