package com.eainde.augury.analysis.nodes;

import com.eainde.augury.analysis.AnalysisState;
import com.eainde.augury.selection.SelectionResult;
import com.eainde.augury.selection.TheorySelector;
import com.eainde.augury.theory.TheoryRegistry;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Log4j2
@Component
public class SelectTheoriesNode implements AsyncNodeAction<AnalysisState> {

    private final TheorySelector selector;
    private final TheoryRegistry registry;

    public SelectTheoriesNode(TheorySelector selector, TheoryRegistry registry) {
        this.selector = selector;
        this.registry = registry;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AnalysisState state) {
        if (state.getInput() == null || state.getCategory() == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Analysis needs an input and a category"));
        }
        SelectionResult selection = selector.select(state.getCategory(), state.getInput(), registry);
        return CompletableFuture.completedFuture(Map.of(AnalysisState.SELECTION, selection));
    }
}
