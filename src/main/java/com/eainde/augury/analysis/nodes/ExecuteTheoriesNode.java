package com.eainde.augury.analysis.nodes;

import com.eainde.augury.analysis.AnalysisState;
import com.eainde.augury.analysis.TheoryExecution;
import com.eainde.augury.analysis.TheoryExecutor;
import com.eainde.augury.theory.TheoryDescriptor;
import com.eainde.augury.theory.TheoryResult;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the selected theories, reusing cached results that no modification made stale.
 * Results keep the execution order of the selection.
 */
@Log4j2
@Component
public class ExecuteTheoriesNode implements AsyncNodeAction<AnalysisState> {

    private final TheoryExecutor executor;

    public ExecuteTheoriesNode(TheoryExecutor executor) {
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AnalysisState state) {
        List<TheoryDescriptor> selected = state.getSelection().orElseThrow().selected();
        Map<String, TheoryResult> cached = state.getCached();

        List<TheoryDescriptor> toRun = new ArrayList<>();
        for (TheoryDescriptor descriptor : selected) {
            if (!cached.containsKey(descriptor.getName()) || state.getStale().contains(descriptor.getName())) {
                toRun.add(descriptor);
            }
        }
        log.info("Running {} of {} selected theories ({} reused from cache)", toRun.size(), selected.size(),
                selected.size() - toRun.size());

        TheoryExecution execution = executor.execute(toRun, state.getInput());
        Map<String, TheoryResult> fresh = new HashMap<>();
        execution.results().forEach(r -> fresh.put(r.theoryName(), r));

        List<TheoryResult> results = new ArrayList<>();
        for (TheoryDescriptor descriptor : selected) {
            String name = descriptor.getName();
            TheoryResult result = toRun.contains(descriptor) ? fresh.get(name) : cached.get(name);
            if (result != null) {
                results.add(result);
            }
        }

        return CompletableFuture.completedFuture(Map.of(
                AnalysisState.RESULTS, new ArrayList<>(results),
                AnalysisState.FAILURES, new LinkedHashMap<>(execution.failures())));
    }
}
