package com.eainde.augury.analysis.nodes;

import com.eainde.augury.analysis.AnalysisState;
import com.eainde.augury.analysis.TheoryArbitrator;
import com.eainde.augury.analysis.TheoryExecutor;
import com.eainde.augury.arbitration.ArbitrationSystem;
import com.eainde.augury.conflict.ConflictResolution;
import com.eainde.augury.conflict.ConflictResolver;
import com.eainde.augury.theory.TheoryDescriptor;
import com.eainde.augury.theory.TheoryRegistry;
import com.eainde.augury.theory.TheoryResult;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

@Component
public class ResolveConflictsNode implements AsyncNodeAction<AnalysisState> {

    private final ConflictResolver resolver;
    private final ArbitrationSystem arbitrationSystem;
    private final TheoryRegistry registry;
    private final TheoryExecutor executor;

    public ResolveConflictsNode(ConflictResolver resolver, ArbitrationSystem arbitrationSystem,
                                TheoryRegistry registry, TheoryExecutor executor) {
        this.resolver = resolver;
        this.arbitrationSystem = arbitrationSystem;
        this.registry = registry;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AnalysisState state) {
        // Selected theories count as used even when they were dropped
        Set<String> used = new HashSet<>();
        state.getSelection().ifPresent(s -> s.selected().stream().map(TheoryDescriptor::getName).forEach(used::add));
        state.getResults().stream().map(TheoryResult::theoryName).forEach(used::add);

        TheoryArbitrator arbitrator = new TheoryArbitrator(arbitrationSystem, registry, executor,
                state.getCategory(), state.getInput(), used);
        ConflictResolution resolution = resolver.resolve(state.getResults(), arbitrator);
        return CompletableFuture.completedFuture(Map.of(AnalysisState.RESOLUTION, resolution));
    }
}
