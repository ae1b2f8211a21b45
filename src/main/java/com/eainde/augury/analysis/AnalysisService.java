package com.eainde.augury.analysis;

import com.eainde.augury.arbitration.ArbitrationSystem;
import com.eainde.augury.conflict.ConflictResolution;
import com.eainde.augury.conflict.ConflictResolver;
import com.eainde.augury.error.AuguryException;
import com.eainde.augury.error.InsufficientTheoriesException;
import com.eainde.augury.selection.SelectionResult;
import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryRegistry;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.UserInput;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point for analysis passes.
 * <p>
 * A full pass runs the {@code analysisWorkflow} graph (select, execute, resolve). A re-resolution
 * feeds an already joined result set with revised confidences back through the same resolver.
 * </p>
 */
@Log4j2
@Service
public class AnalysisService {

    private final CompiledGraph<AnalysisState> analysisWorkflow;
    private final ConflictResolver resolver;
    private final ArbitrationSystem arbitrationSystem;
    private final TheoryRegistry registry;
    private final TheoryExecutor executor;

    public AnalysisService(@Qualifier("analysisWorkflow") CompiledGraph<AnalysisState> analysisWorkflow,
                           ConflictResolver resolver,
                           ArbitrationSystem arbitrationSystem,
                           TheoryRegistry registry,
                           TheoryExecutor executor) {
        this.analysisWorkflow = analysisWorkflow;
        this.resolver = resolver;
        this.arbitrationSystem = arbitrationSystem;
        this.registry = registry;
        this.executor = executor;
    }

    public AnalysisPass analyze(UserInput input, QuestionCategory category) {
        return analyze(input, category, Map.of(), Set.of());
    }

    /**
     * Runs one pass.
     *
     * @param cached results of earlier passes, reused unless listed in {@code stale}
     * @param stale  theories whose inputs changed since they were cached
     * @throws InsufficientTheoriesException when no theory could produce a result
     */
    public AnalysisPass analyze(UserInput input, QuestionCategory category,
                                Map<String, TheoryResult> cached, Set<String> stale) {
        RunnableConfig config = RunnableConfig.builder()
                .threadId(UUID.randomUUID().toString())
                .build();

        AnalysisState state;
        try {
            state = analysisWorkflow.invoke(AnalysisState.inputs(input, category, cached, stale), config)
                    .orElseThrow(() -> new AuguryException("Analysis workflow produced no state"));
        } catch (AuguryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw unwrap(e);
        }

        SelectionResult selection = state.getSelection().orElseThrow();
        ConflictResolution resolution = state.getResolution().orElseThrow(() -> {
            log.warn("Analysis for {} produced no result; selected {}, dropped {}", category.key(),
                    selection.names(), state.getFailures().keySet());
            return new InsufficientTheoriesException(selection.missingFields());
        });
        return new AnalysisPass(selection, state.getResults(), state.getFailures(), resolution);
    }

    /**
     * Resolves an existing result set again, typically after confidence adjustments.
     */
    public ConflictResolution reresolve(List<TheoryResult> results, UserInput input, QuestionCategory category) {
        Set<String> used = results.stream().map(TheoryResult::theoryName).collect(Collectors.toSet());
        TheoryArbitrator arbitrator = new TheoryArbitrator(arbitrationSystem, registry, executor, category, input, used);
        return resolver.resolve(results, arbitrator);
    }

    private static RuntimeException unwrap(RuntimeException e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof AuguryException augury) {
                return augury;
            }
            cause = cause.getCause();
        }
        return new AuguryException("Analysis failed: " + e.getMessage(), e);
    }
}
