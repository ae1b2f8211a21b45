package com.eainde.augury.analysis;

import com.eainde.augury.conflict.ConflictResolution;
import com.eainde.augury.selection.SelectionResult;
import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.UserInput;
import org.bsc.langgraph4j.state.AgentState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of one analysis pass flowing through {@link AnalysisWorkflowGraph}.
 */
public class AnalysisState extends AgentState {

    public static final String INPUT = "input";
    public static final String CATEGORY = "category";
    public static final String CACHED = "cached";
    public static final String STALE = "stale";
    public static final String SELECTION = "selection";
    public static final String RESULTS = "results";
    public static final String FAILURES = "failures";
    public static final String RESOLUTION = "resolution";

    public AnalysisState(Map<String, Object> initData) {
        super(initData);
    }

    public UserInput getInput() { return (UserInput) this.data().get(INPUT); }
    public QuestionCategory getCategory() { return (QuestionCategory) this.data().get(CATEGORY); }

    @SuppressWarnings("unchecked")
    public Map<String, TheoryResult> getCached() {
        return (Map<String, TheoryResult>) this.data().getOrDefault(CACHED, Map.of());
    }

    @SuppressWarnings("unchecked")
    public Set<String> getStale() {
        return new HashSet<>((List<String>) this.data().getOrDefault(STALE, List.of()));
    }

    public Optional<SelectionResult> getSelection() {
        return Optional.ofNullable((SelectionResult) this.data().get(SELECTION));
    }

    @SuppressWarnings("unchecked")
    public List<TheoryResult> getResults() {
        return (List<TheoryResult>) this.data().getOrDefault(RESULTS, List.of());
    }

    @SuppressWarnings("unchecked")
    public Map<String, String> getFailures() {
        return (Map<String, String>) this.data().getOrDefault(FAILURES, Map.of());
    }

    public Optional<ConflictResolution> getResolution() {
        return Optional.ofNullable((ConflictResolution) this.data().get(RESOLUTION));
    }

    /** Initial state of a pass. */
    public static Map<String, Object> inputs(UserInput input, QuestionCategory category,
                                             Map<String, TheoryResult> cached, Set<String> stale) {
        Map<String, Object> inputs = new HashMap<>();
        inputs.put(INPUT, input);
        inputs.put(CATEGORY, category);
        inputs.put(CACHED, new HashMap<>(cached));
        // The state serializer only knows lists
        inputs.put(STALE, new ArrayList<>(stale));
        return inputs;
    }
}
