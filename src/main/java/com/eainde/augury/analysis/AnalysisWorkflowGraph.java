package com.eainde.augury.analysis;

import com.eainde.augury.analysis.edges.ResultsRoutingEdge;
import com.eainde.augury.analysis.edges.SelectionRoutingEdge;
import com.eainde.augury.analysis.nodes.ExecuteTheoriesNode;
import com.eainde.augury.analysis.nodes.ResolveConflictsNode;
import com.eainde.augury.analysis.nodes.SelectTheoriesNode;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * One analysis pass:
 * <pre>
 *   START ─► select ──(none selected)──► END
 *               │
 *               ▼
 *            execute ──(all dropped)──► END
 *               │
 *               ▼
 *            resolve ─► END
 * </pre>
 */
@Component
public class AnalysisWorkflowGraph {

    static final String SELECT = "select";
    static final String EXECUTE = "execute";
    static final String RESOLVE = "resolve";

    private final SelectTheoriesNode selectNode;
    private final ExecuteTheoriesNode executeNode;
    private final ResolveConflictsNode resolveNode;
    private final SelectionRoutingEdge selectionEdge;
    private final ResultsRoutingEdge resultsEdge;

    public AnalysisWorkflowGraph(SelectTheoriesNode selectNode,
                                 ExecuteTheoriesNode executeNode,
                                 ResolveConflictsNode resolveNode,
                                 SelectionRoutingEdge selectionEdge,
                                 ResultsRoutingEdge resultsEdge) {
        this.selectNode = selectNode;
        this.executeNode = executeNode;
        this.resolveNode = resolveNode;
        this.selectionEdge = selectionEdge;
        this.resultsEdge = resultsEdge;
    }

    @Bean("analysisWorkflow")
    public CompiledGraph<AnalysisState> build() throws GraphStateException {
        StateGraph<AnalysisState> workflow = new StateGraph<>(AnalysisState::new);

        workflow.addNode(SELECT, selectNode);
        workflow.addNode(EXECUTE, executeNode);
        workflow.addNode(RESOLVE, resolveNode);

        workflow.addEdge(START, SELECT);
        workflow.addConditionalEdges(
                SELECT,
                selectionEdge,
                Map.of(
                        SelectionRoutingEdge.EXECUTE, EXECUTE,
                        SelectionRoutingEdge.INSUFFICIENT, END
                )
        );
        workflow.addConditionalEdges(
                EXECUTE,
                resultsEdge,
                Map.of(
                        ResultsRoutingEdge.RESOLVE, RESOLVE,
                        ResultsRoutingEdge.INSUFFICIENT, END
                )
        );
        workflow.addEdge(RESOLVE, END);

        return workflow.compile();
    }
}
