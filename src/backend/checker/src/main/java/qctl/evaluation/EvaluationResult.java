package qctl.evaluation;

import qctl.formula.FormulaTree;
import qctl.graph.State;
import qctl.graph.StateGraph;

import java.util.*;

/**
 * Degrees of a formula over a state graph: the root's map, the value at every
 * initial state, and the maps of all subformulas for diagnostics.
 */
public class EvaluationResult {
    private final FormulaTree formula;
    private final StateGraph graph;
    private final List<DegreeMap> nodeDegrees;
    private final List<FixpointStatistics> statistics;
    private final long elapsedMillis;

    EvaluationResult(FormulaTree formula, StateGraph graph, List<DegreeMap> nodeDegrees,
                     List<FixpointStatistics> statistics, long elapsedMillis) {
        this.formula = formula;
        this.graph = graph;
        this.nodeDegrees = Collections.unmodifiableList(new ArrayList<>(nodeDegrees));
        this.statistics = Collections.unmodifiableList(new ArrayList<>(statistics));
        this.elapsedMillis = elapsedMillis;
    }

    public FormulaTree getFormula() { return formula; }
    public StateGraph getGraph() { return graph; }
    public List<FixpointStatistics> getStatistics() { return statistics; }
    public long getElapsedMillis() { return elapsedMillis; }

    public DegreeMap getRootDegrees() {
        return nodeDegrees.get(formula.getRoot().getId());
    }

    /** Degree map of the subformula with the given node id. */
    public DegreeMap getDegrees(int nodeId) {
        return nodeDegrees.get(nodeId);
    }

    public double degreeAt(State state) {
        return getRootDegrees().get(state);
    }

    /** Root degree at each initial state, in declaration order. */
    public Map<State, Double> getInitialDegrees() {
        DegreeMap root = getRootDegrees();
        Map<State, Double> result = new LinkedHashMap<>();
        for (int i : graph.initialIndices()) {
            result.put(graph.state(i), root.get(i));
        }
        return result;
    }
}
