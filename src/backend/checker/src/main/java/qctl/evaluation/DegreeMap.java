package qctl.evaluation;

import qctl.graph.State;
import qctl.graph.StateGraph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Satisfaction degree of one subformula in every reachable state, keyed by the
 * state graph's numbering. Read-only once the evaluator hands it out.
 */
public final class DegreeMap {
    private final StateGraph graph;
    private final double[] degrees;

    DegreeMap(StateGraph graph, double[] degrees) {
        if (degrees.length != graph.size()) {
            throw new IllegalArgumentException("Expected " + graph.size() + " degrees, got " + degrees.length);
        }
        this.graph = graph;
        this.degrees = degrees;
    }

    public double get(State state) {
        return degrees[graph.indexOf(state)];
    }

    public double get(int stateIndex) {
        return degrees[stateIndex];
    }

    public int size() {
        return degrees.length;
    }

    public double min() {
        double m = Double.POSITIVE_INFINITY;
        for (double d : degrees) m = Math.min(m, d);
        return m;
    }

    public double max() {
        double m = Double.NEGATIVE_INFINITY;
        for (double d : degrees) m = Math.max(m, d);
        return m;
    }

    public double[] toArray() {
        return degrees.clone();
    }

    /** Degrees by state, in the graph's discovery order. */
    public Map<State, Double> toMap() {
        Map<State, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < degrees.length; i++) {
            result.put(graph.state(i), degrees[i]);
        }
        return result;
    }

    double[] raw() {
        return degrees;
    }
}
