package qctl.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import qctl.evaluation.DegreeMap;
import qctl.evaluation.EvaluationResult;
import qctl.graph.State;
import qctl.graph.StateGraph;
import qctl.lattice.Degrees;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of one formula over a state graph, as written by the command line tool.
 *
 * Example JSON output:
 * {
 *   "formula": "EX (A == 1)",
 *   "reachableStates": 6,
 *   "transitions": 10,
 *   "initialStates": 1,
 *   "worstDegree": 1.0,
 *   "worstState": "(0,0)",
 *   "bestDegree": 1.0,
 *   "bestState": "(0,0)",
 *   "averageDegree": 1.0,
 *   "satisfied": true,
 *   "initialDegrees": { "(0,0)": 1.0 },
 *   "evaluationMillis": 0
 * }
 *
 * States are keyed by their level vector in gene declaration order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SatisfactionReport {

    @JsonProperty("formula")
    private String formula;

    @JsonProperty("reachableStates")
    private int reachableStates;

    @JsonProperty("transitions")
    private int transitions;

    @JsonProperty("initialStates")
    private int initialStateCount;

    @JsonProperty("worstDegree")
    private double worstDegree;

    @JsonProperty("worstState")
    private String worstState;

    @JsonProperty("bestDegree")
    private double bestDegree;

    @JsonProperty("bestState")
    private String bestState;

    @JsonProperty("averageDegree")
    private double averageDegree;

    @JsonProperty("satisfied") // every initial state has a non-negative degree
    private boolean satisfied;

    @JsonProperty("initialDegrees")
    private Map<String, Double> initialDegrees;

    @JsonProperty("degreeMap") // all reachable states, only on request
    private Map<String, Double> degreeMap;

    @JsonProperty("evaluationMillis")
    private long evaluationMillis;

    public SatisfactionReport() {
        this.initialDegrees = new LinkedHashMap<>();
    }

    /**
     * Summarizes the root degrees at the graph's initial states. Ties for worst
     * and best go to the first initial state in declaration order.
     */
    public static SatisfactionReport from(EvaluationResult result, boolean includeDegreeMap) {
        StateGraph graph = result.getGraph();
        SatisfactionReport report = new SatisfactionReport();
        report.formula = result.getFormula().render();
        report.reachableStates = graph.size();
        report.transitions = graph.getTransitionCount();
        report.evaluationMillis = result.getElapsedMillis();

        Map<State, Double> initial = result.getInitialDegrees();
        report.initialStateCount = initial.size();
        double sum = 0.0;
        double worst = Double.POSITIVE_INFINITY;
        double best = Double.NEGATIVE_INFINITY;
        for (Map.Entry<State, Double> e : initial.entrySet()) {
            double d = e.getValue();
            String key = e.getKey().toString();
            report.initialDegrees.put(key, d);
            sum += d;
            if (d < worst) {
                worst = d;
                report.worstState = key;
            }
            if (d > best) {
                best = d;
                report.bestState = key;
            }
        }
        if (!initial.isEmpty()) {
            report.worstDegree = worst;
            report.bestDegree = best;
            report.averageDegree = sum / initial.size();
            report.satisfied = Degrees.isSatisfied(worst);
        }

        if (includeDegreeMap) {
            DegreeMap root = result.getRootDegrees();
            Map<String, Double> all = new LinkedHashMap<>();
            for (Map.Entry<State, Double> e : root.toMap().entrySet()) {
                all.put(e.getKey().toString(), e.getValue());
            }
            report.degreeMap = all;
        }
        return report;
    }

    public String getFormula() { return formula; }
    public void setFormula(String formula) { this.formula = formula; }

    public int getReachableStates() { return reachableStates; }
    public void setReachableStates(int reachableStates) { this.reachableStates = reachableStates; }

    public int getTransitions() { return transitions; }
    public void setTransitions(int transitions) { this.transitions = transitions; }

    public int getInitialStateCount() { return initialStateCount; }
    public void setInitialStateCount(int initialStateCount) { this.initialStateCount = initialStateCount; }

    public double getWorstDegree() { return worstDegree; }
    public void setWorstDegree(double worstDegree) { this.worstDegree = worstDegree; }

    public String getWorstState() { return worstState; }
    public void setWorstState(String worstState) { this.worstState = worstState; }

    public double getBestDegree() { return bestDegree; }
    public void setBestDegree(double bestDegree) { this.bestDegree = bestDegree; }

    public String getBestState() { return bestState; }
    public void setBestState(String bestState) { this.bestState = bestState; }

    public double getAverageDegree() { return averageDegree; }
    public void setAverageDegree(double averageDegree) { this.averageDegree = averageDegree; }

    public boolean isSatisfied() { return satisfied; }
    public void setSatisfied(boolean satisfied) { this.satisfied = satisfied; }

    public Map<String, Double> getInitialDegrees() { return initialDegrees; }
    public void setInitialDegrees(Map<String, Double> initialDegrees) { this.initialDegrees = initialDegrees; }

    public Map<String, Double> getDegreeMap() { return degreeMap; }
    public void setDegreeMap(Map<String, Double> degreeMap) { this.degreeMap = degreeMap; }

    public long getEvaluationMillis() { return evaluationMillis; }
    public void setEvaluationMillis(long evaluationMillis) { this.evaluationMillis = evaluationMillis; }

    @Override
    public String toString() {
        return String.format("SatisfactionReport{formula=%s, states=%d, initial=%d, worst=%.4f, best=%.4f, satisfied=%s}",
                formula, reachableStates, initialStateCount, worstDegree, bestDegree, satisfied);
    }
}
