package qctl.graph;

import java.util.*;

/**
 * Kripke structure of a gene network: the reachable states with precomputed
 * successor and predecessor adjacency.
 *
 * States are numbered in discovery order; all adjacency is kept as index arrays
 * so that degree maps can be plain arrays over the same numbering. Instances are
 * immutable and may be read from several threads.
 */
public class StateGraph {
    private final GeneNetwork network;
    private final List<State> states;
    private final Map<State, Integer> indexOf;
    private final int[][] successors;
    private final int[][] predecessors;
    private final int[] initial;

    StateGraph(GeneNetwork network, List<State> states, Map<State, Integer> indexOf,
               int[][] successors, int[][] predecessors, int[] initial) {
        this.network = network;
        this.states = Collections.unmodifiableList(states);
        this.indexOf = Collections.unmodifiableMap(indexOf);
        this.successors = successors;
        this.predecessors = predecessors;
        this.initial = initial;
    }

    public GeneNetwork getNetwork() {
        return network;
    }

    public int size() {
        return states.size();
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    public List<State> getStates() {
        return states;
    }

    public State state(int index) {
        return states.get(index);
    }

    public boolean contains(State state) {
        return indexOf.containsKey(state);
    }

    public int indexOf(State state) {
        Integer i = indexOf.get(state);
        if (i == null) {
            throw new IllegalArgumentException("State " + state + " is not reachable in this graph");
        }
        return i;
    }

    /** Successor indices of the state at {@code index}. Never empty. Callers must not modify. */
    public int[] successorIndices(int index) {
        return successors[index];
    }

    /** Predecessor indices of the state at {@code index}. Callers must not modify. */
    public int[] predecessorIndices(int index) {
        return predecessors[index];
    }

    public Set<State> successors(State state) {
        return toStates(successors[indexOf(state)]);
    }

    public Set<State> predecessors(State state) {
        return toStates(predecessors[indexOf(state)]);
    }

    public List<State> getInitialStates() {
        List<State> result = new ArrayList<>(initial.length);
        for (int i : initial) result.add(states.get(i));
        return result;
    }

    public int[] initialIndices() {
        return initial.clone();
    }

    /**
     * Total number of directed edges, self-loops included.
     */
    public int getTransitionCount() {
        int count = 0;
        for (int[] succs : successors) count += succs.length;
        return count;
    }

    public int branchingDegree(State state) {
        return successors[indexOf(state)].length;
    }

    public double evaluateAtomic(AtomicProposition prop, State state) {
        Gene gene = network.gene(prop.getGene());
        return prop.degree(state.level(gene.getIndex()), gene.getMaxLevel());
    }

    private Set<State> toStates(int[] indices) {
        Set<State> result = new LinkedHashSet<>();
        for (int i : indices) result.add(states.get(i));
        return result;
    }
}
