package qctl.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qctl.exception.EmptyStateSpaceException;
import qctl.exception.MalformedModelException;
import qctl.exception.StateSpaceLimitException;

import java.util.*;

/**
 * Materializes the reachable state space of a gene network under the
 * asynchronous update rule.
 *
 * In every state each gene whose target level differs from its current level may
 * move one step towards the target; each such move is one transition. A state in
 * which no gene can move gets a self-loop, so every state has a successor.
 * Exploration is breadth-first from the initial states.
 */
public class StateGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(StateGraphBuilder.class);

    public static final int DEFAULT_STATE_LIMIT = 1_000_000;

    private int stateLimit = DEFAULT_STATE_LIMIT;

    public StateGraphBuilder withStateLimit(int stateLimit) {
        if (stateLimit < 1) {
            throw new IllegalArgumentException("State limit must be positive, got " + stateLimit);
        }
        this.stateLimit = stateLimit;
        return this;
    }

    public int getStateLimit() {
        return stateLimit;
    }

    /**
     * Explore from every vector of the network's full level space.
     */
    public StateGraph buildFull(GeneNetwork network)
            throws MalformedModelException, EmptyStateSpaceException, StateSpaceLimitException {
        if (network.fullSpaceSize() > stateLimit) {
            throw new StateSpaceLimitException(stateLimit);
        }
        return build(network, allStates(network));
    }

    public StateGraph build(GeneNetwork network, Collection<State> initialStates)
            throws MalformedModelException, EmptyStateSpaceException, StateSpaceLimitException {
        validateNetwork(network);
        if (initialStates == null || initialStates.isEmpty()) {
            throw new EmptyStateSpaceException("No initial states declared, nothing is reachable");
        }
        for (State s : initialStates) {
            validateState(network, s);
        }

        long start = System.currentTimeMillis();
        List<Gene> genes = network.getGenes();
        List<State> states = new ArrayList<>();
        Map<State, Integer> indexOf = new HashMap<>();
        List<int[]> successorList = new ArrayList<>();
        Deque<State> queue = new ArrayDeque<>();

        Set<Integer> initial = new LinkedHashSet<>();
        for (State s : initialStates) {
            initial.add(register(s, states, indexOf, queue));
        }

        while (!queue.isEmpty()) {
            State current = queue.poll();
            Set<Integer> succs = new LinkedHashSet<>();
            for (Gene gene : genes) {
                int level = current.level(gene.getIndex());
                int target = network.targetLevel(gene, current);
                if (!gene.admits(target)) {
                    throw new MalformedModelException(gene.getName(), "Target level " + target
                            + " in state " + current + " is outside [0, " + gene.getMaxLevel() + "]");
                }
                if (target == level) continue;
                State next = current.with(gene.getIndex(), level + Integer.signum(target - level));
                succs.add(register(next, states, indexOf, queue));
            }
            if (succs.isEmpty()) {
                succs.add(indexOf.get(current));
            }
            successorList.add(toArray(succs));
            if (states.size() > stateLimit) {
                throw new StateSpaceLimitException(stateLimit);
            }
        }

        int n = states.size();
        int[][] successors = successorList.toArray(new int[n][]);
        int[][] predecessors = invert(successors);

        int[] initialIdx = new int[initial.size()];
        int k = 0;
        for (int i : initial) initialIdx[k++] = i;

        StateGraph graph = new StateGraph(network, states, indexOf, successors, predecessors, initialIdx);
        logger.info("State graph built: {} states, {} transitions, {} initial states in {} ms",
                n, graph.getTransitionCount(), initialIdx.length, System.currentTimeMillis() - start);
        return graph;
    }

    /** All vectors of the full level space, in lexicographic order. */
    public static List<State> allStates(GeneNetwork network) {
        int[] max = network.maxLevels();
        List<State> result = new ArrayList<>();
        int[] current = new int[max.length];
        while (true) {
            result.add(new State(current));
            int i = max.length - 1;
            while (i >= 0 && current[i] == max[i]) {
                current[i] = 0;
                i--;
            }
            if (i < 0) break;
            current[i]++;
        }
        return result;
    }

    static void validateNetwork(GeneNetwork network) throws MalformedModelException {
        for (Map.Entry<String, UpdateRule> entry : network.getRules().entrySet()) {
            String target = entry.getKey();
            if (!network.declares(target)) {
                throw new MalformedModelException(target, "Regulated gene is not declared");
            }
            for (String regulator : entry.getValue().regulators()) {
                if (!network.declares(regulator)) {
                    throw new MalformedModelException(regulator,
                            "Regulator of '" + target + "' is not declared");
                }
            }
        }
    }

    static void validateState(GeneNetwork network, State state) throws MalformedModelException {
        if (state.dimension() != network.size()) {
            throw new MalformedModelException(null, "Initial state " + state + " has " + state.dimension()
                    + " levels, the network declares " + network.size() + " genes");
        }
        for (Gene gene : network.getGenes()) {
            int level = state.level(gene.getIndex());
            if (!gene.admits(level)) {
                throw new MalformedModelException(gene.getName(), "Initial level " + level
                        + " is outside [0, " + gene.getMaxLevel() + "]");
            }
        }
    }

    private static int register(State s, List<State> states, Map<State, Integer> indexOf, Deque<State> queue) {
        Integer known = indexOf.get(s);
        if (known != null) return known;
        int index = states.size();
        states.add(s);
        indexOf.put(s, index);
        queue.add(s);
        return index;
    }

    private static int[][] invert(int[][] successors) {
        int n = successors.length;
        int[] counts = new int[n];
        for (int[] succs : successors) {
            for (int t : succs) counts[t]++;
        }
        int[][] predecessors = new int[n][];
        for (int i = 0; i < n; i++) predecessors[i] = new int[counts[i]];
        int[] fill = new int[n];
        for (int s = 0; s < n; s++) {
            for (int t : successors[s]) {
                predecessors[t][fill[t]++] = s;
            }
        }
        return predecessors;
    }

    private static int[] toArray(Collection<Integer> values) {
        int[] result = new int[values.size()];
        int i = 0;
        for (int v : values) result[i++] = v;
        return result;
    }
}
