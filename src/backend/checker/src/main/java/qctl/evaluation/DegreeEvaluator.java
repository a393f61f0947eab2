package qctl.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qctl.exception.EmptyStateSpaceException;
import qctl.exception.UnsupportedFormulaException;
import qctl.formula.FormulaKind;
import qctl.formula.FormulaNode;
import qctl.formula.FormulaTree;
import qctl.graph.AtomicProposition;
import qctl.graph.StateGraph;
import qctl.lattice.Degrees;
import qctl.queue.IndexedPriorityQueue;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes satisfaction degrees of a formula in every state of a graph.
 *
 * <p>Nodes are evaluated in the tree's post-order, each once, from the already
 * finished maps of its children. The four fixpoint operators share one
 * propagation scheme over an {@link IndexedPriorityQueue}:
 * <ul>
 *   <li>Until (least fixpoint, starts at the goal degrees):
 *       {@code U[s] = join(goal[s], meet(hold[s], agg U[s']))}, descending queue;</li>
 *   <li>Globally (greatest fixpoint, starts at the operand degrees):
 *       {@code G[s] = meet(hold[s], agg G[s'])}, ascending queue.</li>
 * </ul>
 * where {@code agg} ranges over the successors, {@code join} for E and {@code meet} for A.
 * A state's value is final when it leaves the queue, and every propagated
 * candidate is bounded by the value just extracted, so each state is extracted
 * exactly once. When the aggregate is the one favouring the queue order (EU, AG)
 * the first settled successor already decides a predecessor's candidate; otherwise
 * (AU, EG) the candidate is formed only once all successors are settled, from the
 * last one, which holds the aggregate.
 *
 * <p>The graph and the tree are only read. One evaluator may be used from one
 * thread at a time; separate evaluators may share a graph.
 */
public class DegreeEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(DegreeEvaluator.class);

    private final StateGraph graph;

    public DegreeEvaluator(StateGraph graph) {
        this.graph = graph;
    }

    public StateGraph getGraph() {
        return graph;
    }

    public EvaluationResult evaluate(FormulaTree formula) throws UnsupportedFormulaException, EmptyStateSpaceException {
        if (graph.isEmpty()) {
            throw new EmptyStateSpaceException("State graph has no reachable states");
        }
        checkPropositions(formula);

        long start = System.currentTimeMillis();
        List<DegreeMap> maps = new ArrayList<>(formula.size());
        List<FixpointStatistics> statistics = new ArrayList<>();
        for (FormulaNode node : formula.getNodes()) {
            double[] degrees = evaluateNode(node, maps, statistics);
            maps.add(new DegreeMap(graph, degrees));
            logger.debug("Evaluated {}: min={}, max={}", node, maps.get(node.getId()).min(), maps.get(node.getId()).max());
        }
        long elapsed = System.currentTimeMillis() - start;
        logger.info("Evaluated '{}' ({} nodes) over {} states in {} ms", formula.render(), formula.size(), graph.size(), elapsed);
        return new EvaluationResult(formula, graph, maps, statistics, elapsed);
    }

    private void checkPropositions(FormulaTree formula) throws UnsupportedFormulaException {
        for (FormulaNode node : formula.getNodes()) {
            if (node.getKind() != FormulaKind.ATOMIC) continue;
            String gene = node.getProposition().getGene();
            if (!graph.getNetwork().declares(gene)) {
                throw new UnsupportedFormulaException(gene, "Proposition '" + node.getProposition()
                        + "' refers to gene '" + gene + "' which the network does not declare");
            }
        }
    }

    private double[] evaluateNode(FormulaNode node, List<DegreeMap> maps, List<FixpointStatistics> statistics)
            throws UnsupportedFormulaException {
        FormulaKind kind = node.getKind();
        switch (kind) {
            case ATOMIC:
                return atomic(node.getProposition());
            case NOT:
                return negation(operand(maps, node.getLeft()));
            case AND:
            case OR:
                return pointwise(kind, operand(maps, node.getLeft()), operand(maps, node.getRight()));
            case EXISTS_NEXT:
            case FORALL_NEXT:
                return next(kind, operand(maps, node.getLeft()));
            case EXISTS_GLOBALLY:
            case FORALL_GLOBALLY: {
                FixpointStatistics stats = new FixpointStatistics(node.getId(), kind, graph.size());
                statistics.add(stats);
                double[] hold = operand(maps, node.getLeft());
                return fixpoint(kind, hold, null, stats);
            }
            case EXISTS_UNTIL:
            case FORALL_UNTIL: {
                FixpointStatistics stats = new FixpointStatistics(node.getId(), kind, graph.size());
                statistics.add(stats);
                return fixpoint(kind, operand(maps, node.getLeft()), operand(maps, node.getRight()), stats);
            }
            default:
                throw new UnsupportedFormulaException(String.valueOf(kind), "No evaluation for node " + node);
        }
    }

    private static double[] operand(List<DegreeMap> maps, int id) {
        return maps.get(id).raw();
    }

    private double[] atomic(AtomicProposition prop) {
        double[] result = new double[graph.size()];
        for (int s = 0; s < result.length; s++) {
            result[s] = graph.evaluateAtomic(prop, graph.state(s));
        }
        return result;
    }

    private static double[] negation(double[] child) {
        double[] result = new double[child.length];
        for (int s = 0; s < result.length; s++) {
            result[s] = Degrees.negate(child[s]);
        }
        return result;
    }

    private static double[] pointwise(FormulaKind kind, double[] left, double[] right) {
        double[] result = new double[left.length];
        for (int s = 0; s < result.length; s++) {
            result[s] = kind == FormulaKind.AND ? Degrees.meet(left[s], right[s]) : Degrees.join(left[s], right[s]);
        }
        return result;
    }

    private double[] next(FormulaKind kind, double[] child) {
        double[] result = new double[child.length];
        for (int s = 0; s < result.length; s++) {
            int[] succs = graph.successorIndices(s);
            result[s] = kind == FormulaKind.EXISTS_NEXT ? Degrees.joinAll(child, succs) : Degrees.meetAll(child, succs);
        }
        return result;
    }

    /**
     * Shared propagation for EG, AG, EU and AU. {@code goal} is null for Globally.
     */
    private double[] fixpoint(FormulaKind kind, double[] hold, double[] goal, FixpointStatistics stats) {
        boolean until = kind == FormulaKind.EXISTS_UNTIL || kind == FormulaKind.FORALL_UNTIL;
        boolean waitForAll = kind == FormulaKind.FORALL_UNTIL || kind == FormulaKind.EXISTS_GLOBALLY;
        int n = graph.size();

        double[] value = (until ? goal : hold).clone();
        boolean[] settled = new boolean[n];
        int[] pending = null;
        if (waitForAll) {
            pending = new int[n];
            for (int s = 0; s < n; s++) pending[s] = graph.successorIndices(s).length;
        }

        IndexedPriorityQueue queue = until ? IndexedPriorityQueue.maxQueue(n) : IndexedPriorityQueue.minQueue(n);
        for (int s = 0; s < n; s++) {
            queue.insert(s, value[s]);
        }

        while (!queue.isEmpty()) {
            int s = until ? queue.extractMax() : queue.extractMin();
            settled[s] = true;
            stats.extracted();
            double v = value[s];
            for (int p : graph.predecessorIndices(s)) {
                if (settled[p]) continue;
                if (waitForAll && --pending[p] > 0) continue;
                if (until) {
                    double candidate = Degrees.join(goal[p], Degrees.meet(hold[p], v));
                    if (candidate > value[p]) {
                        value[p] = candidate;
                        queue.increaseKey(p, candidate);
                        stats.updated();
                    }
                } else {
                    double candidate = Degrees.meet(hold[p], v);
                    if (candidate < value[p]) {
                        value[p] = candidate;
                        queue.decreaseKey(p, candidate);
                        stats.updated();
                    }
                }
            }
        }
        logger.debug("{}", stats);
        return value;
    }
}
