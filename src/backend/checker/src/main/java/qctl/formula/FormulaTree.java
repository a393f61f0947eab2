package qctl.formula;

import qctl.graph.AtomicProposition;
import qctl.graph.ComparisonOperator;

import java.util.*;

/**
 * Immutable, index-based syntax tree of a formula in the supported fragment.
 *
 * Nodes are stored in post-order: every child precedes its parents, so walking
 * {@link #getNodes()} front to back is a valid bottom-up evaluation order.
 * Structurally equal subformulas are stored once and shared, which makes the
 * tree a DAG and lets an evaluator memoize by node id.
 */
public final class FormulaTree {
    private final List<FormulaNode> nodes;
    private final int root;

    private FormulaTree(List<FormulaNode> nodes) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.root = nodes.size() - 1;
    }

    public static Builder builder() {
        return new Builder();
    }

    public FormulaNode getRoot() {
        return nodes.get(root);
    }

    public FormulaNode node(int id) {
        return nodes.get(id);
    }

    /** All nodes, children before parents. */
    public List<FormulaNode> getNodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public String render() {
        return render(root);
    }

    /**
     * Text form of the subformula at {@code id}, in the syntax accepted by
     * {@link qctl.formula.parse.CtlParser}.
     */
    public String render(int id) {
        FormulaNode n = nodes.get(id);
        switch (n.getKind()) {
            case ATOMIC:
                return n.getProposition().toString();
            case NOT:
                return "!(" + render(n.getLeft()) + ")";
            case AND:
                return "(" + render(n.getLeft()) + " & " + render(n.getRight()) + ")";
            case OR:
                return "(" + render(n.getLeft()) + " | " + render(n.getRight()) + ")";
            case EXISTS_UNTIL:
            case FORALL_UNTIL:
                return n.getKind().getSymbol() + " (" + render(n.getLeft()) + ") U (" + render(n.getRight()) + ")";
            default:
                return n.getKind().getSymbol() + " (" + render(n.getLeft()) + ")";
        }
    }

    @Override
    public String toString() {
        return render();
    }

    /**
     * Appends nodes bottom-up. Every factory method returns the id of the node,
     * reusing an existing id when an identical node was already added.
     */
    public static class Builder {
        private final List<FormulaNode> nodes = new ArrayList<>();
        private final Map<List<Object>, Integer> interned = new HashMap<>();

        public int atom(AtomicProposition proposition) {
            return add(FormulaKind.ATOMIC, FormulaNode.NONE, FormulaNode.NONE, Objects.requireNonNull(proposition));
        }

        public int atom(String gene, ComparisonOperator op, int threshold) {
            return atom(new AtomicProposition(gene, op, threshold));
        }

        public int not(int operand) { return unary(FormulaKind.NOT, operand); }
        public int and(int left, int right) { return binary(FormulaKind.AND, left, right); }
        public int or(int left, int right) { return binary(FormulaKind.OR, left, right); }
        public int existsNext(int operand) { return unary(FormulaKind.EXISTS_NEXT, operand); }
        public int forallNext(int operand) { return unary(FormulaKind.FORALL_NEXT, operand); }
        public int existsGlobally(int operand) { return unary(FormulaKind.EXISTS_GLOBALLY, operand); }
        public int forallGlobally(int operand) { return unary(FormulaKind.FORALL_GLOBALLY, operand); }
        public int existsUntil(int hold, int goal) { return binary(FormulaKind.EXISTS_UNTIL, hold, goal); }
        public int forallUntil(int hold, int goal) { return binary(FormulaKind.FORALL_UNTIL, hold, goal); }

        public int unary(FormulaKind kind, int operand) {
            if (kind.getArity() != 1) {
                throw new IllegalArgumentException(kind + " is not unary");
            }
            checkId(operand);
            return add(kind, operand, FormulaNode.NONE, null);
        }

        public int binary(FormulaKind kind, int left, int right) {
            if (kind.getArity() != 2) {
                throw new IllegalArgumentException(kind + " is not binary");
            }
            checkId(left);
            checkId(right);
            return add(kind, left, right, null);
        }

        public int size() {
            return nodes.size();
        }

        /**
         * Finishes the tree with the given root. Nodes not below the root are dropped
         * and the remaining ones renumbered, keeping their relative order.
         */
        public FormulaTree build(int root) {
            checkId(root);
            boolean[] used = new boolean[root + 1];
            used[root] = true;
            for (int id = root; id >= 0; id--) {
                if (!used[id]) continue;
                FormulaNode n = nodes.get(id);
                if (n.getLeft() != FormulaNode.NONE) used[n.getLeft()] = true;
                if (n.getRight() != FormulaNode.NONE) used[n.getRight()] = true;
            }
            int[] remap = new int[root + 1];
            List<FormulaNode> kept = new ArrayList<>();
            for (int id = 0; id <= root; id++) {
                if (!used[id]) continue;
                FormulaNode n = nodes.get(id);
                remap[id] = kept.size();
                kept.add(new FormulaNode(kept.size(), n.getKind(),
                        n.getLeft() == FormulaNode.NONE ? FormulaNode.NONE : remap[n.getLeft()],
                        n.getRight() == FormulaNode.NONE ? FormulaNode.NONE : remap[n.getRight()],
                        n.getProposition()));
            }
            return new FormulaTree(kept);
        }

        private int add(FormulaKind kind, int left, int right, AtomicProposition proposition) {
            List<Object> key = Arrays.asList(kind, left, right, proposition);
            Integer existing = interned.get(key);
            if (existing != null) {
                return existing;
            }
            int id = nodes.size();
            nodes.add(new FormulaNode(id, kind, left, right, proposition));
            interned.put(key, id);
            return id;
        }

        private void checkId(int id) {
            if (id < 0 || id >= nodes.size()) {
                throw new IllegalArgumentException("Unknown formula node #" + id);
            }
        }
    }
}
