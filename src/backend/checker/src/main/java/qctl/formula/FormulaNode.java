package qctl.formula;

import qctl.graph.AtomicProposition;

/**
 * One node of a {@link FormulaTree}. Children are referenced by id; a child's id
 * is always smaller than its parent's.
 */
public final class FormulaNode {
    public static final int NONE = -1;

    private final int id;
    private final FormulaKind kind;
    private final int left;
    private final int right;
    private final AtomicProposition proposition;

    FormulaNode(int id, FormulaKind kind, int left, int right, AtomicProposition proposition) {
        this.id = id;
        this.kind = kind;
        this.left = left;
        this.right = right;
        this.proposition = proposition;
    }

    public int getId() { return id; }
    public FormulaKind getKind() { return kind; }

    /** Operand of a unary node, left operand of a binary one. */
    public int getLeft() { return left; }

    public int getRight() { return right; }

    /** Only set for {@link FormulaKind#ATOMIC}. */
    public AtomicProposition getProposition() { return proposition; }

    @Override
    public String toString() {
        switch (kind) {
            case ATOMIC: return "#" + id + " " + proposition;
            case NOT:
            case EXISTS_NEXT:
            case FORALL_NEXT:
            case EXISTS_GLOBALLY:
            case FORALL_GLOBALLY:
                return "#" + id + " " + kind.getSymbol() + " #" + left;
            default:
                return "#" + id + " " + kind + "(#" + left + ", #" + right + ")";
        }
    }
}
