package qctl.formula;

/**
 * Node types of the supported CTL fragment.
 */
public enum FormulaKind {
    ATOMIC(0, null),
    NOT(1, "!"),
    AND(2, "&"),
    OR(2, "|"),
    EXISTS_NEXT(1, "EX"),
    FORALL_NEXT(1, "AX"),
    EXISTS_GLOBALLY(1, "EG"),
    FORALL_GLOBALLY(1, "AG"),
    EXISTS_UNTIL(2, "E"),
    FORALL_UNTIL(2, "A");

    private final int arity;
    private final String symbol;

    FormulaKind(int arity, String symbol) {
        this.arity = arity;
        this.symbol = symbol;
    }

    public int getArity() {
        return arity;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isTemporal() {
        return ordinal() >= EXISTS_NEXT.ordinal();
    }

    /** Whether the evaluation of this kind needs a fixpoint rather than a single pass. */
    public boolean isFixpoint() {
        return this == EXISTS_GLOBALLY || this == FORALL_GLOBALLY
                || this == EXISTS_UNTIL || this == FORALL_UNTIL;
    }
}
