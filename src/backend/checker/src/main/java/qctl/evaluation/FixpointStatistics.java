package qctl.evaluation;

import qctl.formula.FormulaKind;

/**
 * Work done by one Globally or Until computation. Every state is extracted from
 * the queue exactly once, so {@code extractions == states} on completion.
 */
public final class FixpointStatistics {
    private final int nodeId;
    private final FormulaKind kind;
    private final int states;
    private int extractions;
    private int keyUpdates;

    FixpointStatistics(int nodeId, FormulaKind kind, int states) {
        this.nodeId = nodeId;
        this.kind = kind;
        this.states = states;
    }

    void extracted() { extractions++; }
    void updated() { keyUpdates++; }

    public int getNodeId() { return nodeId; }
    public FormulaKind getKind() { return kind; }
    public int getStates() { return states; }
    public int getExtractions() { return extractions; }
    public int getKeyUpdates() { return keyUpdates; }

    @Override
    public String toString() {
        return String.format("FixpointStatistics{node=#%d, kind=%s, states=%d, extractions=%d, keyUpdates=%d}",
                nodeId, kind, states, extractions, keyUpdates);
    }
}
