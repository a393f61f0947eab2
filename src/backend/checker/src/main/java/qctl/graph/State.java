package qctl.graph;

import java.util.Arrays;

/**
 * Immutable level vector, one entry per gene in network order.
 * Equal vectors are the same state.
 */
public final class State {
    private final int[] levels;
    private final int hash;

    public State(int... levels) {
        this.levels = levels.clone();
        this.hash = Arrays.hashCode(this.levels);
    }

    public int level(int geneIndex) {
        return levels[geneIndex];
    }

    public int dimension() {
        return levels.length;
    }

    /** Copy of this state with one gene's level replaced. */
    public State with(int geneIndex, int level) {
        int[] next = levels.clone();
        next[geneIndex] = level;
        return new State(next);
    }

    public int[] toArray() {
        return levels.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof State)) return false;
        return Arrays.equals(levels, ((State) o).levels);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < levels.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(levels[i]);
        }
        return sb.append(')').toString();
    }
}
