package qctl.graph;

import java.util.Objects;

/**
 * A gene of the network: a name, its position in every state vector and the
 * highest discrete level it can reach.
 */
public final class Gene {
    private final String name;
    private final int index;
    private final int maxLevel;

    public Gene(String name, int index, int maxLevel) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Gene name must not be empty");
        }
        if (maxLevel < 1) {
            throw new IllegalArgumentException("Gene '" + name + "' must have a max level >= 1, got " + maxLevel);
        }
        this.name = name;
        this.index = index;
        this.maxLevel = maxLevel;
    }

    public String getName() { return name; }
    public int getIndex() { return index; }
    public int getMaxLevel() { return maxLevel; }

    public boolean admits(int level) {
        return level >= 0 && level <= maxLevel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Gene)) return false;
        Gene other = (Gene) o;
        return index == other.index && maxLevel == other.maxLevel && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, index, maxLevel);
    }

    @Override
    public String toString() {
        return name + "[0.." + maxLevel + "]";
    }
}
