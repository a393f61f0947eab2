package qctl.graph;

import qctl.lattice.Degrees;

import java.util.Objects;

/**
 * Predicate {@code gene op threshold} over a single gene's level.
 *
 * <p>Its quantitative value is the number of level steps separating the state
 * from the comparison boundary, divided by the gene's max level:
 * <ul>
 *   <li>satisfied: steps needed to leave the admitted interval, positive;</li>
 *   <li>violated: steps needed to enter it, negative.</li>
 * </ul>
 * The ends of the gene's range are not boundaries, so a comparison that holds for
 * every level is {@link Degrees#TOP} and one that holds for none is {@link Degrees#BOTTOM}.
 */
public final class AtomicProposition {
    private final String gene;
    private final ComparisonOperator operator;
    private final int threshold;

    public AtomicProposition(String gene, ComparisonOperator operator, int threshold) {
        this.gene = Objects.requireNonNull(gene, "gene");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.threshold = threshold;
    }

    public String getGene() { return gene; }
    public ComparisonOperator getOperator() { return operator; }
    public int getThreshold() { return threshold; }

    public boolean holds(int level) {
        return level >= operator.lowestAdmitted(threshold) && level <= operator.highestAdmitted(threshold);
    }

    /**
     * Signed distance of a level from the boundary, for a gene ranging over [0, maxLevel].
     */
    public double degree(int level, int maxLevel) {
        long lo = Math.max(0L, operator.lowestAdmitted(threshold));
        long hi = Math.min((long) maxLevel, operator.highestAdmitted(threshold));
        if (lo > hi) {
            return Degrees.BOTTOM;
        }
        if (lo == 0 && hi == maxLevel) {
            return Degrees.TOP;
        }
        long steps;
        if (level >= lo && level <= hi) {
            long down = lo > 0 ? level - lo + 1 : Long.MAX_VALUE;
            long up = hi < maxLevel ? hi - level + 1 : Long.MAX_VALUE;
            steps = Math.min(down, up);
            return (double) steps / maxLevel;
        }
        steps = level < lo ? lo - level : level - hi;
        return -((double) steps / maxLevel);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AtomicProposition)) return false;
        AtomicProposition other = (AtomicProposition) o;
        return threshold == other.threshold && operator == other.operator && gene.equals(other.gene);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gene, operator, threshold);
    }

    @Override
    public String toString() {
        return gene + " " + operator.getSymbol() + " " + threshold;
    }
}
