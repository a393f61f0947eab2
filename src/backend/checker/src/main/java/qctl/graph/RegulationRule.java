package qctl.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Context-based regulation of a single target gene.
 *
 * Every regulator splits its own level range with ascending thresholds. A level
 * v of the regulator falls into interval {@code 1 + |{t : t <= v}|}, so k thresholds
 * give intervals 1..k+1. A context names one interval per regulator (or a
 * wildcard) together with the target value; the first context matching the
 * current state decides the target. Without a matching context the gene stays
 * where it is.
 */
public class RegulationRule implements UpdateRule {

    public static final class Regulator {
        private final String gene;
        private final int[] thresholds;

        public Regulator(String gene, int... thresholds) {
            this.gene = gene;
            this.thresholds = thresholds.clone();
        }

        public String getGene() { return gene; }
        public int[] getThresholds() { return thresholds.clone(); }

        /** 1-based index of the activity interval that contains the level. */
        public int intervalOf(int level) {
            int below = 0;
            for (int t : thresholds) {
                if (t <= level) below++;
                else break;
            }
            return below + 1;
        }

        public int intervalCount() {
            return thresholds.length + 1;
        }
    }

    public static final class Context {
        /** Wildcard marker for "any interval". */
        public static final int ANY = 0;

        private final int[] intervals;
        private final int targetValue;

        public Context(int[] intervals, int targetValue) {
            this.intervals = intervals.clone();
            this.targetValue = targetValue;
        }

        public int[] getIntervals() { return intervals.clone(); }
        public int getTargetValue() { return targetValue; }

        boolean matches(List<Regulator> regulators, int[] regulatorLevels) {
            for (int i = 0; i < intervals.length; i++) {
                if (intervals[i] == ANY) continue;
                if (regulators.get(i).intervalOf(regulatorLevels[i]) != intervals[i]) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String toString() {
            return Arrays.toString(intervals) + " -> " + targetValue;
        }
    }

    private final String target;
    private final List<Regulator> regulators;
    private final List<Context> contexts;

    public RegulationRule(String target, List<Regulator> regulators, List<Context> contexts) {
        this.target = target;
        this.regulators = Collections.unmodifiableList(new ArrayList<>(regulators));
        this.contexts = Collections.unmodifiableList(new ArrayList<>(contexts));
        for (Context c : contexts) {
            if (c.intervals.length != regulators.size()) {
                throw new IllegalArgumentException("Context " + c + " of '" + target + "' has "
                        + c.intervals.length + " intervals for " + regulators.size() + " regulators");
            }
        }
    }

    /** A rule without regulators that always drives the gene towards one level. */
    public static RegulationRule constant(String target, int level) {
        return new RegulationRule(target, Collections.emptyList(),
                Collections.singletonList(new Context(new int[0], level)));
    }

    public String getTarget() { return target; }
    public List<Regulator> getRegulators() { return regulators; }
    public List<Context> getContexts() { return contexts; }

    @Override
    public List<String> regulators() {
        List<String> names = new ArrayList<>(regulators.size());
        for (Regulator r : regulators) names.add(r.gene);
        return names;
    }

    @Override
    public int targetLevel(GeneNetwork network, State state) {
        int[] regulatorLevels = new int[regulators.size()];
        for (int i = 0; i < regulatorLevels.length; i++) {
            regulatorLevels[i] = state.level(network.gene(regulators.get(i).gene).getIndex());
        }
        for (Context context : contexts) {
            if (context.matches(regulators, regulatorLevels)) {
                return context.targetValue;
            }
        }
        return state.level(network.gene(target).getIndex());
    }
}
