package qctl.graph;

import java.util.*;

/**
 * Multivalued gene regulatory network: ordered genes with their level bounds and
 * an update rule per regulated gene. Genes without a rule are static inputs.
 *
 * The network is not validated on construction. References to undeclared genes
 * are reported when a state graph is built from it.
 */
public class GeneNetwork {
    private final List<Gene> genes;
    private final Map<String, Gene> byName;
    private final Map<String, UpdateRule> rules;

    private GeneNetwork(List<Gene> genes, Map<String, UpdateRule> rules) {
        this.genes = Collections.unmodifiableList(new ArrayList<>(genes));
        Map<String, Gene> names = new LinkedHashMap<>();
        for (Gene g : genes) names.put(g.getName(), g);
        this.byName = Collections.unmodifiableMap(names);
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Gene> getGenes() {
        return genes;
    }

    public int size() {
        return genes.size();
    }

    public boolean declares(String name) {
        return byName.containsKey(name);
    }

    public Gene gene(String name) {
        Gene g = byName.get(name);
        if (g == null) {
            throw new IllegalArgumentException("Gene '" + name + "' is not declared");
        }
        return g;
    }

    public Map<String, UpdateRule> getRules() {
        return rules;
    }

    /**
     * Level the gene is attracted to in the given state. An unregulated gene keeps its level.
     */
    public int targetLevel(Gene gene, State state) {
        UpdateRule rule = rules.get(gene.getName());
        if (rule == null) {
            return state.level(gene.getIndex());
        }
        return rule.targetLevel(this, state);
    }

    public int[] maxLevels() {
        int[] max = new int[genes.size()];
        for (Gene g : genes) max[g.getIndex()] = g.getMaxLevel();
        return max;
    }

    /** Number of distinct level vectors, saturating at Long.MAX_VALUE. */
    public long fullSpaceSize() {
        long size = 1;
        for (Gene g : genes) {
            long factor = g.getMaxLevel() + 1L;
            if (size > Long.MAX_VALUE / factor) return Long.MAX_VALUE;
            size *= factor;
        }
        return size;
    }

    public static class Builder {
        private final List<Gene> genes = new ArrayList<>();
        private final Map<String, UpdateRule> rules = new LinkedHashMap<>();

        public Builder gene(String name, int maxLevel) {
            for (Gene g : genes) {
                if (g.getName().equals(name)) {
                    throw new IllegalArgumentException("Gene '" + name + "' declared twice");
                }
            }
            genes.add(new Gene(name, genes.size(), maxLevel));
            return this;
        }

        public Builder rule(String target, UpdateRule rule) {
            rules.put(target, rule);
            return this;
        }

        public GeneNetwork build() {
            return new GeneNetwork(genes, rules);
        }
    }
}
