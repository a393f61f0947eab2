package qctl.graph;

import java.util.List;

/**
 * Computes the level a gene is attracted to in a given state.
 * Implementations must be pure.
 */
public interface UpdateRule {

    /** Names of the genes this rule reads. All must be declared in the network. */
    List<String> regulators();

    int targetLevel(GeneNetwork network, State state);
}
