package qctl.graph;

import org.junit.Test;
import qctl.exception.EmptyStateSpaceException;
import qctl.exception.MalformedModelException;
import qctl.exception.StateSpaceLimitException;

import java.util.*;

import static org.junit.Assert.*;

public class StateGraphBuilderTest {

    @Test
    public void delayModelReachesThreeStates() throws Exception {
        StateGraph graph = new StateGraphBuilder().build(Networks.delay(), Collections.singletonList(new State(0, 0)));

        assertEquals(Arrays.asList(new State(0, 0), new State(1, 0), new State(1, 1)), graph.getStates());
        assertEquals(Collections.singleton(new State(1, 0)), graph.successors(new State(0, 0)));
        assertEquals(Collections.singleton(new State(1, 1)), graph.successors(new State(1, 0)));
        assertEquals(3, graph.getTransitionCount());
        assertEquals(Collections.singletonList(new State(0, 0)), graph.getInitialStates());
    }

    @Test
    public void terminalStateGetsSelfLoop() throws Exception {
        StateGraph graph = new StateGraphBuilder().build(Networks.delay(), Collections.singletonList(new State(0, 0)));

        State fixed = new State(1, 1);
        assertEquals(Collections.singleton(fixed), graph.successors(fixed));
        assertEquals(new HashSet<>(Arrays.asList(new State(1, 0), fixed)), graph.predecessors(fixed));
        assertTrue(graph.predecessors(new State(0, 0)).isEmpty());
    }

    @Test
    public void everyStateHasASuccessorAndAdjacencyIsConsistent() throws Exception {
        StateGraph graph = new StateGraphBuilder().buildFull(Networks.oscillator());
        assertEquals(4, graph.size());
        for (int s = 0; s < graph.size(); s++) {
            assertTrue(graph.successorIndices(s).length > 0);
            for (int t : graph.successorIndices(s)) {
                boolean found = false;
                for (int p : graph.predecessorIndices(t)) found |= p == s;
                assertTrue(s + " -> " + t + " missing from predecessors", found);
            }
        }
    }

    @Test
    public void branchingStateHasOneSuccessorPerMovingGene() throws Exception {
        StateGraph graph = new StateGraphBuilder().buildFull(Networks.delay());

        assertEquals(4, graph.size());
        assertEquals(new HashSet<>(Arrays.asList(new State(1, 1), new State(0, 0))),
                graph.successors(new State(0, 1)));
        assertEquals(2, graph.branchingDegree(new State(0, 1)));
        assertEquals(4, graph.getInitialStates().size());
    }

    @Test
    public void stepsAreUnitTowardsTarget() throws Exception {
        StateGraph graph = new StateGraphBuilder().build(Networks.ramp(), Collections.singletonList(new State(0)));
        assertEquals(Arrays.asList(new State(0), new State(1), new State(2)), graph.getStates());
        assertEquals(Collections.singleton(new State(1)), graph.successors(new State(0)));
    }

    @Test
    public void duplicateInitialStatesAreMerged() throws Exception {
        StateGraph graph = new StateGraphBuilder().build(Networks.ramp(),
                Arrays.asList(new State(1), new State(1), new State(0)));
        assertEquals(2, graph.getInitialStates().size());
        assertEquals(3, graph.size());
    }

    @Test
    public void unknownStateIsRejected() throws Exception {
        StateGraph graph = new StateGraphBuilder().build(Networks.ramp(), Collections.singletonList(new State(2)));
        assertFalse(graph.contains(new State(0)));
        try {
            graph.indexOf(new State(0));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("(0)"));
        }
    }

    @Test(expected = EmptyStateSpaceException.class)
    public void noInitialStates() throws Exception {
        new StateGraphBuilder().build(Networks.delay(), Collections.emptyList());
    }

    @Test
    public void undeclaredRegulatorIsMalformed() {
        GeneNetwork network = GeneNetwork.builder()
                .gene("B", 1)
                .rule("B", new RegulationRule("B",
                        Collections.singletonList(new RegulationRule.Regulator("C", 1)),
                        Collections.singletonList(new RegulationRule.Context(new int[]{2}, 1))))
                .build();
        try {
            new StateGraphBuilder().build(network, Collections.singletonList(new State(0)));
            fail("Expected MalformedModelException");
        } catch (MalformedModelException e) {
            assertEquals("C", e.getSubject());
        } catch (Exception e) {
            fail("Unexpected " + e);
        }
    }

    @Test
    public void targetOutsideRangeIsMalformed() {
        GeneNetwork network = GeneNetwork.builder()
                .gene("A", 1)
                .rule("A", RegulationRule.constant("A", 3))
                .build();
        try {
            new StateGraphBuilder().build(network, Collections.singletonList(new State(0)));
            fail("Expected MalformedModelException");
        } catch (MalformedModelException e) {
            assertEquals("A", e.getSubject());
        } catch (Exception e) {
            fail("Unexpected " + e);
        }
    }

    @Test(expected = MalformedModelException.class)
    public void initialLevelOutOfBounds() throws Exception {
        new StateGraphBuilder().build(Networks.delay(), Collections.singletonList(new State(0, 2)));
    }

    @Test(expected = MalformedModelException.class)
    public void initialStateOfWrongArity() throws Exception {
        new StateGraphBuilder().build(Networks.delay(), Collections.singletonList(new State(0)));
    }

    @Test
    public void explorationStopsAtLimit() throws Exception {
        try {
            new StateGraphBuilder().withStateLimit(2).build(Networks.ramp(), Collections.singletonList(new State(0)));
            fail("Expected StateSpaceLimitException");
        } catch (StateSpaceLimitException e) {
            assertEquals(2, e.getLimit());
        }
    }

    @Test(expected = StateSpaceLimitException.class)
    public void fullSpaceAboveLimit() throws Exception {
        new StateGraphBuilder().withStateLimit(3).buildFull(Networks.delay());
    }

    @Test
    public void allStatesIsLexicographic() {
        List<State> states = StateGraphBuilder.allStates(Networks.delay());
        assertEquals(Arrays.asList(new State(0, 0), new State(0, 1), new State(1, 0), new State(1, 1)), states);
    }

    @Test
    public void atomicDegreeUsesGeneRange() throws Exception {
        StateGraph graph = new StateGraphBuilder().build(Networks.ramp(), Collections.singletonList(new State(0)));
        AtomicProposition p = new AtomicProposition("X", ComparisonOperator.GE, 1);
        assertEquals(-0.5, graph.evaluateAtomic(p, new State(0)), 1e-12);
        assertEquals(1.0, graph.evaluateAtomic(p, new State(2)), 1e-12);
    }
}
