package qctl.graph;

import org.junit.Test;
import qctl.lattice.Degrees;

import static org.junit.Assert.*;

public class AtomicPropositionTest {
    private static final double EPS = 1e-12;

    @Test
    public void equalityMeasuresStepsToLeaveOrEnter() {
        AtomicProposition p = new AtomicProposition("X", ComparisonOperator.EQ, 1);
        assertEquals(-0.5, p.degree(0, 2), EPS);
        assertEquals(0.5, p.degree(1, 2), EPS);
        assertEquals(-0.5, p.degree(2, 2), EPS);
    }

    @Test
    public void rangeEndIsNotABoundary() {
        AtomicProposition p = new AtomicProposition("X", ComparisonOperator.GE, 1);
        assertEquals(-0.5, p.degree(0, 2), EPS);
        assertEquals(0.5, p.degree(1, 2), EPS);
        assertEquals(1.0, p.degree(2, 2), EPS);
    }

    @Test
    public void marginGrowsWithDistance() {
        AtomicProposition p = new AtomicProposition("X", ComparisonOperator.LE, 1);
        assertEquals(2.0 / 4, p.degree(0, 4), EPS);
        assertEquals(1.0 / 4, p.degree(1, 4), EPS);
        assertEquals(-1.0 / 4, p.degree(2, 4), EPS);
        assertEquals(-3.0 / 4, p.degree(4, 4), EPS);
    }

    @Test
    public void strictOperatorsShiftTheInterval() {
        AtomicProposition lt = new AtomicProposition("X", ComparisonOperator.LT, 1);
        AtomicProposition gt = new AtomicProposition("X", ComparisonOperator.GT, 0);
        assertEquals(1.0, lt.degree(0, 1), EPS);
        assertEquals(-1.0, lt.degree(1, 1), EPS);
        assertEquals(-1.0, gt.degree(0, 1), EPS);
        assertEquals(1.0, gt.degree(1, 1), EPS);
    }

    @Test
    public void unviolableComparisonIsTop() {
        AtomicProposition p = new AtomicProposition("B", ComparisonOperator.LE, 1);
        assertEquals(Degrees.TOP, p.degree(0, 1), 0.0);
        assertEquals(Degrees.TOP, p.degree(1, 1), 0.0);
        assertEquals(Degrees.TOP, new AtomicProposition("B", ComparisonOperator.GE, 0).degree(1, 1), 0.0);
    }

    @Test
    public void unsatisfiableComparisonIsBottom() {
        AtomicProposition p = new AtomicProposition("B", ComparisonOperator.GE, 5);
        assertEquals(Degrees.BOTTOM, p.degree(0, 1), 0.0);
        assertEquals(Degrees.BOTTOM, new AtomicProposition("B", ComparisonOperator.LT, 0).degree(1, 1), 0.0);
    }

    @Test
    public void signAgreesWithBooleanTruth() {
        ComparisonOperator[] ops = ComparisonOperator.values();
        for (ComparisonOperator op : ops) {
            for (int threshold = 0; threshold <= 3; threshold++) {
                AtomicProposition p = new AtomicProposition("X", op, threshold);
                for (int level = 0; level <= 3; level++) {
                    double d = p.degree(level, 3);
                    assertEquals(p + " at " + level, p.holds(level), d > 0);
                    assertTrue(d >= Degrees.BOTTOM && d <= Degrees.TOP);
                }
            }
        }
    }

    @Test
    public void extremeThresholdsDoNotOverflow() {
        assertEquals(Degrees.BOTTOM,
                new AtomicProposition("X", ComparisonOperator.GT, Integer.MAX_VALUE).degree(1, 1), 0.0);
        assertTrue(new AtomicProposition("X", ComparisonOperator.LE, Integer.MAX_VALUE).holds(1));
    }

    @Test
    public void rendersAsFormulaText() {
        assertEquals("A == 1", new AtomicProposition("A", ComparisonOperator.EQ, 1).toString());
        assertEquals(ComparisonOperator.GE, ComparisonOperator.fromSymbol(">="));
    }
}
