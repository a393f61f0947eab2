package qctl.lattice;

/**
 * Algebra of signed satisfaction degrees.
 *
 * A degree is a double in [BOTTOM, TOP]. Positive means satisfied with that
 * margin, negative means violated by that margin, zero is the boundary.
 * Only min, max and sign flip are used, so no rounding is ever introduced:
 * De Morgan duality and double negation hold bit for bit.
 */
public final class Degrees {

    /** Value of a comparison that no reachable level can violate. */
    public static final double TOP = 1.0;

    /** Value of a comparison that no level can satisfy. */
    public static final double BOTTOM = -1.0;

    private Degrees() {}

    public static double negate(double d) {
        return -d;
    }

    /** Logical AND: the worse margin dominates. */
    public static double meet(double d1, double d2) {
        return Math.min(d1, d2);
    }

    /** Logical OR: the better margin dominates. */
    public static double join(double d1, double d2) {
        return Math.max(d1, d2);
    }

    /**
     * Universal combination over a set of values, e.g. the degrees of all successors.
     * The meet of nothing is TOP.
     */
    public static double meetAll(double[] values, int[] indices) {
        double result = TOP;
        for (int i : indices) {
            result = meet(result, values[i]);
        }
        return result;
    }

    /**
     * Existential combination over a set of values. The join of nothing is BOTTOM.
     */
    public static double joinAll(double[] values, int[] indices) {
        double result = BOTTOM;
        for (int i : indices) {
            result = join(result, values[i]);
        }
        return result;
    }

    /** Clamp into the normalized range. NaN is rejected. */
    public static double clamp(double d) {
        if (Double.isNaN(d)) {
            throw new IllegalArgumentException("Degree must not be NaN");
        }
        return Math.max(BOTTOM, Math.min(TOP, d));
    }

    public static boolean isSatisfied(double d) {
        return d >= 0.0;
    }
}
