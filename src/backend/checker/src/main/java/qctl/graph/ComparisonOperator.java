package qctl.graph;

/**
 * Comparison between a gene level and a threshold. Each operator admits a
 * contiguous interval of levels, which is what the signed distance measures against.
 */
public enum ComparisonOperator {
    LE("<="),
    GE(">="),
    LT("<"),
    GT(">"),
    EQ("==");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        throw new IllegalArgumentException("Unknown comparison operator '" + symbol + "'");
    }

    /** Smallest level admitted for the threshold, before clipping to the gene's range. */
    long lowestAdmitted(int threshold) {
        switch (this) {
            case GE: return threshold;
            case GT: return threshold + 1L;
            case EQ: return threshold;
            default: return Long.MIN_VALUE;
        }
    }

    /** Highest level admitted for the threshold, before clipping to the gene's range. */
    long highestAdmitted(int threshold) {
        switch (this) {
            case LE: return threshold;
            case LT: return threshold - 1L;
            case EQ: return threshold;
            default: return Long.MAX_VALUE;
        }
    }
}
