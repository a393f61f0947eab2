package qctl.exception;

/**
 * Forward exploration discovered more states than the configured bound allows.
 */
@SuppressWarnings("serial")
public class StateSpaceLimitException extends QuantitativeCheckException {
    private final int limit;

    public StateSpaceLimitException(int limit) {
        super(null, "Reachable state space exceeds the limit of " + limit + " states");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
