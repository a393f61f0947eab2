package qctl.exception;

@SuppressWarnings("serial")
public class EmptyStateSpaceException extends QuantitativeCheckException {
    public EmptyStateSpaceException(String message) {
        super(null, message);
    }
}
